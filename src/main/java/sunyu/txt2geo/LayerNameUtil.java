package sunyu.txt2geo;

import cn.hutool.core.date.DateUtil;
import cn.hutool.core.io.FileUtil;
import cn.hutool.core.util.IdUtil;
import cn.hutool.core.util.NumberUtil;
import cn.hutool.core.util.RandomUtil;
import cn.hutool.core.util.ReUtil;
import cn.hutool.core.util.StrUtil;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 导出图层名称：名称模板渲染与标识符规范化
 *
 * @author SunYu
 */
public class LayerNameUtil {

    /**
     * 名称最大长度（按字符计）
     */
    public static final int MAX_NAME_LENGTH = 52;

    /**
     * 默认名称模板
     */
    public static final String DEFAULT_TEMPLATE = "{name}";

    private static final String UNNAMED = "unnamed";
    private static final String DEFAULT_DATE_PATTERN = "yyyyMMdd";
    private static final int DEFAULT_RAND_LENGTH = 8;

    /**
     * GIS字段名与SQL保留字，命中时名称前加下划线
     */
    private static final Set<String> RESERVED = new HashSet<>(Arrays.asList(
            "fid", "area", "len", "points", "numofpts", "entity",
            "eminx", "eminy", "emaxx", "emaxy", "eminz", "emaxz",
            "min_measure", "max_measure",
            "add", "alter", "and", "between", "by", "column",
            "create", "delete", "drop", "exists", "for", "from",
            "group", "having", "in", "insert", "into", "is",
            "like", "not", "null", "or", "order", "select",
            "set", "table", "update", "values", "where"));

    private LayerNameUtil() {
    }

    /**
     * 渲染名称模板
     * <p>
     * 支持占位符：
     * <ul>
     *   <li>{name} 基础名称</li>
     *   <li>{index[:width]} 当前序号，参数长度为补零宽度，参数数值为偏移量，例如 {index:000} 输出 001</li>
     *   <li>{count} 总数量</li>
     *   <li>{date[:pattern]} 当前日期，默认 yyyyMMdd</li>
     *   <li>{uuid} 随机UUID</li>
     *   <li>{rand[:len]} 随机字符串，默认8位</li>
     * </ul>
     * 所有占位符均可追加 :lower、:upper、:title 转换大小写；未知占位符原样保留。
     * </p>
     *
     * @param template 模板，为空时使用 {@link #DEFAULT_TEMPLATE}
     * @param baseName 基础名称
     * @param index    序号(从1开始)
     * @param count    总数量
     *
     * @return 渲染结果
     */
    public static String render(String template, String baseName, int index, int count) {
        String tmpl = StrUtil.isBlank(template) ? DEFAULT_TEMPLATE : StrUtil.trim(template);
        StringBuilder out = new StringBuilder();
        int pos = 0;
        while (pos < tmpl.length()) {
            int start = tmpl.indexOf('{', pos);
            if (start < 0) {
                out.append(tmpl, pos, tmpl.length());
                break;
            }
            out.append(tmpl, pos, start);
            int end = tmpl.indexOf('}', start + 1);
            if (end < 0) {
                // 无闭合，原样输出剩余
                out.append(tmpl, start, tmpl.length());
                break;
            }
            out.append(resolveToken(tmpl.substring(start + 1, end), baseName, index, count));
            pos = end + 1;
        }
        return out.toString();
    }

    private static String resolveToken(String token, String baseName, int index, int count) {
        if (StrUtil.isBlank(token)) {
            return "{" + token + "}";
        }
        List<String> parts = StrUtil.split(token, ':');
        String name = StrUtil.trim(parts.get(0)).toLowerCase();
        if (name.isEmpty()) {
            return "{" + token + "}";
        }

        // 大小写参数可出现在任意位置，取最后一次
        String caseTransform = null;
        List<String> args = new ArrayList<>();
        for (String arg : parts.subList(1, parts.size())) {
            String lower = arg.toLowerCase();
            if ("lower".equals(lower) || "upper".equals(lower) || "title".equals(lower)) {
                caseTransform = lower;
            } else {
                args.add(arg);
            }
        }
        String firstArg = args.isEmpty() ? "" : args.get(0);

        String result;
        switch (name) {
            case "name":
                result = baseName;
                break;
            case "index":
                int offset = NumberUtil.isInteger(firstArg) ? Integer.parseInt(firstArg) : 0;
                result = firstArg.isEmpty() ? String.valueOf(index + offset) : String.format("%0" + firstArg.length() + "d", index + offset);
                break;
            case "count":
                result = String.valueOf(count);
                break;
            case "date":
                result = DateUtil.format(new Date(), StrUtil.isEmpty(firstArg) ? DEFAULT_DATE_PATTERN : firstArg);
                break;
            case "uuid":
                result = IdUtil.randomUUID();
                break;
            case "rand":
                int length = NumberUtil.isInteger(firstArg) && Integer.parseInt(firstArg) > 0 ? Integer.parseInt(firstArg) : DEFAULT_RAND_LENGTH;
                result = RandomUtil.randomString(length);
                break;
            default:
                return "{" + token + "}";
        }

        if ("lower".equals(caseTransform)) {
            return result.toLowerCase();
        }
        if ("upper".equals(caseTransform)) {
            return result.toUpperCase();
        }
        if ("title".equals(caseTransform)) {
            return StrUtil.upperFirst(result.toLowerCase());
        }
        return result;
    }

    /**
     * 把任意文件名或图层名转换为安全的标识符
     * <ol>
     *   <li>取路径最后一段并去掉扩展名</li>
     *   <li>NFKC归一化（兼容全角字符）</li>
     *   <li>只保留字母、数字、下划线，连续非法字符合并为一个下划线，去掉首尾下划线</li>
     *   <li>结果为空时为 unnamed</li>
     *   <li>以数字开头或与保留字冲突时前加下划线</li>
     *   <li>截断到 {@link #MAX_NAME_LENGTH}</li>
     *   <li>提供usedNames时追加 _1、_2 ... 保证唯一，并把结果登记进去</li>
     * </ol>
     *
     * @param name      原始名称
     * @param usedNames 已使用的名称，可为null
     *
     * @return 非空的安全名称
     */
    public static String sanitize(String name, Set<String> usedNames) {
        String normalized = UNNAMED;
        if (StrUtil.isNotBlank(name)) {
            String stem = FileUtil.mainName(StrUtil.trim(name));
            if (StrUtil.isEmpty(stem)) {
                stem = FileUtil.getName(StrUtil.trim(name));
            }
            String folded = fold(stem);
            if (StrUtil.isNotEmpty(folded)) {
                normalized = folded;
            }
        }

        if (Character.isDigit(normalized.charAt(0)) || RESERVED.contains(normalized.toLowerCase())) {
            normalized = "_" + normalized;
        }
        if (normalized.codePointCount(0, normalized.length()) > MAX_NAME_LENGTH) {
            normalized = normalized.substring(0, normalized.offsetByCodePoints(0, MAX_NAME_LENGTH));
            normalized = ReUtil.replaceAll(normalized, "_+$", "");
            if (normalized.isEmpty()) {
                normalized = UNNAMED;
            }
        }

        if (usedNames == null) {
            return normalized;
        }
        if (usedNames.add(normalized)) {
            return normalized;
        }
        for (int i = 1; ; i++) {
            String candidate = normalized + "_" + i;
            if (usedNames.add(candidate)) {
                return candidate;
            }
        }
    }

    /**
     * NFKC归一化，保留字母数字下划线，非法字符段合并为单个下划线，去掉首尾下划线
     */
    private static String fold(String s) {
        String nfkc = Normalizer.normalize(s, Normalizer.Form.NFKC);
        StringBuilder sb = new StringBuilder(nfkc.length());
        boolean prevUnderscore = false;
        for (int i = 0; i < nfkc.length(); ) {
            int cp = nfkc.codePointAt(i);
            i += Character.charCount(cp);
            if (cp == '_' || Character.isLetter(cp) || Character.isDigit(cp)) {
                sb.appendCodePoint(cp);
                prevUnderscore = false;
            } else if (!prevUnderscore) {
                sb.append('_');
                prevUnderscore = true;
            }
        }
        return ReUtil.replaceAll(sb.toString(), "^_+|_+$", "");
    }
}
