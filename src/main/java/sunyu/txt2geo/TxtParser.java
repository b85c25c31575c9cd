package sunyu.txt2geo;

import cn.hutool.core.convert.Convert;
import cn.hutool.core.util.NumberUtil;
import cn.hutool.core.util.ReUtil;
import cn.hutool.core.util.StrUtil;
import cn.hutool.log.Log;
import cn.hutool.log.LogFactory;
import sunyu.txt2geo.exception.MissingAttributesException;
import sunyu.txt2geo.exception.MissingParcelHeaderException;
import sunyu.txt2geo.exception.MissingSectionException;
import sunyu.txt2geo.exception.SyntaxException;
import sunyu.txt2geo.pojo.ParsedDocument;
import sunyu.txt2geo.pojo.Parcel;
import sunyu.txt2geo.pojo.Point;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * 界址点坐标TXT解析器（状态机）
 * <p>
 * 解析原则：
 * <ol>
 *   <li>坐标行格式（字段数、数值可解析性）一旦出错立即抛出异常，精确到行号</li>
 *   <li>只负责把同一地块下按圈号分组的点序列收集为环，不做去重、闭合、点数校验等几何修正</li>
 *   <li>缺少[属性描述]/[地块坐标]部分或文件级必选属性，在全部扫描结束后统一校验并一次性报告</li>
 * </ol>
 * 几何修正交给 {@link GeometryProcessor}。解析器本身无状态，可在多线程间共享。
 * </p>
 *
 * @author SunYu
 */
public class TxtParser {
    private static final Log log = LogFactory.get();

    /**
     * 属性段标记
     */
    public static final String SECTION_ATTRIBUTES = "[属性描述]";
    /**
     * 坐标段标记
     */
    public static final String SECTION_COORDINATES = "[地块坐标]";

    /**
     * 文件级必选属性，校验时按此顺序报告
     */
    public static final String[] REQUIRED_FILE_ATTRIBUTES = {
            ParsedDocument.ATTR_COORDINATE_SYSTEM,
            ParsedDocument.ATTR_PROJECTION_TYPE,
            ParsedDocument.ATTR_DEGREE,
            ParsedDocument.ATTR_BAND
    };

    /**
     * 地块起始行后缀
     */
    private static final String PARCEL_HEADER_SUFFIX = ",@";

    /**
     * 属性键常见误写及其规范写法
     */
    private static final String MISWRITTEN_KEY_PART = "产生";
    private static final String CANONICAL_KEY_PART = "生产";

    private static final Pattern FIRST_DIGITS = Pattern.compile("[0-9]+");
    /**
     * 十进制坐标，可带符号与指数，不接受 NaN、Infinity、十六进制及 d/f 后缀
     */
    private static final Pattern DECIMAL_COORDINATE = Pattern.compile("[+-]?([0-9]+(\\.[0-9]*)?|\\.[0-9]+)([eE][+-]?[0-9]+)?");

    private enum State {
        /**
         * 寻找[属性描述]
         */
        INITIAL,
        /**
         * 正在解析属性
         */
        ATTRIBUTES,
        /**
         * 正在解析坐标
         */
        COORDINATES
    }

    /**
     * 解析原始文本为结构化地块数据（语法层面）
     *
     * @param text 已解码的文本
     *
     * @return 解析结果，几何仍为原始形态（可能未闭合、包含重复点、点数不足）
     *
     * @throws SyntaxException             坐标行格式错误
     * @throws MissingParcelHeaderException 坐标行之前没有地块起始行
     * @throws MissingSectionException      缺少[属性描述]或[地块坐标]部分
     * @throws MissingAttributesException   缺少文件级必选属性
     */
    public ParsedDocument parse(String text) {
        ParseContext ctx = new ParseContext();
        List<String> lines = StrUtil.split(StrUtil.nullToEmpty(text), '\n');
        for (String raw : lines) {
            ctx.lineNo++;
            String line = StrUtil.trim(raw);
            if (StrUtil.isEmpty(line)) {
                continue;
            }
            ctx.processLine(line);
        }
        // 文件结束时，处理最后一个地块
        ctx.finalizeCurrentParcel();

        switch (ctx.state) {
            case INITIAL:
                throw new MissingSectionException(SECTION_ATTRIBUTES);
            case ATTRIBUTES:
                throw new MissingSectionException(SECTION_COORDINATES);
            default:
                break;
        }

        validateFileAttributes(ctx.attrs);

        log.debug("解析完成：行数 {} 地块数 {} 文件属性数 {}", ctx.lineNo, ctx.parcels.size(), ctx.attrs.size());
        return new ParsedDocument(ctx.parcels, new LinkedHashMap<>(ctx.attrs));
    }

    /**
     * 校验文件级必选属性，缺失项一次性报告
     */
    private void validateFileAttributes(Map<String, String> attrs) {
        List<String> missing = new ArrayList<>();
        for (String key : REQUIRED_FILE_ATTRIBUTES) {
            if (!attrs.containsKey(key)) {
                missing.add(key);
            }
        }
        if (!missing.isEmpty()) {
            throw new MissingAttributesException(missing);
        }
    }

    /**
     * 全角转半角，包括全角空格、全角英文数字符号及常见中文标点，中文引号转为英文引号
     *
     * @param str 原始字符串
     *
     * @return 半角字符串
     */
    public static String toHalfWidth(String str) {
        if (StrUtil.isEmpty(str)) {
            return str;
        }
        String dbc = Convert.toDBC(str);
        StringBuilder sb = new StringBuilder(dbc.length());
        for (int i = 0; i < dbc.length(); i++) {
            char c = dbc.charAt(i);
            switch (c) {
                case '　':
                    sb.append(' ');
                    break;
                case '“':
                case '”':
                    sb.append('"');
                    break;
                case '‘':
                case '’':
                    sb.append('\'');
                    break;
                default:
                    sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * 解析以",@"结尾的地块起始行，字段顺序见 {@link Parcel#ATTRIBUTE_KEYS}
     *
     * @param line 地块起始行
     *
     * @return 固定8个键的属性，缺失字段补空串
     */
    static Map<String, String> parseParcelAttributes(String line) {
        Map<String, String> attrs = new LinkedHashMap<>();
        String core = StrUtil.trim(StrUtil.removeSuffix(line, PARCEL_HEADER_SUFFIX));
        List<String> parts = StrUtil.isEmpty(core) ? new ArrayList<>() : StrUtil.split(core, ',');
        for (int i = 0; i < Parcel.ATTRIBUTE_KEYS.length; i++) {
            attrs.put(Parcel.ATTRIBUTE_KEYS[i], i < parts.size() ? StrUtil.trim(parts.get(i)) : "");
        }
        return attrs;
    }

    /**
     * 提取字符串中的第一段连续数字作为点号，未找到或超出int范围返回0
     */
    static int extractPointId(String field) {
        String digits = ReUtil.get(FIRST_DIGITS, field, 0);
        if (digits == null || !NumberUtil.isInteger(digits)) {
            return 0;
        }
        return Integer.parseInt(digits);
    }

    /**
     * 单个地块的构建器，暂存按圈号分组的点
     * <p>每遇到新的地块起始行就换一个新的构建器</p>
     */
    private static class ParcelBuilder {
        private final Map<String, String> attributes;
        private final TreeMap<Integer, List<Point>> ringPoints = new TreeMap<>();

        ParcelBuilder(Map<String, String> attributes) {
            this.attributes = attributes;
        }

        void addPoint(Point point) {
            ringPoints.computeIfAbsent(point.getRingId(), k -> new ArrayList<>()).add(point);
        }

        boolean isEmpty() {
            return ringPoints.isEmpty();
        }

        /**
         * 按圈号升序生成环，空点集跳过，不做任何几何修补
         */
        Parcel build() {
            List<List<Point>> rings = new ArrayList<>(ringPoints.size());
            for (List<Point> points : ringPoints.values()) {
                if (!points.isEmpty()) {
                    rings.add(points);
                }
            }
            return new Parcel(attributes, rings);
        }
    }

    /**
     * 单次解析的上下文，解析结束即丢弃
     */
    private static class ParseContext {
        private State state = State.INITIAL;
        private int lineNo;
        private final Map<String, String> attrs = new LinkedHashMap<>();
        private final List<Parcel> parcels = new ArrayList<>();
        private ParcelBuilder current;

        void processLine(String line) {
            switch (state) {
                case INITIAL:
                    // 在找到[属性描述]之前忽略所有其他行
                    if (SECTION_ATTRIBUTES.equals(line)) {
                        state = State.ATTRIBUTES;
                    }
                    break;
                case ATTRIBUTES:
                    processAttributeLine(line);
                    break;
                case COORDINATES:
                    processCoordinateLine(line);
                    break;
                default:
                    break;
            }
        }

        private void processAttributeLine(String line) {
            if (SECTION_COORDINATES.equals(line)) {
                state = State.COORDINATES;
                return;
            }
            // 重复的文件头，忽略
            if (SECTION_ATTRIBUTES.equals(line)) {
                return;
            }
            int idx = line.indexOf('=');
            if (idx < 0) {
                return;
            }
            String key = StrUtil.trim(line.substring(0, idx));
            String value = toHalfWidth(StrUtil.trim(line.substring(idx + 1)));

            String canonical = StrUtil.replace(key, MISWRITTEN_KEY_PART, CANONICAL_KEY_PART);
            if (!canonical.equals(key)) {
                if (attrs.containsKey(canonical)) {
                    log.debug("第{}行 属性键 {} 为误写，规范键 {} 已存在，忽略", lineNo, key, canonical);
                    return;
                }
                log.debug("第{}行 属性键 {} 纠正为 {}", lineNo, key, canonical);
                key = canonical;
            }
            attrs.put(key, value);
        }

        private void processCoordinateLine(String line) {
            // 后续再次出现的段标记均忽略，不改变状态
            if (SECTION_ATTRIBUTES.equals(line) || SECTION_COORDINATES.equals(line)) {
                return;
            }
            // 坐标行必须含逗号，重复的属性行是 key=value 且不含逗号
            if (line.indexOf('=') >= 0 && line.indexOf(',') < 0) {
                return;
            }
            if (line.endsWith(PARCEL_HEADER_SUFFIX)) {
                finalizeCurrentParcel();
                current = new ParcelBuilder(parseParcelAttributes(line));
                return;
            }
            addPoint(line);
        }

        /**
         * 解析一条坐标记录：点号,圈号,X,Y,... 至少4个字段，多余字段忽略
         */
        private void addPoint(String line) {
            if (current == null) {
                throw new MissingParcelHeaderException(lineNo);
            }
            List<String> parts = StrUtil.split(line, ',');
            if (parts.size() < 4) {
                throw new SyntaxException(lineNo, SyntaxException.CODE_INVALID_POINT_FORMAT, "坐标行格式错误，字段不足");
            }
            int pointId = extractPointId(parts.get(0));
            int ringId;
            try {
                ringId = Integer.parseInt(StrUtil.trim(parts.get(1)));
            } catch (NumberFormatException e) {
                throw new SyntaxException(lineNo, SyntaxException.CODE_INVALID_POINT_FORMAT, "无效的圈号: " + parts.get(1));
            }
            double x = parseCoordinate(parts.get(2), "X");
            double y = parseCoordinate(parts.get(3), "Y");
            current.addPoint(new Point(pointId, ringId, x, y));
        }

        private double parseCoordinate(String field, String axis) {
            String value = StrUtil.trim(field);
            if (!ReUtil.isMatch(DECIMAL_COORDINATE, value)) {
                throw new SyntaxException(lineNo, SyntaxException.CODE_INVALID_POINT_FORMAT, StrUtil.format("无效的{}坐标: {}", axis, field));
            }
            double d = Double.parseDouble(value);
            if (Double.isInfinite(d)) {
                throw new SyntaxException(lineNo, SyntaxException.CODE_INVALID_POINT_FORMAT, StrUtil.format("{}坐标超出范围: {}", axis, field));
            }
            return d;
        }

        /**
         * 把当前地块写入结果，没有任何坐标点的地块直接丢弃
         */
        void finalizeCurrentParcel() {
            if (current == null) {
                return;
            }
            if (current.isEmpty()) {
                log.debug("第{}行之前的地块 {} 没有坐标点，丢弃", lineNo, current.attributes.get(Parcel.KEY_PID));
            } else {
                parcels.add(current.build());
            }
            current = null;
        }
    }
}
