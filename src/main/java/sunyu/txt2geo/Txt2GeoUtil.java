package sunyu.txt2geo;

import cn.hutool.core.collection.CollUtil;
import cn.hutool.core.io.FileUtil;
import cn.hutool.core.io.IORuntimeException;
import cn.hutool.core.util.StrUtil;
import cn.hutool.crypto.digest.DigestUtil;
import cn.hutool.json.JSONArray;
import cn.hutool.json.JSONObject;
import cn.hutool.json.JSONUtil;
import cn.hutool.log.Log;
import cn.hutool.log.LogFactory;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;
import sunyu.txt2geo.exception.Txt2GeoException;
import sunyu.txt2geo.pojo.*;

import java.io.File;
import java.util.*;

/**
 * 界址点坐标TXT转换工具类，提供解码、解析、几何清理、坐标系推导、WKT组装与批量文件处理
 * <p>
 * 处理流程：解析 -> 几何后处理 -> 坐标系构建 -> 要素组装，每个阶段只依赖输入和选项，
 * 实例本身不保存任何文件相关的状态，可在多线程间共享（处理历史除外，它本身是线程安全的）。
 * </p>
 *
 * @author SunYu
 */
public class Txt2GeoUtil implements AutoCloseable {
    private final Log log = LogFactory.get();
    private final Config config;

    public static Builder builder() {
        return new Builder();
    }

    private Txt2GeoUtil(Config config) {
        log.info("[构建{}] 开始", this.getClass().getSimpleName());
        this.config = config;
        config.history = new ProcessingHistory(config.historyFile);
        log.info("[构建{}] 结束", this.getClass().getSimpleName());
    }

    private static class Config {
        /**
         * 几何工厂，用于把WKT解析为JTS几何对象
         */
        private final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();

        /**
         * 空几何集合，用于表示无效或空的几何结果
         */
        private final Geometry EMPTY_GEOMETRY = GEOMETRY_FACTORY.createGeometryCollection();

        /**
         * 参与处理的文件扩展名
         */
        private final String TXT_EXTENSION = "txt";

        /**
         * 合并模式下的默认图层名
         */
        private final String DEFAULT_MERGE_NAME = "merged_output";

        private final TxtParser parser = new TxtParser();
        private final GeometryProcessor geometryProcessor = new GeometryProcessor();
        private final CoordinateSystemBuilder coordinateSystemBuilder = new CoordinateSystemBuilder();
        private final FeatureAssembler featureAssembler = new FeatureAssembler();
        private final TextDecoder textDecoder = new TextDecoder();

        /**
         * 容差，&lt;=0 表示使用文件属性"精度"，再退回到最大容差
         */
        private double precision = 0;
        private boolean deduplicate = true;
        private boolean autoClose = true;

        /**
         * 处理历史记录文件，为空时只在本次运行内去重
         */
        private String historyFile;
        /**
         * 强制重新处理历史中已存在的文件（仍会记录指纹）
         */
        private boolean forceRefresh = false;
        /**
         * 目录遍历深度，0表示不限制
         */
        private int depth = 0;
        /**
         * 图层名称模板
         */
        private String nameTemplate = LayerNameUtil.DEFAULT_TEMPLATE;
        /**
         * 是否把所有文件合并到一个图层
         */
        private boolean merge = false;

        private ProcessingHistory history;
    }

    public static class Builder {
        private Config config = new Config();

        /**
         * 设置容差
         *
         * @param precision 容差，&lt;=0 时使用文件属性"精度"，超出最大容差时回退到最大容差
         *
         * @return Builder
         */
        public Builder precision(double precision) {
            config.precision = precision;
            return this;
        }

        public Builder deduplicate(boolean deduplicate) {
            config.deduplicate = deduplicate;
            return this;
        }

        public Builder autoClose(boolean autoClose) {
            config.autoClose = autoClose;
            return this;
        }

        /**
         * 设置处理历史记录文件，记录过的文件内容再次出现时会被跳过
         *
         * @param historyFile 记录文件路径
         *
         * @return Builder
         */
        public Builder historyFile(String historyFile) {
            config.historyFile = historyFile;
            return this;
        }

        public Builder forceRefresh(boolean forceRefresh) {
            config.forceRefresh = forceRefresh;
            return this;
        }

        /**
         * 设置目录遍历深度
         *
         * @param depth 1表示只处理目录下的直接文件，0表示不限制
         *
         * @return Builder
         */
        public Builder depth(int depth) {
            config.depth = depth;
            return this;
        }

        public Builder nameTemplate(String nameTemplate) {
            config.nameTemplate = nameTemplate;
            return this;
        }

        public Builder merge(boolean merge) {
            config.merge = merge;
            return this;
        }

        public Txt2GeoUtil build() {
            return new Txt2GeoUtil(config);
        }
    }

    @Override
    public void close() {
        log.info("[销毁{}] 开始", this.getClass().getSimpleName());
        log.info("[销毁{}] 结束", this.getClass().getSimpleName());
    }

    /**
     * 当前配置的几何选项
     *
     * @return 几何选项副本
     */
    public GeometryOptions getGeometryOptions() {
        return new GeometryOptions(config.precision, config.deduplicate, config.autoClose);
    }

    /**
     * 检测编码并解码为文本
     *
     * @param content 原始字节
     *
     * @return 解码结果
     */
    public DecodeResult decode(byte[] content) {
        return config.textDecoder.decode(content);
    }

    /**
     * 解析文本
     *
     * @param text 已解码的文本
     *
     * @return 原始形态的解析结果
     */
    public ParsedDocument parse(String text) {
        return config.parser.parse(text);
    }

    /**
     * 生成预处理数据：确定容差 -> 几何后处理 -> 坐标系 -> WKT与属性
     * <p>
     * 容差优先级：opts中大于0的容差 -> 文件属性"精度" -> 最大容差。
     * 解析结果中的环会被原地处理。
     * </p>
     *
     * @param doc  解析结果
     * @param opts 几何选项，不会被修改
     *
     * @return 预处理结果
     */
    public PreprocessResult preprocess(ParsedDocument doc, GeometryOptions opts) {
        if (doc == null || CollUtil.isEmpty(doc.getParcels())) {
            throw new Txt2GeoException("无可用地块数据");
        }
        double precision = opts.getPrecision();
        if (precision <= 0 && doc.getFileAttributes() != null) {
            precision = GeometryProcessor.parsePrecision(doc.getFileAttributes().get(ParsedDocument.ATTR_PRECISION));
        }
        precision = GeometryProcessor.normalizePrecision(precision);
        int decimalPlaces = GeometryProcessor.decimalPlaces(precision);
        GeometryOptions effective = new GeometryOptions(precision, opts.isDeduplicate(), opts.isAutoClose());

        config.geometryProcessor.process(doc, effective);
        CoordinateSystem coordinateSystem = config.coordinateSystemBuilder.build(doc);
        PreprocessResult result = config.featureAssembler.assemble(doc, coordinateSystem, decimalPlaces);
        log.debug("预处理完成：地块 {} 容差 {} 小数位 {} 坐标系 {}", doc.getParcels().size(), precision, decimalPlaces, result.getEpsg() > 0 ? result.getCrs() : coordinateSystem.getName());
        return result;
    }

    /**
     * 按当前配置预处理已解析的文档
     */
    public PreprocessResult preprocess(ParsedDocument doc) {
        return preprocess(doc, getGeometryOptions());
    }

    /**
     * 解析并预处理文本
     */
    public PreprocessResult preprocess(String text) {
        return preprocess(parse(text));
    }

    /**
     * 解码、解析并预处理原始字节
     */
    public PreprocessResult preprocess(byte[] content) {
        DecodeResult decoded = decode(content);
        if (decoded.hasWarning()) {
            log.warn("解码警告：{}", decoded.getWarning());
        }
        return preprocess(decoded.getText());
    }

    /**
     * 将要素WKT解析为JTS几何对象
     * <p>坐标轴顺序与WKT一致，即X为东向（原始Y），Y为北向（原始X）</p>
     *
     * @param wkt WKT字符串
     *
     * @return 几何对象，解析失败返回空几何
     */
    public Geometry toGeometry(String wkt) {
        if (StrUtil.isBlank(wkt)) {
            log.warn("WKT字符串为空或null");
            return config.EMPTY_GEOMETRY;
        }
        try {
            return new WKTReader(config.GEOMETRY_FACTORY).read(wkt);
        } catch (ParseException e) {
            log.warn("WKT字符串解析失败：{}", e.getMessage());
            return config.EMPTY_GEOMETRY;
        }
    }

    /**
     * 收集输入路径下的txt文件，结果按路径排序并去重
     *
     * @param inputPaths 文件或目录
     *
     * @return 文件列表
     */
    public List<File> collectFiles(Collection<String> inputPaths) {
        TreeMap<String, File> files = new TreeMap<>();
        int maxDepth = config.depth > 0 ? config.depth : -1;
        for (String inputPath : inputPaths) {
            File input = FileUtil.file(inputPath);
            if (!FileUtil.exist(input)) {
                log.warn("[跳过] 路径不存在 {}", inputPath);
                continue;
            }
            if (input.isFile()) {
                if (isTxt(input)) {
                    files.put(input.getAbsolutePath(), input);
                }
                continue;
            }
            for (File f : FileUtil.loopFiles(input.toPath(), maxDepth, file -> file.isFile() && isTxt(file))) {
                files.put(f.getAbsolutePath(), f);
            }
        }
        return new ArrayList<>(files.values());
    }

    private boolean isTxt(File file) {
        return config.TXT_EXTENSION.equalsIgnoreCase(FileUtil.extName(file));
    }

    /**
     * 批量处理文件
     * <p>
     * 已处理过的内容（处理历史）和本次运行中内容相同的文件会被跳过；
     * 单个文件失败只记录日志，不影响其他文件。
     * </p>
     *
     * @param inputPaths 文件或目录
     *
     * @return 成功处理的文件结果，按路径排序
     */
    public List<FileResult> preprocessFiles(Collection<String> inputPaths) {
        log.info("[开始] 处理文件 强制刷新 {}", config.forceRefresh);
        List<File> sourceFiles = collectFiles(inputPaths);

        Set<String> seen = new HashSet<>();
        List<FileResult> results = new ArrayList<>();
        int skipped = 0;
        int failed = 0;
        for (File file : sourceFiles) {
            String path = file.getAbsolutePath();
            byte[] content;
            try {
                content = FileUtil.readBytes(file);
            } catch (IORuntimeException e) {
                log.error("[失败] 读取文件失败 {} 原因 {}", path, e.getMessage());
                failed++;
                continue;
            }
            String fingerprint = DigestUtil.sha256Hex(content);
            boolean isNew = config.history.checkAndRecord(fingerprint);
            if (!isNew && !config.forceRefresh) {
                log.debug("[跳过] 已处理文件 {}", path);
                skipped++;
                continue;
            }
            if (!seen.add(fingerprint)) {
                log.debug("[跳过] 内容相同文件 {}", path);
                skipped++;
                continue;
            }

            try {
                DecodeResult decoded = decode(content);
                if (decoded.hasWarning()) {
                    log.warn("[警告] {} {}", path, decoded.getWarning());
                }
                PreprocessResult result = preprocess(parse(decoded.getText()));
                if (CollUtil.isEmpty(result.getFeatures())) {
                    log.warn("[跳过] 文件无有效地块 {}", path);
                    skipped++;
                    continue;
                }
                results.add(new FileResult(path, fingerprint, decoded.getEncoding(), result));
            } catch (Txt2GeoException e) {
                log.error("[失败] 预处理失败 {} 原因 {}", path, e.getMessage());
                failed++;
            }
        }
        log.info("[完成] 文件预处理完成 发现 {} 成功 {} 跳过 {} 失败 {}", sourceFiles.size(), results.size(), skipped, failed);
        return results;
    }

    /**
     * 组装交给外部GIS导出器的JSON数据
     * <p>
     * 合并模式下所有文件使用同一个图层名，否则每个文件按源文件名生成图层名。
     * </p>
     *
     * @param fileResults 文件处理结果
     *
     * @return JSON字符串，形如 {"datasets":[{"layer_name":..,"source_path":..,"source_crs":..,"epsg":..,"total_features":..,"features":[{"wkt":..,"properties":{..}}]}]}
     */
    public String toPayloadJson(List<FileResult> fileResults) {
        Set<String> usedNames = new HashSet<>();
        JSONArray datasets = new JSONArray();
        String mergedName = null;
        if (config.merge) {
            mergedName = LayerNameUtil.sanitize(LayerNameUtil.render(config.nameTemplate, config.DEFAULT_MERGE_NAME, 1, 1), usedNames);
        }
        int total = fileResults.size();
        for (int i = 0; i < total; i++) {
            FileResult fr = fileResults.get(i);
            String layerName = mergedName;
            if (layerName == null) {
                String stem = FileUtil.mainName(fr.getPath());
                if (StrUtil.isBlank(stem)) {
                    stem = "file_" + (i + 1);
                }
                layerName = LayerNameUtil.sanitize(LayerNameUtil.render(config.nameTemplate, stem, i + 1, total), usedNames);
            }

            JSONArray features = new JSONArray();
            for (Feature feature : fr.getResult().getFeatures()) {
                features.add(JSONUtil.createObj()
                        .set("wkt", feature.getWkt())
                        .set("properties", feature.getAttributes()));
            }
            JSONObject dataset = JSONUtil.createObj()
                    .set("layer_name", layerName)
                    .set("source_path", fr.getPath())
                    .set("source_crs", fr.getResult().getCrs())
                    .set("epsg", fr.getResult().getEpsg())
                    .set("total_features", features.size())
                    .set("features", features);
            datasets.add(dataset);
        }
        log.info("[完成] 数据组装完成 数据集 {}", datasets.size());
        return JSONUtil.createObj().set("datasets", datasets).toString();
    }
}
