package sunyu.txt2geo;

import cn.hutool.core.collection.CollUtil;
import cn.hutool.core.util.StrUtil;
import cn.hutool.log.Log;
import cn.hutool.log.LogFactory;
import sunyu.txt2geo.exception.CrsException;
import sunyu.txt2geo.pojo.CoordinateSystem;
import sunyu.txt2geo.pojo.ParsedDocument;
import sunyu.txt2geo.pojo.Parcel;
import sunyu.txt2geo.pojo.Point;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 根据解析结果构建CGCS2000高斯-克吕格投影定义
 * <p>
 * 规则：
 * <ol>
 *   <li>坐标系字段必须包含"2000国家大地坐标系"，括号内数字表示自定义中央经线</li>
 *   <li>仅支持3度或6度分带，3度带号范围[25,45]，6度带号范围[13,23]</li>
 *   <li>标准中央经线输出EPSG码和WKT，自定义中央经线仅输出WKT</li>
 *   <li>属性中的带号与几何推断不一致时，以几何为准</li>
 * </ol>
 * </p>
 *
 * @author SunYu
 */
public class CoordinateSystemBuilder {
    private static final Log log = LogFactory.get();

    /**
     * 坐标系名称必须包含的基准面标识
     */
    public static final String CGCS2000_MARKER = "2000国家大地坐标系";

    private static final int MIN_3_DEGREE_BAND = 25;
    private static final int MAX_3_DEGREE_BAND = 45;
    private static final int MIN_6_DEGREE_BAND = 13;
    private static final int MAX_6_DEGREE_BAND = 23;

    /**
     * 中国经度范围
     */
    private static final double MIN_CENTRAL_MERIDIAN = 75;
    private static final double MAX_CENTRAL_MERIDIAN = 135;

    private static final double BAND_FACTOR = 1_000_000.0;
    private static final double BASE_FALSE_EASTING = 500_000.0;

    /**
     * CGCS2000高斯-克吕格投影WKT模板（ESRI风格）
     */
    private static final String WKT_TEMPLATE = "PROJCS[\"%s\","
            + "GEOGCS[\"GCS_China_Geodetic_Coordinate_System_2000\","
            + "DATUM[\"D_China_2000\",SPHEROID[\"CGCS2000\",6378137.0,298.257222101]],"
            + "PRIMEM[\"Greenwich\",0.0],"
            + "UNIT[\"Degree\",0.0174532925199433]],"
            + "PROJECTION[\"Gauss_Kruger\"],"
            + "PARAMETER[\"False_Easting\",%.1f],"
            + "PARAMETER[\"False_Northing\",0.0],"
            + "PARAMETER[\"Central_Meridian\",%.1f],"
            + "PARAMETER[\"Scale_Factor\",1.0],"
            + "PARAMETER[\"Latitude_Of_Origin\",0.0],"
            + "UNIT[\"Meter\",1.0]]";

    /**
     * 构建坐标系
     *
     * @param doc 几何后处理之后的解析结果
     *
     * @return 坐标系定义
     *
     * @throws CrsException 坐标系名称无效、分带与带号不匹配或中央经线超出范围
     */
    public CoordinateSystem build(ParsedDocument doc) {
        if (doc == null) {
            throw new CrsException("解析结果为空");
        }
        if (CollUtil.isEmpty(doc.getParcels())) {
            throw new CrsException("解析结果不包含任何地块");
        }
        Map<String, String> attrs = doc.getFileAttributes();
        if (attrs == null) {
            throw new CrsException("缺少文件属性");
        }

        String coordName = StrUtil.trim(attrs.get(ParsedDocument.ATTR_COORDINATE_SYSTEM));
        if (StrUtil.isEmpty(coordName)) {
            throw new CrsException("缺少坐标系字段");
        }
        if (!coordName.contains(CGCS2000_MARKER)) {
            throw new CrsException("坐标系必须为\"{}\"，当前为：{}", CGCS2000_MARKER, coordName);
        }

        // 1. 属性中的分带和带号
        int degreeAttr = parseInt(attrs.get(ParsedDocument.ATTR_DEGREE), ParsedDocument.ATTR_DEGREE);
        if (degreeAttr != 3 && degreeAttr != 6) {
            throw new CrsException("几度分带必须为 3 或 6，当前为：{}", degreeAttr);
        }
        int bandAttr = parseInt(attrs.get(ParsedDocument.ATTR_BAND), ParsedDocument.ATTR_BAND);

        // 2. 几何样本点推断带号
        int bandGeom = deriveBandFromFirstPoint(doc);
        boolean hasBand = bandGeom > 0;

        int degree;
        int band;
        if (hasBand && bandGeom != bandAttr) {
            // 实际坐标能推断带号且与属性不一致，以实际为准
            int geomDegree = degreeForBand(bandGeom);
            degree = geomDegree == 0 ? degreeAttr : geomDegree;
            band = bandGeom;
            log.debug("属性带号 {} 与几何带号 {} 不一致，采用几何带号，分带 {}", bandAttr, bandGeom, degree);
        } else {
            degree = degreeAttr;
            band = bandAttr;
        }

        // 3. 最终校验分带与带号是否匹配
        if (!bandMatchesDegree(degree, band)) {
            if (degreeAttr == 3) {
                throw new CrsException("3度带带号必须在[{},{}]范围内，当前带号：{}", MIN_3_DEGREE_BAND, MAX_3_DEGREE_BAND, band);
            }
            throw new CrsException("6度带带号必须在[{},{}]范围内，当前带号：{}", MIN_6_DEGREE_BAND, MAX_6_DEGREE_BAND, band);
        }

        // 4. 中央经线
        Double customCentral = extractCustomCentralMeridian(coordName);
        boolean custom = customCentral != null;
        double central = custom ? customCentral : standardCentralMeridian(degree, band);
        if (central < MIN_CENTRAL_MERIDIAN || central > MAX_CENTRAL_MERIDIAN) {
            throw new CrsException("中央经线 {} 超出中国区间 [{},{}]", central, MIN_CENTRAL_MERIDIAN, MAX_CENTRAL_MERIDIAN);
        }

        // 5. EPSG、名称与WKT
        boolean standardCentral = Math.abs(central % 3) < 1e-8;
        int epsg = standardCentral ? epsgCode(degree, band, hasBand) : 0;
        String name = projectionName(degree, band, central, hasBand, standardCentral);
        String wkt = buildWkt(name, central, band, hasBand);

        log.debug("坐标系构建完成：名称 {} 分带 {} 带号 {} 中央经线 {} EPSG {} 自定义中央经线 {}", name, degree, band, central, epsg, custom);
        return new CoordinateSystem(name, degree, band, central, epsg, custom, wkt);
    }

    private int parseInt(String value, String field) {
        try {
            return Integer.parseInt(StrUtil.trim(value));
        } catch (NumberFormatException e) {
            throw new CrsException(e, "{}无效: {}", field, value);
        }
    }

    /**
     * 从第一个地块第一个环中第一个Y不为0的点推断带号（Y坐标的百万位）
     *
     * @return 带号，无法推断时返回0
     */
    static int deriveBandFromFirstPoint(ParsedDocument doc) {
        Parcel parcel = doc.getParcels().get(0);
        List<List<Point>> rings = parcel.getRings();
        if (CollUtil.isEmpty(rings)) {
            return 0;
        }
        for (Point pt : rings.get(0)) {
            if (pt.getY() != 0) {
                int candidate = (int) Math.floor(pt.getY() / BAND_FACTOR);
                return Math.max(candidate, 0);
            }
        }
        return 0;
    }

    /**
     * 带号对应的分带，3度带与6度带的带号范围不重叠
     *
     * @return 3、6，带号不在任何范围内时返回0
     */
    static int degreeForBand(int band) {
        if (bandMatchesDegree(3, band)) {
            return 3;
        }
        if (bandMatchesDegree(6, band)) {
            return 6;
        }
        return 0;
    }

    static boolean bandMatchesDegree(int degree, int band) {
        if (degree == 3) {
            return band >= MIN_3_DEGREE_BAND && band <= MAX_3_DEGREE_BAND;
        }
        if (degree == 6) {
            return band >= MIN_6_DEGREE_BAND && band <= MAX_6_DEGREE_BAND;
        }
        return false;
    }

    /**
     * 提取坐标系名称最后一对半角括号内的自定义中央经线
     * <p>全角括号已在解析阶段转为半角</p>
     *
     * @return 中央经线，没有或无法解析时返回null
     */
    static Double extractCustomCentralMeridian(String name) {
        int start = name.lastIndexOf('(');
        int end = name.lastIndexOf(')');
        if (start == -1 || end <= start + 1) {
            return null;
        }
        String raw = StrUtil.trim(name.substring(start + 1, end));
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if ((c >= '0' && c <= '9') || c == '+' || c == '-' || c == '.') {
                sb.append(c);
            }
        }
        if (sb.length() == 0) {
            return null;
        }
        try {
            return Double.parseDouble(sb.toString());
        } catch (NumberFormatException e) {
            log.debug("坐标系 {} 括号内容 {} 不是有效的中央经线", name, raw);
            return null;
        }
    }

    /**
     * 标准中央经线：3度带 band*3，6度带 band*6-3
     */
    static double standardCentralMeridian(int degree, int band) {
        return degree == 3 ? band * 3.0 : band * 6.0 - 3.0;
    }

    /**
     * 根据分带、带号推断EPSG代码
     *
     * @param hasBand 几何坐标是否带有带号前缀，决定使用Zone系列还是CM系列代码
     *
     * @return EPSG代码，超出范围时返回0
     */
    static int epsgCode(int degree, int band, boolean hasBand) {
        if (degree == 6 && bandMatchesDegree(6, band)) {
            return (hasBand ? 4491 : 4502) + (band - MIN_6_DEGREE_BAND);
        }
        if (degree == 3 && bandMatchesDegree(3, band)) {
            return (hasBand ? 4513 : 4534) + (band - MIN_3_DEGREE_BAND);
        }
        return 0;
    }

    /**
     * 构造投影名称，标准中央经线用整数，非标准用一位小数
     */
    static String projectionName(int degree, int band, double central, boolean hasBand, boolean standardCentral) {
        String prefix = degree == 3 ? "CGCS2000_3_Degree_GK_" : "CGCS2000_GK_";
        if (hasBand) {
            return prefix + "Zone_" + band;
        }
        String cm = standardCentral ? String.valueOf((int) central) : String.format(Locale.ROOT, "%.1f", central);
        return prefix + "CM_" + cm + "E";
    }

    /**
     * 构造WKT，带号前缀存在时假东距为 band*1000000+500000
     */
    static String buildWkt(String name, double central, int band, boolean hasBand) {
        double falseEasting = hasBand ? band * BAND_FACTOR + BASE_FALSE_EASTING : BASE_FALSE_EASTING;
        return String.format(Locale.ROOT, WKT_TEMPLATE, name, falseEasting, central);
    }
}
