package sunyu.txt2geo;

import cn.hutool.core.collection.CollUtil;
import cn.hutool.core.util.NumberUtil;
import cn.hutool.log.Log;
import cn.hutool.log.LogFactory;
import sunyu.txt2geo.exception.GeometryBuildException;
import sunyu.txt2geo.pojo.CoordinateSystem;
import sunyu.txt2geo.pojo.Feature;
import sunyu.txt2geo.pojo.ParsedDocument;
import sunyu.txt2geo.pojo.Parcel;
import sunyu.txt2geo.pojo.Point;
import sunyu.txt2geo.pojo.PreprocessResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 把几何后处理后的地块组装为WKT要素，并与坐标系配对
 *
 * @author SunYu
 */
public class FeatureAssembler {
    private static final Log log = LogFactory.get();

    /**
     * 构成多边形环的最少点数（含闭合点）
     */
    public static final int MIN_RING_POINTS = 4;

    /**
     * 组装预处理结果
     *
     * @param doc              几何后处理后的解析结果
     * @param coordinateSystem 坐标系
     * @param decimalPlaces    WKT坐标小数位
     *
     * @return 预处理结果，要素顺序与地块顺序一致
     *
     * @throws GeometryBuildException 地块无环、环点数不足或未闭合
     */
    public PreprocessResult assemble(ParsedDocument doc, CoordinateSystem coordinateSystem, int decimalPlaces) {
        List<Feature> features = new ArrayList<>(doc.getParcels().size());
        for (Parcel parcel : doc.getParcels()) {
            features.add(new Feature(buildPolygonWkt(parcel, decimalPlaces), copyAttributes(parcel.getAttributes())));
        }

        String crs = coordinateSystem.getWkt();
        int epsg = 0;
        if (coordinateSystem.getEpsg() > 0) {
            epsg = coordinateSystem.getEpsg();
            crs = "EPSG:" + epsg;
        }
        log.debug("要素组装完成：要素数 {} 坐标系 {}", features.size(), epsg > 0 ? crs : coordinateSystem.getName());
        return new PreprocessResult(crs, epsg, features);
    }

    /**
     * 构建单个地块的WKT，例如 POLYGON ((y1 x1, y2 x2, ...), (...))
     */
    String buildPolygonWkt(Parcel parcel, int decimalPlaces) {
        String pid = parcel.getPid();
        if (CollUtil.isEmpty(parcel.getRings())) {
            throw new GeometryBuildException(pid, "地块 {} 不包含任何环", pid);
        }
        StringBuilder sb = new StringBuilder("POLYGON (");
        for (int i = 0; i < parcel.getRings().size(); i++) {
            List<Point> ring = parcel.getRings().get(i);
            if (ring.size() < MIN_RING_POINTS) {
                throw new GeometryBuildException(pid, "地块 {} 的第{}个环点数少于{}，无法构成有效多边形", pid, i + 1, MIN_RING_POINTS);
            }
            if (ring.get(0).getId() != ring.get(ring.size() - 1).getId()) {
                throw new GeometryBuildException(pid, "地块 {} 的第{}个环不是闭合的", pid, i + 1);
            }
            for (Point p : ring) {
                if (!Double.isFinite(p.getX()) || !Double.isFinite(p.getY())) {
                    throw new GeometryBuildException(pid, "地块 {} 的第{}个环点号 {} 坐标无效 [{},{}]", pid, i + 1, p.getId(), p.getX(), p.getY());
                }
            }
            if (i > 0) {
                sb.append(", ");
            }
            appendRing(sb, ring, decimalPlaces);
        }
        return sb.append(')').toString();
    }

    /**
     * 输出环，Y在前X在后
     */
    private void appendRing(StringBuilder sb, List<Point> ring, int decimalPlaces) {
        sb.append('(');
        for (int i = 0; i < ring.size(); i++) {
            Point p = ring.get(i);
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(NumberUtil.roundStr(p.getY(), decimalPlaces))
                    .append(' ')
                    .append(NumberUtil.roundStr(p.getX(), decimalPlaces));
        }
        sb.append(')');
    }

    private Map<String, Object> copyAttributes(Map<String, String> attributes) {
        Map<String, Object> m = new LinkedHashMap<>();
        if (attributes != null) {
            m.putAll(attributes);
        }
        return m;
    }
}
