package sunyu.txt2geo;

import cn.hutool.core.util.StrUtil;
import cn.hutool.log.Log;
import cn.hutool.log.LogFactory;
import sunyu.txt2geo.pojo.GeometryOptions;
import sunyu.txt2geo.pojo.ParsedDocument;
import sunyu.txt2geo.pojo.Parcel;
import sunyu.txt2geo.pojo.Point;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 环的几何后处理：八邻域去重、自动闭合、按点号排序
 * <p>
 * 对每个地块的每个环原地处理，结果只取决于环内容和选项，对同一结果重复处理不会再有变化。
 * </p>
 *
 * @author SunYu
 */
public class GeometryProcessor {
    private static final Log log = LogFactory.get();

    /**
     * 最大允许容差（数字越小精度越高）
     */
    public static final double MAX_TOLERANCE = 0.0001;

    /**
     * 渲染WKT时的小数位范围
     */
    private static final int MIN_DECIMAL_PLACES = 4;
    private static final int MAX_DECIMAL_PLACES = 6;

    /**
     * 八邻域偏移（含自身）
     */
    private static final long[][] NEIGHBORS = {{-1, -1}, {-1, 0}, {-1, 1}, {0, -1}, {0, 0}, {0, 1}, {1, -1}, {1, 0}, {1, 1}};

    /**
     * 对所有地块的环执行去重、自动闭合与排序
     *
     * @param doc  解析结果，环会被原地替换
     * @param opts 几何选项，容差会先归一化
     */
    public void process(ParsedDocument doc, GeometryOptions opts) {
        if (doc == null || doc.getParcels() == null) {
            return;
        }
        double precision = normalizePrecision(opts.getPrecision());
        double scale = precisionToScale(precision);
        int ringCount = 0;
        for (Parcel parcel : doc.getParcels()) {
            List<List<Point>> rings = parcel.getRings();
            for (int i = 0; i < rings.size(); i++) {
                List<Point> ring = rings.get(i);
                if (ring == null || ring.isEmpty()) {
                    continue;
                }
                rings.set(i, processRing(ring, scale, precision, opts.isDeduplicate(), opts.isAutoClose()));
                ringCount++;
            }
        }
        log.debug("几何后处理完成：容差 {} 去重 {} 自动闭合 {} 环数 {}", precision, opts.isDeduplicate(), opts.isAutoClose(), ringCount);
    }

    /**
     * 处理单个环：可选去重 -> 可选自动闭合 -> 排序（闭合点保持在最后）
     * <p>闭合点统一取排序后首点的副本，保证首尾点号一致</p>
     */
    private List<Point> processRing(List<Point> ring, double scale, double precision, boolean dedup, boolean autoClose) {
        List<Point> r = dedup ? deduplicate(ring, scale) : new ArrayList<>(ring);
        if (r.size() < 2) {
            return r;
        }
        Point head = r.get(0);
        Point tail = r.get(r.size() - 1);
        // 首尾点号相同且坐标在容差内才算闭合点，坐标重合的不同点号仍参与排序
        boolean closed = head.getId() == tail.getId() && pointsEqual(head, tail, precision);

        // 已闭合的环，末尾闭合点不参与排序
        List<Point> body = closed ? new ArrayList<>(r.subList(0, r.size() - 1)) : r;
        body.sort(Comparator.comparingInt(Point::getId));

        if (closed || autoClose) {
            Point first = body.get(0);
            body.add(new Point(first.getId(), first.getRingId(), first.getX(), first.getY()));
        }
        return body;
    }

    /**
     * 八邻域去重，坐标离散化后自身或相邻格点已被占用的点视为重复点，先出现者保留
     */
    private List<Point> deduplicate(List<Point> ring, double scale) {
        Set<GridKey> seen = new HashSet<>(ring.size() * 2);
        List<Point> result = new ArrayList<>(ring.size());
        for (Point pt : ring) {
            long gx = Math.round(pt.getX() * scale);
            long gy = Math.round(pt.getY() * scale);
            boolean duplicate = false;
            for (long[] off : NEIGHBORS) {
                if (seen.contains(new GridKey(gx + off[0], gy + off[1]))) {
                    duplicate = true;
                    break;
                }
            }
            if (duplicate) {
                log.trace("去除重复点：点号 {} 圈号 {} [{},{}]", pt.getId(), pt.getRingId(), pt.getX(), pt.getY());
                continue;
            }
            seen.add(new GridKey(gx, gy));
            result.add(pt);
        }
        return result;
    }

    /**
     * 判断两点是否在容差范围内相等
     */
    private boolean pointsEqual(Point a, Point b, double tolerance) {
        return Math.abs(a.getX() - b.getX()) <= tolerance && Math.abs(a.getY() - b.getY()) <= tolerance;
    }

    /**
     * 归一化容差，非法或超出范围时回退到 {@link #MAX_TOLERANCE}
     *
     * @param precision 用户或文件提供的容差
     *
     * @return (0, MAX_TOLERANCE] 范围内的容差
     */
    public static double normalizePrecision(double precision) {
        if (Double.isNaN(precision) || precision <= 0 || precision > MAX_TOLERANCE) {
            return MAX_TOLERANCE;
        }
        return precision;
    }

    /**
     * 解析文件属性中的精度字符串
     *
     * @param precision 精度字符串，可为空
     *
     * @return 归一化后的容差，无法解析时为 {@link #MAX_TOLERANCE}
     */
    public static double parsePrecision(String precision) {
        if (StrUtil.isBlank(precision)) {
            return MAX_TOLERANCE;
        }
        try {
            return normalizePrecision(Double.parseDouble(StrUtil.trim(precision)));
        } catch (NumberFormatException e) {
            log.debug("精度 {} 无法解析，使用默认容差 {}", precision, MAX_TOLERANCE);
            return MAX_TOLERANCE;
        }
    }

    /**
     * 根据容差求WKT小数位，限制在4~6位
     *
     * @param precision 容差
     *
     * @return 小数位
     */
    public static int decimalPlaces(double precision) {
        int dec = digits(normalizePrecision(precision));
        return Math.max(MIN_DECIMAL_PLACES, Math.min(MAX_DECIMAL_PLACES, dec));
    }

    /**
     * 根据容差推导离散化比例，至少与 {@link #MAX_TOLERANCE} 对应的精度一致
     *
     * @param precision 容差
     *
     * @return 10的整数次幂
     */
    public static double precisionToScale(double precision) {
        int dec = digits(normalizePrecision(precision));
        int minDec = digits(MAX_TOLERANCE);
        return Math.pow(10, Math.max(dec, minDec));
    }

    /**
     * ceil(-log10(p))，10的整数次幂对应的浮点误差不进位
     */
    private static int digits(double precision) {
        return (int) Math.ceil(-Math.log10(precision) - 1e-9);
    }

    /**
     * 离散网格坐标
     */
    private static final class GridKey {
        private final long x;
        private final long y;

        GridKey(long x, long y) {
            this.x = x;
            this.y = y;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof GridKey)) {
                return false;
            }
            GridKey other = (GridKey) o;
            return x == other.x && y == other.y;
        }

        @Override
        public int hashCode() {
            return 31 * Long.hashCode(x) + Long.hashCode(y);
        }
    }
}
