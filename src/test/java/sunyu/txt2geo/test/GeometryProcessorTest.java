package sunyu.txt2geo.test;

import cn.hutool.log.Log;
import cn.hutool.log.LogFactory;
import org.junit.jupiter.api.Test;
import sunyu.txt2geo.GeometryProcessor;
import sunyu.txt2geo.pojo.GeometryOptions;
import sunyu.txt2geo.pojo.Parcel;
import sunyu.txt2geo.pojo.ParsedDocument;
import sunyu.txt2geo.pojo.Point;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class GeometryProcessorTest {
    Log log = LogFactory.get();
    GeometryProcessor processor = new GeometryProcessor();

    private ParsedDocument document(List<Point>... rings) {
        List<List<Point>> list = new ArrayList<>();
        for (List<Point> ring : rings) {
            list.add(new ArrayList<>(ring));
        }
        List<Parcel> parcels = new ArrayList<>();
        parcels.add(new Parcel(new LinkedHashMap<>(), list));
        return new ParsedDocument(parcels, new HashMap<>());
    }

    private List<Point> ring(ParsedDocument doc, int index) {
        return doc.getParcels().get(0).getRings().get(index);
    }

    private List<Integer> ids(List<Point> ring) {
        List<Integer> ids = new ArrayList<>();
        for (Point p : ring) {
            ids.add(p.getId());
        }
        return ids;
    }

    @Test
    void 容差范围内的点被合并() {
        ParsedDocument doc = document(Arrays.asList(
                new Point(1, 1, 3400000.0, 39500000.0),
                new Point(2, 1, 3400000.00003, 39500000.00003),
                new Point(3, 1, 3400010.0, 39500000.0)));
        processor.process(doc, new GeometryOptions(GeometryProcessor.MAX_TOLERANCE, true, false));
        assertEquals(Arrays.asList(1, 3), ids(ring(doc, 0)));
    }

    @Test
    void 开放三点环自动闭合() {
        ParsedDocument doc = document(Arrays.asList(
                new Point(1, 1, 0, 0),
                new Point(2, 1, 0, 10),
                new Point(3, 1, 10, 10)));
        processor.process(doc, new GeometryOptions(GeometryProcessor.MAX_TOLERANCE, true, true));
        List<Point> r = ring(doc, 0);
        assertEquals(4, r.size());
        assertEquals(Arrays.asList(1, 2, 3, 1), ids(r));
        assertEquals(r.get(0).getX(), r.get(3).getX());
        assertEquals(r.get(0).getY(), r.get(3).getY());
    }

    @Test
    void 自动闭合复制排序后的首点() {
        ParsedDocument doc = document(Arrays.asList(
                new Point(3, 1, 10, 10),
                new Point(1, 1, 0, 0),
                new Point(2, 1, 0, 10)));
        processor.process(doc, new GeometryOptions(0, true, true));
        List<Point> r = ring(doc, 0);
        assertEquals(Arrays.asList(1, 2, 3, 1), ids(r));
        assertEquals(0.0, r.get(3).getX());
    }

    @Test
    void 已闭合环的闭合点保持在最后() {
        ParsedDocument doc = document(Arrays.asList(
                new Point(1, 1, 0, 0),
                new Point(3, 1, 10, 10),
                new Point(2, 1, 0, 10),
                new Point(1, 1, 0, 0)));
        processor.process(doc, new GeometryOptions(0, false, false));
        assertEquals(Arrays.asList(1, 2, 3, 1), ids(ring(doc, 0)));
    }

    @Test
    void 关闭自动闭合时开放环保持开放() {
        ParsedDocument doc = document(Arrays.asList(
                new Point(2, 1, 0, 10),
                new Point(1, 1, 0, 0),
                new Point(3, 1, 10, 10)));
        processor.process(doc, new GeometryOptions(0, true, false));
        assertEquals(Arrays.asList(1, 2, 3), ids(ring(doc, 0)));
    }

    @Test
    void 相同点号保持原有顺序() {
        ParsedDocument doc = document(Arrays.asList(
                new Point(0, 1, 0, 0),
                new Point(0, 1, 0, 10),
                new Point(0, 1, 10, 10)));
        processor.process(doc, new GeometryOptions(0, false, false));
        List<Point> r = ring(doc, 0);
        assertEquals(0.0, r.get(0).getY());
        assertEquals(10.0, r.get(1).getY());
        assertEquals(10.0, r.get(2).getX());
    }

    @Test
    void 空环与单点环不处理() {
        ParsedDocument doc = document(new ArrayList<>(), Arrays.asList(new Point(1, 2, 5, 5)));
        processor.process(doc, new GeometryOptions(0, true, true));
        assertTrue(ring(doc, 0).isEmpty());
        assertEquals(1, ring(doc, 1).size());
    }

    /**
     * 模拟外业成果：顶点间距远大于容差，点号乱序，部分点重复测量，末尾可能带闭合点
     * <p>sharedCorner 为 true 时追加一个点号最大、坐标与最小点号重合的顶点</p>
     */
    private List<Point> surveyRing(Random random, boolean withClosingPoint, boolean sharedCorner) {
        List<Integer> ids = new ArrayList<>();
        for (int i = 1; i <= 12; i++) {
            ids.add(i);
        }
        Collections.shuffle(ids, random);
        List<Point> points = new ArrayList<>();
        Point smallest = null;
        for (int i = 0; i < ids.size(); i++) {
            Point p = new Point(ids.get(i), 1, 3400000 + i * 10.0, 39500000 + (i % 4) * 7.0);
            points.add(p);
            if (p.getId() == 1) {
                smallest = p;
            }
            if (random.nextBoolean()) {
                points.add(new Point(p.getId(), 1, p.getX() + 0.00003, p.getY() - 0.00002));
            }
        }
        if (sharedCorner) {
            points.add(random.nextInt(points.size() + 1), new Point(13, 1, smallest.getX(), smallest.getY()));
        }
        if (withClosingPoint) {
            Point first = points.get(0);
            points.add(new Point(first.getId(), 1, first.getX(), first.getY()));
        }
        return points;
    }

    private List<String> describe(List<Point> ring) {
        List<String> list = new ArrayList<>();
        for (Point p : ring) {
            list.add(p.toString());
        }
        return list;
    }

    @Test
    void 重复处理结果不变() {
        long seed = System.nanoTime();
        log.info("随机种子 {}", seed);
        Random random = new Random(seed);
        for (int round = 0; round < 20; round++) {
            for (boolean closing : new boolean[]{true, false}) {
                for (boolean shared : new boolean[]{true, false}) {
                    for (boolean dedup : new boolean[]{true, false}) {
                        for (boolean autoClose : new boolean[]{true, false}) {
                            ParsedDocument doc = document(surveyRing(random, closing, shared));
                            GeometryOptions opts = new GeometryOptions(0, dedup, autoClose);
                            processor.process(doc, opts);
                            List<String> once = describe(ring(doc, 0));
                            processor.process(doc, opts);
                            assertEquals(once, describe(ring(doc, 0)), "seed=" + seed + " closing=" + closing
                                    + " shared=" + shared + " dedup=" + dedup + " autoClose=" + autoClose);
                        }
                    }
                }
            }
        }
    }

    @Test
    void 坐标重合的不同点号不视为闭合点() {
        ParsedDocument doc = document(Arrays.asList(
                new Point(2, 1, 0, 10),
                new Point(4, 1, 0, 0),
                new Point(1, 1, 0, 0),
                new Point(3, 1, 10, 10)));
        GeometryOptions opts = new GeometryOptions(0, false, false);
        processor.process(doc, opts);
        assertEquals(Arrays.asList(1, 2, 3, 4), ids(ring(doc, 0)));
        List<String> once = describe(ring(doc, 0));
        processor.process(doc, opts);
        assertEquals(once, describe(ring(doc, 0)));
    }

    @Test
    void 起点不是最小点号的闭合环排序后仍闭合() {
        ParsedDocument doc = document(Arrays.asList(
                new Point(3, 1, 10, 10),
                new Point(1, 1, 0, 0),
                new Point(2, 1, 0, 10),
                new Point(3, 1, 10, 10)));
        processor.process(doc, new GeometryOptions(0, false, false));
        List<Point> r = ring(doc, 0);
        assertEquals(Arrays.asList(1, 2, 3, 1), ids(r));
        assertEquals(0.0, r.get(3).getX());
    }

    @Test
    void 去重后没有相邻格点() {
        long seed = System.nanoTime();
        log.info("随机种子 {}", seed);
        Random random = new Random(seed);
        List<Point> points = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            points.add(new Point(i, 1, 3400000 + random.nextDouble() * 0.003, 39500000 + random.nextDouble() * 0.003));
        }
        ParsedDocument doc = document(points);
        processor.process(doc, new GeometryOptions(0, true, false));
        List<Point> r = ring(doc, 0);
        double scale = GeometryProcessor.precisionToScale(GeometryProcessor.MAX_TOLERANCE);
        int n = r.size();
        // 首尾在容差内时末尾为闭合点
        if (n > 1 && r.get(0).getX() == r.get(n - 1).getX() && r.get(0).getY() == r.get(n - 1).getY()) {
            n--;
        }
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                long dx = Math.abs(Math.round(r.get(i).getX() * scale) - Math.round(r.get(j).getX() * scale));
                long dy = Math.abs(Math.round(r.get(i).getY() * scale) - Math.round(r.get(j).getY() * scale));
                assertFalse(dx <= 1 && dy <= 1, "相邻点 " + r.get(i) + " " + r.get(j));
            }
        }
        log.info("去重前 {} 去重后 {}", points.size(), r.size());
    }

    @Test
    void 自动闭合后首尾点号一致() {
        long seed = System.nanoTime();
        log.info("随机种子 {}", seed);
        Random random = new Random(seed);
        for (int n = 2; n < 10; n++) {
            List<Point> points = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                points.add(new Point(1 + random.nextInt(99), 1, i * 10.0, random.nextDouble() * 100));
            }
            ParsedDocument doc = document(points);
            processor.process(doc, new GeometryOptions(0, false, true));
            List<Point> r = ring(doc, 0);
            assertEquals(r.get(0).getId(), r.get(r.size() - 1).getId(), "seed=" + seed);
        }
    }

    @Test
    void 容差归一化() {
        assertEquals(GeometryProcessor.MAX_TOLERANCE, GeometryProcessor.normalizePrecision(0));
        assertEquals(GeometryProcessor.MAX_TOLERANCE, GeometryProcessor.normalizePrecision(-1));
        assertEquals(GeometryProcessor.MAX_TOLERANCE, GeometryProcessor.normalizePrecision(Double.NaN));
        assertEquals(GeometryProcessor.MAX_TOLERANCE, GeometryProcessor.normalizePrecision(0.5));
        assertEquals(0.00001, GeometryProcessor.normalizePrecision(0.00001));

        assertEquals(GeometryProcessor.MAX_TOLERANCE, GeometryProcessor.parsePrecision(null));
        assertEquals(GeometryProcessor.MAX_TOLERANCE, GeometryProcessor.parsePrecision("abc"));
        assertEquals(GeometryProcessor.MAX_TOLERANCE, GeometryProcessor.parsePrecision("0.01"));
        assertEquals(0.00001, GeometryProcessor.parsePrecision(" 0.00001 "));
    }

    @Test
    void 小数位与离散比例() {
        long seed = System.nanoTime();
        log.info("随机种子 {}", seed);
        Random random = new Random(seed);
        assertEquals(4, GeometryProcessor.decimalPlaces(0.0001));
        assertEquals(5, GeometryProcessor.decimalPlaces(0.00005));
        assertEquals(5, GeometryProcessor.decimalPlaces(0.00001));
        assertEquals(6, GeometryProcessor.decimalPlaces(0.000001));
        assertEquals(6, GeometryProcessor.decimalPlaces(1e-9));
        for (int i = 0; i < 100; i++) {
            int dec = GeometryProcessor.decimalPlaces(1e-12 + random.nextDouble() * (GeometryProcessor.MAX_TOLERANCE - 1e-12));
            assertTrue(dec >= 4 && dec <= 6, "seed=" + seed);
        }
        assertEquals(10000.0, GeometryProcessor.precisionToScale(0.0001));
        assertEquals(100000.0, GeometryProcessor.precisionToScale(0.00005));
    }
}
