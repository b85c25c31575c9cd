package sunyu.txt2geo.test;

import org.junit.jupiter.api.Test;
import sunyu.txt2geo.FeatureAssembler;
import sunyu.txt2geo.exception.GeometryBuildException;
import sunyu.txt2geo.pojo.CoordinateSystem;
import sunyu.txt2geo.pojo.Feature;
import sunyu.txt2geo.pojo.Parcel;
import sunyu.txt2geo.pojo.ParsedDocument;
import sunyu.txt2geo.pojo.Point;
import sunyu.txt2geo.pojo.PreprocessResult;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class FeatureAssemblerTest {
    FeatureAssembler assembler = new FeatureAssembler();

    CoordinateSystem zone39 = new CoordinateSystem("CGCS2000_3_Degree_GK_Zone_39", 3, 39, 117, 4527, false, "PROJCS[\"CGCS2000_3_Degree_GK_Zone_39\"]");
    CoordinateSystem custom = new CoordinateSystem("CGCS2000_3_Degree_GK_Zone_38", 3, 38, 114.3, 0, true, "PROJCS[\"CGCS2000_3_Degree_GK_Zone_38\"]");

    private Parcel parcel(String pid, List<Point>... rings) {
        Map<String, String> attrs = new LinkedHashMap<>();
        for (String key : Parcel.ATTRIBUTE_KEYS) {
            attrs.put(key, "");
        }
        attrs.put(Parcel.KEY_PID, pid);
        return new Parcel(attrs, new ArrayList<>(Arrays.asList(rings)));
    }

    private ParsedDocument document(Parcel... parcels) {
        return new ParsedDocument(new ArrayList<>(Arrays.asList(parcels)), new HashMap<>());
    }

    private List<Point> square(int ringId, double x, double y, double size) {
        return Arrays.asList(
                new Point(1, ringId, x, y),
                new Point(2, ringId, x, y + size),
                new Point(3, ringId, x + size, y + size),
                new Point(4, ringId, x + size, y),
                new Point(1, ringId, x, y));
    }

    @Test
    void Y在前X在后() {
        PreprocessResult result = assembler.assemble(document(parcel("G1", square(1, 3400000, 39500000, 10))), zone39, 4);
        assertEquals(1, result.getFeatures().size());
        assertEquals("POLYGON ((39500000.0000 3400000.0000, 39500010.0000 3400000.0000, 39500010.0000 3400010.0000, "
                + "39500000.0000 3400010.0000, 39500000.0000 3400000.0000))", result.getFeatures().get(0).getWkt());
    }

    @Test
    void 多个环() {
        PreprocessResult result = assembler.assemble(document(parcel("G1", square(1, 0, 0, 100), square(2, 10, 10, 5))), zone39, 4);
        String wkt = result.getFeatures().get(0).getWkt();
        assertTrue(wkt.startsWith("POLYGON ((0.0000 0.0000, "));
        assertTrue(wkt.contains("0.0000 0.0000), (10.0000 10.0000, "), wkt);
        assertTrue(wkt.endsWith("(10.0000 10.0000, 15.0000 10.0000, 15.0000 15.0000, 10.0000 15.0000, 10.0000 10.0000))"));
    }

    @Test
    void 四舍五入到指定小数位() {
        List<Point> ring = Arrays.asList(
                new Point(1, 1, 3400000.00005, 39500000.123449),
                new Point(2, 1, 3400000.0, 39500010.0),
                new Point(3, 1, 3400010.0, 39500010.0),
                new Point(1, 1, 3400000.00005, 39500000.123449));
        String wkt = assembler.assemble(document(parcel("G1", ring)), zone39, 4).getFeatures().get(0).getWkt();
        assertTrue(wkt.startsWith("POLYGON ((39500000.1234 3400000.0001, "), wkt);

        String wkt6 = assembler.assemble(document(parcel("G1", ring)), zone39, 6).getFeatures().get(0).getWkt();
        assertTrue(wkt6.startsWith("POLYGON ((39500000.123449 3400000.000050, "), wkt6);
    }

    @Test
    void 坐标系输出() {
        PreprocessResult epsg = assembler.assemble(document(parcel("G1", square(1, 0, 0, 1))), zone39, 4);
        assertEquals("EPSG:4527", epsg.getCrs());
        assertEquals(4527, epsg.getEpsg());

        PreprocessResult wkt = assembler.assemble(document(parcel("G1", square(1, 0, 0, 1))), custom, 4);
        assertEquals(custom.getWkt(), wkt.getCrs());
        assertEquals(0, wkt.getEpsg());
    }

    @Test
    void 属性复制() {
        Parcel p = parcel("G7", square(1, 0, 0, 1));
        p.getAttributes().put(Parcel.KEY_PNAME, "七号地块");
        Feature feature = assembler.assemble(document(p), zone39, 4).getFeatures().get(0);
        assertEquals("G7", feature.getAttributes().get(Parcel.KEY_PID));
        assertEquals("七号地块", feature.getAttributes().get(Parcel.KEY_PNAME));
        assertEquals(Arrays.asList(Parcel.ATTRIBUTE_KEYS), new ArrayList<>(feature.getAttributes().keySet()));
        feature.getAttributes().put("extra", 1);
        assertFalse(p.getAttributes().containsKey("extra"));
    }

    @Test
    void 要素顺序与地块一致() {
        PreprocessResult result = assembler.assemble(document(
                parcel("A", square(1, 0, 0, 1)),
                parcel("B", square(1, 5, 5, 1)),
                parcel("C", square(1, 9, 9, 1))), zone39, 4);
        assertEquals("A", result.getFeatures().get(0).getAttributes().get(Parcel.KEY_PID));
        assertEquals("B", result.getFeatures().get(1).getAttributes().get(Parcel.KEY_PID));
        assertEquals("C", result.getFeatures().get(2).getAttributes().get(Parcel.KEY_PID));
    }

    @Test
    void 环点数不足() {
        List<Point> ring = Arrays.asList(new Point(1, 1, 0, 0), new Point(2, 1, 0, 1), new Point(1, 1, 0, 0));
        GeometryBuildException e = assertThrows(GeometryBuildException.class,
                () -> assembler.assemble(document(parcel("G1", square(1, 0, 0, 1)), parcel("G2", ring)), zone39, 4));
        assertEquals("G2", e.getParcelId());
        assertTrue(e.getMessage().contains("G2"));
    }

    @Test
    void 环未闭合() {
        List<Point> ring = Arrays.asList(new Point(1, 1, 0, 0), new Point(2, 1, 0, 1), new Point(3, 1, 1, 1), new Point(4, 1, 1, 0));
        GeometryBuildException e = assertThrows(GeometryBuildException.class, () -> assembler.assemble(document(parcel("G3", ring)), zone39, 4));
        assertEquals("G3", e.getParcelId());
    }

    @Test
    void 地块无环() {
        GeometryBuildException e = assertThrows(GeometryBuildException.class, () -> assembler.assemble(document(parcel("G4")), zone39, 4));
        assertEquals("G4", e.getParcelId());
    }

    @Test
    void 坐标非有限值() {
        List<Point> ring = Arrays.asList(new Point(1, 1, 0, 0), new Point(2, 1, Double.NaN, 1), new Point(3, 1, 1, 1), new Point(1, 1, 0, 0));
        GeometryBuildException e = assertThrows(GeometryBuildException.class, () -> assembler.assemble(document(parcel("G5", ring)), zone39, 4));
        assertEquals("G5", e.getParcelId());
    }
}
