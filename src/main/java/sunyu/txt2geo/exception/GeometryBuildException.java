package sunyu.txt2geo.exception;

/**
 * 地块几何无法构成有效多边形：无环、环点数不足或环未闭合
 */
public class GeometryBuildException extends Txt2GeoException {
    private final String parcelId;

    public GeometryBuildException(String parcelId, String template, Object... params) {
        super(template, params);
        this.parcelId = parcelId;
    }

    public String getParcelId() {
        return parcelId;
    }
}
