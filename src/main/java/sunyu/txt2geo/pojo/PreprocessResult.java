package sunyu.txt2geo.pojo;

import java.util.List;

/**
 * 预处理结果集合
 */
public class PreprocessResult {
    /**
     * 坐标系，存在EPSG时为"EPSG:xxxx"，否则为完整WKT
     */
    private String crs;
    /**
     * EPSG代码，没有标准代码时为0
     */
    private int epsg;
    /**
     * 要素列表，与地块顺序一致
     */
    private List<Feature> features;

    public PreprocessResult() {
    }

    public PreprocessResult(String crs, int epsg, List<Feature> features) {
        this.crs = crs;
        this.epsg = epsg;
        this.features = features;
    }

    public String getCrs() {
        return crs;
    }

    public void setCrs(String crs) {
        this.crs = crs;
    }

    public int getEpsg() {
        return epsg;
    }

    public void setEpsg(int epsg) {
        this.epsg = epsg;
    }

    public List<Feature> getFeatures() {
        return features;
    }

    public void setFeatures(List<Feature> features) {
        this.features = features;
    }
}
