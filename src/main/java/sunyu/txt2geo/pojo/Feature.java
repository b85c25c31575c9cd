package sunyu.txt2geo.pojo;

import java.util.Map;

/**
 * 预处理阶段的单个要素
 */
public class Feature {
    /**
     * 地块多边形WKT（Y在前，X在后）
     */
    private String wkt;
    /**
     * 地块属性
     */
    private Map<String, Object> attributes;

    public Feature() {
    }

    public Feature(String wkt, Map<String, Object> attributes) {
        this.wkt = wkt;
        this.attributes = attributes;
    }

    public String getWkt() {
        return wkt;
    }

    public void setWkt(String wkt) {
        this.wkt = wkt;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public void setAttributes(Map<String, Object> attributes) {
        this.attributes = attributes;
    }
}
