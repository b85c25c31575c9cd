package sunyu.txt2geo.pojo;

import java.util.List;
import java.util.Map;

/**
 * 解析结果：地块集合与文件级属性
 *
 * @author SunYu
 */
public class ParsedDocument {
    /**
     * 坐标系
     */
    public static final String ATTR_COORDINATE_SYSTEM = "坐标系";
    /**
     * 投影类型
     */
    public static final String ATTR_PROJECTION_TYPE = "投影类型";
    /**
     * 几度分带
     */
    public static final String ATTR_DEGREE = "几度分带";
    /**
     * 带号
     */
    public static final String ATTR_BAND = "带号";
    /**
     * 精度（可选）
     */
    public static final String ATTR_PRECISION = "精度";

    /**
     * 解析出的地块集合，保持源文件顺序
     */
    private List<Parcel> parcels;

    /**
     * 文件级属性键值对（来自[属性描述]部分）
     */
    private Map<String, String> fileAttributes;

    public ParsedDocument() {
    }

    public ParsedDocument(List<Parcel> parcels, Map<String, String> fileAttributes) {
        this.parcels = parcels;
        this.fileAttributes = fileAttributes;
    }

    public List<Parcel> getParcels() {
        return parcels;
    }

    public void setParcels(List<Parcel> parcels) {
        this.parcels = parcels;
    }

    public Map<String, String> getFileAttributes() {
        return fileAttributes;
    }

    public void setFileAttributes(Map<String, String> fileAttributes) {
        this.fileAttributes = fileAttributes;
    }
}
