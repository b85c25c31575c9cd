package sunyu.txt2geo.pojo;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 地块实体，包含属性字段与几何（一个或多个环）
 *
 * @author SunYu
 */
public class Parcel {
    /**
     * 界址点数
     */
    public static final String KEY_BP_CNT = "bp_cnt";
    /**
     * 地块面积
     */
    public static final String KEY_AREA = "area";
    /**
     * 地块编号
     */
    public static final String KEY_PID = "pid";
    /**
     * 地块名称
     */
    public static final String KEY_PNAME = "pname";
    /**
     * 记录图形属性(点/线/面)
     */
    public static final String KEY_GTYPE = "gtype";
    /**
     * 图幅号
     */
    public static final String KEY_SHEET = "sheet";
    /**
     * 地块用途
     */
    public static final String KEY_USAGE = "usage";
    /**
     * 地块编码
     */
    public static final String KEY_CODE = "code";

    /**
     * 地块起始行的字段顺序
     */
    public static final String[] ATTRIBUTE_KEYS = {KEY_BP_CNT, KEY_AREA, KEY_PID, KEY_PNAME, KEY_GTYPE, KEY_SHEET, KEY_USAGE, KEY_CODE};

    /**
     * 地块属性，按 {@link #ATTRIBUTE_KEYS} 顺序保存
     */
    private Map<String, String> attributes;

    /**
     * 地块的环，按圈号升序
     */
    private List<List<Point>> rings;

    public Parcel() {
        this(new LinkedHashMap<>(), new ArrayList<>());
    }

    public Parcel(Map<String, String> attributes, List<List<Point>> rings) {
        this.attributes = attributes;
        this.rings = rings;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public void setAttributes(Map<String, String> attributes) {
        this.attributes = attributes;
    }

    public List<List<Point>> getRings() {
        return rings;
    }

    public void setRings(List<List<Point>> rings) {
        this.rings = rings;
    }

    /**
     * 地块编号，用于错误提示
     *
     * @return 地块编号，不存在时为空串
     */
    public String getPid() {
        if (attributes == null) {
            return "";
        }
        String pid = attributes.get(KEY_PID);
        return pid == null ? "" : pid;
    }
}
