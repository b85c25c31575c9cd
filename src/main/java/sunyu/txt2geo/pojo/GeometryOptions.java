package sunyu.txt2geo.pojo;

/**
 * 几何后处理选项
 */
public class GeometryOptions {
    /**
     * 容差（不大于最大容差，非法值回退到最大容差）
     */
    private double precision;
    /**
     * 是否按坐标容差去重
     */
    private boolean deduplicate;
    /**
     * 是否自动闭合
     */
    private boolean autoClose;

    public GeometryOptions() {
    }

    public GeometryOptions(double precision, boolean deduplicate, boolean autoClose) {
        this.precision = precision;
        this.deduplicate = deduplicate;
        this.autoClose = autoClose;
    }

    public double getPrecision() {
        return precision;
    }

    public void setPrecision(double precision) {
        this.precision = precision;
    }

    public boolean isDeduplicate() {
        return deduplicate;
    }

    public void setDeduplicate(boolean deduplicate) {
        this.deduplicate = deduplicate;
    }

    public boolean isAutoClose() {
        return autoClose;
    }

    public void setAutoClose(boolean autoClose) {
        this.autoClose = autoClose;
    }
}
