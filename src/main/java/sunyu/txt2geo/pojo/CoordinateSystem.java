package sunyu.txt2geo.pojo;

/**
 * 由文件属性与几何推导出的CGCS2000高斯-克吕格投影定义
 * <p>
 * 每个文件只推导一次，文件内所有地块共用。
 * </p>
 *
 * @author SunYu
 */
public class CoordinateSystem {
    /**
     * 投影坐标系名称（WKT中的PROJCS名称）
     */
    private String name;
    /**
     * 几度分带（3或6）
     */
    private int degree;
    /**
     * 带号
     */
    private int band;
    /**
     * 中央经线（单位：度）
     */
    private double centralMeridian;
    /**
     * EPSG代码，0表示不存在标准EPSG
     */
    private int epsg;
    /**
     * 中央经线是否来自坐标系字段括号内的自定义值
     */
    private boolean customMeridian;
    /**
     * ESRI风格的WKT投影描述
     */
    private String wkt;

    public CoordinateSystem() {
    }

    public CoordinateSystem(String name, int degree, int band, double centralMeridian, int epsg, boolean customMeridian, String wkt) {
        this.name = name;
        this.degree = degree;
        this.band = band;
        this.centralMeridian = centralMeridian;
        this.epsg = epsg;
        this.customMeridian = customMeridian;
        this.wkt = wkt;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public int getDegree() {
        return degree;
    }

    public void setDegree(int degree) {
        this.degree = degree;
    }

    public int getBand() {
        return band;
    }

    public void setBand(int band) {
        this.band = band;
    }

    public double getCentralMeridian() {
        return centralMeridian;
    }

    public void setCentralMeridian(double centralMeridian) {
        this.centralMeridian = centralMeridian;
    }

    public int getEpsg() {
        return epsg;
    }

    public void setEpsg(int epsg) {
        this.epsg = epsg;
    }

    public boolean isCustomMeridian() {
        return customMeridian;
    }

    public void setCustomMeridian(boolean customMeridian) {
        this.customMeridian = customMeridian;
    }

    public String getWkt() {
        return wkt;
    }

    public void setWkt(String wkt) {
        this.wkt = wkt;
    }
}
