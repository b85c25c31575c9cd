package sunyu.txt2geo.pojo;

/**
 * 界址点，包含点号、圈号、X、Y
 * <p>
 * 点号与圈号不能混用：点号仅用于排序和闭合判断，圈号用于把点分组成环。
 * 解析后不可变，几何处理只会重排、丢弃或追加点，不会修改已保留点的字段。
 * </p>
 *
 * @author SunYu
 */
public class Point {
    /**
     * 点号（源数据点号中的第一段数字，没有数字时为0）
     */
    private final int id;

    /**
     * 圈号（标识该点所属的环）
     */
    private final int ringId;

    /**
     * X坐标(单位：米)，高斯投影北向坐标
     */
    private final double x;

    /**
     * Y坐标(单位：米)，高斯投影东向坐标，通常带有带号前缀
     */
    private final double y;

    /**
     * 构造方法
     *
     * @param id     点号
     * @param ringId 圈号
     * @param x      X坐标(单位：米)
     * @param y      Y坐标(单位：米)
     */
    public Point(int id, int ringId, double x, double y) {
        this.id = id;
        this.ringId = ringId;
        this.x = x;
        this.y = y;
    }

    public int getId() {
        return id;
    }

    public int getRingId() {
        return ringId;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    @Override
    public String toString() {
        return "Point{id=" + id + ", ringId=" + ringId + ", x=" + x + ", y=" + y + "}";
    }
}
