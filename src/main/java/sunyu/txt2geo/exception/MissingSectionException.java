package sunyu.txt2geo.exception;

/**
 * 文件缺少[属性描述]或[地块坐标]部分
 */
public class MissingSectionException extends Txt2GeoException {
    private final String section;

    public MissingSectionException(String section) {
        super("文件缺少 {} 部分", section);
        this.section = section;
    }

    public String getSection() {
        return section;
    }
}
