package sunyu.txt2geo.exception;

/**
 * 坐标系构建失败：坐标系名称无效、分带与带号不匹配、中央经线超出范围等
 */
public class CrsException extends Txt2GeoException {

    public CrsException(String template, Object... params) {
        super(template, params);
    }

    public CrsException(Throwable cause, String template, Object... params) {
        super(cause, template, params);
    }
}
