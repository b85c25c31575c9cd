package sunyu.txt2geo.exception;

import cn.hutool.core.util.StrUtil;

/**
 * 解析、几何处理与坐标系推导过程中的异常基类
 *
 * @author SunYu
 */
public class Txt2GeoException extends RuntimeException {

    public Txt2GeoException(String message) {
        super(message);
    }

    public Txt2GeoException(String template, Object... params) {
        super(StrUtil.format(template, params));
    }

    public Txt2GeoException(Throwable cause, String template, Object... params) {
        super(StrUtil.format(template, params), cause);
    }
}
