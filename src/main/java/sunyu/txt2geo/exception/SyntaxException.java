package sunyu.txt2geo.exception;

import cn.hutool.core.util.StrUtil;

/**
 * 行级语法错误，带行号(从1开始)与错误代码
 */
public class SyntaxException extends Txt2GeoException {
    /**
     * 坐标行格式错误：字段不足、圈号或坐标无法解析
     */
    public static final String CODE_INVALID_POINT_FORMAT = "INVALID_POINT_FORMAT";
    /**
     * 坐标行之前缺少以@结尾的地块起始行
     */
    public static final String CODE_MISSING_PARCEL_HEADER = "MISSING_PARCEL_HEADER";

    private final int lineNo;
    private final String code;

    public SyntaxException(int lineNo, String code, String detail) {
        super(StrUtil.format("line {}: {}: {}", lineNo, code, detail));
        this.lineNo = lineNo;
        this.code = code;
    }

    public int getLineNo() {
        return lineNo;
    }

    public String getCode() {
        return code;
    }
}
