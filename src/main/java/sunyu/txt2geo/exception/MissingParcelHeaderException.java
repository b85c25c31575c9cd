package sunyu.txt2geo.exception;

/**
 * [地块坐标]部分出现坐标点，但之前没有以@结尾的地块起始行
 */
public class MissingParcelHeaderException extends SyntaxException {

    public MissingParcelHeaderException(int lineNo) {
        super(lineNo, CODE_MISSING_PARCEL_HEADER, "在[地块坐标]部分发现坐标点，但之前缺少以@结尾的地块起始行");
    }
}
