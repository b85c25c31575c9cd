package sunyu.txt2geo.pojo;

/**
 * 文本解码结果
 */
public class DecodeResult {
    private final String text;
    private final String encoding;
    /**
     * 解码警告，例如无法识别编码时的替换解码；没有警告时为null
     */
    private final String warning;

    public DecodeResult(String text, String encoding, String warning) {
        this.text = text;
        this.encoding = encoding;
        this.warning = warning;
    }

    public String getText() {
        return text;
    }

    public String getEncoding() {
        return encoding;
    }

    public String getWarning() {
        return warning;
    }

    public boolean hasWarning() {
        return warning != null;
    }
}
