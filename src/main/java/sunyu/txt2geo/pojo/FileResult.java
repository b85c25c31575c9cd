package sunyu.txt2geo.pojo;

/**
 * 单个文件成功处理后的结果
 */
public class FileResult {
    /**
     * 源文件路径
     */
    private String path;
    /**
     * 文件内容指纹（SHA-256）
     */
    private String fingerprint;
    /**
     * 源文件编码
     */
    private String encoding;
    /**
     * 预处理结果
     */
    private PreprocessResult result;

    public FileResult() {
    }

    public FileResult(String path, String fingerprint, String encoding, PreprocessResult result) {
        this.path = path;
        this.fingerprint = fingerprint;
        this.encoding = encoding;
        this.result = result;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public void setFingerprint(String fingerprint) {
        this.fingerprint = fingerprint;
    }

    public String getEncoding() {
        return encoding;
    }

    public void setEncoding(String encoding) {
        this.encoding = encoding;
    }

    public PreprocessResult getResult() {
        return result;
    }

    public void setResult(PreprocessResult result) {
        this.result = result;
    }
}
