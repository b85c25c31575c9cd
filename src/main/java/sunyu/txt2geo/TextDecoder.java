package sunyu.txt2geo;

import cn.hutool.core.io.CharsetDetector;
import cn.hutool.core.io.IoUtil;
import cn.hutool.core.util.ArrayUtil;
import cn.hutool.core.util.CharsetUtil;
import cn.hutool.core.util.StrUtil;
import cn.hutool.log.Log;
import cn.hutool.log.LogFactory;
import sunyu.txt2geo.pojo.DecodeResult;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 常见中文文本编码（UTF-8/BOM、UTF-16LE/BE、GB18030）的检测与统一解码
 * <p>
 * 检测顺序：BOM -> 无BOM的UTF-16（零字节分布） -> 严格UTF-8 -> 严格GB18030。
 * 都不满足时按GB18030替换解码并返回警告。
 * </p>
 *
 * @author SunYu
 */
public class TextDecoder {
    private static final Log log = LogFactory.get();

    public static final String ENCODING_UTF8 = "utf-8";
    public static final String ENCODING_UTF8_BOM = "utf-8-sig";
    public static final String ENCODING_UTF16_LE = "utf-16-le";
    public static final String ENCODING_UTF16_BE = "utf-16-be";
    public static final String ENCODING_GB18030 = "gb18030";
    public static final String ENCODING_UNKNOWN = "unknown";

    private static final Charset GB18030 = CharsetUtil.charset("GB18030");

    private static final byte[] BOM_UTF8 = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
    private static final byte[] BOM_UTF16_LE = {(byte) 0xFF, (byte) 0xFE};
    private static final byte[] BOM_UTF16_BE = {(byte) 0xFE, (byte) 0xFF};

    /**
     * 无BOM的UTF-16判定阈值：一侧零字节比例高于HIGH，另一侧低于LOW
     */
    private static final double ZERO_RATIO_HIGH = 0.30;
    private static final double ZERO_RATIO_LOW = 0.05;

    /**
     * 检测并解码
     *
     * @param data 原始字节
     *
     * @return 解码结果，文本不含BOM
     */
    public DecodeResult decode(byte[] data) {
        if (ArrayUtil.isEmpty(data)) {
            return new DecodeResult("", ENCODING_UTF8, null);
        }
        if (startsWith(data, BOM_UTF8)) {
            return new DecodeResult(decode(data, BOM_UTF8.length, CharsetUtil.CHARSET_UTF_8), ENCODING_UTF8_BOM, null);
        }
        if (startsWith(data, BOM_UTF16_LE)) {
            return new DecodeResult(decode(data, BOM_UTF16_LE.length, StandardCharsets.UTF_16LE), ENCODING_UTF16_LE, null);
        }
        if (startsWith(data, BOM_UTF16_BE)) {
            return new DecodeResult(decode(data, BOM_UTF16_BE.length, StandardCharsets.UTF_16BE), ENCODING_UTF16_BE, null);
        }

        String encoding = detect(data);
        switch (encoding) {
            case ENCODING_UTF8:
                return new DecodeResult(StrUtil.str(data, CharsetUtil.CHARSET_UTF_8), encoding, null);
            case ENCODING_UTF16_LE:
                return new DecodeResult(StrUtil.str(data, StandardCharsets.UTF_16LE), encoding, null);
            case ENCODING_UTF16_BE:
                return new DecodeResult(StrUtil.str(data, StandardCharsets.UTF_16BE), encoding, null);
            case ENCODING_GB18030:
                return new DecodeResult(StrUtil.str(data, GB18030), encoding, null);
            default:
                String warning = StrUtil.format("无法识别文件编码，按{}替换解码，可能存在乱码", ENCODING_GB18030);
                log.warn(warning);
                return new DecodeResult(StrUtil.str(data, GB18030), ENCODING_UNKNOWN, warning);
        }
    }

    /**
     * 检测无BOM数据的编码
     *
     * @param data 原始字节
     *
     * @return 编码标识，无法判定时为 {@link #ENCODING_UNKNOWN}
     */
    public String detect(byte[] data) {
        if (ArrayUtil.isEmpty(data)) {
            return ENCODING_UTF8;
        }
        // 零字节在UTF-8中合法，UTF-16需先于UTF-8判断
        String utf16 = guessUtf16(data);
        if (utf16 != null) {
            return utf16;
        }
        if (strictlyDecodable(data, CharsetUtil.CHARSET_UTF_8)) {
            return ENCODING_UTF8;
        }
        if (strictlyDecodable(data, GB18030)) {
            return ENCODING_GB18030;
        }
        return ENCODING_UNKNOWN;
    }

    /**
     * 通过零字节分布猜测无BOM的UTF-16，ASCII为主的文本在UTF-16下高字节几乎全为0
     */
    private String guessUtf16(byte[] data) {
        if (data.length < 4 || data.length % 2 != 0) {
            return null;
        }
        int evenZeros = 0;
        int oddZeros = 0;
        for (int i = 0; i < data.length; i++) {
            if (data[i] == 0) {
                if (i % 2 == 0) {
                    evenZeros++;
                } else {
                    oddZeros++;
                }
            }
        }
        double half = data.length / 2.0;
        double evenRatio = evenZeros / half;
        double oddRatio = oddZeros / half;
        if (oddRatio > ZERO_RATIO_HIGH && evenRatio < ZERO_RATIO_LOW && strictlyDecodable(data, StandardCharsets.UTF_16LE)) {
            return ENCODING_UTF16_LE;
        }
        if (evenRatio > ZERO_RATIO_HIGH && oddRatio < ZERO_RATIO_LOW && strictlyDecodable(data, StandardCharsets.UTF_16BE)) {
            return ENCODING_UTF16_BE;
        }
        return null;
    }

    /**
     * 整段数据能否按指定编码无错误解码
     */
    private boolean strictlyDecodable(byte[] data, Charset charset) {
        // 缓冲区取整段长度，避免多字节字符被缓冲区边界截断
        return CharsetDetector.detect(data.length, IoUtil.toStream(data), charset) != null;
    }

    private boolean startsWith(byte[] data, byte[] prefix) {
        return data.length >= prefix.length && Arrays.equals(Arrays.copyOf(data, prefix.length), prefix);
    }

    private String decode(byte[] data, int offset, Charset charset) {
        return new String(data, offset, data.length - offset, charset);
    }
}
