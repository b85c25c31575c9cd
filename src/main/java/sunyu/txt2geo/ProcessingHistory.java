package sunyu.txt2geo;

import cn.hutool.core.io.FileUtil;
import cn.hutool.core.util.StrUtil;
import cn.hutool.log.Log;
import cn.hutool.log.LogFactory;

import java.io.File;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 已处理文件的内容指纹记录，用于跳过重复文件
 * <p>
 * 指纹每行一个追加写入记录文件；未配置记录文件时只在内存中去重。
 * {@link #checkAndRecord(String)} 是原子操作，可在多线程间共享。
 * </p>
 *
 * @author SunYu
 */
public class ProcessingHistory {
    private static final Log log = LogFactory.get();

    private final File historyFile;
    private final Set<String> processed = Collections.newSetFromMap(new ConcurrentHashMap<>());

    /**
     * 创建处理历史并加载已有记录
     *
     * @param historyFile 记录文件路径，为空表示只在内存中记录
     */
    public ProcessingHistory(String historyFile) {
        this.historyFile = StrUtil.isBlank(historyFile) ? null : FileUtil.file(historyFile);
        if (this.historyFile != null && FileUtil.exist(this.historyFile)) {
            for (String line : FileUtil.readUtf8Lines(this.historyFile)) {
                String fingerprint = StrUtil.trim(line);
                if (StrUtil.isNotEmpty(fingerprint)) {
                    processed.add(fingerprint);
                }
            }
        }
        log.debug("处理历史初始化完成：记录文件 {} 已有指纹 {}", historyFile, processed.size());
    }

    /**
     * 检查指纹是否已处理，未处理则记录
     *
     * @param fingerprint 内容指纹
     *
     * @return true表示新指纹，文件应被处理；false表示已处理过或指纹为空
     */
    public boolean checkAndRecord(String fingerprint) {
        if (StrUtil.isBlank(fingerprint)) {
            return false;
        }
        if (processed.contains(fingerprint)) {
            return false;
        }
        synchronized (this) {
            if (processed.contains(fingerprint)) {
                return false;
            }
            if (historyFile != null) {
                FileUtil.appendUtf8Lines(Collections.singletonList(fingerprint), historyFile);
            }
            processed.add(fingerprint);
        }
        log.debug("记录新指纹 {}", fingerprint);
        return true;
    }

    /**
     * @return 已记录的指纹数量
     */
    public int size() {
        return processed.size();
    }
}
