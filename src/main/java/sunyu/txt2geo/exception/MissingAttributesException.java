package sunyu.txt2geo.exception;

import cn.hutool.core.collection.CollUtil;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * [属性描述]部分缺少必选参数，一次性列出全部缺失项
 */
public class MissingAttributesException extends Txt2GeoException {
    private final List<String> keys;

    public MissingAttributesException(List<String> keys) {
        super("[属性描述]部分缺少必选参数: {}", CollUtil.join(keys, ", "));
        this.keys = Collections.unmodifiableList(new ArrayList<>(keys));
    }

    public List<String> getKeys() {
        return keys;
    }
}
