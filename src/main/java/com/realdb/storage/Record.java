package com.realdb.storage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Record - 一条记录
 *
 * 字段名(小写) → Value 的映射。
 *
 * 不变量:
 * - 每条记录都有隐含字段"id",值为自己的RecordId,创建时写入,之后永不覆盖
 * - 字段名写入时统一转小写,值不做任何转换
 *
 * 字段顺序对语义没有影响,这里保留插入顺序只是为了输出稳定("id"总在最前)。
 */
public class Record {

    /** 隐含的标识字段名 */
    public static final String ID_FIELD = "id";

    private final RecordId recordId;

    private final Map<String, Value> fields;

    /**
     * 创建记录,自动填充"id"字段
     *
     * @param recordId 记录标识
     */
    public Record(RecordId recordId) {
        if (recordId == null) {
            throw new IllegalArgumentException("Record id cannot be null");
        }
        this.recordId = recordId;
        this.fields = new LinkedHashMap<>();
        this.fields.put(ID_FIELD, Value.ofIdentity(recordId));
    }

    public RecordId getRecordId() {
        return recordId;
    }

    /**
     * 写入字段(存在则覆盖)
     *
     * "id"字段不会被覆盖。
     *
     * @param key 字段名(任意大小写)
     * @param value 字段值
     */
    public void setField(String key, Value value) {
        if (key == null) {
            throw new IllegalArgumentException("Field key cannot be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("Field value cannot be null");
        }

        String normalized = key.toLowerCase(Locale.ROOT);
        if (ID_FIELD.equals(normalized)) {
            return;
        }
        fields.put(normalized, value);
    }

    /**
     * 获取字段值
     *
     * @param key 字段名(小写)
     * @return 字段值,不存在返回null
     */
    public Value getField(String key) {
        return fields.get(key);
    }

    public int getFieldCount() {
        return fields.size();
    }

    /**
     * 只读视图
     */
    public Map<String, Value> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    /**
     * 复制当前字段,用于在释放锁之后渲染结果
     */
    public Map<String, Value> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    @Override
    public String toString() {
        return "Record{" + fields + "}";
    }
}
