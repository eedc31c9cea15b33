package com.realdb.storage;

import java.util.Objects;

/**
 * Value - 查询语言中的值
 *
 * 栈上的操作数和记录中的字段值都是Value,一共四种变体:
 * - IDENTITY: 记录标识(表名 + 行号)
 * - INTEGER: 有符号64位整数
 * - FLOAT: 64位浮点数
 * - TEXT: 字符串
 *
 * 比较语义:
 * - 同类型比较底层值
 * - 不同类型之间既不相等,也没有大小关系(compare返回null)
 *
 * 设计原则:
 * - 不可变对象
 * - "Good taste": 一个类型标签 + 一个载荷,没有继承层次
 */
public final class Value {

    /**
     * 值类型
     */
    public enum Type {
        IDENTITY,
        INTEGER,
        FLOAT,
        TEXT
    }

    private final Type type;

    /** RecordId / Long / Double / String */
    private final Object payload;

    private Value(Type type, Object payload) {
        this.type = type;
        this.payload = payload;
    }

    public static Value ofIdentity(RecordId recordId) {
        if (recordId == null) {
            throw new IllegalArgumentException("Record id cannot be null");
        }
        return new Value(Type.IDENTITY, recordId);
    }

    public static Value ofIdentity(String tableName, long row) {
        return ofIdentity(new RecordId(tableName, row));
    }

    public static Value ofInteger(long value) {
        return new Value(Type.INTEGER, value);
    }

    public static Value ofFloat(double value) {
        return new Value(Type.FLOAT, value);
    }

    public static Value ofText(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Text value cannot be null");
        }
        return new Value(Type.TEXT, value);
    }

    public Type getType() {
        return type;
    }

    public boolean isIdentity() {
        return type == Type.IDENTITY;
    }

    public boolean isInteger() {
        return type == Type.INTEGER;
    }

    public boolean isText() {
        return type == Type.TEXT;
    }

    public RecordId asIdentity() {
        checkType(Type.IDENTITY);
        return (RecordId) payload;
    }

    public long asInteger() {
        checkType(Type.INTEGER);
        return (Long) payload;
    }

    public double asFloat() {
        checkType(Type.FLOAT);
        return (Double) payload;
    }

    public String asText() {
        checkType(Type.TEXT);
        return (String) payload;
    }

    private void checkType(Type expected) {
        if (type != expected) {
            throw new IllegalStateException("Value is " + type + ", not " + expected);
        }
    }

    /**
     * 比较两个值
     *
     * FLOAT按IEEE语义比较:只要有一方是NaN,就没有大小关系,返回null。
     *
     * @param other 另一个值
     * @return 负数/0/正数;类型不同或无法比较时返回null
     */
    public Integer compare(Value other) {
        if (other == null || type != other.type) {
            return null;
        }

        switch (type) {
            case INTEGER:
                return Long.compare((Long) payload, (Long) other.payload);

            case FLOAT:
                double l = (Double) payload;
                double r = (Double) other.payload;
                if (l < r) {
                    return -1;
                }
                if (l > r) {
                    return 1;
                }
                if (l == r) {
                    return 0;
                }
                return null;

            case TEXT:
                return ((String) payload).compareTo((String) other.payload);

            case IDENTITY:
                return ((RecordId) payload).compareTo((RecordId) other.payload);

            default:
                throw new IllegalStateException("Unknown value type: " + type);
        }
    }

    /**
     * 按JSON响应格式渲染(不做任何转义)
     *
     * - IDENTITY → "table:row"
     * - INTEGER/FLOAT → 裸数字
     * - TEXT → "text"
     */
    public String render() {
        switch (type) {
            case IDENTITY:
            case TEXT:
                return "\"" + payload + "\"";
            default:
                return payload.toString();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Value)) {
            return false;
        }
        Value value = (Value) o;
        return type == value.type && payload.equals(value.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, payload);
    }

    @Override
    public String toString() {
        switch (type) {
            case IDENTITY:
                return "@" + payload;
            case TEXT:
                return "\"" + payload + "\"";
            default:
                return payload.toString();
        }
    }
}
