package com.realdb.storage;

import java.util.Objects;

/**
 * RecordId - 记录标识
 *
 * (表名, 行号)二元组,在表内唯一。
 * 行号是无符号64位整数,用long存储,比较和输出都按无符号处理。
 *
 * 输出格式: table:row
 */
public final class RecordId implements Comparable<RecordId> {

    /** 表名 */
    private final String tableName;

    /** 行号(无符号) */
    private final long row;

    public RecordId(String tableName, long row) {
        if (tableName == null || tableName.isEmpty()) {
            throw new IllegalArgumentException("Table name cannot be null or empty");
        }
        this.tableName = tableName;
        this.row = row;
    }

    public String getTableName() {
        return tableName;
    }

    public long getRow() {
        return row;
    }

    @Override
    public int compareTo(RecordId other) {
        int byTable = tableName.compareTo(other.tableName);
        if (byTable != 0) {
            return byTable;
        }
        return Long.compareUnsigned(row, other.row);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RecordId)) {
            return false;
        }
        RecordId other = (RecordId) o;
        return row == other.row && tableName.equals(other.tableName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tableName, row);
    }

    @Override
    public String toString() {
        return tableName + ":" + Long.toUnsignedString(row);
    }
}
