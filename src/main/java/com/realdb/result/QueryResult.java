package com.realdb.result;

import com.realdb.storage.RecordId;
import com.realdb.storage.Value;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * QueryResult - 查询结果集
 *
 * 结果集本身是记录标识的有序列表;这里同时保存每条记录在持锁期间复制出来的字段快照,
 * 释放锁之后渲染响应不会读到其他程序的修改。
 *
 * 设计原则:
 * - 不可变性:创建后不可修改
 * - 标识和快照一一对应,同一条记录被选中两次就出现两次
 *
 * 输出示例:
 * <pre>
 * +------------+-------+-----+
 * | id         | name  | age |
 * +------------+-------+-----+
 * | users:1    | Alice | 25  |
 * | users:2    | Bob   |     |
 * +------------+-------+-----+
 * 2 rows in set
 * </pre>
 */
public class QueryResult {

    /** 记录标识(结果集) */
    private final List<RecordId> recordIds;

    /** 字段快照,与recordIds按下标对应 */
    private final List<Map<String, Value>> records;

    /**
     * 创建查询结果集
     *
     * @param recordIds 记录标识
     * @param records 字段快照
     */
    public QueryResult(List<RecordId> recordIds, List<Map<String, Value>> records) {
        if (recordIds == null) {
            throw new IllegalArgumentException("Record ids cannot be null");
        }
        if (records == null) {
            throw new IllegalArgumentException("Records cannot be null");
        }
        if (recordIds.size() != records.size()) {
            throw new IllegalArgumentException(
                    "Record count mismatch: ids=" + recordIds.size() + ", records=" + records.size());
        }

        this.recordIds = List.copyOf(recordIds);
        this.records = List.copyOf(records);
    }

    public List<RecordId> getRecordIds() {
        return recordIds;
    }

    public List<Map<String, Value>> getRecords() {
        return records;
    }

    public int getRowCount() {
        return recordIds.size();
    }

    public boolean isEmpty() {
        return recordIds.isEmpty();
    }

    /**
     * 格式化输出为表格
     *
     * 列为所有记录字段名的并集(按首次出现顺序),记录缺少的字段留空。
     */
    @Override
    public String toString() {
        if (records.isEmpty()) {
            return "Empty set";
        }

        Set<String> columnSet = new LinkedHashSet<>();
        for (Map<String, Value> record : records) {
            columnSet.addAll(record.keySet());
        }
        List<String> columns = new ArrayList<>(columnSet);

        // 计算每列的最大宽度
        int[] columnWidths = new int[columns.size()];
        for (int i = 0; i < columns.size(); i++) {
            columnWidths[i] = columns.get(i).length();
        }

        for (Map<String, Value> record : records) {
            for (int i = 0; i < columns.size(); i++) {
                columnWidths[i] = Math.max(columnWidths[i], cell(record, columns.get(i)).length());
            }
        }

        String separator = buildSeparator(columnWidths);

        StringBuilder sb = new StringBuilder();
        sb.append(separator).append("\n");
        sb.append("| ");
        for (int i = 0; i < columns.size(); i++) {
            sb.append(padRight(columns.get(i), columnWidths[i]));
            sb.append(" | ");
        }
        sb.append("\n");
        sb.append(separator).append("\n");

        for (Map<String, Value> record : records) {
            sb.append("| ");
            for (int i = 0; i < columns.size(); i++) {
                sb.append(padRight(cell(record, columns.get(i)), columnWidths[i]));
                sb.append(" | ");
            }
            sb.append("\n");
        }
        sb.append(separator).append("\n");

        sb.append(records.size()).append(" row").append(records.size() > 1 ? "s" : "").append(" in set");

        return sb.toString();
    }

    private String cell(Map<String, Value> record, String column) {
        Value value = record.get(column);
        if (value == null) {
            return "";
        }
        if (value.isIdentity()) {
            return value.asIdentity().toString();
        }
        if (value.isText()) {
            return value.asText();
        }
        return value.render();
    }

    private String buildSeparator(int[] columnWidths) {
        StringBuilder sb = new StringBuilder("+");
        for (int width : columnWidths) {
            sb.append("-".repeat(width + 2));
            sb.append("+");
        }
        return sb.toString();
    }

    private String padRight(String str, int width) {
        if (str.length() >= width) {
            return str;
        }
        return str + " ".repeat(width - str.length());
    }
}
