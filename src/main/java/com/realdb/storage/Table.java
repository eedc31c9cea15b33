package com.realdb.storage;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Table - 表
 *
 * 行号 → Record 的映射,行号唯一。
 * 表在第一次写入时由Database按需创建,没有表结构定义。
 *
 * 核心操作:
 * - upsert: 存在则原地写字段,不存在则新建记录
 * - scanFilter: 全表线性扫描,返回满足谓词的行号
 *
 * 设计原则:
 * - 没有二级索引,filter永远是全表扫描(接受的限制,不是bug)
 * - 行按插入顺序遍历,select_all和filter的输出顺序由此决定
 * - 不做并发控制,由Database的全局锁保护
 */
public class Table {

    /** 表名 */
    private final String name;

    /** 行号 → 记录 */
    private final Map<Long, Record> records;

    public Table(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Table name cannot be null or empty");
        }
        this.name = name;
        this.records = new LinkedHashMap<>();
    }

    public String getName() {
        return name;
    }

    /**
     * 写入字段
     *
     * 记录存在:插入/覆盖字段。
     * 记录不存在:新建记录,字段只有"id"和key。
     *
     * @param row 行号
     * @param key 字段名
     * @param value 字段值
     * @return 被写入的记录
     */
    public Record upsert(long row, String key, Value value) {
        Record record = records.get(row);
        if (record == null) {
            record = new Record(new RecordId(name, row));
            records.put(row, record);
        }
        record.setField(key, value);
        return record;
    }

    /**
     * 获取记录
     *
     * @param row 行号
     * @return 记录,不存在返回null
     */
    public Record getRecord(long row) {
        return records.get(row);
    }

    public boolean containsRow(long row) {
        return records.containsKey(row);
    }

    public int getRecordCount() {
        return records.size();
    }

    public Collection<Record> getRecords() {
        return Collections.unmodifiableCollection(records.values());
    }

    /**
     * 所有行的标识(插入顺序)
     */
    public List<RecordId> getRecordIds() {
        List<RecordId> ids = new ArrayList<>(records.size());
        for (Record record : records.values()) {
            ids.add(record.getRecordId());
        }
        return ids;
    }

    /**
     * 线性扫描过滤
     *
     * 记录中名为key的字段满足predicate(fieldValue, value)时,该行入选。
     * 字段名按原样匹配,不做大小写转换。
     *
     * 时间复杂度: O(记录数 × 每条记录字段数)
     *
     * @param key 字段名
     * @param predicate 谓词
     * @param value 比较值
     * @return 满足条件的行号(插入顺序)
     */
    public List<Long> scanFilter(String key, FilterPredicate predicate, Value value) {
        List<Long> rows = new ArrayList<>();

        for (Map.Entry<Long, Record> entry : records.entrySet()) {
            boolean include = false;
            for (Map.Entry<String, Value> field : entry.getValue().getFields().entrySet()) {
                if (field.getKey().equals(key) && predicate.test(field.getValue(), value)) {
                    include = true;
                    break;
                }
            }

            if (include) {
                rows.add(entry.getKey());
            }
        }

        return rows;
    }

    @Override
    public String toString() {
        return "Table{name='" + name + "', records=" + records.size() + "}";
    }
}
