package com.realdb.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Database - 进程内的全部数据
 *
 * 表名 → Table 的映射,进程启动时为空,进程退出即丢失(没有持久化)。
 * 所有连接共享同一个Database。
 *
 * 并发模型:
 * - 一把进程级的排他锁保护全部状态
 * - 一个程序从执行开始到读完结果记录,全程持有这把锁
 * - 不区分只读/写程序,不做表级或行级锁
 * - 结果: 并发程序严格串行化,任何两个程序的操作不会交错
 *
 * 使用模式:
 * <pre>
 * database.lock();
 * try {
 *     database.upsert("users", 1, "name", Value.ofText("Alice"));
 * } finally {
 *     database.unlock();
 * }
 * </pre>
 *
 * 所有访问表的方法都要求当前线程持有锁,否则抛IllegalStateException。
 *
 * "Good taste": 一把锁,没有特殊情况
 */
public class Database {

    private static final Logger logger = LoggerFactory.getLogger(Database.class);

    /** 表名 → 表 */
    private final Map<String, Table> tables;

    /** 全局排他锁(可重入,VM在引擎已持锁时可以再次获取) */
    private final ReentrantLock lock;

    public Database() {
        this.tables = new HashMap<>();
        this.lock = new ReentrantLock();
    }

    public void lock() {
        lock.lock();
    }

    public void unlock() {
        lock.unlock();
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    /**
     * 写入字段,表和记录不存在时自动创建
     *
     * @param tableName 表名
     * @param row 行号
     * @param key 字段名
     * @param value 字段值
     * @return 被写入的记录
     */
    public Record upsert(String tableName, long row, String key, Value value) {
        checkLockHeld();

        Table table = tables.get(tableName);
        if (table == null) {
            table = new Table(tableName);
            tables.put(tableName, table);
            logger.debug("创建表: {}", tableName);
        }

        return table.upsert(row, key, value);
    }

    /**
     * 获取表
     *
     * @param tableName 表名
     * @return 表,不存在返回null
     */
    public Table getTable(String tableName) {
        checkLockHeld();
        return tables.get(tableName);
    }

    /**
     * 根据标识获取记录
     *
     * @param recordId 记录标识
     * @return 记录,表或行不存在返回null
     */
    public Record getRecord(RecordId recordId) {
        Table table = getTable(recordId.getTableName());
        if (table == null) {
            return null;
        }
        return table.getRecord(recordId.getRow());
    }

    public boolean tableExists(String tableName) {
        checkLockHeld();
        return tables.containsKey(tableName);
    }

    public List<String> getAllTableNames() {
        checkLockHeld();
        return new ArrayList<>(tables.keySet());
    }

    public int getTableCount() {
        checkLockHeld();
        return tables.size();
    }

    private void checkLockHeld() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Database lock is not held by the current thread");
        }
    }
}
