package com.realdb.executor;

import com.realdb.parser.QueryCompiler;
import com.realdb.program.Program;
import com.realdb.result.QueryResult;
import com.realdb.storage.Database;
import com.realdb.storage.Record;
import com.realdb.storage.RecordId;
import com.realdb.storage.RowIdGenerator;
import com.realdb.storage.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * QueryEngine - 查询执行入口
 *
 * 串起一次查询的完整流程:
 * 1. 词法分析 + 编译(不持有任何锁,可以并行)
 * 2. 获取Database排他锁
 * 3. 虚拟机执行程序,得到记录标识
 * 4. 复制结果记录的字段快照
 * 5. 释放锁
 *
 * 持锁区间覆盖执行和读取结果记录,所以并发查询对Database的访问严格串行,
 * 结果里的标识在返回时一定指向存在的记录。
 *
 * 使用示例:
 * <pre>
 * QueryEngine engine = new QueryEngine(new Database(), new RowIdGenerator());
 * QueryResult result = engine.execute("@users:1 \"name\" \"Alice\" set select");
 * </pre>
 */
public class QueryEngine {

    private static final Logger logger = LoggerFactory.getLogger(QueryEngine.class);

    private final Database database;

    private final QueryCompiler compiler;

    private final VirtualMachine virtualMachine;

    public QueryEngine(Database database, RowIdGenerator rowIdGenerator) {
        if (database == null) {
            throw new IllegalArgumentException("Database cannot be null");
        }
        this.database = database;
        this.compiler = new QueryCompiler(rowIdGenerator);
        this.virtualMachine = new VirtualMachine();
    }

    public Database getDatabase() {
        return database;
    }

    /**
     * 执行一个查询
     *
     * @param query 查询文本
     * @return 查询结果
     * @throws com.realdb.parser.CompileException 编译失败
     * @throws VirtualMachine.ExecutionException 执行失败
     */
    public QueryResult execute(String query) {
        Program program = compiler.compile(query);
        logger.trace("编译结果:\n{}", program);

        database.lock();
        try {
            List<RecordId> recordIds = virtualMachine.execute(database, program);

            List<Map<String, Value>> records = new ArrayList<>(recordIds.size());
            for (RecordId recordId : recordIds) {
                Record record = database.getRecord(recordId);
                if (record == null) {
                    throw new IllegalStateException("Selected record disappeared: " + recordId);
                }
                records.add(record.snapshot());
            }

            return new QueryResult(recordIds, records);
        } finally {
            database.unlock();
        }
    }
}
