package com.realdb.executor;

import com.realdb.program.OpCode;
import com.realdb.program.Operation;
import com.realdb.program.Program;
import com.realdb.storage.Database;
import com.realdb.storage.FilterPredicate;
import com.realdb.storage.RecordId;
import com.realdb.storage.Table;
import com.realdb.storage.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * VirtualMachine - 栈式虚拟机
 *
 * 对Database执行一个字节码程序,返回结果集(有序的记录标识列表)。
 *
 * 运行时状态:
 * - 操作数栈: Value栈,后压入的先弹出
 * - 程序计数器: 从0开始
 * - 迭代寄存器it: 只有一个,初始为0
 * - 循环状态表: 每个RANGE指令(按程序下标)剩余的循环次数
 *
 * 指令语义(栈内容从栈底到栈顶):
 * <pre>
 * START/END         无操作
 * PUSH v            压入v
 * SET               [id, key, value] → 写字段,把id压回栈
 * SELECT            [id]             → 记录必须存在,加入结果集
 * SELECT_ALL        [id]             → 只用表名,表中所有记录加入结果集
 * FILTER            [id, key, value, predicate] → 只用表名,线性扫描
 * DROP              [x]              → 丢弃栈顶
 * ADD/SUBTRACT      [a, b]           → 压入 a+b / a-b (都必须是INTEGER)
 * IT                压入INTEGER(it)
 * RANGE count end   剩余次数>0: it=剩余次数,剩余次数-1,进入循环体;否则跳到end
 * JUMP target       跳转
 * </pre>
 *
 * 循环语义:
 * - range N 的循环体恰好执行N次,it依次为 N, N-1, ..., 1
 * - 循环状态表在一次执行内不会重置:内层循环耗尽后,外层再次进入时内层执行0次
 * - it寄存器全局唯一,内层循环会覆盖外层的it,外层恢复执行时不会还原
 *
 * 错误处理:
 * - 任何前置条件不满足(栈不够、类型不对、表或记录不存在)立即中止整个程序
 * - 不回滚:出错前已经执行的SET保留在Database中
 *
 * 并发:
 * - 整个execute期间持有Database的排他锁
 *
 * 使用示例:
 * <pre>
 * Program program = compiler.compile("@users:1 \"name\" \"Alice\" set select");
 * List&lt;RecordId&gt; result = new VirtualMachine().execute(database, program);
 * // [users:1]
 * </pre>
 */
public class VirtualMachine {

    private static final Logger logger = LoggerFactory.getLogger(VirtualMachine.class);

    /**
     * 执行程序
     *
     * @param database 数据库
     * @param program 字节码程序
     * @return 结果集(记录标识,按加入顺序)
     * @throws ExecutionException 执行失败
     */
    public List<RecordId> execute(Database database, Program program) {
        if (database == null) {
            throw new IllegalArgumentException("Database cannot be null");
        }
        if (program == null) {
            throw new IllegalArgumentException("Program cannot be null");
        }

        database.lock();
        try {
            logger.debug("执行程序: {} 条指令", program.size());
            List<RecordId> result = new Frame(database, program).run();
            logger.debug("程序执行完成, 结果集 {} 条", result.size());
            return result;
        } finally {
            database.unlock();
        }
    }

    /**
     * 一次执行的全部运行时状态
     */
    private static class Frame {

        private final Database database;

        private final Program program;

        private final Deque<Value> stack = new ArrayDeque<>();

        private final List<RecordId> result = new ArrayList<>();

        /** 每个RANGE剩余的循环次数,按程序下标索引 */
        private final long[] remaining;

        /** 对应下标的RANGE是否已经初始化过 */
        private final boolean[] rangeStarted;

        /** 迭代寄存器 */
        private long it = 0;

        /** 程序计数器 */
        private int pc = 0;

        Frame(Database database, Program program) {
            this.database = database;
            this.program = program;
            this.remaining = new long[program.size()];
            this.rangeStarted = new boolean[program.size()];
        }

        List<RecordId> run() {
            while (pc < program.size()) {
                Operation op = program.get(pc);

                switch (op.getOpCode()) {
                    case START:
                    case END:
                        pc++;
                        break;

                    case PUSH:
                        stack.push(op.getValue());
                        pc++;
                        break;

                    case SET:
                        executeSet();
                        pc++;
                        break;

                    case SELECT:
                        executeSelect();
                        pc++;
                        break;

                    case SELECT_ALL:
                        executeSelectAll();
                        pc++;
                        break;

                    case FILTER:
                        executeFilter();
                        pc++;
                        break;

                    case DROP:
                        requireStack(1);
                        stack.pop();
                        pc++;
                        break;

                    case ADD:
                    case SUBTRACT:
                        executeArithmetic(op);
                        pc++;
                        break;

                    case IT:
                        stack.push(Value.ofInteger(it));
                        pc++;
                        break;

                    case RANGE:
                        executeRange(op);
                        break;

                    case JUMP:
                        pc = op.getTarget();
                        break;

                    default:
                        throw error("Unknown operation");
                }
            }

            return result;
        }

        private void executeSet() {
            requireStack(3);

            Value value = stack.pop();
            Value key = stack.pop();
            Value recordId = stack.pop();

            if (!key.isText()) {
                throw error("Key must be a string, got " + key);
            }
            if (!recordId.isIdentity()) {
                throw error("Record id must be an identity, got " + recordId);
            }

            RecordId id = recordId.asIdentity();
            database.upsert(id.getTableName(), id.getRow(), key.asText(), value);
            stack.push(recordId);
        }

        private void executeSelect() {
            requireStack(1);

            RecordId id = popIdentity();
            Table table = database.getTable(id.getTableName());
            if (table == null) {
                throw error("Table not found: " + id.getTableName());
            }
            if (!table.containsRow(id.getRow())) {
                throw error("Record not found: " + id);
            }

            result.add(id);
        }

        private void executeSelectAll() {
            requireStack(1);

            RecordId id = popIdentity();
            Table table = database.getTable(id.getTableName());
            if (table == null) {
                throw error("Table not found: " + id.getTableName());
            }

            result.addAll(table.getRecordIds());
        }

        private void executeFilter() {
            requireStack(4);

            Value predicateValue = stack.pop();
            Value value = stack.pop();
            Value key = stack.pop();
            Value recordId = stack.pop();

            FilterPredicate predicate = predicateValue.isText()
                    ? FilterPredicate.fromSymbol(predicateValue.asText())
                    : null;
            if (predicate == null) {
                throw error("Predicate unknown: " + predicateValue);
            }
            if (!key.isText()) {
                throw error("Key must be a string, got " + key);
            }
            if (!recordId.isIdentity()) {
                throw error("Record id must be an identity, got " + recordId);
            }

            String tableName = recordId.asIdentity().getTableName();
            Table table = database.getTable(tableName);
            if (table == null) {
                throw error("Table not found: " + tableName);
            }

            for (long row : table.scanFilter(key.asText(), predicate, value)) {
                result.add(new RecordId(tableName, row));
            }
        }

        private void executeArithmetic(Operation op) {
            requireStack(2);

            Value b = stack.pop();
            Value a = stack.pop();
            if (!a.isInteger() || !b.isInteger()) {
                throw error("Operands must be integers, got " + a + " and " + b);
            }

            try {
                long r = op.getOpCode() == OpCode.ADD
                        ? Math.addExact(a.asInteger(), b.asInteger())
                        : Math.subtractExact(a.asInteger(), b.asInteger());
                stack.push(Value.ofInteger(r));
            } catch (ArithmeticException e) {
                throw new ExecutionException(String.format(
                        "%s at %d: integer overflow", op.getOpCode(), pc), e);
            }
        }

        private void executeRange(Operation op) {
            if (!rangeStarted[pc]) {
                remaining[pc] = op.getCount();
                rangeStarted[pc] = true;
            }

            if (remaining[pc] > 0) {
                it = remaining[pc];
                remaining[pc]--;
                pc++;
            } else {
                pc = op.getEnd();
            }
        }

        private RecordId popIdentity() {
            Value value = stack.pop();
            if (!value.isIdentity()) {
                throw error("Record id must be an identity, got " + value);
            }
            return value.asIdentity();
        }

        private void requireStack(int n) {
            if (stack.size() < n) {
                throw error(String.format(
                        "Stack must have at least %d value(s), current stack is %s", n, stack));
            }
        }

        private ExecutionException error(String message) {
            return new ExecutionException(String.format(
                    "%s at %d: %s", program.get(pc).getOpCode(), pc, message));
        }
    }

    /**
     * 执行异常
     */
    public static class ExecutionException extends RuntimeException {
        public ExecutionException(String message) {
            super(message);
        }

        public ExecutionException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
