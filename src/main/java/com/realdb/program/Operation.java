package com.realdb.program;

import com.realdb.storage.Value;

import java.util.Objects;

/**
 * Operation - 一条字节码指令
 *
 * 不可变对象。不同操作类型使用的字段:
 * - PUSH: value
 * - RANGE: count(循环次数), end(循环结束后跳转的位置)
 * - JUMP: target(跳转目标)
 * - 其他: 无操作数
 *
 * 编译器回填RANGE的end时创建新的Operation替换旧的,而不是修改原对象。
 */
public final class Operation {

    private final OpCode opCode;

    private final Value value;

    private final long count;

    private final int end;

    private final int target;

    private Operation(OpCode opCode, Value value, long count, int end, int target) {
        this.opCode = opCode;
        this.value = value;
        this.count = count;
        this.end = end;
        this.target = target;
    }

    /**
     * 无操作数的指令
     *
     * @param opCode 操作类型(不能是PUSH/RANGE/JUMP)
     */
    public static Operation of(OpCode opCode) {
        if (opCode == null) {
            throw new IllegalArgumentException("OpCode cannot be null");
        }
        if (opCode == OpCode.PUSH || opCode == OpCode.RANGE || opCode == OpCode.JUMP) {
            throw new IllegalArgumentException(opCode + " requires operands");
        }
        return new Operation(opCode, null, 0, 0, 0);
    }

    public static Operation push(Value value) {
        if (value == null) {
            throw new IllegalArgumentException("Pushed value cannot be null");
        }
        return new Operation(OpCode.PUSH, value, 0, 0, 0);
    }

    public static Operation range(long count, int end) {
        return new Operation(OpCode.RANGE, null, count, end, 0);
    }

    public static Operation jump(int target) {
        return new Operation(OpCode.JUMP, null, 0, 0, target);
    }

    /**
     * 返回end被回填后的RANGE指令
     */
    public Operation withEnd(int newEnd) {
        if (opCode != OpCode.RANGE) {
            throw new IllegalStateException("Only RANGE has an end offset, got: " + opCode);
        }
        return range(count, newEnd);
    }

    public OpCode getOpCode() {
        return opCode;
    }

    public Value getValue() {
        return value;
    }

    public long getCount() {
        return count;
    }

    public int getEnd() {
        return end;
    }

    public int getTarget() {
        return target;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Operation)) {
            return false;
        }
        Operation other = (Operation) o;
        return opCode == other.opCode
                && count == other.count
                && end == other.end
                && target == other.target
                && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(opCode, value, count, end, target);
    }

    @Override
    public String toString() {
        switch (opCode) {
            case PUSH:
                return "PUSH " + value;
            case RANGE:
                return "RANGE count=" + count + " end=" + end;
            case JUMP:
                return "JUMP " + target;
            default:
                return opCode.name();
        }
    }
}
