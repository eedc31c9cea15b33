package com.realdb.program;

import java.util.List;

/**
 * Program - 编译后的字节码程序
 *
 * 一次查询对应一个Program,是Operation的有序序列。
 * 创建后不可修改:循环计数等运行时状态由虚拟机自己保存,不写回程序。
 *
 * 示例:
 * <pre>
 * range 2 do it drop end
 *
 * 0: START
 * 1: RANGE count=2 end=5
 * 2: IT
 * 3: DROP
 * 4: JUMP 1
 * 5: END
 * </pre>
 */
public class Program {

    private final List<Operation> operations;

    public Program(List<Operation> operations) {
        if (operations == null) {
            throw new IllegalArgumentException("Operations cannot be null");
        }
        this.operations = List.copyOf(operations);
    }

    public Operation get(int index) {
        return operations.get(index);
    }

    public int size() {
        return operations.size();
    }

    public List<Operation> getOperations() {
        return operations;
    }

    /**
     * 反汇编输出,每行一条指令
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < operations.size(); i++) {
            sb.append(i).append(": ").append(operations.get(i)).append("\n");
        }
        return sb.toString();
    }
}
