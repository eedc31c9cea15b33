package com.realdb.program;

/**
 * OpCode - 字节码操作类型
 */
public enum OpCode {
    /** 程序开始标记,无运行时效果 */
    START,
    /** 程序结束标记,无运行时效果 */
    END,
    /** 压入常量 */
    PUSH,
    SET,
    SELECT,
    SELECT_ALL,
    FILTER,
    DROP,
    ADD,
    SUBTRACT,
    /** 压入迭代寄存器的值 */
    IT,
    /** 循环头: count > 0 时进入循环体,否则跳到end */
    RANGE,
    /** 无条件跳转 */
    JUMP
}
