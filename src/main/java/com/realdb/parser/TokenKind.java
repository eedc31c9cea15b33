package com.realdb.parser;

/**
 * TokenKind - 词法单元类型
 */
public enum TokenKind {
    // 关键字
    SET,
    SELECT,
    SELECT_ALL,
    FILTER,
    DROP,
    RANGE,
    IT,
    DO,
    END,
    PLUS,
    MINUS,

    // 字面量
    STRING,
    INT,
    FLOAT,
    IDENTITY,

    /** 无法识别的单词,编译时一定报错 */
    WORD
}
