package com.realdb.parser;

/**
 * CompileException - 查询编译异常
 *
 * 括号不匹配的end、循环外使用it、非法的标识字面量、无法识别的单词等情况抛出此异常。
 */
public class CompileException extends RuntimeException {

    public CompileException(String message) {
        super(message);
    }

    public CompileException(String message, Throwable cause) {
        super(message, cause);
    }
}
