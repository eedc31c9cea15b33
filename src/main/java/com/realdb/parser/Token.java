package com.realdb.parser;

/**
 * Token - 词法单元
 *
 * 保存原始文本、类型和源码位置(行列号从1开始,指向单词的第一个字符)。
 */
public class Token {

    private final String word;

    private final TokenKind kind;

    private final int line;

    private final int column;

    public Token(String word, TokenKind kind, int line, int column) {
        this.word = word;
        this.kind = kind;
        this.line = line;
        this.column = column;
    }

    public String getWord() {
        return word;
    }

    public TokenKind getKind() {
        return kind;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /**
     * 源码位置,格式 line:column
     */
    public String getPosition() {
        return line + ":" + column;
    }

    @Override
    public String toString() {
        return kind + "(" + word + ")@" + getPosition();
    }
}
