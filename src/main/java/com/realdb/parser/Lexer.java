package com.realdb.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Lexer - 查询语言词法分析器
 *
 * 把原始文本切分为Token序列:
 * - 空格、回车、换行是分隔符
 * - '#' 开始行注释,直到换行为止的内容全部丢弃
 * - 双引号切换"字符串内"状态,字符串内的空白不分隔单词,'#'也不是注释
 *
 * 单词分类(关键字不区分大小写):
 * 1. 关键字: set select select_all filter drop range it do end + -
 * 2. 双引号包围 → STRING
 * 3. 能解析为64位整数 → INT
 * 4. 十进制浮点数 → FLOAT
 * 5. @name:value(恰好一个':') → IDENTITY
 * 6. 其他 → WORD
 *
 * 设计原则:
 * - 词法分析永远不失败,语义检查全部交给编译器
 *
 * 使用示例:
 * <pre>
 * List&lt;Token&gt; tokens = new Lexer().tokenize("@users:1 \"name\" \"Alice\" set");
 * // [IDENTITY(@users:1), STRING("name"), STRING("Alice"), SET(set)]
 * </pre>
 */
public class Lexer {

    /** 十进制浮点数(不接受NaN/Infinity和十六进制写法) */
    private static final Pattern FLOAT_PATTERN =
            Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    /**
     * 词法分析
     *
     * @param text 查询文本
     * @return Token列表
     */
    public List<Token> tokenize(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Query text cannot be null");
        }

        List<Token> tokens = new ArrayList<>();
        StringBuilder word = new StringBuilder();
        boolean inString = false;
        boolean inComment = false;
        int line = 1;
        int column = 0;
        int wordLine = 1;
        int wordColumn = 1;

        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            column++;

            if (inComment) {
                if (ch == '\n') {
                    inComment = false;
                    line++;
                    column = 0;
                }
                continue;
            }

            if (ch == ' ' || ch == '\r' || ch == '\n') {
                if (inString) {
                    word.append(ch);
                } else {
                    flush(tokens, word, wordLine, wordColumn);
                }
                if (ch == '\n') {
                    line++;
                    column = 0;
                }
                continue;
            }

            if (ch == '#' && !inString) {
                flush(tokens, word, wordLine, wordColumn);
                inComment = true;
                continue;
            }

            if (ch == '"') {
                inString = !inString;
            }

            if (word.length() == 0) {
                wordLine = line;
                wordColumn = column;
            }
            word.append(ch);
        }

        flush(tokens, word, wordLine, wordColumn);
        return tokens;
    }

    private void flush(List<Token> tokens, StringBuilder word, int line, int column) {
        if (word.length() == 0) {
            return;
        }

        String w = word.toString();
        tokens.add(new Token(w, classify(w), line, column));
        word.setLength(0);
    }

    /**
     * 单词分类
     *
     * @param word 单词原文
     * @return 类型
     */
    static TokenKind classify(String word) {
        switch (word.toLowerCase(Locale.ROOT)) {
            case "set":
                return TokenKind.SET;
            case "select":
                return TokenKind.SELECT;
            case "select_all":
                return TokenKind.SELECT_ALL;
            case "filter":
                return TokenKind.FILTER;
            case "drop":
                return TokenKind.DROP;
            case "range":
                return TokenKind.RANGE;
            case "it":
                return TokenKind.IT;
            case "do":
                return TokenKind.DO;
            case "end":
                return TokenKind.END;
            case "+":
                return TokenKind.PLUS;
            case "-":
                return TokenKind.MINUS;
            default:
                break;
        }

        if (word.length() >= 2 && word.startsWith("\"") && word.endsWith("\"")) {
            return TokenKind.STRING;
        }

        if (isInteger(word)) {
            return TokenKind.INT;
        }

        if (FLOAT_PATTERN.matcher(word).matches()) {
            return TokenKind.FLOAT;
        }

        if (word.startsWith("@") && word.indexOf(':') >= 0
                && word.indexOf(':') == word.lastIndexOf(':')) {
            return TokenKind.IDENTITY;
        }

        return TokenKind.WORD;
    }

    private static boolean isInteger(String word) {
        try {
            Long.parseLong(word);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
