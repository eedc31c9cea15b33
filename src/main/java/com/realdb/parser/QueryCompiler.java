package com.realdb.parser;

import com.realdb.program.OpCode;
import com.realdb.program.Operation;
import com.realdb.program.Program;
import com.realdb.storage.RecordId;
import com.realdb.storage.RowIdGenerator;
import com.realdb.storage.Value;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * QueryCompiler - 查询编译器
 *
 * 把Token序列编译为扁平的字节码程序(Program)。
 *
 * 编译规则:
 * - 程序首尾分别是START和END标记
 * - 字面量(STRING/INT/FLOAT/IDENTITY) → PUSH
 * - set/select/select_all/filter/drop/+/- → 一一对应的指令
 * - range/it/do/end → 循环结构,见下文
 *
 * 作用域解析:
 * 编译器维护一个"未闭合循环"栈,栈里存放RANGE指令在程序中的下标。
 * <pre>
 * range N  → 记录下标,生成 RANGE(count=N, end=0),end稍后回填
 * it       → 必须在某个循环内,生成 IT
 * do       → 纯语法,不生成指令
 * end      → 弹出最近的RANGE,把它的end回填为"JUMP之后的位置",
 *            然后生成 JUMP(RANGE的下标)
 * </pre>
 *
 * 示例:
 * <pre>
 * range 3 do it end
 *
 * 0: START
 * 1: RANGE count=3 end=4
 * 2: IT
 * 3: JUMP 1
 * 4: END
 * </pre>
 *
 * 标识字面量:
 * - @users:42 → 行号42(无符号64位)
 * - @users:_  → 由RowIdGenerator生成随机行号
 *
 * "Good taste": 一个栈解决所有嵌套,不需要语法树
 */
public class QueryCompiler {

    /** 随机行号占位符 */
    private static final String AUTO_ROW = "_";

    private final Lexer lexer;

    private final RowIdGenerator rowIdGenerator;

    /**
     * 创建编译器
     *
     * @param rowIdGenerator 进程共享的行号生成器
     */
    public QueryCompiler(RowIdGenerator rowIdGenerator) {
        if (rowIdGenerator == null) {
            throw new IllegalArgumentException("RowIdGenerator cannot be null");
        }
        this.lexer = new Lexer();
        this.rowIdGenerator = rowIdGenerator;
    }

    /**
     * 词法分析 + 编译
     *
     * @param text 查询文本
     * @return 字节码程序
     * @throws CompileException 编译失败
     */
    public Program compile(String text) {
        return compile(lexer.tokenize(text));
    }

    /**
     * 编译Token序列
     *
     * @param tokens Token序列
     * @return 字节码程序
     * @throws CompileException 编译失败
     */
    public Program compile(List<Token> tokens) {
        if (tokens == null) {
            throw new IllegalArgumentException("Tokens cannot be null");
        }

        List<Operation> operations = new ArrayList<>();
        Deque<Scope> scopes = new ArrayDeque<>();

        operations.add(Operation.of(OpCode.START));

        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);

            switch (token.getKind()) {
                case STRING:
                    String word = token.getWord();
                    operations.add(Operation.push(Value.ofText(word.substring(1, word.length() - 1))));
                    break;

                case INT:
                    operations.add(Operation.push(Value.ofInteger(Long.parseLong(token.getWord()))));
                    break;

                case FLOAT:
                    operations.add(Operation.push(Value.ofFloat(parseFloat(token))));
                    break;

                case IDENTITY:
                    operations.add(Operation.push(Value.ofIdentity(parseIdentity(token))));
                    break;

                case SET:
                    operations.add(Operation.of(OpCode.SET));
                    break;

                case SELECT:
                    operations.add(Operation.of(OpCode.SELECT));
                    break;

                case SELECT_ALL:
                    operations.add(Operation.of(OpCode.SELECT_ALL));
                    break;

                case FILTER:
                    operations.add(Operation.of(OpCode.FILTER));
                    break;

                case DROP:
                    operations.add(Operation.of(OpCode.DROP));
                    break;

                case PLUS:
                    operations.add(Operation.of(OpCode.ADD));
                    break;

                case MINUS:
                    operations.add(Operation.of(OpCode.SUBTRACT));
                    break;

                case RANGE:
                    if (i + 1 >= tokens.size() || tokens.get(i + 1).getKind() != TokenKind.INT) {
                        throw new CompileException(String.format(
                                "range at line %s must be followed by an integer", token.getPosition()));
                    }
                    i++;
                    long count = Long.parseLong(tokens.get(i).getWord());
                    scopes.push(new Scope(operations.size(), token));
                    operations.add(Operation.range(count, 0));
                    break;

                case IT:
                    if (scopes.isEmpty()) {
                        throw new CompileException(String.format(
                                "`it` outside of range at line %s", token.getPosition()));
                    }
                    operations.add(Operation.of(OpCode.IT));
                    break;

                case DO:
                    break;

                case END:
                    if (scopes.isEmpty()) {
                        throw new CompileException(String.format(
                                "unmatched end at line %s", token.getPosition()));
                    }
                    int rangeIndex = scopes.pop().rangeIndex;
                    int jumpIndex = operations.size();
                    operations.set(rangeIndex, operations.get(rangeIndex).withEnd(jumpIndex + 1));
                    operations.add(Operation.jump(rangeIndex));
                    break;

                case WORD:
                default:
                    if (token.getWord().startsWith("@")) {
                        throw new CompileException(String.format(
                                "malformed identity literal `%s` at line %s",
                                token.getWord(), token.getPosition()));
                    }
                    throw new CompileException(String.format(
                            "unknown word `%s` at line %s", token.getWord(), token.getPosition()));
            }
        }

        if (!scopes.isEmpty()) {
            throw new CompileException(String.format(
                    "unclosed range at line %s", scopes.peek().token.getPosition()));
        }

        operations.add(Operation.of(OpCode.END));
        return new Program(operations);
    }

    /**
     * 解析标识字面量 @table:row
     *
     * @param token IDENTITY类型的Token
     * @return 记录标识
     */
    private RecordId parseIdentity(Token token) {
        String body = token.getWord().substring(1);
        int separator = body.indexOf(':');
        if (separator < 0 || separator != body.lastIndexOf(':')) {
            throw malformedIdentity(token);
        }

        String tableName = body.substring(0, separator);
        String row = body.substring(separator + 1);
        if (tableName.isEmpty()) {
            throw malformedIdentity(token);
        }

        if (AUTO_ROW.equals(row)) {
            return new RecordId(tableName, rowIdGenerator.nextRow());
        }

        if (row.isEmpty() || !row.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw malformedIdentity(token);
        }

        try {
            return new RecordId(tableName, Long.parseUnsignedLong(row));
        } catch (NumberFormatException e) {
            throw new CompileException(String.format(
                    "identity row out of range `%s` at line %s", token.getWord(), token.getPosition()), e);
        }
    }

    /**
     * 浮点字面量必须是有限值,溢出为Infinity时无法按JSON数字输出
     */
    private double parseFloat(Token token) {
        double value = Double.parseDouble(token.getWord());
        if (!Double.isFinite(value)) {
            throw new CompileException(String.format(
                    "float literal out of range `%s` at line %s", token.getWord(), token.getPosition()));
        }
        return value;
    }

    private CompileException malformedIdentity(Token token) {
        return new CompileException(String.format(
                "malformed identity literal `%s` at line %s", token.getWord(), token.getPosition()));
    }

    /**
     * 未闭合的循环
     */
    private static class Scope {
        final int rangeIndex;
        final Token token;

        Scope(int rangeIndex, Token token) {
            this.rangeIndex = rangeIndex;
            this.token = token;
        }
    }
}
