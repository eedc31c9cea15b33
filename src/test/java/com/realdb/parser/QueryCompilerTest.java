package com.realdb.parser;

import com.realdb.program.OpCode;
import com.realdb.program.Operation;
import com.realdb.program.Program;
import com.realdb.storage.RowIdGenerator;
import com.realdb.storage.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * QueryCompilerTest - 查询编译器测试
 *
 * 测试:
 * - 字面量和关键字的指令生成
 * - range/it/do/end 的作用域解析和跳转回填
 * - 各类编译错误
 */
@DisplayName("查询编译器测试")
class QueryCompilerTest {

    private static final long SEED = 42L;

    private QueryCompiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new QueryCompiler(new RowIdGenerator(new Random(SEED)));
    }

    @Test
    @DisplayName("空程序只有首尾标记")
    void testEmptyProgram() {
        Program program = compiler.compile("");

        assertEquals(List.of(Operation.of(OpCode.START), Operation.of(OpCode.END)),
                program.getOperations());
    }

    @Test
    @DisplayName("字面量编译为PUSH")
    void testLiterals() {
        Program program = compiler.compile("\"k\" 5 2.5 @t:7 \"two words\"");

        assertEquals(List.of(
                Operation.of(OpCode.START),
                Operation.push(Value.ofText("k")),
                Operation.push(Value.ofInteger(5)),
                Operation.push(Value.ofFloat(2.5)),
                Operation.push(Value.ofIdentity("t", 7)),
                Operation.push(Value.ofText("two words")),
                Operation.of(OpCode.END)), program.getOperations());
    }

    @Test
    @DisplayName("关键字一一对应指令")
    void testKeywords() {
        Program program = compiler.compile("set select select_all filter drop + -");

        assertEquals(List.of(
                Operation.of(OpCode.START),
                Operation.of(OpCode.SET),
                Operation.of(OpCode.SELECT),
                Operation.of(OpCode.SELECT_ALL),
                Operation.of(OpCode.FILTER),
                Operation.of(OpCode.DROP),
                Operation.of(OpCode.ADD),
                Operation.of(OpCode.SUBTRACT),
                Operation.of(OpCode.END)), program.getOperations());
    }

    @Test
    @DisplayName("range回填end并生成回跳")
    void testRangeBackPatch() {
        Program program = compiler.compile("range 3 do it end");

        assertEquals(List.of(
                Operation.of(OpCode.START),
                Operation.range(3, 4),
                Operation.of(OpCode.IT),
                Operation.jump(1),
                Operation.of(OpCode.END)), program.getOperations());
    }

    @Test
    @DisplayName("嵌套range")
    void testNestedRange() {
        Program program = compiler.compile("range 2 do range 3 do it end end");

        assertEquals(List.of(
                Operation.of(OpCode.START),
                Operation.range(2, 6),
                Operation.range(3, 5),
                Operation.of(OpCode.IT),
                Operation.jump(2),
                Operation.jump(1),
                Operation.of(OpCode.END)), program.getOperations());
    }

    @Test
    @DisplayName("do不生成指令")
    void testDoIsSyntaxOnly() {
        Program withDo = compiler.compile("range 1 do end");
        Program withoutDo = compiler.compile("range 1 end");

        assertEquals(withDo.getOperations(), withoutDo.getOperations());
    }

    @Test
    @DisplayName("随机行号来自生成器")
    void testAutoRow() {
        Random expected = new Random(SEED);

        Program program = compiler.compile("@t:_ @t:_");

        assertEquals(Value.ofIdentity("t", expected.nextLong()), program.get(1).getValue());
        assertEquals(Value.ofIdentity("t", expected.nextLong()), program.get(2).getValue());
        assertNotEquals(program.get(1).getValue(), program.get(2).getValue());
    }

    @Test
    @DisplayName("行号按无符号64位解析")
    void testUnsignedRow() {
        Program program = compiler.compile("@t:18446744073709551615");

        assertEquals(-1L, program.get(1).getValue().asIdentity().getRow());
        assertEquals("t:18446744073709551615", program.get(1).getValue().asIdentity().toString());
    }

    @Test
    @DisplayName("反汇编输出")
    void testDisassembly() {
        String listing = compiler.compile("range 3 do it end").toString();

        assertTrue(listing.contains("1: RANGE count=3 end=4"));
        assertTrue(listing.contains("3: JUMP 1"));
    }

    @Test
    @DisplayName("错误: 不匹配的end")
    void testUnmatchedEnd() {
        CompileException e = assertThrows(CompileException.class, () -> compiler.compile("drop end"));
        assertEquals("unmatched end at line 1:6", e.getMessage());
    }

    @Test
    @DisplayName("错误: 循环外使用it")
    void testItOutsideRange() {
        CompileException e = assertThrows(CompileException.class,
                () -> compiler.compile("range 1 do end it"));
        assertTrue(e.getMessage().contains("outside of range"));
    }

    @Test
    @DisplayName("错误: range后面不是整数")
    void testRangeWithoutInteger() {
        assertThrows(CompileException.class, () -> compiler.compile("range do end"));
        assertThrows(CompileException.class, () -> compiler.compile("range 1.5 do end"));
        assertThrows(CompileException.class, () -> compiler.compile("range"));
    }

    @Test
    @DisplayName("错误: 未闭合的range")
    void testUnclosedRange() {
        CompileException e = assertThrows(CompileException.class,
                () -> compiler.compile("range 2 do it"));
        assertEquals("unclosed range at line 1:1", e.getMessage());
    }

    @Test
    @DisplayName("错误: 无法识别的单词")
    void testUnknownWord() {
        CompileException e = assertThrows(CompileException.class,
                () -> compiler.compile("set\n  bogus"));
        assertEquals("unknown word `bogus` at line 2:3", e.getMessage());
    }

    @Test
    @DisplayName("错误: 非法的标识字面量")
    void testMalformedIdentity() {
        assertTrue(assertThrows(CompileException.class, () -> compiler.compile("@t:abc"))
                .getMessage().contains("malformed identity literal `@t:abc`"));
        assertTrue(assertThrows(CompileException.class, () -> compiler.compile("@:1"))
                .getMessage().contains("malformed identity literal"));
        assertTrue(assertThrows(CompileException.class, () -> compiler.compile("@a:b:c"))
                .getMessage().contains("malformed identity literal"));
        assertTrue(assertThrows(CompileException.class, () -> compiler.compile("@users"))
                .getMessage().contains("malformed identity literal"));
        assertTrue(assertThrows(CompileException.class, () -> compiler.compile("@t:"))
                .getMessage().contains("malformed identity literal"));
    }

    @Test
    @DisplayName("错误: 行号超出范围")
    void testRowOutOfRange() {
        CompileException e = assertThrows(CompileException.class,
                () -> compiler.compile("@t:18446744073709551616"));
        assertTrue(e.getMessage().contains("out of range"));
    }

    @Test
    @DisplayName("错误: 浮点数溢出")
    void testFloatOutOfRange() {
        CompileException e = assertThrows(CompileException.class,
                () -> compiler.compile("@t:1 \"k\" 1e400 set"));
        assertEquals("float literal out of range `1e400` at line 1:10", e.getMessage());

        assertTrue(assertThrows(CompileException.class, () -> compiler.compile("-1e400"))
                .getMessage().contains("float literal out of range `-1e400`"));
        assertEquals(Value.ofFloat(1e300), compiler.compile("1e300").get(1).getValue());
    }
}
