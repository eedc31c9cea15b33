package com.realdb.storage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ValueTest - 值比较和渲染测试
 */
@DisplayName("Value测试")
class ValueTest {

    @Test
    @DisplayName("同类型按底层值比较")
    void testSameTypeComparison() {
        assertTrue(Value.ofInteger(1).compare(Value.ofInteger(2)) < 0);
        assertEquals(0, Value.ofInteger(7).compare(Value.ofInteger(7)));
        assertTrue(Value.ofFloat(2.5).compare(Value.ofFloat(1.0)) > 0);
        assertTrue(Value.ofText("apple").compare(Value.ofText("banana")) < 0);
    }

    @Test
    @DisplayName("不同类型无法比较")
    void testCrossTypeComparison() {
        assertNull(Value.ofInteger(2).compare(Value.ofFloat(2.0)));
        assertNull(Value.ofInteger(2).compare(Value.ofText("2")));
        assertNull(Value.ofIdentity("t", 1).compare(Value.ofInteger(1)));
        assertNotEquals(Value.ofInteger(2), Value.ofFloat(2.0));
    }

    @Test
    @DisplayName("NaN没有大小关系")
    void testNaN() {
        assertNull(Value.ofFloat(Double.NaN).compare(Value.ofFloat(1.0)));
        assertNull(Value.ofFloat(Double.NaN).compare(Value.ofFloat(Double.NaN)));
    }

    @Test
    @DisplayName("标识先按表名再按无符号行号比较")
    void testIdentityOrdering() {
        assertTrue(Value.ofIdentity("a", 9).compare(Value.ofIdentity("b", 1)) < 0);
        assertTrue(Value.ofIdentity("t", -1L).compare(Value.ofIdentity("t", 1)) > 0);
        assertEquals(0, Value.ofIdentity("t", 3).compare(Value.ofIdentity("t", 3)));
    }

    @Test
    @DisplayName("JSON渲染")
    void testRender() {
        assertEquals("\"users:1\"", Value.ofIdentity("users", 1).render());
        assertEquals("\"t:18446744073709551615\"", Value.ofIdentity("t", -1L).render());
        assertEquals("-42", Value.ofInteger(-42).render());
        assertEquals("1.5", Value.ofFloat(1.5).render());
        assertEquals("\"Alice\"", Value.ofText("Alice").render());
    }

    @Test
    @DisplayName("类型访问")
    void testAccessors() {
        assertEquals(5L, Value.ofInteger(5).asInteger());
        assertEquals("x", Value.ofText("x").asText());
        assertEquals(new RecordId("t", 2), Value.ofIdentity("t", 2).asIdentity());
        assertEquals(2.5, Value.ofFloat(2.5).asFloat());
        assertEquals(Value.Type.IDENTITY, Value.ofIdentity("t", 2).getType());
        assertEquals(Value.Type.INTEGER, Value.ofInteger(5).getType());
        assertEquals(Value.Type.FLOAT, Value.ofFloat(2.5).getType());
        assertEquals(Value.Type.TEXT, Value.ofText("x").getType());
        assertThrows(IllegalStateException.class, () -> Value.ofInteger(5).asText());
        assertThrows(IllegalStateException.class, () -> Value.ofInteger(5).asFloat());
        assertThrows(IllegalArgumentException.class, () -> Value.ofText(null));
    }
}
