package com.realdb.storage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FilterPredicateTest - 过滤谓词测试
 */
@DisplayName("过滤谓词测试")
class FilterPredicateTest {

    @Test
    @DisplayName("根据符号查找谓词")
    void testFromSymbol() {
        assertEquals(FilterPredicate.EQUAL, FilterPredicate.fromSymbol("=="));
        assertEquals(FilterPredicate.LESS_THAN, FilterPredicate.fromSymbol("<"));
        assertEquals(FilterPredicate.LESS_EQUAL, FilterPredicate.fromSymbol("<="));
        assertEquals(FilterPredicate.GREATER_THAN, FilterPredicate.fromSymbol(">"));
        assertEquals(FilterPredicate.GREATER_EQUAL, FilterPredicate.fromSymbol(">="));
        assertNull(FilterPredicate.fromSymbol("!="));
        assertNull(FilterPredicate.fromSymbol("="));
    }

    @Test
    @DisplayName("字段值在左,比较值在右")
    void testOperandOrder() {
        Value field = Value.ofInteger(3);
        Value operand = Value.ofInteger(2);

        assertTrue(FilterPredicate.GREATER_THAN.test(field, operand));
        assertTrue(FilterPredicate.GREATER_EQUAL.test(field, operand));
        assertFalse(FilterPredicate.LESS_THAN.test(field, operand));
        assertFalse(FilterPredicate.LESS_EQUAL.test(field, operand));
        assertFalse(FilterPredicate.EQUAL.test(field, operand));
    }

    @Test
    @DisplayName("不同类型所有谓词都不成立")
    void testCrossTypeAlwaysFalse() {
        Value field = Value.ofInteger(2);
        Value operand = Value.ofText("2");

        for (FilterPredicate predicate : FilterPredicate.values()) {
            assertFalse(predicate.test(field, operand), predicate.getSymbol());
        }
    }
}
