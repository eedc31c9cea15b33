package com.realdb.server;

import com.realdb.executor.QueryEngine;
import com.realdb.result.JsonResponseRenderer;
import com.realdb.storage.Database;
import com.realdb.storage.RowIdGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ConnectionHandlerTest - 查询到响应JSON的转换测试
 */
@DisplayName("连接处理测试")
class ConnectionHandlerTest {

    private ConnectionHandler handler;

    @BeforeEach
    void setUp() {
        QueryEngine engine = new QueryEngine(new Database(), new RowIdGenerator());
        handler = new ConnectionHandler(null, engine, new RequestReader(512), new JsonResponseRenderer());
    }

    @Test
    @DisplayName("成功查询")
    void testOk() {
        assertEquals("{\"message\":\"OK\",\"data\":[{\"id\":\"users:1\",\"name\":\"Alice\"}]}",
                handler.handle("@users:1 \"name\" \"Alice\" set select"));
    }

    @Test
    @DisplayName("空查询返回空数据")
    void testEmptyQuery() {
        assertEquals("{\"message\":\"OK\",\"data\":[]}", handler.handle(""));
    }

    @Test
    @DisplayName("编译错误")
    void testCompileError() {
        assertEquals("{\"message\":\"unknown word `bogus` at line 1:1\"}", handler.handle("bogus"));
    }

    @Test
    @DisplayName("执行错误")
    void testExecutionError() {
        String json = handler.handle("@users:9 select");

        assertTrue(json.startsWith("{\"message\":\""), json);
        assertTrue(json.contains("Table not found: users"), json);
        assertFalse(json.contains("\"data\""), json);
    }
}
