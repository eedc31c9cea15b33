package com.realdb.server;

import com.realdb.CommonConstant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ServerConfigTest - 服务端配置测试
 */
@DisplayName("服务端配置测试")
class ServerConfigTest {

    @Test
    @DisplayName("默认配置")
    void testDefaults() {
        ServerConfig config = ServerConfig.fromArgs(new String[0]);

        assertEquals(CommonConstant.DEFAULT_PORT, config.getPort());
        assertEquals(CommonConstant.DEFAULT_WORKER_THREADS, config.getWorkerThreads());
        assertEquals(CommonConstant.MAX_BODY_BYTES, config.getMaxBodyBytes());
        assertEquals(ServerConfig.defaults().toString(), config.toString());
    }

    @Test
    @DisplayName("解析端口和线程数")
    void testParseArgs() {
        ServerConfig config = ServerConfig.fromArgs(new String[]{"--threads", "8", "--port", "9000"});

        assertEquals(9000, config.getPort());
        assertEquals(8, config.getWorkerThreads());
    }

    @Test
    @DisplayName("非法参数")
    void testInvalidArgs() {
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.fromArgs(new String[]{"--verbose"}));
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.fromArgs(new String[]{"--port"}));
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.fromArgs(new String[]{"--port", "abc"}));
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.fromArgs(new String[]{"--port", "70000"}));
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.fromArgs(new String[]{"--threads", "0"}));
    }
}
