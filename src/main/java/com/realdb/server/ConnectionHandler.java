package com.realdb.server;

import com.realdb.executor.QueryEngine;
import com.realdb.executor.VirtualMachine;
import com.realdb.parser.CompileException;
import com.realdb.result.JsonResponseRenderer;
import com.realdb.result.QueryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

/**
 * ConnectionHandler - 处理一个客户端连接
 *
 * 每个连接只处理一个请求:读取查询 → 执行 → 写回JSON → 关闭连接。
 *
 * 响应状态永远是200 OK,查询成功与否只体现在JSON的message字段中。
 */
public class ConnectionHandler implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionHandler.class);

    private final Socket socket;

    private final QueryEngine engine;

    private final RequestReader requestReader;

    private final JsonResponseRenderer renderer;

    public ConnectionHandler(Socket socket, QueryEngine engine, RequestReader requestReader,
                             JsonResponseRenderer renderer) {
        this.socket = socket;
        this.engine = engine;
        this.requestReader = requestReader;
        this.renderer = renderer;
    }

    @Override
    public void run() {
        try (Socket s = socket) {
            String query;
            try {
                query = requestReader.readQuery(s.getInputStream());
            } catch (IOException e) {
                logger.warn("读取请求失败 {}: {}", s.getRemoteSocketAddress(), e.getMessage());
                writeResponse(s.getOutputStream(), renderer.renderError(e.getMessage()));
                return;
            }

            if (query == null) {
                logger.debug("连接在请求前关闭: {}", s.getRemoteSocketAddress());
                return;
            }

            logger.debug("收到查询: {}", query);
            writeResponse(s.getOutputStream(), handle(query));
        } catch (IOException e) {
            logger.warn("连接处理失败: {}", e.getMessage());
        }
    }

    /**
     * 执行查询并渲染JSON
     *
     * @param query 查询文本
     * @return 响应JSON
     */
    String handle(String query) {
        try {
            QueryResult result = engine.execute(query);
            return renderer.renderOk(result);
        } catch (CompileException | VirtualMachine.ExecutionException e) {
            logger.debug("查询失败: {}", e.getMessage());
            return renderer.renderError(e.getMessage());
        } catch (RuntimeException e) {
            logger.error("查询执行出现内部错误: {}", query, e);
            return renderer.renderError("Internal error: " + e.getMessage());
        }
    }

    private void writeResponse(OutputStream out, String json) throws IOException {
        byte[] body = json.getBytes(StandardCharsets.UTF_8);
        String head = "HTTP/1.1 200 OK\r\n"
                + "Content-Type: application/json\r\n"
                + "Content-Length: " + body.length + "\r\n"
                + "Connection: close\r\n"
                + "\r\n";

        out.write(head.getBytes(StandardCharsets.US_ASCII));
        out.write(body);
        out.flush();
    }
}
