package com.realdb.server;

import com.realdb.executor.QueryEngine;
import com.realdb.result.JsonResponseRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * QueryServer - 查询服务端
 *
 * 一个接收线程 + 固定大小的工作线程池:
 * - 接收线程只负责accept,把连接交给线程池
 * - 工作线程负责读请求、编译、执行、写响应
 * - 编译和网络I/O可以并行,执行由Database的全局锁串行化
 *
 * 没有超时和取消:一个查询要么执行完,要么遇到第一个错误。
 *
 * 使用示例:
 * <pre>
 * QueryServer server = new QueryServer(ServerConfig.defaults(), engine);
 * server.start();
 * server.awaitTermination();
 * </pre>
 */
public class QueryServer implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(QueryServer.class);

    private final ServerConfig config;

    private final QueryEngine engine;

    private final RequestReader requestReader;

    private final JsonResponseRenderer renderer;

    private ServerSocket serverSocket;

    private ExecutorService workers;

    private Thread acceptor;

    private volatile boolean closed;

    public QueryServer(ServerConfig config, QueryEngine engine) {
        if (config == null) {
            throw new IllegalArgumentException("Server config cannot be null");
        }
        if (engine == null) {
            throw new IllegalArgumentException("Query engine cannot be null");
        }
        this.config = config;
        this.engine = engine;
        this.requestReader = new RequestReader(config.getMaxBodyBytes());
        this.renderer = new JsonResponseRenderer();
    }

    /**
     * 绑定端口并开始接收连接
     *
     * @throws IOException 端口绑定失败
     * @throws IllegalStateException 已经启动或已关闭
     */
    public synchronized void start() throws IOException {
        if (serverSocket != null || closed) {
            throw new IllegalStateException("Server already started or closed");
        }

        serverSocket = new ServerSocket(config.getPort());
        workers = Executors.newFixedThreadPool(config.getWorkerThreads(), new WorkerThreadFactory());

        acceptor = new Thread(this::acceptLoop, "realdb-acceptor");
        acceptor.start();

        logger.info("服务已启动, 端口: {}, 工作线程: {}", getPort(), config.getWorkerThreads());
    }

    private void acceptLoop() {
        while (!closed) {
            Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (IOException e) {
                if (closed) {
                    break;
                }
                logger.warn("接收连接失败: {}", e.getMessage());
                continue;
            }

            try {
                workers.execute(new ConnectionHandler(socket, engine, requestReader, renderer));
            } catch (RejectedExecutionException e) {
                logger.warn("线程池已关闭, 丢弃连接: {}", socket.getRemoteSocketAddress());
                closeQuietly(socket);
            }
        }
        logger.debug("接收线程退出");
    }

    /**
     * 实际监听的端口(配置为0时返回系统分配的端口)
     */
    public int getPort() {
        if (serverSocket == null) {
            throw new IllegalStateException("Server not started");
        }
        return serverSocket.getLocalPort();
    }

    /**
     * 阻塞直到接收线程退出
     */
    public void awaitTermination() throws InterruptedException {
        Thread t = acceptor;
        if (t != null) {
            t.join();
        }
    }

    @Override
    public synchronized void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;

        if (serverSocket != null) {
            serverSocket.close();
        }
        if (workers != null) {
            workers.shutdown();
            try {
                if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                    workers.shutdownNow();
                }
            } catch (InterruptedException e) {
                workers.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        logger.info("服务已关闭");
    }

    private void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            logger.debug("关闭连接失败: {}", e.getMessage());
        }
    }

    /**
     * 工作线程命名: realdb-worker-N
     */
    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "realdb-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
