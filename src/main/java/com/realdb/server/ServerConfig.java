package com.realdb.server;

import com.realdb.CommonConstant;

/**
 * ServerConfig - 服务端配置
 *
 * 支持的命令行参数:
 * <pre>
 * --port N       监听端口(默认8080, 0表示随机端口)
 * --threads N    工作线程数(默认4)
 * </pre>
 */
public class ServerConfig {

    private final int port;

    private final int workerThreads;

    private final int maxBodyBytes;

    public ServerConfig(int port, int workerThreads, int maxBodyBytes) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Port out of range: " + port);
        }
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("Worker threads must be positive: " + workerThreads);
        }
        if (maxBodyBytes <= 0) {
            throw new IllegalArgumentException("Max body bytes must be positive: " + maxBodyBytes);
        }
        this.port = port;
        this.workerThreads = workerThreads;
        this.maxBodyBytes = maxBodyBytes;
    }

    /**
     * 默认配置
     */
    public static ServerConfig defaults() {
        return new ServerConfig(
                CommonConstant.DEFAULT_PORT,
                CommonConstant.DEFAULT_WORKER_THREADS,
                CommonConstant.MAX_BODY_BYTES);
    }

    /**
     * 从命令行参数解析
     *
     * @param args 参数(不含子命令)
     * @return 配置
     * @throws IllegalArgumentException 参数无法识别或取值非法
     */
    public static ServerConfig fromArgs(String[] args) {
        int port = CommonConstant.DEFAULT_PORT;
        int threads = CommonConstant.DEFAULT_WORKER_THREADS;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--port":
                    port = parseInt(arg, args, ++i);
                    break;
                case "--threads":
                    threads = parseInt(arg, args, ++i);
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }

        return new ServerConfig(port, threads, CommonConstant.MAX_BODY_BYTES);
    }

    private static int parseInt(String option, String[] args, int index) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        try {
            return Integer.parseInt(args[index]);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + option + ": " + args[index], e);
        }
    }

    public int getPort() {
        return port;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public int getMaxBodyBytes() {
        return maxBodyBytes;
    }

    @Override
    public String toString() {
        return "ServerConfig{port=" + port + ", workerThreads=" + workerThreads
                + ", maxBodyBytes=" + maxBodyBytes + "}";
    }
}
