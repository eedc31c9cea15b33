package com.realdb;

import com.realdb.executor.QueryEngine;
import com.realdb.executor.VirtualMachine;
import com.realdb.parser.CompileException;
import com.realdb.result.QueryResult;
import com.realdb.server.QueryServer;
import com.realdb.server.ServerConfig;
import com.realdb.storage.Database;
import com.realdb.storage.RowIdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Real DB - 主入口
 *
 * 用法:
 * <pre>
 * realdb [serve] [--port N] [--threads N]   启动服务(默认)
 * realdb run &lt;file&gt;                        对一个空数据库执行查询文件并打印结果
 * </pre>
 */
public class RealDB {

    private static final Logger logger = LoggerFactory.getLogger(RealDB.class);

    public static void main(String[] args) {
        String command = args.length > 0 && !args[0].startsWith("--") ? args[0] : "serve";
        String[] rest = args.length > 0 && !args[0].startsWith("--")
                ? Arrays.copyOfRange(args, 1, args.length)
                : args;

        switch (command) {
            case "serve":
                System.exit(serve(rest));
                break;
            case "run":
                System.exit(run(rest));
                break;
            default:
                System.err.println("Unknown command: " + command);
                System.err.println("Usage: realdb [serve] [--port N] [--threads N] | realdb run <file>");
                System.exit(2);
        }
    }

    static int serve(String[] args) {
        ServerConfig config;
        try {
            config = ServerConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return 2;
        }

        QueryEngine engine = new QueryEngine(new Database(), new RowIdGenerator());
        QueryServer server = new QueryServer(config, engine);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                server.close();
            } catch (IOException e) {
                logger.warn("关闭服务失败: {}", e.getMessage());
            }
        }, "realdb-shutdown"));

        try {
            server.start();
            server.awaitTermination();
            return 0;
        } catch (IOException e) {
            logger.error("服务启动失败: {}", config, e);
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 1;
        }
    }

    static int run(String[] args) {
        if (args.length != 1) {
            System.err.println("Usage: realdb run <file>");
            return 2;
        }

        String query;
        try {
            query = Files.readString(Path.of(args[0]), StandardCharsets.UTF_8);
        } catch (IOException e) {
            System.out.println("Error: cannot read " + args[0] + ": " + e.getMessage());
            return 1;
        }

        QueryEngine engine = new QueryEngine(new Database(), new RowIdGenerator());
        try {
            QueryResult result = engine.execute(query);
            System.out.println(result);
            return 0;
        } catch (CompileException | VirtualMachine.ExecutionException e) {
            System.out.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
