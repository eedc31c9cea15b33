package com.realdb;

/**
 * 全局常量
 */
public final class CommonConstant {

    /** 默认监听端口 */
    public static final int DEFAULT_PORT = 8080;

    /** 默认工作线程数 */
    public static final int DEFAULT_WORKER_THREADS = 4;

    /** 请求体(查询文本)最多读取的字节数 */
    public static final int MAX_BODY_BYTES = 512;

    /** 超出上限的请求体最多读取并丢弃的字节数 */
    public static final int MAX_DISCARD_BYTES = 64 * 1024;

    /** 请求行/头部单行最大字节数 */
    public static final int MAX_HEADER_LINE_BYTES = 8192;

    private CommonConstant() {
    }
}
