package com.realdb.result;

import com.realdb.storage.Value;

import java.util.Map;

/**
 * JsonResponseRenderer - 响应JSON渲染
 *
 * 手工拼接,不是通用的JSON序列化器,格式固定:
 * <pre>
 * 成功: {"message":"OK","data":[{"id":"users:1","name":"Alice"}, ...]}
 * 失败: {"message":"&lt;错误信息&gt;"}
 * </pre>
 *
 * 值的渲染:
 * - IDENTITY → "table:row"
 * - INTEGER/FLOAT → 裸数字
 * - TEXT → 带引号的原文,不做转义
 *
 * 错误信息会引用查询中的字符串字面量,只对错误信息转义引号、反斜杠和换行。
 */
public class JsonResponseRenderer {

    public static final String OK_MESSAGE = "OK";

    /**
     * 渲染成功响应
     *
     * @param result 查询结果
     * @return JSON文本
     */
    public String renderOk(QueryResult result) {
        if (result == null) {
            throw new IllegalArgumentException("Query result cannot be null");
        }

        StringBuilder sb = new StringBuilder();
        sb.append("{\"message\":\"").append(OK_MESSAGE).append("\",\"data\":[");

        boolean firstRecord = true;
        for (Map<String, Value> record : result.getRecords()) {
            if (!firstRecord) {
                sb.append(",");
            }
            firstRecord = false;

            sb.append("{");
            boolean firstField = true;
            for (Map.Entry<String, Value> field : record.entrySet()) {
                if (!firstField) {
                    sb.append(",");
                }
                firstField = false;
                sb.append("\"").append(field.getKey()).append("\":").append(field.getValue().render());
            }
            sb.append("}");
        }

        sb.append("]}");
        return sb.toString();
    }

    /**
     * 渲染错误响应
     *
     * @param message 错误信息
     * @return JSON文本
     */
    public String renderError(String message) {
        return "{\"message\":\"" + escape(String.valueOf(message)) + "\"}";
    }

    private String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            switch (ch) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                default:
                    sb.append(ch);
            }
        }
        return sb.toString();
    }
}
