package com.realdb.server;

import com.realdb.CommonConstant;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;

/**
 * RequestReader - 请求读取(类HTTP分帧)
 *
 * 请求格式:
 * <pre>
 * POST / HTTP/1.1           ← 请求行,读取后丢弃
 * Content-Length: 17        ← 头部,除Content-Length外全部丢弃
 *                           ← 空行
 * &#64;users:_ select_all   ← 请求体,只读一行,最多maxBodyBytes字节
 * </pre>
 *
 * 请求体读取规则:
 * - 有Content-Length: 读取min(Content-Length, maxBodyBytes)字节
 * - 没有Content-Length: 读到换行、EOF或maxBodyBytes为止
 * - 只取第一行,多行请求体不支持
 * - 超出上限的部分读出后丢弃(最多MAX_DISCARD_BYTES字节),关闭连接前输入流里不留未读数据
 */
public class RequestReader {

    private static final String CONTENT_LENGTH = "content-length";

    private final int maxBodyBytes;

    public RequestReader(int maxBodyBytes) {
        if (maxBodyBytes <= 0) {
            throw new IllegalArgumentException("Max body bytes must be positive: " + maxBodyBytes);
        }
        this.maxBodyBytes = maxBodyBytes;
    }

    /**
     * 读取一个请求的查询文本
     *
     * @param in 连接输入流
     * @return 查询文本;连接在请求行之前就关闭时返回null
     * @throws IOException 读取失败或头部格式错误
     */
    public String readQuery(InputStream in) throws IOException {
        String requestLine = readLine(in, CommonConstant.MAX_HEADER_LINE_BYTES);
        if (requestLine == null) {
            return null;
        }

        int contentLength = -1;
        while (true) {
            String header = readLine(in, CommonConstant.MAX_HEADER_LINE_BYTES);
            if (header == null || header.isEmpty()) {
                break;
            }

            int colon = header.indexOf(':');
            if (colon > 0 && header.substring(0, colon).trim().toLowerCase(Locale.ROOT).equals(CONTENT_LENGTH)) {
                contentLength = parseContentLength(header.substring(colon + 1).trim());
            }
        }

        String body;
        if (contentLength >= 0) {
            int toRead = Math.min(contentLength, maxBodyBytes);
            byte[] bytes = readFixed(in, toRead);
            if (bytes.length == toRead) {
                discard(in, contentLength - toRead);
            }
            body = new String(bytes, StandardCharsets.UTF_8);
        } else {
            body = readBodyLine(in);
        }

        if (body == null) {
            return "";
        }

        int newline = body.indexOf('\n');
        if (newline >= 0) {
            body = body.substring(0, newline);
        }
        if (body.endsWith("\r")) {
            body = body.substring(0, body.length() - 1);
        }
        return body;
    }

    private int parseContentLength(String value) throws IOException {
        try {
            int length = Integer.parseInt(value);
            if (length < 0) {
                throw new IOException("Invalid Content-Length: " + value);
            }
            return length;
        } catch (NumberFormatException e) {
            throw new IOException("Invalid Content-Length: " + value, e);
        }
    }

    /**
     * 读取固定字节数(提前EOF时返回已读内容)
     */
    private byte[] readFixed(InputStream in, int length) throws IOException {
        byte[] buffer = new byte[length];
        int read = 0;
        while (read < length) {
            int n = in.read(buffer, read, length - read);
            if (n < 0) {
                break;
            }
            read += n;
        }
        return read == length ? buffer : Arrays.copyOf(buffer, read);
    }

    /**
     * 读取并丢弃Content-Length声明但超出上限的字节
     */
    private void discard(InputStream in, long remaining) throws IOException {
        long limit = Math.min(remaining, CommonConstant.MAX_DISCARD_BYTES);
        byte[] buffer = new byte[1024];
        while (limit > 0) {
            int n = in.read(buffer, 0, (int) Math.min(buffer.length, limit));
            if (n < 0) {
                return;
            }
            limit -= n;
        }
    }

    /**
     * 没有Content-Length时读取请求体:一行,超过maxBodyBytes的部分读到行尾后丢弃
     *
     * @return 请求体;一个字节都没读到就EOF时返回null
     */
    private String readBodyLine(InputStream in) throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream();
        int discarded = 0;
        int b;
        boolean any = false;

        while ((b = in.read()) >= 0) {
            any = true;
            if (b == '\n') {
                break;
            }
            if (line.size() < maxBodyBytes) {
                line.write(b);
            } else if (++discarded >= CommonConstant.MAX_DISCARD_BYTES) {
                break;
            }
        }

        if (!any) {
            return null;
        }
        return line.toString(StandardCharsets.UTF_8);
    }

    /**
     * 读取一行(去掉行尾的\r\n)
     *
     * @param limit 最多读取的字节数,达到后直接返回已读内容
     * @return 行内容;一个字节都没读到就EOF时返回null
     */
    private String readLine(InputStream in, int limit) throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream();
        int count = 0;

        while (count < limit) {
            int b = in.read();
            if (b < 0) {
                if (count == 0) {
                    return null;
                }
                break;
            }
            count++;
            if (b == '\n') {
                break;
            }
            line.write(b);
        }

        String text = line.toString(StandardCharsets.UTF_8);
        if (text.endsWith("\r")) {
            text = text.substring(0, text.length() - 1);
        }
        return text;
    }
}
