package com.fileservice.ingest;

import org.apache.tika.Tika;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;

/**
 * 优先使用客户端声明的 Content-Type；缺失、为 application/octet-stream 或超出列宽时
 * 用 Tika 按文件名 + 文件头探测。
 */
@Component
public class MimeTypeResolver {

    static final String OCTET_STREAM = "application/octet-stream";

    /** files.mime_type 列宽 */
    static final int MAX_LENGTH = 100;

    private final Tika tika = new Tika();

    /**
     * @param content 必须支持 mark/reset，探测后流位置会被复位
     */
    public String resolve(String declared, String filename, InputStream content) throws IOException {
        String normalized = normalize(declared);
        if (normalized != null && !OCTET_STREAM.equals(normalized) && normalized.length() <= MAX_LENGTH) {
            return normalized;
        }
        String detected = content.markSupported()
                ? tika.detect(content, filename)
                : filename != null ? tika.detect(filename) : null;
        return detected != null && detected.length() <= MAX_LENGTH ? detected : OCTET_STREAM;
    }

    /** 去掉参数（charset 等），统一小写 */
    static String normalize(String contentType) {
        if (contentType == null || contentType.isBlank()) return null;
        String base = contentType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
        return base.isEmpty() || !base.contains("/") ? null : base;
    }
}
