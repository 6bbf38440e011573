package com.fileservice.ingest;

import java.io.InputStream;

/**
 * 一次上传的输入。content 由调用方负责关闭。
 *
 * @param requestedFilename 客户端指定的目标文件名，可为空
 * @param declaredMimeType  multipart part 上声明的 Content-Type，可为空
 */
public record UploadRequest(
        InputStream content,
        String originalFilename,
        String requestedFilename,
        String declaredMimeType
) {}
