package com.fileservice.retrieval;

import java.io.InputStream;

/**
 * 打开的 blob 流及其响应头信息。content 由消费方关闭。
 *
 * @param contentLength 未知时为 null
 * @param downloadName  Content-Disposition 里的文件名，为 null 时不设置
 */
public record BlobContent(InputStream content, String contentType, Long contentLength, String downloadName) {}
