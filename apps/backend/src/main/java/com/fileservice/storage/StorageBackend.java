package com.fileservice.storage;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.InputStream;

/**
 * 统一的 blob 存储接口，本地文件系统与 S3 兼容对象存储各一个实现，启动时二选一。
 * key 对调用方是不透明的，只保证唯一性。
 *
 * <p>失败约定：key 不存在 -> BlobNotFoundException；I/O / 网络 / 超时 -> BackendUnavailableException。
 */
public interface StorageBackend {

    /** 当前后端写入记录时使用的 storage_type */
    StorageType storageType();

    /**
     * 把流写到 key，返回实际写入的字节数。
     * 不负责关闭 {@code content}。
     */
    Mono<Long> put(String key, InputStream content, String contentType);

    /**
     * 打开对象的读取流。
     * 注意：调用方需要在消费完后 close()
     */
    Mono<InputStream> get(String key);

    /** 幂等删除；true 表示确实删掉了东西，false 表示本来就不存在 */
    Mono<Boolean> delete(String key);

    Mono<Boolean> exists(String key);

    /** 按前缀列举 */
    Flux<StoredBlob> list(String prefix);
}
