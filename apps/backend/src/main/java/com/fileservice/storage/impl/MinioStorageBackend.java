package com.fileservice.storage.impl;

import com.fileservice.exception.BackendUnavailableException;
import com.fileservice.exception.BlobNotFoundException;
import com.fileservice.storage.MinioProps;
import com.fileservice.storage.StorageBackend;
import com.fileservice.storage.StorageType;
import com.fileservice.storage.StoredBlob;
import io.minio.BucketExistsArgs;
import io.minio.GetObjectArgs;
import io.minio.ListObjectsArgs;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.RemoveObjectArgs;
import io.minio.Result;
import io.minio.StatObjectArgs;
import io.minio.errors.ErrorResponseException;
import io.minio.errors.MinioException;
import io.minio.messages.Item;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.security.GeneralSecurityException;
import java.time.Instant;
import java.util.Set;

/**
 * S3 兼容对象存储后端（MinIO 客户端）。
 * 上传时对象大小未知，按固定分片走 multipart，不会把整个对象读进内存。
 */
@Slf4j
public class MinioStorageBackend implements StorageBackend {

    private static final Set<String> MISSING_CODES = Set.of("NoSuchKey", "NoSuchObject");

    private final MinioClient client;
    private final MinioProps props;

    public MinioStorageBackend(MinioClient client, MinioProps props) {
        this.client = client;
        this.props = props;
    }

    @Override
    public StorageType storageType() {
        return StorageType.S3;
    }

    public String getBucket() {
        return props.getBucket();
    }

    /** 确保桶存在（幂等操作） */
    public Mono<Void> ensureBucket() {
        return Mono.fromRunnable(() -> {
            String bucket = props.getBucket();
            try {
                boolean exists = client.bucketExists(BucketExistsArgs.builder().bucket(bucket).build());
                if (!exists) {
                    client.makeBucket(MakeBucketArgs.builder().bucket(bucket).build());
                    log.info("[storage] bucket {} created", bucket);
                }
            } catch (MinioException | GeneralSecurityException | IOException e) {
                throw new BackendUnavailableException("Error handling bucket " + bucket, e);
            }
        }).subscribeOn(Schedulers.boundedElastic()).then();
    }

    @Override
    public Mono<Long> put(String key, InputStream content, String contentType) {
        return Mono.fromCallable(() -> {
            CountingStream counted = new CountingStream(content);
            try {
                // objectSize 未知传 -1，partSize 必须显式给出
                client.putObject(
                        PutObjectArgs.builder()
                                .bucket(props.getBucket())
                                .object(key)
                                .stream(counted, -1, props.getPartSize())
                                .contentType(contentType != null ? contentType : "application/octet-stream")
                                .build()
                );
            } catch (MinioException | GeneralSecurityException | IOException e) {
                throw new BackendUnavailableException("Failed to put object " + key, e);
            }
            log.debug("[storage] s3 put key={} bytes={}", key, counted.count);
            return counted.count;
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<InputStream> get(String key) {
        return Mono.fromCallable(() -> {
            try {
                return (InputStream) client.getObject(
                        GetObjectArgs.builder().bucket(props.getBucket()).object(key).build());
            } catch (ErrorResponseException e) {
                if (isMissing(e)) throw new BlobNotFoundException(key, e);
                throw new BackendUnavailableException("Failed to get object " + key, e);
            } catch (MinioException | GeneralSecurityException | IOException e) {
                throw new BackendUnavailableException("Failed to get object " + key, e);
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Boolean> delete(String key) {
        return exists(key).flatMap(present -> {
            if (!present) {
                return Mono.just(false);
            }
            return Mono.fromCallable(() -> {
                try {
                    client.removeObject(RemoveObjectArgs.builder().bucket(props.getBucket()).object(key).build());
                    return true;
                } catch (MinioException | GeneralSecurityException | IOException e) {
                    throw new BackendUnavailableException("Failed to delete object " + key, e);
                }
            }).subscribeOn(Schedulers.boundedElastic());
        });
    }

    @Override
    public Mono<Boolean> exists(String key) {
        return Mono.fromCallable(() -> {
            try {
                client.statObject(StatObjectArgs.builder().bucket(props.getBucket()).object(key).build());
                return true;
            } catch (ErrorResponseException e) {
                if (isMissing(e)) return false;
                throw new BackendUnavailableException("Failed to stat object " + key, e);
            } catch (MinioException | GeneralSecurityException | IOException e) {
                throw new BackendUnavailableException("Failed to stat object " + key, e);
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    /** 列举某前缀下的对象 */
    @Override
    public Flux<StoredBlob> list(String prefix) {
        return Flux.defer(() -> {
            Iterable<Result<Item>> it = client.listObjects(
                    ListObjectsArgs.builder()
                            .bucket(props.getBucket())
                            .recursive(true)
                            .prefix(prefix)
                            .build()
            );
            return Flux.fromIterable(it)
                    .map(res -> {
                        try {
                            Item item = res.get();
                            Instant modified = item.lastModified() != null
                                    ? item.lastModified().toInstant()
                                    : Instant.EPOCH;
                            return new StoredBlob(item.objectName(), modified);
                        } catch (MinioException | GeneralSecurityException | IOException e) {
                            throw new BackendUnavailableException("Failed to list objects under " + prefix, e);
                        }
                    });
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private static boolean isMissing(ErrorResponseException e) {
        return e.errorResponse() != null && MISSING_CODES.contains(e.errorResponse().code());
    }

    /** MinIO 不回报写入字节数，这里自己数 */
    private static final class CountingStream extends FilterInputStream {
        private long count;

        CountingStream(InputStream in) {
            super(in);
        }

        @Override
        public int read() throws IOException {
            int b = super.read();
            if (b != -1) count++;
            return b;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            int n = super.read(b, off, len);
            if (n > 0) count += n;
            return n;
        }

        @Override
        public boolean markSupported() {
            return false;
        }
    }
}
