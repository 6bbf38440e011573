package com.fileservice.storage.impl;

import com.fileservice.exception.BackendUnavailableException;
import com.fileservice.exception.BlobNotFoundException;
import com.fileservice.exception.InvalidInputException;
import com.fileservice.storage.StorageBackend;
import com.fileservice.storage.StorageType;
import com.fileservice.storage.StoredBlob;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * 本地文件系统后端：key 映射为 root 下的相对路径。
 * 写入先落临时文件，再原子 rename 到最终路径，崩溃时最终 key 下不会出现半截文件。
 */
@Slf4j
public class LocalFsStorageBackend implements StorageBackend {

    static final String TEMP_PREFIX = ".upload-";

    private final Path root;

    public LocalFsStorageBackend(Path root) {
        this.root = root.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.root);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create storage root " + this.root, e);
        }
        log.info("[storage] local backend rooted at {}", this.root);
    }

    public Path getRoot() {
        return root;
    }

    @Override
    public StorageType storageType() {
        return StorageType.LOCAL;
    }

    @Override
    public Mono<Long> put(String key, InputStream content, String contentType) {
        return Mono.fromCallable(() -> {
            Path target = resolve(key);
            Path tmp = null;
            try {
                Files.createDirectories(target.getParent());
                tmp = Files.createTempFile(target.getParent(), TEMP_PREFIX, ".tmp");
                long written = Files.copy(content, tmp, StandardCopyOption.REPLACE_EXISTING);
                moveIntoPlace(tmp, target);
                tmp = null;
                log.debug("[storage] local put key={} bytes={}", key, written);
                return written;
            } catch (IOException e) {
                throw new BackendUnavailableException("Failed to write " + key + " to local storage", e);
            } finally {
                if (tmp != null) {
                    deleteQuietly(tmp);
                }
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<InputStream> get(String key) {
        return Mono.fromCallable(() -> {
            Path path = resolve(key);
            if (!Files.isRegularFile(path)) {
                throw new BlobNotFoundException(key);
            }
            try {
                return Files.newInputStream(path);
            } catch (NoSuchFileException e) {
                throw new BlobNotFoundException(key, e);
            } catch (IOException e) {
                throw new BackendUnavailableException("Failed to read " + key + " from local storage", e);
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Boolean> delete(String key) {
        return Mono.fromCallable(() -> {
            try {
                return Files.deleteIfExists(resolve(key));
            } catch (IOException e) {
                throw new BackendUnavailableException("Failed to delete " + key + " from local storage", e);
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Boolean> exists(String key) {
        return Mono.fromCallable(() -> Files.isRegularFile(resolve(key)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Flux<StoredBlob> list(String prefix) {
        return Flux.defer(() -> {
            Path dir = resolve(prefix == null ? "" : prefix);
            if (!Files.isDirectory(dir)) {
                return Flux.empty();
            }
            return Flux.using(
                    () -> Files.walk(dir),
                    (Stream<Path> paths) -> Flux.fromStream(paths
                            .filter(Files::isRegularFile)
                            .filter(p -> !p.getFileName().toString().startsWith(TEMP_PREFIX))
                            .flatMap(p -> toBlob(p).stream())),
                    Stream::close);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    // ========= 工具方法 =========

    /** key -> root 下的路径；拒绝逃逸出 root 的 key */
    Path resolve(String key) {
        if (key == null) {
            throw new InvalidInputException("Storage key is null");
        }
        Path p = root.resolve(key).normalize();
        if (!p.startsWith(root)) {
            throw new InvalidInputException("Storage key escapes storage root: " + key);
        }
        return p;
    }

    private Optional<StoredBlob> toBlob(Path p) {
        try {
            String key = root.relativize(p).toString().replace('\\', '/');
            return Optional.of(new StoredBlob(key, Files.getLastModifiedTime(p).toInstant()));
        } catch (IOException e) {
            // 遍历期间被并发删除
            log.debug("[storage] skip {} while listing: {}", p, e.getMessage());
            return Optional.empty();
        }
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path p) {
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            log.warn("[storage] failed to remove temp file {}: {}", p, e.getMessage());
        }
    }
}
