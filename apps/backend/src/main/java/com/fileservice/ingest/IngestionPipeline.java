package com.fileservice.ingest;

import com.fileservice.config.StorageProperties;
import com.fileservice.exception.BackendUnavailableException;
import com.fileservice.exception.DedupConflictException;
import com.fileservice.exception.InvalidInputException;
import com.fileservice.exception.UploadInterruptedException;
import com.fileservice.file.domain.FileRecord;
import com.fileservice.file.service.FileRecordService;
import com.fileservice.storage.StorageBackend;
import com.fileservice.storage.StorageKeys;
import com.fileservice.thumbnail.ThumbnailGenerator;
import com.fileservice.thumbnail.ThumbnailResult;
import com.fileservice.util.FileNames;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * 上传管道：写存储（同时计算摘要）-> 按 checksum 去重 -> 缩略图 -> 提交元数据。
 * 严格按此顺序执行。
 *
 * <p>存储与数据库之间没有分布式事务：允许出现没有记录的孤儿 blob（由 OrphanBlobSweeper 回收），
 * 但绝不在 blob 写入确认之前提交记录。
 */
@Slf4j
@Service
public class IngestionPipeline {

    /** files.original_filename 列宽 */
    static final int MAX_ORIGINAL_FILENAME = 255;

    /** Tika 探测读取的文件头上限，mark 需要覆盖它 */
    private static final int SNIFF_BUFFER = 64 * 1024;

    private final StorageBackend storage;
    private final FileRecordService recordService;
    private final ThumbnailGenerator thumbnailGenerator;
    private final MimeTypeResolver mimeTypeResolver;
    private final StorageProperties props;

    public IngestionPipeline(StorageBackend storage,
                             FileRecordService recordService,
                             ThumbnailGenerator thumbnailGenerator,
                             MimeTypeResolver mimeTypeResolver,
                             StorageProperties props) {
        this.storage = storage;
        this.recordService = recordService;
        this.thumbnailGenerator = thumbnailGenerator;
        this.mimeTypeResolver = mimeTypeResolver;
        this.props = props;
    }

    public Mono<IngestionResult> ingest(UploadRequest request) {
        return Mono.defer(() -> {
            validate(request);

            UUID id = UUID.randomUUID();
            String chosen = StringUtils.hasText(request.requestedFilename())
                    ? request.requestedFilename()
                    : request.originalFilename();
            String filename = id + "_" + FileNames.sanitize(chosen);
            String key = StorageKeys.fileKey(filename);

            return store(key, request)
                    .flatMap(stored -> blocking(() -> recordService.findByChecksum(stored.checksum()))
                            .flatMap(existing -> existing.isPresent()
                                    ? discardDuplicate(existing.get(), stored, null)
                                    : thumbnailAndCommit(id, filename, request, stored)));
        });
    }

    private void validate(UploadRequest request) {
        if (request == null || request.content() == null) {
            throw new InvalidInputException("No file provided");
        }
        if (!StringUtils.hasText(request.originalFilename())) {
            throw new InvalidInputException("No file provided");
        }
        String extension = FileNames.extension(request.originalFilename());
        if (extension == null) {
            throw new InvalidInputException("Invalid file extension");
        }
        if (!props.getUpload().isExtensionAllowed(extension)) {
            throw new InvalidInputException("File extension ." + extension + " is not allowed");
        }
    }

    /** 写入存储，失败时尽力删除可能残留的 key */
    private Mono<StoredContent> store(String key, UploadRequest request) {
        return blocking(() -> {
            BufferedInputStream buffered = new BufferedInputStream(request.content(), SNIFF_BUFFER);
            String mime;
            try {
                mime = mimeTypeResolver.resolve(request.declaredMimeType(), request.originalFilename(), buffered);
            } catch (IOException e) {
                throw new UploadInterruptedException("Failed to read upload stream", e);
            }
            return new Prepared(new ChecksumInputStream(buffered, props.getUpload().getMaxFileSize()), mime);
        }).flatMap(prepared -> storage.put(key, prepared.stream(), prepared.mimeType())
                .map(written -> {
                    long counted = prepared.stream().getCount();
                    if (written != counted) {
                        throw new BackendUnavailableException(
                                "Short write for " + key + ": stored " + written + " of " + counted + " bytes");
                    }
                    return new StoredContent(key, counted, prepared.stream().hexDigest(), prepared.mimeType());
                }))
                .doOnNext(stored -> log.info("[ingest] stored key={} bytes={} checksum={}",
                        key, stored.size(), stored.checksum()))
                .onErrorResume(e -> {
                    log.warn("[ingest] storage write failed for key={}: {}", key, e.getMessage());
                    return deleteQuietly(key).then(Mono.error(e));
                })
                .doOnCancel(() -> deleteQuietly(key).subscribe());
    }

    private Mono<IngestionResult> thumbnailAndCommit(UUID id, String filename, UploadRequest request, StoredContent stored) {
        Mono<ThumbnailResult> thumbnail = thumbnailGenerator.supports(stored.mimeType())
                ? thumbnailGenerator.generate(stored.key())
                : Mono.just(ThumbnailResult.skipped());

        return thumbnail.flatMap(thumb -> {
            if (thumb.status() == ThumbnailResult.Status.FAILED) {
                log.warn("[ingest] thumbnail skipped for id={}: {}", id, thumb.reason());
            }
            FileRecord record = FileRecord.builder()
                    .id(id)
                    .filename(filename)
                    .originalFilename(FileNames.truncate(request.originalFilename(), MAX_ORIGINAL_FILENAME))
                    .filePath(stored.key())
                    .fileSize(stored.size())
                    .mimeType(stored.mimeType())
                    .storageType(storage.storageType().tag())
                    .checksum(stored.checksum())
                    .thumbnailPath(thumb.key())
                    .build();
            return commit(record, stored, true);
        });
    }

    /**
     * 提交记录。撞上 checksum 唯一索引说明并发上传了相同内容且对方先提交：
     * 回退到去重路径，返回胜出方的记录。
     */
    private Mono<IngestionResult> commit(FileRecord record, StoredContent stored, boolean retryOnVanishedWinner) {
        return blocking(() -> recordService.insert(record))
                .map(saved -> {
                    log.info("[ingest] committed id={} filename={} size={} mime={}",
                            saved.getId(), saved.getFilename(), saved.getFileSize(), saved.getMimeType());
                    return IngestionResult.created(saved);
                })
                .onErrorResume(e -> {
                    if (e instanceof DedupConflictException) {
                        log.info("[ingest] dedup conflict on checksum={}, falling back to existing record",
                                stored.checksum());
                        return blocking(() -> recordService.findByChecksum(stored.checksum()))
                                .flatMap(winner -> resolveConflict(winner, record, stored, retryOnVanishedWinner, e));
                    }
                    log.warn("[ingest] commit failed for id={}: {}", record.getId(), e.getMessage());
                    return deleteQuietly(stored.key())
                            .then(deleteQuietly(record.getThumbnailPath()))
                            .then(Mono.error(e));
                });
    }

    private Mono<IngestionResult> resolveConflict(Optional<FileRecord> winner,
                                                  FileRecord record,
                                                  StoredContent stored,
                                                  boolean retryOnVanishedWinner,
                                                  Throwable conflict) {
        if (winner.isPresent()) {
            return discardDuplicate(winner.get(), stored, record.getThumbnailPath());
        }
        // 胜出方在此期间被删除：自己的 blob 还在，重试一次插入
        if (retryOnVanishedWinner) {
            return commit(record, stored, false);
        }
        return deleteQuietly(stored.key())
                .then(deleteQuietly(record.getThumbnailPath()))
                .then(Mono.error(conflict));
    }

    private Mono<IngestionResult> discardDuplicate(FileRecord existing, StoredContent stored, String thumbnailKey) {
        log.info("[ingest] duplicate content checksum={} -> existing id={}", stored.checksum(), existing.getId());
        return deleteQuietly(stored.key())
                .then(deleteQuietly(thumbnailKey))
                .thenReturn(IngestionResult.deduplicated(existing));
    }

    /** 尽力删除；失败只记日志，留给孤儿清理 */
    private Mono<Void> deleteQuietly(String key) {
        if (key == null) {
            return Mono.empty();
        }
        return storage.delete(key)
                .onErrorResume(e -> {
                    log.warn("[ingest] cleanup failed, orphan blob left at key={}: {}", key, e.getMessage());
                    return Mono.empty();
                })
                .then();
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }

    private record Prepared(ChecksumInputStream stream, String mimeType) {}

    private record StoredContent(String key, long size, String checksum, String mimeType) {}
}
