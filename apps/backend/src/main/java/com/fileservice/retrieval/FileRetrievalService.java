package com.fileservice.retrieval;

import com.fileservice.api.dto.FileResponse;
import com.fileservice.config.StorageProperties;
import com.fileservice.exception.BackendUnavailableException;
import com.fileservice.exception.BlobNotFoundException;
import com.fileservice.exception.FileRecordNotFoundException;
import com.fileservice.exception.StorageInconsistencyException;
import com.fileservice.file.domain.FileRecord;
import com.fileservice.file.service.FileRecordService;
import com.fileservice.storage.StorageBackend;
import com.fileservice.thumbnail.ThumbnailGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.InputStream;
import java.util.List;
import java.util.UUID;

/**
 * 读取路径：元数据、原文件、缩略图、最近列表、删除。
 * 记录是否存在只看元数据库；记录在而 blob 不在属于存储不一致，和普通 404 区分。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FileRetrievalService {

    private final FileRecordService recordService;
    private final StorageBackend storage;
    private final StorageProperties props;

    public Mono<FileRecord> findRecord(UUID id) {
        return Mono.fromCallable(() -> recordService.findById(id))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(Mono::justOrEmpty)
                .switchIfEmpty(Mono.error(() -> FileRecordNotFoundException.file(id)));
    }

    public Mono<FileResponse> getMetadata(UUID id) {
        return findRecord(id).map(FileResponse::from);
    }

    public Mono<List<FileResponse>> listRecent() {
        int limit = props.getListing().getLimit();
        return Mono.fromCallable(() -> recordService.listRecent(limit))
                .subscribeOn(Schedulers.boundedElastic())
                .map(records -> records.stream().map(FileResponse::from).toList());
    }

    public Mono<BlobContent> openOriginal(UUID id) {
        return findRecord(id).flatMap(record -> open(record, record.getFilePath())
                .map(in -> new BlobContent(in, record.getMimeType(), record.getFileSize(), record.getOriginalFilename())));
    }

    public Mono<BlobContent> openThumbnail(UUID id) {
        return findRecord(id).flatMap(record -> {
            if (record.getThumbnailPath() == null) {
                return Mono.error(FileRecordNotFoundException.thumbnail(id));
            }
            return open(record, record.getThumbnailPath())
                    .map(in -> new BlobContent(in, ThumbnailGenerator.CONTENT_TYPE, null, null));
        });
    }

    /**
     * 先删记录再删 blob：记录一旦删掉就不可见，blob 删除失败只记为孤儿，不再向客户端报错。
     */
    public Mono<Void> delete(UUID id) {
        return findRecord(id)
                .flatMap(record -> Mono.fromCallable(() -> recordService.delete(id))
                        .subscribeOn(Schedulers.boundedElastic())
                        .flatMap(deleted -> {
                            if (!deleted) {
                                return Mono.error(FileRecordNotFoundException.file(id));
                            }
                            log.info("[retrieval] deleted record id={} filename={}", id, record.getFilename());
                            return deleteBlob(record, record.getFilePath())
                                    .then(deleteBlob(record, record.getThumbnailPath()));
                        }));
    }

    private Mono<InputStream> open(FileRecord record, String key) {
        if (!storage.storageType().tag().equals(record.getStorageType())) {
            return Mono.error(new BackendUnavailableException(
                    "File " + record.getId() + " is stored in '" + record.getStorageType()
                            + "' but the active backend is '" + storage.storageType().tag() + "'"));
        }
        return storage.get(key)
                .onErrorMap(BlobNotFoundException.class, e -> {
                    log.error("[retrieval] record id={} references missing blob key={}", record.getId(), key);
                    return new StorageInconsistencyException(
                            "Record " + record.getId() + " exists but blob " + key + " is missing", e);
                });
    }

    private Mono<Void> deleteBlob(FileRecord record, String key) {
        if (key == null) {
            return Mono.empty();
        }
        if (!storage.storageType().tag().equals(record.getStorageType())) {
            log.warn("[retrieval] orphan blob key={} left in inactive backend '{}'", key, record.getStorageType());
            return Mono.empty();
        }
        return storage.delete(key)
                .doOnNext(removed -> {
                    if (!removed) {
                        log.warn("[retrieval] blob key={} was already absent for id={}", key, record.getId());
                    }
                })
                .onErrorResume(e -> {
                    log.warn("[retrieval] orphan blob key={} for deleted id={}: {}", key, record.getId(), e.getMessage());
                    return Mono.empty();
                })
                .then();
    }
}
