package com.fileservice.sweep;

import com.fileservice.config.StorageProperties;
import com.fileservice.file.service.FileRecordService;
import com.fileservice.storage.StorageBackend;
import com.fileservice.storage.StorageKeys;
import com.fileservice.storage.StoredBlob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * 孤儿 blob 清理：删除没有任何记录引用、且早于宽限期的 key。
 * 宽限期保护的是已写入存储但尚未提交记录的上传。
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "storage.sweep", name = "enabled", havingValue = "true", matchIfMissing = true)
public class OrphanBlobSweeper {

    private final StorageBackend storage;
    private final FileRecordService recordService;
    private final StorageProperties props;

    @Scheduled(
            initialDelayString = "#{@storageProperties.sweep.interval.toMillis()}",
            fixedDelayString = "#{@storageProperties.sweep.interval.toMillis()}"
    )
    public void scheduledSweep() {
        try {
            sweep(Instant.now());
        } catch (RuntimeException e) {
            log.warn("[sweep] orphan sweep aborted: {}", e.getMessage(), e);
        }
    }

    /**
     * @return 删除的 key 数量
     */
    public int sweep(Instant now) {
        Instant cutoff = now.minus(props.getSweep().getGracePeriod());

        // 先列存储再读引用：期间新提交的记录一定能在引用集合里看到
        List<StoredBlob> blobs = Flux.concat(
                        storage.list(StorageKeys.FILES_PREFIX),
                        storage.list(StorageKeys.THUMBNAILS_PREFIX))
                .collectList()
                .block();
        Set<String> referenced = recordService.referencedKeys();

        int deleted = 0;
        int failed = 0;
        for (StoredBlob blob : blobs == null ? List.<StoredBlob>of() : blobs) {
            if (referenced.contains(blob.key()) || blob.lastModified().isAfter(cutoff)) {
                continue;
            }
            try {
                if (Boolean.TRUE.equals(storage.delete(blob.key()).block())) {
                    deleted++;
                    log.info("[sweep] removed orphan blob key={} lastModified={}", blob.key(), blob.lastModified());
                }
            } catch (RuntimeException e) {
                failed++;
                log.warn("[sweep] failed to remove orphan blob key={}: {}", blob.key(), e.getMessage());
            }
        }
        log.info("[sweep] scanned={} referenced={} removed={} failed={}",
                blobs == null ? 0 : blobs.size(), referenced.size(), deleted, failed);
        return deleted;
    }
}
