package com.fileservice.ingest;

import com.fileservice.config.StorageProperties;
import com.fileservice.storage.StoredBlob;
import com.fileservice.storage.impl.LocalFsStorageBackend;
import com.fileservice.support.InMemoryFileRecordService;
import com.fileservice.thumbnail.ThumbnailGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.publisher.Flux;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 并发上传相同内容：最终只有一条记录、一个 blob，所有请求拿到同一个 id。
 */
class ConcurrentIngestionTest {

    private static final int UPLOADERS = 8;

    @TempDir
    Path root;

    private LocalFsStorageBackend storage;
    private InMemoryFileRecordService records;
    private IngestionPipeline pipeline;

    @BeforeEach
    void setUp() {
        StorageProperties props = new StorageProperties();
        storage = new LocalFsStorageBackend(root);
        records = new InMemoryFileRecordService();
        pipeline = new IngestionPipeline(storage, records, new ThumbnailGenerator(storage, props),
                new MimeTypeResolver(), props);
    }

    @RepeatedTest(5)
    void identicalConcurrentUploadsConvergeOnOneRecord() {
        byte[] content = "same bytes from every client".getBytes(StandardCharsets.UTF_8);

        List<IngestionResult> results = Flux.range(0, UPLOADERS)
                .flatMap(i -> pipeline.ingest(new UploadRequest(
                        new ByteArrayInputStream(content), "copy-" + i + ".txt", null, "text/plain")))
                .collectList()
                .block(Duration.ofSeconds(30));

        assertThat(results).hasSize(UPLOADERS);
        Set<UUID> ids = results.stream().map(r -> r.record().getId()).collect(Collectors.toSet());
        assertThat(ids).hasSize(1);
        assertThat(results.stream().filter(r -> !r.deduplicated())).hasSize(1);

        assertThat(records.size()).isEqualTo(1);
        List<String> blobs = storage.list("files/").map(StoredBlob::key).collectList().block();
        assertThat(blobs).containsExactly(results.get(0).record().getFilePath());
    }

    @Test
    void distinctConcurrentUploadsAllCommit() {
        List<IngestionResult> results = Flux.range(0, UPLOADERS)
                .flatMap(i -> pipeline.ingest(new UploadRequest(
                        new ByteArrayInputStream(("payload " + i).getBytes(StandardCharsets.UTF_8)),
                        "file-" + i + ".txt", null, "text/plain")))
                .collectList()
                .block(Duration.ofSeconds(30));

        assertThat(results).hasSize(UPLOADERS).noneMatch(IngestionResult::deduplicated);
        assertThat(records.size()).isEqualTo(UPLOADERS);
        assertThat(storage.list("files/").count().block()).isEqualTo((long) UPLOADERS);
    }
}
