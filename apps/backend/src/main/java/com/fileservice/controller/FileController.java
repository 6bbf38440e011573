package com.fileservice.controller;

import com.fileservice.api.dto.FileResponse;
import com.fileservice.api.dto.UploadFileResponse;
import com.fileservice.exception.FileRecordNotFoundException;
import com.fileservice.exception.InvalidInputException;
import com.fileservice.ingest.IngestionPipeline;
import com.fileservice.ingest.IngestionResult;
import com.fileservice.ingest.UploadRequest;
import com.fileservice.retrieval.BlobContent;
import com.fileservice.retrieval.FileRetrievalService;
import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePartEvent;
import org.springframework.http.codec.multipart.FormPartEvent;
import org.springframework.http.codec.multipart.PartEvent;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

@Slf4j
@RestController
@RequiredArgsConstructor
public class FileController {

    private static final int CHUNK_SIZE = 8192;

    private static final String FILE_FIELD = "file";
    private static final String FILENAME_FIELD = "filename";

    /** 上传流的预取 buffer 数，限制内存占用 */
    private static final int UPLOAD_DEMAND = 16;

    private final IngestionPipeline ingestionPipeline;
    private final FileRetrievalService retrievalService;

    /**
     * 上传单个文件，按 part 事件流式读取，不落临时盘。
     *
     * 表单字段：
     * - filename: 目标文件名（可选，默认用原文件名），必须排在 file 之前
     * - file: 文件本体（必填）
     *
     * file 之后的字段不再生效。
     */
    @Operation(summary = "上传文件（按内容去重）")
    @PostMapping(
            value = "/upload",
            consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<UploadFileResponse> upload(@RequestBody Flux<PartEvent> events) {
        AtomicReference<String> requested = new AtomicReference<>();
        AtomicBoolean fileSeen = new AtomicBoolean(false);

        return events
                .windowUntil(PartEvent::isLast)
                .concatMap(partEvents -> partEvents.switchOnFirst((signal, all) -> {
                    if (!signal.hasValue()) {
                        return all.then(Mono.<IngestionResult>empty());
                    }
                    PartEvent first = signal.get();
                    String name = first.name();
                    if (FILE_FIELD.equals(name)) {
                        if (!(first instanceof FilePartEvent filePart)) {
                            return drain(all).then(Mono.<IngestionResult>error(
                                    new InvalidInputException("Field 'file' must be a file")));
                        }
                        if (!fileSeen.compareAndSet(false, true)) {
                            log.warn("[upload] extra file part ignored: {}", filePart.filename());
                            return drain(all);
                        }
                        return ingest(filePart, all, requested.get());
                    }
                    if (FILENAME_FIELD.equals(name) && first instanceof FormPartEvent form) {
                        if (fileSeen.get()) {
                            log.warn("[upload] field '{}' after file part ignored", name);
                        } else {
                            requested.set(form.value());
                        }
                    }
                    return drain(all);
                }))
                .singleOrEmpty()
                .switchIfEmpty(Mono.error(() -> new InvalidInputException("No file provided")))
                .map(result -> UploadFileResponse.from(result.record()));
    }

    private Mono<IngestionResult> ingest(FilePartEvent filePart, Flux<PartEvent> events, String requestedName) {
        MediaType ct = filePart.headers().getContentType();
        InputStream content = DataBufferUtils.subscriberInputStream(events.map(PartEvent::content), UPLOAD_DEMAND);
        UploadRequest request = new UploadRequest(
                content,
                filePart.filename(),
                requestedName,
                ct != null ? ct.toString() : null
        );
        return ingestionPipeline.ingest(request)
                .doFinally(signal -> closeQuietly(content));
    }

    /** 读完并释放不需要的 part */
    private static Mono<IngestionResult> drain(Flux<PartEvent> events) {
        return events
                .doOnNext(event -> DataBufferUtils.release(event.content()))
                .then(Mono.empty());
    }

    @Operation(summary = "下载原文件")
    @GetMapping("/files/{id}/download")
    public Mono<ResponseEntity<Flux<DataBuffer>>> download(@PathVariable("id") String id) {
        return parseId(id)
                .flatMap(retrievalService::openOriginal)
                .map(this::toResponse);
    }

    @Operation(summary = "下载缩略图")
    @GetMapping("/files/{id}/thumbnail")
    public Mono<ResponseEntity<Flux<DataBuffer>>> thumbnail(@PathVariable("id") String id) {
        return parseId(id)
                .flatMap(retrievalService::openThumbnail)
                .map(this::toResponse);
    }

    @Operation(summary = "查询文件元数据")
    @GetMapping(value = "/files/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<FileResponse> metadata(@PathVariable("id") String id) {
        return parseId(id).flatMap(retrievalService::getMetadata);
    }

    @Operation(summary = "最近上传的文件")
    @GetMapping(value = "/files", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<List<FileResponse>> list() {
        return retrievalService.listRecent();
    }

    @Operation(summary = "删除文件（记录 + blob）")
    @DeleteMapping("/files/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> delete(@PathVariable("id") String id) {
        return parseId(id).flatMap(retrievalService::delete);
    }

    private ResponseEntity<Flux<DataBuffer>> toResponse(BlobContent blob) {
        // 按 8KB 分块读出，阻塞读放到 boundedElastic
        Flux<DataBuffer> body = DataBufferUtils.readInputStream(
                        blob::content, DefaultDataBufferFactory.sharedInstance, CHUNK_SIZE)
                .subscribeOn(Schedulers.boundedElastic());

        ResponseEntity.BodyBuilder builder = ResponseEntity.ok().contentType(mediaType(blob.contentType()));
        if (blob.contentLength() != null) {
            builder.contentLength(blob.contentLength());
        }
        if (blob.downloadName() != null) {
            builder.header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                    .filename(blob.downloadName(), StandardCharsets.UTF_8)
                    .build().toString());
        }
        return builder.body(body);
    }

    private static MediaType mediaType(String value) {
        try {
            return value != null ? MediaType.parseMediaType(value) : MediaType.APPLICATION_OCTET_STREAM;
        } catch (InvalidMediaTypeException e) {
            return MediaType.APPLICATION_OCTET_STREAM;
        }
    }

    /** 不是合法 UUID 的 id 不可能对应任何记录，按 404 处理 */
    private static Mono<UUID> parseId(String id) {
        try {
            return Mono.just(UUID.fromString(id));
        } catch (IllegalArgumentException e) {
            return Mono.error(FileRecordNotFoundException.file(id));
        }
    }

    private static void closeQuietly(InputStream in) {
        try {
            in.close();
        } catch (IOException e) {
            log.debug("closing upload stream failed: {}", e.getMessage());
        }
    }
}
