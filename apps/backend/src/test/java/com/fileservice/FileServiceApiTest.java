package com.fileservice;

import com.fasterxml.jackson.databind.JsonNode;
import com.fileservice.support.TestImages;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.function.BodyInserters;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 端到端：真实 HTTP + H2 + 本地文件系统存储。
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class FileServiceApiTest {

    private static final Logger log = LoggerFactory.getLogger(FileServiceApiTest.class);

    private static final Path STORAGE_ROOT;

    static {
        try {
            STORAGE_ROOT = Files.createTempDirectory("file-service-it");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @DynamicPropertySource
    static void storageRoot(DynamicPropertyRegistry registry) {
        registry.add("storage.local.root", STORAGE_ROOT::toString);
    }

    @Autowired
    private WebTestClient client;

    @Test
    void healthReportsActiveBackend() {
        client.get().uri("/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("UP")
                .jsonPath("$.service").isEqualTo("file-service")
                .jsonPath("$.storage_type").isEqualTo("local")
                .jsonPath("$.timestamp").isNotEmpty();
    }

    @Test
    void imageUploadServesOriginalThumbnailAndDeduplicates() throws IOException {
        byte[] png = TestImages.png(640, 320, new Color(12, 34, 56));

        JsonNode uploaded = upload(png, "days.png", MediaType.IMAGE_PNG, "daysGone.png")
                .expectStatus().isCreated()
                .expectBody(JsonNode.class)
                .returnResult().getResponseBody();
        assertThat(uploaded).isNotNull();
        String id = uploaded.get("id").asText();
        log.info("Uploaded days.png as {}", uploaded);
        assertThat(uploaded.get("url").asText()).isEqualTo("/files/" + id);
        assertThat(uploaded.get("size").asLong()).isEqualTo(png.length);
        assertThat(uploaded.get("mime_type").asText()).isEqualTo("image/png");
        assertThat(uploaded.get("filename").asText()).isEqualTo(id + "_daysGone.png");

        client.get().uri("/files/{id}", id)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.original_filename").isEqualTo("days.png")
                .jsonPath("$.download_url").isEqualTo("/files/" + id + "/download")
                .jsonPath("$.thumbnail_url").isEqualTo("/files/" + id + "/thumbnail")
                .jsonPath("$.uploaded_at").isNotEmpty();

        byte[] downloaded = client.get().uri("/files/{id}/download", id)
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentType(MediaType.IMAGE_PNG)
                .expectHeader().contentLength(png.length)
                .expectHeader().valueMatches(HttpHeaders.CONTENT_DISPOSITION, "attachment;.*days\\.png.*")
                .expectBody(byte[].class)
                .returnResult().getResponseBody();
        assertThat(downloaded).isEqualTo(png);

        byte[] thumb = client.get().uri("/files/{id}/thumbnail", id)
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentType(MediaType.IMAGE_PNG)
                .expectBody(byte[].class)
                .returnResult().getResponseBody();
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(thumb));
        assertThat(image).isNotNull();
        assertThat(image.getWidth()).isEqualTo(200);
        assertThat(image.getHeight()).isEqualTo(100);

        // 同样的字节换个名字再传：返回同一个 id 和最初的记录
        upload(png, "copy.png", MediaType.IMAGE_PNG, null)
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.id").isEqualTo(id)
                .jsonPath("$.filename").isEqualTo(id + "_daysGone.png");

        client.get().uri("/files")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[?(@.id == '" + id + "')].original_filename").isEqualTo("days.png");
    }

    @Test
    void textFileHasNoThumbnail() {
        byte[] text = ("plain text " + UUID.randomUUID()).getBytes(StandardCharsets.UTF_8);

        String id = upload(text, "notes.txt", MediaType.TEXT_PLAIN, null)
                .expectStatus().isCreated()
                .expectBody(JsonNode.class)
                .returnResult().getResponseBody()
                .get("id").asText();

        client.get().uri("/files/{id}", id)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.mime_type").isEqualTo("text/plain")
                .jsonPath("$.thumbnail_url").doesNotExist();

        client.get().uri("/files/{id}/thumbnail", id)
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("not_found")
                .jsonPath("$.status").isEqualTo(404);
    }

    @Test
    void requestedFilenameIsHonoured() {
        byte[] text = ("renamed " + UUID.randomUUID()).getBytes(StandardCharsets.UTF_8);

        JsonNode body = upload(text, "draft.txt", MediaType.TEXT_PLAIN, "final report.txt")
                .expectStatus().isCreated()
                .expectBody(JsonNode.class)
                .returnResult().getResponseBody();

        assertThat(body.get("filename").asText()).endsWith("_final_report.txt");
    }

    @Test
    void uploadWithoutFileIsBadRequest() {
        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        builder.part("filename", "lonely.txt");

        client.post().uri("/upload")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(builder.build()))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("invalid_input")
                .jsonPath("$.path").isEqualTo("/upload");
    }

    @Test
    void disallowedExtensionIsBadRequest() {
        upload(new byte[]{'M', 'Z'}, "setup.exe", MediaType.APPLICATION_OCTET_STREAM, null)
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").value(m -> assertThat(m.toString()).contains(".exe"));
    }

    @Test
    void oversizeUploadIsRejected() {
        byte[] big = new byte[1024 * 1024 + 1024];

        upload(big, "big.txt", MediaType.TEXT_PLAIN, null)
                .expectStatus().isEqualTo(HttpStatus.PAYLOAD_TOO_LARGE)
                .expectBody()
                .jsonPath("$.error").isEqualTo("file_too_large");
    }

    @Test
    void overlongOriginalFilenameIsShortenedToFitTheColumn() {
        byte[] text = ("long name " + UUID.randomUUID()).getBytes(StandardCharsets.UTF_8);
        String longName = "a".repeat(300) + ".txt";

        JsonNode body = upload(text, longName, MediaType.TEXT_PLAIN, null)
                .expectStatus().isCreated()
                .expectBody(JsonNode.class)
                .returnResult().getResponseBody();

        assertThat(body.get("filename").asText()).endsWith(".txt");
        String original = client.get().uri("/files/{id}", body.get("id").asText())
                .exchange()
                .expectStatus().isOk()
                .expectBody(JsonNode.class)
                .returnResult().getResponseBody()
                .get("original_filename").asText();
        assertThat(original).hasSize(255).endsWith(".txt").startsWith("aaaa");
    }

    @Test
    void overlongDeclaredTypeFallsBackToDetection() {
        byte[] text = ("odd type " + UUID.randomUUID()).getBytes(StandardCharsets.UTF_8);
        MediaType odd = MediaType.parseMediaType("application/x-" + "b".repeat(120));

        upload(text, "odd.txt", odd, null)
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.mime_type").isEqualTo("text/plain");
    }

    @Test
    void filenameFieldAfterFileIsIgnored() {
        byte[] text = ("late field " + UUID.randomUUID()).getBytes(StandardCharsets.UTF_8);
        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        addFile(builder, text, "early.txt", MediaType.TEXT_PLAIN);
        builder.part("filename", "late.txt");

        client.post().uri("/upload")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(builder.build()))
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.filename").value(f -> assertThat(f.toString()).endsWith("_early.txt"));
    }

    @Test
    void plainFieldNamedFileIsBadRequest() {
        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        builder.part("file", "just text");

        client.post().uri("/upload")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(builder.build()))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("invalid_input");
    }

    @Test
    void unknownAndMalformedIdsAreNotFound() {
        client.get().uri("/files/{id}", UUID.randomUUID())
                .exchange()
                .expectStatus().isNotFound();

        client.get().uri("/files/not-a-uuid/download")
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void deletedFileDisappears() {
        byte[] text = ("to be deleted " + UUID.randomUUID()).getBytes(StandardCharsets.UTF_8);
        JsonNode uploaded = upload(text, "tmp.txt", MediaType.TEXT_PLAIN, null)
                .expectStatus().isCreated()
                .expectBody(JsonNode.class)
                .returnResult().getResponseBody();
        String id = uploaded.get("id").asText();
        Path blob = STORAGE_ROOT.resolve("files").resolve(uploaded.get("filename").asText());
        assertThat(blob).exists();

        client.get().uri("/files")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[?(@.id == '" + id + "')]").exists();

        client.delete().uri("/files/{id}", id)
                .exchange()
                .expectStatus().isNoContent();

        client.get().uri("/files/{id}", id)
                .exchange()
                .expectStatus().isNotFound();

        client.get().uri("/files/{id}/download", id)
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("not_found");

        assertThat(blob).doesNotExist();

        client.get().uri("/files")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[?(@.id == '" + id + "')]").doesNotExist();

        client.delete().uri("/files/{id}", id)
                .exchange()
                .expectStatus().isNotFound();
    }

    private WebTestClient.ResponseSpec upload(byte[] content, String name, MediaType type, String filename) {
        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        if (filename != null) {
            builder.part("filename", filename);
        }
        addFile(builder, content, name, type);
        return client.post().uri("/upload")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(builder.build()))
                .exchange();
    }

    private static void addFile(MultipartBodyBuilder builder, byte[] content, String name, MediaType type) {
        builder.part("file", new ByteArrayResource(content) {
            @Override
            public String getFilename() {
                return name;
            }
        }).contentType(type);
    }
}
