package com.fileservice.storage;

import com.fileservice.config.StorageProperties;
import com.fileservice.storage.impl.LocalFsStorageBackend;
import com.fileservice.storage.impl.MinioStorageBackend;
import io.minio.MinioClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;

/**
 * 按 storage.type 在启动时选定唯一的存储后端，运行期不再切换。
 */
@Slf4j
@Configuration
public class StorageBackendConfig {

    @Bean
    @ConditionalOnProperty(prefix = "storage", name = "type", havingValue = "local", matchIfMissing = true)
    public StorageBackend localStorageBackend(StorageProperties props) {
        log.info("Initializing local storage");
        return new LocalFsStorageBackend(Path.of(props.getLocal().getRoot()));
    }

    @Bean
    @ConditionalOnProperty(prefix = "storage", name = "type", havingValue = "s3")
    public StorageBackend s3StorageBackend(MinioClient client, MinioProps props) {
        log.info("Initializing S3 storage: endpoint={} bucket={}", props.getEndpoint(), props.getBucket());
        MinioStorageBackend backend = new MinioStorageBackend(client, props);
        try {
            backend.ensureBucket().block(Duration.ofSeconds(30));
        } catch (RuntimeException e) {
            // 对象存储暂时不可达时照常启动，请求会以 502 失败
            log.error("Bucket {} does not exist and cannot be created: {}", props.getBucket(), e.getMessage());
        }
        return backend;
    }
}
