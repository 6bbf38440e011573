package com.fileservice.storage;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "storage.s3")
public class MinioProps {
    private String endpoint = "http://localhost:9000";
    private String accessKey;
    private String secretKey;
    private String region = "us-east-1";
    private String bucket = "file-service";

    /** multipart 分片大小；对象大小未知时 MinIO 要求显式给出，最小 5MiB */
    private long partSize = 10L * 1024 * 1024;

    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration readTimeout = Duration.ofSeconds(60);
    private Duration writeTimeout = Duration.ofSeconds(60);
}
