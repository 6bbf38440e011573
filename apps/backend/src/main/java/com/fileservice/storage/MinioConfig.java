package com.fileservice.storage;

import io.minio.MinioClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(prefix = "storage", name = "type", havingValue = "s3")
public class MinioConfig {

    @Bean
    public MinioClient minioClient(MinioProps props) {
        MinioClient client = MinioClient.builder()
                .endpoint(props.getEndpoint())
                .region(props.getRegion())
                .credentials(props.getAccessKey(), props.getSecretKey())
                .build();
        // 超时到期会以 IOException 抛出，最终归为 BackendUnavailable
        client.setTimeout(
                props.getConnectTimeout().toMillis(),
                props.getWriteTimeout().toMillis(),
                props.getReadTimeout().toMillis());
        return client;
    }
}
