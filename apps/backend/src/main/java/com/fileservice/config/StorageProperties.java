package com.fileservice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * storage.* 配置：启动时读取一次，之后只读。
 * S3 连接参数单独放在 {@link com.fileservice.storage.MinioProps}。
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "storage")
public class StorageProperties {

    /** local | s3 */
    private String type = "local";

    private Local local = new Local();
    private Upload upload = new Upload();
    private Thumbnail thumbnail = new Thumbnail();
    private Listing listing = new Listing();
    private Sweep sweep = new Sweep();

    @Data
    public static class Local {
        private String root = "./uploads";
    }

    @Data
    public static class Upload {
        private long maxFileSize = 10L * 1024 * 1024;
        private List<String> allowedExtensions =
                List.of("jpg", "jpeg", "png", "gif", "bmp", "pdf", "doc", "docx", "txt");

        public boolean isExtensionAllowed(String extension) {
            if (extension == null || extension.isBlank()) return false;
            // 空列表表示不限制
            if (allowedExtensions == null || allowedExtensions.isEmpty()) return true;
            String ext = extension.toLowerCase(Locale.ROOT);
            return allowedExtensions.stream().anyMatch(a -> a.equalsIgnoreCase(ext));
        }
    }

    @Data
    public static class Thumbnail {
        private int maxDimension = 200;
    }

    @Data
    public static class Listing {
        private int limit = 100;
    }

    @Data
    public static class Sweep {
        private boolean enabled = true;
        private Duration interval = Duration.ofHours(1);
        /** 比这更新的 blob 可能属于仍在进行中的上传，跳过 */
        private Duration gracePeriod = Duration.ofHours(1);
    }
}
