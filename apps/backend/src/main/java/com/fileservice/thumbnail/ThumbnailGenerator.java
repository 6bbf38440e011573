package com.fileservice.thumbnail;

import com.fileservice.config.StorageProperties;
import com.fileservice.storage.StorageBackend;
import com.fileservice.storage.StorageKeys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Set;

/**
 * 从已存储的原图生成缩略图：等比缩放到 maxDimension 以内（不放大），统一编码为 PNG，
 * 写到由原 key 推导出的 thumbnails/ 路径下。
 */
@Slf4j
@Component
public class ThumbnailGenerator {

    public static final String CONTENT_TYPE = "image/png";

    private static final Set<String> SUPPORTED = Set.of(
            "image/png", "image/jpeg", "image/jpg", "image/pjpeg", "image/gif", "image/bmp", "image/x-ms-bmp");

    private final StorageBackend storage;
    private final int maxDimension;

    public ThumbnailGenerator(StorageBackend storage, StorageProperties props) {
        this.storage = storage;
        this.maxDimension = props.getThumbnail().getMaxDimension();
    }

    public boolean supports(String mimeType) {
        return mimeType != null && SUPPORTED.contains(mimeType.toLowerCase(Locale.ROOT));
    }

    /**
     * 读取原图、生成并写入缩略图。任何失败都以 {@link ThumbnailResult#failed} 返回，不会抛错。
     */
    public Mono<ThumbnailResult> generate(String originalKey) {
        String key = StorageKeys.thumbnailKey(originalKey);
        return storage.get(originalKey)
                .flatMap(in -> Mono.fromCallable(() -> {
                    try (InputStream src = in) {
                        return render(src);
                    }
                }).subscribeOn(Schedulers.boundedElastic()))
                .flatMap(png -> storage.put(key, new ByteArrayInputStream(png), CONTENT_TYPE))
                .map(written -> {
                    log.debug("[thumbnail] {} -> {} ({} bytes)", originalKey, key, written);
                    return ThumbnailResult.created(key);
                })
                .onErrorResume(e -> {
                    log.warn("[thumbnail] failed for {}: {}", originalKey, e.getMessage());
                    return Mono.just(ThumbnailResult.failed(e.getMessage()));
                });
    }

    byte[] render(InputStream in) throws IOException {
        BufferedImage source = ImageIO.read(in);
        if (source == null) {
            throw new IOException("Unsupported or corrupt image");
        }
        int width = source.getWidth();
        int height = source.getHeight();
        double scale = Math.min(1.0, Math.min((double) maxDimension / width, (double) maxDimension / height));
        int targetWidth = Math.max(1, (int) Math.round(width * scale));
        int targetHeight = Math.max(1, (int) Math.round(height * scale));

        BufferedImage thumb = new BufferedImage(targetWidth, targetHeight, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = thumb.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(source, 0, 0, targetWidth, targetHeight, null);
        } finally {
            g.dispose();
        }

        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        if (!ImageIO.write(thumb, "png", bos)) {
            throw new IOException("No PNG writer available");
        }
        return bos.toByteArray();
    }
}
