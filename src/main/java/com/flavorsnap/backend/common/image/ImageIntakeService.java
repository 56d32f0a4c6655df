package com.flavorsnap.backend.common.image;

import com.flavorsnap.backend.common.error.StorageUnavailableException;
import com.flavorsnap.backend.common.storage.StorageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.UUID;

/**
 * Upload -> magic-byte check -> StorageService. Only the object key leaves this class.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImageIntakeService {

    private final StorageService storage;

    public record AcceptedImage(byte[] bytes, ImageSniffer.Detection detection, String originalName) {}

    /**
     * @return null 代表不是支援的圖片（caller 決定要略過還是報錯）
     */
    public AcceptedImage sniff(MultipartFile file) {
        if (file == null || file.isEmpty()) return null;
        byte[] bytes;
        try {
            bytes = file.getBytes();
        } catch (IOException e) {
            log.warn("image_read_failed name={} error={}", file.getOriginalFilename(), e.getClass().getSimpleName());
            return null;
        }
        ImageSniffer.Detection det = ImageSniffer.detect(bytes, Math.min(bytes.length, ImageSniffer.HEAD_BYTES));
        if (det == null) {
            log.info("image_skipped name={} sizeBytes={} reason=UNSUPPORTED_FORMAT", file.getOriginalFilename(), bytes.length);
            return null;
        }
        return new AcceptedImage(bytes, det, file.getOriginalFilename());
    }

    public StorageService.SaveResult store(AcceptedImage img, String keyPrefix) {
        String key = keyPrefix + "/" + UUID.randomUUID() + img.detection().ext();
        try {
            return storage.save(key, new ByteArrayInputStream(img.bytes()), img.detection().contentType());
        } catch (Exception e) {
            log.error("image_store_failed key={} error={}", key, e.getClass().getSimpleName(), e);
            throw new StorageUnavailableException("IMAGE_STORE_FAILED", e);
        }
    }
}
