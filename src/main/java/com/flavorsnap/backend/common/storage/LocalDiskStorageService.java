package com.flavorsnap.backend.common.storage;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.FileNotFoundException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.util.HexFormat;

@Slf4j
@Getter
@Service
public class LocalDiskStorageService implements StorageService {

    private final Path baseDir;

    @Autowired
    public LocalDiskStorageService(StorageProperties props) {
        this(props.getBaseDir());
    }

    public LocalDiskStorageService(String baseDir) {
        this.baseDir = Paths.get(baseDir).toAbsolutePath().normalize();
    }

    @Override
    public SaveResult save(String objectKey, InputStream in, String contentType) throws Exception {
        Path path = resolve(objectKey);
        Files.createDirectories(path.getParent());

        MessageDigest md = MessageDigest.getInstance("SHA-256");
        long size;
        try (DigestInputStream din = new DigestInputStream(in, md);
             OutputStream out = Files.newOutputStream(path, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {
            size = din.transferTo(out);
        }

        String sha256 = HexFormat.of().formatHex(md.digest());
        log.debug("object_saved key={} sizeBytes={} sha256={}", objectKey, size, sha256);
        return new SaveResult(objectKey, sha256, size, contentType);
    }

    @Override
    public OpenResult open(String objectKey) throws Exception {
        Path path = resolve(objectKey);
        if (!Files.exists(path)) throw new FileNotFoundException("OBJECT_NOT_FOUND: " + objectKey);

        String ct = Files.probeContentType(path);
        long size = Files.size(path);
        InputStream in = Files.newInputStream(path, StandardOpenOption.READ);
        return new OpenResult(in, size, ct);
    }

    @Override
    public void delete(String objectKey) throws Exception {
        Files.deleteIfExists(resolve(objectKey));
    }

    @Override
    public boolean exists(String objectKey) throws Exception {
        return Files.exists(resolve(objectKey));
    }

    private Path resolve(String objectKey) {
        Path p = baseDir.resolve(objectKey).normalize();
        if (!p.startsWith(baseDir)) throw new SecurityException("Invalid objectKey");
        return p;
    }
}
