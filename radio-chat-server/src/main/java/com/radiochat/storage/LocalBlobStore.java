package com.radiochat.storage;

import com.radiochat.config.StorageProperties;
import com.radiochat.service.PersistenceException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * 서버 디스크에 파일을 저장하고 /media/** 아래 공개 URL을 돌려준다.
 */
@Service
@ConditionalOnProperty(prefix = "storage", name = "type", havingValue = "local", matchIfMissing = true)
public class LocalBlobStore implements BlobStore {

    private static final Logger log = LoggerFactory.getLogger(LocalBlobStore.class);

    private final Path root;
    private final String publicBaseUrl;

    public LocalBlobStore(StorageProperties properties) {
        this.root = properties.getLocalDir().toAbsolutePath().normalize();
        this.publicBaseUrl = properties.getPublicBaseUrlWithoutSlash();
    }

    @Override
    public String store(String path, byte[] content, String contentType) {
        Path target = root.resolve(path).normalize();
        if (!target.startsWith(root)) {
            throw new PersistenceException("Blob path escapes storage root: " + path);
        }
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, content);
        } catch (IOException ex) {
            log.error("Failed to write blob {}: {}", target, ex.getMessage(), ex);
            throw new PersistenceException("Failed to store blob at " + path + ": " + ex.getMessage(), ex);
        }
        log.debug("Stored blob {} ({} bytes, {})", path, content.length, contentType);
        return publicBaseUrl + "/media/" + path;
    }
}
