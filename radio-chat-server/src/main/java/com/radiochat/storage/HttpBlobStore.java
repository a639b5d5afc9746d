package com.radiochat.storage;

import com.radiochat.config.StorageProperties;
import com.radiochat.service.PersistenceException;
import java.net.URI;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * 외부 오브젝트 스토리지(HTTP PUT)와의 연동을 담당하는 블롭 스토어.
 */
@Service
@ConditionalOnProperty(prefix = "storage", name = "type", havingValue = "http")
public class HttpBlobStore implements BlobStore {

    private static final Logger log = LoggerFactory.getLogger(HttpBlobStore.class);

    private final RestTemplate restTemplate;
    private final StorageProperties properties;

    public HttpBlobStore(RestTemplate restTemplate, StorageProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    @Override
    public String store(String path, byte[] content, String contentType) {
        // 모든 업로드가 이 메서드를 통해 이루어진다. 실패는 PersistenceException으로 감싼다.
        URI uri = URI.create(properties.getBaseUrlWithoutSlash() + "/" + path);
        try {
            log.debug("Uploading blob {} ({} bytes, {})", uri, content.length, contentType);

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.parseMediaType(contentType));
            headers.setCacheControl(CacheControl.maxAge(Duration.ofDays(365)).cachePublic());

            HttpEntity<byte[]> entity = new HttpEntity<>(content, headers);
            restTemplate.exchange(uri, HttpMethod.PUT, entity, Void.class);
        } catch (RestClientException | IllegalArgumentException ex) {
            log.error("Blob upload failed for {}: {}", path, ex.getMessage(), ex);
            throw new PersistenceException("Failed to upload blob at path " + path + ": " + ex.getMessage(), ex);
        }
        return properties.getPublicBaseUrlWithoutSlash() + "/" + path;
    }
}
