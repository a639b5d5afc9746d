package com.radiochat.config;

import java.net.URI;
import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * application.yml의 storage 설정 값을 바인딩하기 위한 POJO.
 * 오디오/아바타 파일을 저장할 블롭 스토어 위치를 지정한다.
 */
@ConfigurationProperties(prefix = "storage")
public class StorageProperties {

    /**
     * local: 서버 디스크에 저장하고 /media/** 로 서빙, http: 외부 스토리지에 PUT.
     */
    private String type = "local";
    private Path localDir = Path.of("data", "media");
    private URI baseUrl = URI.create("http://localhost:9000/chat-media");
    private URI publicBaseUrl = URI.create("http://localhost:8080");

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public Path getLocalDir() {
        return localDir;
    }

    public void setLocalDir(Path localDir) {
        this.localDir = localDir;
    }

    public URI getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(URI baseUrl) {
        this.baseUrl = baseUrl;
    }

    public URI getPublicBaseUrl() {
        return publicBaseUrl;
    }

    public void setPublicBaseUrl(URI publicBaseUrl) {
        this.publicBaseUrl = publicBaseUrl;
    }

    /**
     * 후행 슬래시를 제거한 스토리지 업로드 주소를 반환한다.
     */
    public String getBaseUrlWithoutSlash() {
        return stripTrailingSlash(baseUrl, "storage.base-url");
    }

    /**
     * 후행 슬래시를 제거한 공개 URL 접두사를 반환한다.
     */
    public String getPublicBaseUrlWithoutSlash() {
        return stripTrailingSlash(publicBaseUrl, "storage.public-base-url");
    }

    private static String stripTrailingSlash(URI uri, String property) {
        if (uri == null) {
            throw new IllegalStateException(property + " must be configured");
        }
        String base = uri.toString();
        if (base.endsWith("/")) {
            return base.substring(0, base.length() - 1);
        }
        return base;
    }
}
