package com.radiochat.storage;

import java.util.Base64;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * base64 또는 data URL 형태로 전달된 미디어 페이로드를 디코딩한 결과.
 */
public final class MediaPayload {

    public static final String DEFAULT_AUDIO_TYPE = "audio/mp4";

    private static final Pattern DATA_URL = Pattern.compile("^data:([a-zA-Z0-9.+-]+/[a-zA-Z0-9.+-]+)(;[^,]*)?;base64,",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern IMAGE_DATA_URL = Pattern.compile("^data:image/[a-zA-Z0-9.+-]+;base64,",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern HTTP_URL = Pattern.compile("^https?://", Pattern.CASE_INSENSITIVE);

    private static final Map<String, String> EXTENSIONS = Map.of(
            "audio/mp4", "m4a",
            "audio/m4a", "m4a",
            "audio/x-m4a", "m4a",
            "audio/mpeg", "mp3",
            "audio/aac", "aac",
            "audio/ogg", "ogg",
            "audio/webm", "webm",
            "audio/wav", "wav",
            "image/jpeg", "jpg");

    private final byte[] content;
    private final String contentType;

    private MediaPayload(byte[] content, String contentType) {
        this.content = content;
        this.contentType = contentType;
    }

    /**
     * data URL이면 MIME 타입을 읽고, 아니면 순수 base64로 보고 기본 타입을 사용한다.
     *
     * @throws IllegalArgumentException base64 디코딩에 실패했거나 내용이 비어 있는 경우
     */
    public static MediaPayload decode(String payload, String defaultContentType) {
        if (payload == null || payload.isBlank()) {
            throw new IllegalArgumentException("payload is empty");
        }
        String contentType = defaultContentType;
        String base64 = payload.trim();
        Matcher matcher = DATA_URL.matcher(base64);
        if (matcher.find()) {
            contentType = matcher.group(1).toLowerCase(Locale.ROOT);
            base64 = base64.substring(matcher.end());
        }
        byte[] bytes = Base64.getMimeDecoder().decode(base64);
        if (bytes.length == 0) {
            throw new IllegalArgumentException("payload decodes to zero bytes");
        }
        return new MediaPayload(bytes, contentType);
    }

    public static boolean isImageDataUrl(String value) {
        return value != null && IMAGE_DATA_URL.matcher(value).find();
    }

    public static boolean isHttpUrl(String value) {
        return value != null && HTTP_URL.matcher(value).find();
    }

    public byte[] getContent() {
        return content;
    }

    public String getContentType() {
        return contentType;
    }

    /**
     * MIME 타입에 맞는 파일 확장자. 모르는 타입은 서브타입을 그대로 쓴다.
     */
    public String getExtension() {
        String known = EXTENSIONS.get(contentType);
        if (known != null) {
            return known;
        }
        int slash = contentType.indexOf('/');
        String subtype = slash >= 0 ? contentType.substring(slash + 1) : contentType;
        return subtype.replaceAll("[^a-zA-Z0-9]", "");
    }
}
