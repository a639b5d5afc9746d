package com.radiochat.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.junit.jupiter.api.Test;

class MediaPayloadTest {

    private static final String CLIP = Base64.getEncoder().encodeToString("clip".getBytes(StandardCharsets.UTF_8));

    @Test
    void rawBase64UsesDefaultType() {
        MediaPayload payload = MediaPayload.decode(CLIP, MediaPayload.DEFAULT_AUDIO_TYPE);

        assertThat(payload.getContent()).isEqualTo("clip".getBytes(StandardCharsets.UTF_8));
        assertThat(payload.getContentType()).isEqualTo("audio/mp4");
        assertThat(payload.getExtension()).isEqualTo("m4a");
    }

    @Test
    void dataUrlCarriesItsOwnType() {
        MediaPayload payload = MediaPayload.decode("data:audio/webm;codecs=opus;base64," + CLIP,
                MediaPayload.DEFAULT_AUDIO_TYPE);

        assertThat(payload.getContentType()).isEqualTo("audio/webm");
        assertThat(payload.getExtension()).isEqualTo("webm");
    }

    @Test
    void emptyPayloadIsRejected() {
        assertThatThrownBy(() -> MediaPayload.decode("  ", MediaPayload.DEFAULT_AUDIO_TYPE))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MediaPayload.decode("data:audio/mp4;base64,", MediaPayload.DEFAULT_AUDIO_TYPE))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void classifiesAvatarSources() {
        assertThat(MediaPayload.isImageDataUrl("data:image/jpeg;base64,AAAA")).isTrue();
        assertThat(MediaPayload.isImageDataUrl("data:audio/mp4;base64,AAAA")).isFalse();
        assertThat(MediaPayload.isHttpUrl("https://cdn.example.com/a.jpg")).isTrue();
        assertThat(MediaPayload.isHttpUrl("content://media/external/images/1")).isFalse();
    }
}
