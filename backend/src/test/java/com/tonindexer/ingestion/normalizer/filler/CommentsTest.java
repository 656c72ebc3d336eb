package com.tonindexer.ingestion.normalizer.filler;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class CommentsTest {

    @Test
    void render_encrypted_base64OfRawBytes() {
        assertThat(Comments.render(new byte[]{1, 2}, true)).isEqualTo("AQI=");
    }

    @Test
    void render_plain_utf8WithoutNul() {
        assertThat(Comments.render("привет\u0000".getBytes(StandardCharsets.UTF_8), false)).isEqualTo("привет");
    }

    @Test
    void render_null_staysNull() {
        assertThat(Comments.render(null, true)).isNull();
    }
}
