package com.alibaba.cloud.ai.knowledge.domain.vo;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Source Tests")
class SourceTest {

    private static Source.SourceBuilder builder(String fileName) {
        return Source.builder()
                .sourceId("id")
                .path(Path.of("/kb", fileName))
                .fileSize(10)
                .mimeType("text/plain")
                .mtime(LocalDateTime.now())
                .sha256Hash("abc");
    }

    @Test
    @DisplayName("Should expose extension and text classification")
    void shouldClassifyFile() {
        assertThat(builder("Guide.MD").build().getFileExtension()).isEqualTo("md");
        assertThat(builder("Guide.MD").build().isTextFile()).isTrue();
        assertThat(builder("photo.png").build().isTextFile()).isFalse();
        assertThat(builder("Makefile").build().getFileExtension()).isEmpty();
    }

    @Test
    @DisplayName("Should default chunk count and indexed time")
    void shouldApplyDefaults() {
        Source source = builder("a.md").build();

        assertThat(source.getChunkCount()).isZero();
        assertThat(source.getIndexedAt()).isNotNull();
        assertThat(source.getGitCommit()).isNull();
    }

    @Test
    @DisplayName("Should require the content hash")
    void shouldRequireHash() {
        assertThatThrownBy(() -> builder("a.md").sha256Hash(null).build())
                .isInstanceOf(NullPointerException.class);
    }
}
