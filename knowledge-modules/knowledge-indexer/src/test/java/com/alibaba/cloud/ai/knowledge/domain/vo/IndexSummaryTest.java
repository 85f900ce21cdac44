package com.alibaba.cloud.ai.knowledge.domain.vo;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("IndexSummary Tests")
class IndexSummaryTest {

    @Test
    @DisplayName("Should accumulate processed, skipped and failed files")
    void shouldAccumulateResults() {
        IndexSummary summary = new IndexSummary();

        summary.record(FileIndexResult.processed("a", 3, 3));
        summary.record(FileIndexResult.processed("b", 2, 2));
        summary.record(FileIndexResult.skipped("c"));
        summary.recordError(Path.of("d.md"), "boom");

        assertThat(summary.getProcessedFiles()).isEqualTo(2);
        assertThat(summary.getSkippedFiles()).isEqualTo(1);
        assertThat(summary.getErrorFiles()).isEqualTo(1);
        assertThat(summary.getTotalChunks()).isEqualTo(5);
        assertThat(summary.getTotalEmbeddings()).isEqualTo(5);
        assertThat(summary.getErrors()).containsExactly("d.md: boom");
    }
}
