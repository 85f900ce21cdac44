package com.alibaba.cloud.ai.knowledge.store.backend;

import com.alibaba.cloud.ai.knowledge.domain.vo.BackendStats;
import com.alibaba.cloud.ai.knowledge.domain.vo.Chunk;
import com.alibaba.cloud.ai.knowledge.domain.vo.Source;
import com.alibaba.cloud.ai.knowledge.exception.KnowledgeIndexException;
import com.alibaba.cloud.ai.knowledge.exception.KnowledgeValidationException;
import com.alibaba.cloud.ai.knowledge.store.domain.entity.ChunkEntity;
import com.alibaba.cloud.ai.knowledge.store.domain.entity.SourceEntity;
import com.alibaba.cloud.ai.knowledge.store.mapper.ChunkMapper;
import com.alibaba.cloud.ai.knowledge.store.mapper.SourceMapper;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("MybatisKnowledgeBackend Tests")
class MybatisKnowledgeBackendTest {

    @Mock
    private SourceMapper sourceMapper;

    @Mock
    private ChunkMapper chunkMapper;

    @Captor
    private ArgumentCaptor<List<ChunkEntity>> entitiesCaptor;

    @Captor
    private ArgumentCaptor<SourceEntity> sourceCaptor;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private MybatisKnowledgeBackend backend;

    @BeforeEach
    void setUp() {
        backend = new MybatisKnowledgeBackend(sourceMapper, chunkMapper, objectMapper, 3);
    }

    private static Chunk embeddedChunk(int index) {
        return Chunk.builder()
                .chunkId("s1_" + index)
                .sourceId("s1")
                .text("chunk " + index)
                .chunkIndex(index)
                .startChar(index * 5)
                .endChar(index * 5 + 7)
                .metadata(Map.of("chunk_index", index))
                .build()
                .withEmbedding(new float[]{0.5f, 1.5f, 2.5f}, "m", LocalDateTime.of(2024, 1, 1, 8, 0));
    }

    @Test
    @DisplayName("Should map source to entity on insert")
    void shouldInsertSource() {
        Source source = Source.builder()
                .sourceId("s1")
                .path(Path.of("/kb/a.md"))
                .fileSize(42)
                .mimeType("text/markdown")
                .mtime(LocalDateTime.of(2024, 1, 1, 0, 0))
                .sha256Hash("h1")
                .loaderType("markdown")
                .chunkCount(4)
                .build();

        backend.addSource(source);

        verify(sourceMapper).insert(sourceCaptor.capture());
        SourceEntity entity = sourceCaptor.getValue();
        assertThat(entity.getSourceId()).isEqualTo("s1");
        assertThat(entity.getPath()).isEqualTo(Path.of("/kb/a.md").toString());
        assertThat(entity.getSha256Hash()).isEqualTo("h1");
        assertThat(entity.getChunkCount()).isEqualTo(4);
        assertThat(entity.getFileSize()).isEqualTo(42L);
    }

    @Test
    @DisplayName("Should serialize embeddings and metadata as JSON")
    void shouldSerializeChunks() {
        backend.addChunks(List.of(embeddedChunk(0), embeddedChunk(1)));

        verify(chunkMapper).batchInsert(entitiesCaptor.capture());
        List<ChunkEntity> entities = entitiesCaptor.getValue();
        assertThat(entities).extracting(ChunkEntity::getChunkId).containsExactly("s1_0", "s1_1");
        assertThat(entities.get(0).getEmbedding()).isEqualTo("[0.5,1.5,2.5]");
        assertThat(entities.get(0).getMetadata()).isEqualTo("{\"chunk_index\":0}");
        assertThat(entities.get(0).getContent()).isEqualTo("chunk 0");
        assertThat(entities.get(0).getEmbeddingDimensions()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should restore chunks from stored JSON")
    void shouldRestoreChunks() {
        ChunkEntity entity = new ChunkEntity();
        entity.setChunkId("s1_0");
        entity.setSourceId("s1");
        entity.setContent("chunk 0");
        entity.setChunkIndex(0);
        entity.setStartChar(0);
        entity.setEndChar(7);
        entity.setMetadata("{\"chunk_index\":0}");
        entity.setEmbedding("[0.5,1.5,2.5]");
        entity.setEmbeddingModel("m");
        entity.setEmbeddingDimensions(3);
        when(chunkMapper.selectList(any())).thenReturn(List.of(entity));

        List<Chunk> chunks = backend.getChunks("s1");

        assertThat(chunks).singleElement().satisfies(chunk -> {
            assertThat(chunk.getText()).isEqualTo("chunk 0");
            assertThat(chunk.getEmbedding()).containsExactly(0.5f, 1.5f, 2.5f);
            assertThat(chunk.getMetadata()).containsEntry("chunk_index", 0);
        });
    }

    @Test
    @DisplayName("Should reject embeddings of the wrong dimension before writing")
    void shouldRejectDimensionMismatch() {
        Chunk wrong = Chunk.builder()
                .chunkId("s1_0")
                .sourceId("s1")
                .text("x")
                .chunkIndex(0)
                .startChar(0)
                .endChar(1)
                .embedding(new float[]{1f})
                .build();

        assertThatThrownBy(() -> backend.addChunks(List.of(wrong)))
                .isInstanceOf(KnowledgeValidationException.class);
        verifyNoInteractions(chunkMapper);
    }

    @Test
    @DisplayName("Empty chunk list should not reach the database")
    void emptyChunkListShouldBeIgnored() {
        backend.addChunks(List.of());

        verifyNoInteractions(chunkMapper);
    }

    @Test
    @DisplayName("Should delete chunks before the source")
    void shouldDeleteChunksFirst() {
        backend.deleteSource("s1");

        InOrder order = inOrder(chunkMapper, sourceMapper);
        order.verify(chunkMapper).deleteBySourceId("s1");
        order.verify(sourceMapper).deleteById("s1");
    }

    @Test
    @DisplayName("Mapper failures should surface as index exceptions")
    void mapperFailureShouldBeWrapped() {
        IllegalStateException failure = new IllegalStateException("connection refused");
        when(chunkMapper.batchInsert(anyList())).thenThrow(failure);

        assertThatThrownBy(() -> backend.addChunks(List.of(embeddedChunk(0))))
                .isInstanceOf(KnowledgeIndexException.class)
                .hasMessageContaining("connection refused")
                .hasCause(failure);
    }

    @Test
    @DisplayName("Should read hashes, ids and existence through the mappers")
    void shouldReadSourceState() {
        when(sourceMapper.selectAllSourceIds()).thenReturn(List.of("s1", "s2"));
        when(sourceMapper.selectHashById("s1")).thenReturn("h1");
        when(sourceMapper.selectCount(any())).thenReturn(1L);

        assertThat(backend.getExistingSources()).containsExactlyInAnyOrder("s1", "s2");
        assertThat(backend.getSourceHash("s1")).isEqualTo("h1");
        assertThat(backend.sourceExists("s1")).isTrue();
    }

    @Test
    @DisplayName("Should aggregate stats from counts")
    void shouldAggregateStats() {
        when(sourceMapper.selectCount(any())).thenReturn(2L);
        when(chunkMapper.selectCount(any())).thenReturn(7L);
        when(chunkMapper.countEmbedded()).thenReturn(6L);

        BackendStats stats = backend.getStats();

        assertThat(stats.getTotalSources()).isEqualTo(2);
        assertThat(stats.getTotalChunks()).isEqualTo(7);
        assertThat(stats.getTotalEmbeddings()).isEqualTo(6);
        assertThat(backend.getEmbeddingDimension()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should restore a stored source")
    void shouldRestoreSource() {
        SourceEntity entity = SourceEntity.builder()
                .sourceId("s1")
                .path("/kb/a.md")
                .fileSize(10L)
                .mimeType("text/markdown")
                .mtime(LocalDateTime.of(2024, 1, 1, 0, 0))
                .sha256Hash("h1")
                .indexedAt(LocalDateTime.of(2024, 1, 2, 0, 0))
                .chunkCount(3)
                .build();
        when(sourceMapper.selectById("s1")).thenReturn(entity);

        Source source = backend.getSource("s1");

        assertThat(source.getPath()).isEqualTo(Path.of("/kb/a.md"));
        assertThat(source.getChunkCount()).isEqualTo(3);
        assertThat(source.getSha256Hash()).isEqualTo("h1");
    }
}
