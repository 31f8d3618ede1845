package dev.athenaeum.config;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.pgvector.DefaultMetadataStorageConfig;
import dev.langchain4j.store.embedding.pgvector.MetadataStorageMode;
import dev.langchain4j.store.embedding.pgvector.PgVectorEmbeddingStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.util.List;

/**
 * Embedding model and vector store for version snapshots.
 *
 * <p>Snapshots and queries are embedded in-process with the quantized bge-small-en-v1.5 model.
 * Vectors live in {@code content_embeddings}, one row per content version, on the application's
 * own {@link DataSource}.
 *
 * @see dev.athenaeum.search.SemanticRetriever
 * @see dev.athenaeum.ingestion.ContentIndexer
 */
@Configuration
public class EmbeddingConfig {

    /** bge-small-en-v1.5, quantized, 384 dimensions. */
    @Bean
    public EmbeddingModel embeddingModel() {
        return new BgeSmallEnV15QuantizedEmbeddingModel();
    }

    /**
     * pgvector store over {@code content_embeddings}. Table and HNSW index come from the Flyway
     * migration. Metadata is one JSONB column so that {@code valid_to} can be rewritten in place
     * when a version is closed.
     */
    @Bean
    public EmbeddingStore<TextSegment> embeddingStore(DataSource dataSource) {
        return PgVectorEmbeddingStore.datasourceBuilder()
                .datasource(dataSource)
                .table("content_embeddings")
                .dimension(384)
                .createTable(false)
                .useIndex(false)
                .metadataStorageConfig(DefaultMetadataStorageConfig.builder()
                        .storageMode(MetadataStorageMode.COMBINED_JSONB)
                        .columnDefinitions(List.of("metadata JSONB NULL"))
                        .build())
                .build();
    }
}
