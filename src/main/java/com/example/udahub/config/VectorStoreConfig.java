package com.example.udahub.config;

import javax.sql.DataSource;

import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.vectorstore.pgvector.PgVectorStore;
import org.springframework.ai.vectorstore.pgvector.PgVectorStore.PgDistanceType;
import org.springframework.ai.vectorstore.pgvector.PgVectorStore.PgIndexType;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

@Configuration
public class VectorStoreConfig {

    @Bean
    PgVectorStore vectorStore(EmbeddingModel embeddingModel, DataSource dataSource,
                              @Value("${spring.ai.vectorstore.pgvector.dimensions:1536}") int dimensions,
                              @Value("${spring.ai.vectorstore.pgvector.table-name:kb_vectors}") String tableName) {
        return PgVectorStore.builder(new JdbcTemplate(dataSource), embeddingModel)
            .vectorTableName(tableName)
            .dimensions(dimensions)
            .distanceType(PgDistanceType.COSINE_DISTANCE)
            .indexType(PgIndexType.HNSW)
            .initializeSchema(true)
            .build();
    }
}
