package com.orgmind.chat.config;

import io.qdrant.client.QdrantClient;
import io.qdrant.client.QdrantGrpcClient;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.vectorstore.qdrant.QdrantVectorStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 图谱文档向量库（Qdrant）。
 * <p>
 * 仅当 {@code app.rag.enabled=true} 时创建；未开启时回答不引用图谱文档，
 * Qdrant 不可达也不影响启动。文档需带 {@code graph_id} 元数据以便按图谱过滤。
 */
@Configuration
@ConditionalOnProperty(name = "app.rag.enabled", havingValue = "true")
public class VectorStoreConfig {

    @Value("${spring.ai.vectorstore.qdrant.host:localhost}")
    private String host;

    @Value("${spring.ai.vectorstore.qdrant.port:6334}")
    private int port;

    @Value("${spring.ai.vectorstore.qdrant.use-tls:false}")
    private boolean useTls;

    @Value("${spring.ai.vectorstore.qdrant.collection-name:orgmind_graph_documents}")
    private String collectionName;

    @Value("${spring.ai.vectorstore.qdrant.initialize-schema:false}")
    private boolean initializeSchema;

    @Bean(destroyMethod = "close")
    public QdrantClient qdrantClient() {
        return new QdrantClient(QdrantGrpcClient.newBuilder(host, port, useTls).build());
    }

    @Bean
    public QdrantVectorStore graphDocumentStore(QdrantClient qdrantClient, EmbeddingModel embeddingModel) {
        return QdrantVectorStore.builder(qdrantClient, embeddingModel)
                .collectionName(collectionName)
                .initializeSchema(initializeSchema)
                .build();
    }
}
