package com.imperium.cocounsel.ai.memory;

import com.imperium.cocounsel.model.enums.AgentType;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.ai.vectorstore.filter.Filter;
import org.springframework.ai.vectorstore.filter.FilterExpressionBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 基于 Spring AI {@link VectorStore} 的语义记忆实现（生产环境为 Qdrant）。
 * <p>
 * 仅当 {@code app.memory.semantic.enabled=true} 且 VectorStore bean 存在时启用。
 * 事实按 user_id / case_id 元数据隔离，检索时作为过滤条件。
 */
@Service
public class VectorStoreSemanticMemoryService implements SemanticMemoryService {

    public static final String META_USER_ID = "user_id";
    public static final String META_CASE_ID = "case_id";
    public static final String META_SESSION_ID = "session_id";
    public static final String META_SOURCE_AGENT = "source_agent";
    public static final String META_JURISDICTION = "jurisdiction";
    public static final String META_CONFIDENCE = "confidence";

    /** list 没有查询词，用固定文本取相似度并放大 topK */
    private static final String LIST_QUERY = "legal matter memory";
    private static final int LIST_TOP_K = 100;

    @Nullable
    private final VectorStore vectorStore;

    private final boolean enabled;

    public VectorStoreSemanticMemoryService(@Nullable VectorStore vectorStore,
            @Value("${app.memory.semantic.enabled:false}") boolean enabled) {
        this.vectorStore = vectorStore;
        this.enabled = enabled;
    }

    @Override
    public boolean isEnabled() {
        return enabled && vectorStore != null;
    }

    @Override
    public List<SemanticFact> search(String query, MemoryScope scope, int limit) {
        if (!isEnabled() || query == null || query.isBlank() || limit <= 0) {
            return List.of();
        }
        List<Document> docs = vectorStore.similaritySearch(SearchRequest.builder()
                .query(query)
                .topK(limit)
                .filterExpression(scopeFilter(scope))
                .build());
        return toFacts(docs);
    }

    @Override
    public String write(String text, MemoryScope scope, AgentType sourceAgent, String jurisdiction, double confidence) {
        requireEnabled();
        String id = UUID.randomUUID().toString();
        Map<String, Object> metadata = new HashMap<>();
        metadata.put(META_USER_ID, scope.userId());
        if (scope.caseId() != null) {
            metadata.put(META_CASE_ID, String.valueOf(scope.caseId()));
        }
        if (scope.sessionId() != null) {
            metadata.put(META_SESSION_ID, scope.sessionId());
        }
        if (sourceAgent != null) {
            metadata.put(META_SOURCE_AGENT, sourceAgent.value());
        }
        if (jurisdiction != null) {
            metadata.put(META_JURISDICTION, jurisdiction);
        }
        metadata.put(META_CONFIDENCE, confidence);

        vectorStore.add(List.of(Document.builder()
                .id(id)
                .text(text)
                .metadata(metadata)
                .build()));
        return id;
    }

    @Override
    public List<SemanticFact> list(MemoryScope scope) {
        if (!isEnabled()) {
            return List.of();
        }
        List<Document> docs = vectorStore.similaritySearch(SearchRequest.builder()
                .query(LIST_QUERY)
                .topK(LIST_TOP_K)
                .filterExpression(scopeFilter(scope))
                .build());
        return toFacts(docs);
    }

    @Override
    public void delete(String memoryId) {
        requireEnabled();
        if (memoryId == null || memoryId.isBlank()) {
            throw new IllegalArgumentException("memoryId is required");
        }
        vectorStore.delete(List.of(memoryId));
    }

    private static Filter.Expression scopeFilter(MemoryScope scope) {
        FilterExpressionBuilder b = new FilterExpressionBuilder();
        if (scope.hasCase()) {
            return b.and(b.eq(META_USER_ID, scope.userId()), b.eq(META_CASE_ID, String.valueOf(scope.caseId())))
                    .build();
        }
        return b.eq(META_USER_ID, scope.userId()).build();
    }

    private static List<SemanticFact> toFacts(List<Document> docs) {
        if (docs == null || docs.isEmpty()) {
            return List.of();
        }
        return docs.stream()
                .filter(d -> d != null && d.getText() != null && !d.getText().isBlank())
                .map(d -> new SemanticFact(d.getId(), d.getText(), d.getScore(), d.getMetadata()))
                .toList();
    }

    private void requireEnabled() {
        if (!isEnabled()) {
            throw new IllegalStateException("semantic memory is disabled");
        }
    }
}
