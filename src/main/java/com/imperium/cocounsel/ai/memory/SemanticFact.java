package com.imperium.cocounsel.ai.memory;

import java.util.Map;

/**
 * 语义库中的一条事实。score 仅在检索结果中有值。
 */
public record SemanticFact(String id, String text, Double score, Map<String, Object> metadata) {

    public SemanticFact {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
