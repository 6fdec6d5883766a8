package com.imperium.cocounsel.ai.memory;

import com.imperium.cocounsel.model.enums.AgentType;

import java.util.List;

/**
 * 语义记忆（派生索引）。关系库才是权威来源，这里的任何失败都由调用方降级处理。
 */
public interface SemanticMemoryService {

    /**
     * 是否可用。为 false 时其余方法不应被调用。
     */
    boolean isEnabled();

    /**
     * 按相关度返回至多 limit 条事实。
     */
    List<SemanticFact> search(String query, MemoryScope scope, int limit);

    /**
     * 写入一条事实，返回生成的ID。
     */
    String write(String text, MemoryScope scope, AgentType sourceAgent, String jurisdiction, double confidence);

    List<SemanticFact> list(MemoryScope scope);

    void delete(String memoryId);
}
