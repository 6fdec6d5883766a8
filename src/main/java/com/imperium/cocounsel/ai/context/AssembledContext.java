package com.imperium.cocounsel.ai.context;

import com.imperium.cocounsel.model.dto.agent.MatterContext;

/**
 * 上下文组装结果。
 *
 * @param matter             案件上下文，未选案件时为空上下文
 * @param semanticMemoryText 语义记忆拼接文本，无命中或不可用时为空串
 */
public record AssembledContext(MatterContext matter, String semanticMemoryText) {

    public AssembledContext {
        matter = matter == null ? MatterContext.empty() : matter;
        semanticMemoryText = semanticMemoryText == null ? "" : semanticMemoryText;
    }

    public boolean memoryUsed() {
        return !semanticMemoryText.isEmpty();
    }
}
