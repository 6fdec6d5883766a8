package com.imperium.cocounsel.model.dto.agent;

import com.imperium.cocounsel.model.enums.AgentType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 专家输出。content 与 agentType 为必填，缺失视为专家实现错误。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AgentOutput {

    private String content;
    private AgentType agentType;
    @Builder.Default
    private List<AgentType> subAgentsCalled = List.of();
    private int tokensUsed;
    @Builder.Default
    private List<Citation> citations = List.of();
    @Builder.Default
    private List<String> risksFlagged = List.of();
    @Builder.Default
    private List<String> followUpActions = List.of();
    @Builder.Default
    private List<MemoryUpdate> memoryUpdates = List.of();
    private long durationMs;
    private double confidence;

    /**
     * 校验必填字段，不合法时直接抛出，不做兜底。
     */
    public AgentOutput requireWellFormed() {
        if (content == null) {
            throw new IllegalStateException("specialist output is missing content");
        }
        if (agentType == null) {
            throw new IllegalStateException("specialist output is missing agent type");
        }
        if (tokensUsed < 0) {
            throw new IllegalStateException("specialist output has negative token count: " + tokensUsed);
        }
        if (citations == null || risksFlagged == null || memoryUpdates == null
                || subAgentsCalled == null || followUpActions == null) {
            throw new IllegalStateException("specialist output has null collections");
        }
        return this;
    }
}
