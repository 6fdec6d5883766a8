package com.imperium.cocounsel.model.dto.response;

import com.imperium.cocounsel.model.dto.agent.Citation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 对话响应：合并后的正文 + 路由元数据。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatReplyResponse {

    private String requestId;
    private String sessionId;
    private String content;
    /** 主路由 Agent */
    private String agentType;
    private double confidence;
    private List<String> subAgents;
    private String routingReasoning;
    private int tokensUsed;
    private long durationMs;
    private List<Citation> citations;
    private List<String> risksFlagged;
    private List<String> followUpActions;
    /** 本次是否命中语义记忆 */
    private boolean memoryUsed;
}
