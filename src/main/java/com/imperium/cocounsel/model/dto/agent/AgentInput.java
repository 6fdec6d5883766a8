package com.imperium.cocounsel.model.dto.agent;

import com.imperium.cocounsel.model.entity.ConversationTurn;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * 编排器交给专家的输入包。主 Agent 与协同 Agent 共享同一实例，专家不得修改。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentInput {

    private String message;
    private String jurisdiction;
    private MatterContext matter;
    private String sessionId;
    /** 按时间正序的历史轮次 */
    private List<ConversationTurn> conversationHistory;
    private LocalDate date;
    private String userId;
    /** 语义记忆拼接文本，无命中时为空串 */
    private String semanticMemoryText;
}
