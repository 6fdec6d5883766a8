package com.imperium.cocounsel.model.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 历史列表中的单条轮次。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TurnDto {

    private String id;
    private String role;
    private String content;
    private String agentType;
    private Double confidence;
    private List<String> subAgents;
    private Integer tokensUsed;
    private Long durationMs;
    private LocalDateTime createdAt;
}
