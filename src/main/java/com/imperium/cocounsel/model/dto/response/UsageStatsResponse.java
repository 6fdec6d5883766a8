package com.imperium.cocounsel.model.dto.response;

import com.imperium.cocounsel.model.entity.AgentUsage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageStatsResponse {

    private long totalOperations;
    private long totalTokens;
    private List<AgentBreakdown> byAgent;
    private List<AgentUsage> recentOperations;

    public record AgentBreakdown(String agentType, long count, long tokens) {}
}
