package com.imperium.cocounsel.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.query.QueryWrapper;
import com.imperium.cocounsel.mapper.AgentUsageMapper;
import com.imperium.cocounsel.model.dto.response.UsageStatsResponse;
import com.imperium.cocounsel.model.entity.AgentUsage;
import com.imperium.cocounsel.service.UsageService;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
public class UsageServiceImpl implements UsageService {

    private static final int RECENT_IN_STATS = 5;

    private final AgentUsageMapper agentUsageMapper;

    public UsageServiceImpl(AgentUsageMapper agentUsageMapper) {
        this.agentUsageMapper = agentUsageMapper;
    }

    @Override
    public void record(AgentUsage usage) {
        usage.setId("au_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16));
        usage.setCreatedAt(LocalDateTime.now());
        agentUsageMapper.insert(usage);
    }

    @Override
    public List<AgentUsage> recent(Long caseId, String agentType, int limit) {
        LambdaQueryWrapper<AgentUsage> query = new LambdaQueryWrapper<AgentUsage>()
                .eq(caseId != null, AgentUsage::getCaseId, caseId)
                .eq(agentType != null && !agentType.isBlank(), AgentUsage::getAgentType, agentType)
                .orderByDesc(AgentUsage::getCreatedAt)
                .last("LIMIT " + Math.max(1, limit));
        return agentUsageMapper.selectList(query);
    }

    @Override
    public UsageStatsResponse stats() {
        List<Map<String, Object>> rows = agentUsageMapper.selectMaps(new QueryWrapper<AgentUsage>()
                .select("agent_type", "COUNT(*) AS op_count", "COALESCE(SUM(tokens_used), 0) AS token_sum")
                .groupBy("agent_type"));

        long totalOps = 0;
        long totalTokens = 0;
        List<UsageStatsResponse.AgentBreakdown> byAgent = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            long count = asLong(column(row, "op_count"));
            long tokens = asLong(column(row, "token_sum"));
            Object agent = column(row, "agent_type");
            totalOps += count;
            totalTokens += tokens;
            byAgent.add(new UsageStatsResponse.AgentBreakdown(agent != null ? agent.toString() : "unknown", count, tokens));
        }

        return UsageStatsResponse.builder()
                .totalOperations(totalOps)
                .totalTokens(totalTokens)
                .byAgent(byAgent)
                .recentOperations(recent(null, null, RECENT_IN_STATS))
                .build();
    }

    /** 不同数据库对别名大小写处理不同，这里忽略大小写取值 */
    private static Object column(Map<String, Object> row, String name) {
        for (Map.Entry<String, Object> e : row.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name)) {
                return e.getValue();
            }
        }
        return null;
    }

    private static long asLong(Object value) {
        return value instanceof Number n ? n.longValue() : 0L;
    }
}
