package com.imperium.cocounsel.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.QueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.imperium.cocounsel.mapper.MemoryFactMapper;
import com.imperium.cocounsel.model.entity.MemoryFactRecord;
import com.imperium.cocounsel.model.enums.AgentType;
import com.imperium.cocounsel.service.MemoryFactService;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class MemoryFactServiceImpl extends ServiceImpl<MemoryFactMapper, MemoryFactRecord> implements MemoryFactService {

    /** LIKE 检索词最大长度 */
    private static final int MAX_KEYWORD_CHARS = 100;

    @Override
    public List<MemoryFactRecord> latestForCase(Long caseId, AgentType agentType, int limit) {
        if (caseId == null) {
            return List.of();
        }
        return lambdaQuery()
                .eq(MemoryFactRecord::getCaseId, caseId)
                .eq(agentType != null, MemoryFactRecord::getSourceAgent, agentType != null ? agentType.value() : null)
                .orderByDesc(MemoryFactRecord::getCreatedAt)
                .last("LIMIT " + Math.max(1, limit))
                .list();
    }

    @Override
    public List<MemoryFactRecord> keywordSearch(String query, Long caseId, int limit) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String term = query.trim();
        if (term.length() > MAX_KEYWORD_CHARS) {
            term = term.substring(0, MAX_KEYWORD_CHARS);
        }
        String keyword = term;
        return lambdaQuery()
                .eq(caseId != null, MemoryFactRecord::getCaseId, caseId)
                .and(w -> w.like(MemoryFactRecord::getMemoryValue, keyword)
                        .or()
                        .like(MemoryFactRecord::getMemoryKey, keyword))
                .orderByDesc(MemoryFactRecord::getCreatedAt)
                .last("LIMIT " + Math.max(1, limit))
                .list();
    }

    @Override
    public List<MemoryFactRecord> latestForUser(String userId, Long caseId, int limit) {
        if (userId == null || userId.isBlank()) {
            return List.of();
        }
        return lambdaQuery()
                .eq(MemoryFactRecord::getUserId, userId)
                .eq(caseId != null, MemoryFactRecord::getCaseId, caseId)
                .orderByDesc(MemoryFactRecord::getCreatedAt)
                .last("LIMIT " + Math.max(1, limit))
                .list();
    }

    @Override
    public Map<String, Long> countBySourceAgent() {
        List<Map<String, Object>> rows = baseMapper.selectMaps(new QueryWrapper<MemoryFactRecord>()
                .select("source_agent", "COUNT(*) AS fact_count")
                .groupBy("source_agent")
                .orderByAsc("source_agent"));
        Map<String, Long> counts = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            Object agent = column(row, "source_agent");
            Object count = column(row, "fact_count");
            counts.put(agent != null ? agent.toString() : "unknown", count instanceof Number n ? n.longValue() : 0L);
        }
        return counts;
    }

    /** 别名大小写随数据库而异 */
    private static Object column(Map<String, Object> row, String name) {
        for (Map.Entry<String, Object> e : row.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name)) {
                return e.getValue();
            }
        }
        return null;
    }
}
