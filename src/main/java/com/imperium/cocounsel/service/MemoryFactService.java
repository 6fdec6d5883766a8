package com.imperium.cocounsel.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.imperium.cocounsel.model.entity.MemoryFactRecord;
import com.imperium.cocounsel.model.enums.AgentType;

import java.util.List;
import java.util.Map;

/**
 * 关系库中的记忆事实（权威来源）。
 */
public interface MemoryFactService extends IService<MemoryFactRecord> {

    /**
     * 案件下最新的记忆，agentType 为 null 时不过滤。
     */
    List<MemoryFactRecord> latestForCase(Long caseId, AgentType agentType, int limit);

    /**
     * 关键词回退检索（LIKE），语义库不可用时使用。
     */
    List<MemoryFactRecord> keywordSearch(String query, Long caseId, int limit);

    /**
     * 调用者名下最新的记忆，caseId 为 null 时不限案件。语义库列表不可用时的回退。
     */
    List<MemoryFactRecord> latestForUser(String userId, Long caseId, int limit);

    /**
     * 按产生记忆的 Agent 分组计数，按 Agent 名排序。
     */
    Map<String, Long> countBySourceAgent();
}
