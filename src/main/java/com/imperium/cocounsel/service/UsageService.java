package com.imperium.cocounsel.service;

import com.imperium.cocounsel.model.dto.response.UsageStatsResponse;
import com.imperium.cocounsel.model.entity.AgentUsage;

import java.util.List;

/**
 * 编排请求用量记录服务（可观测性）。
 */
public interface UsageService {

    /**
     * 记录一次编排请求的用量与耗时。
     *
     * @param usage 除 id 与 createdAt 外由调用方填写
     */
    void record(AgentUsage usage);

    /**
     * 最近的用量记录，caseId / agentType 可为 null。
     */
    List<AgentUsage> recent(Long caseId, String agentType, int limit);

    UsageStatsResponse stats();
}
