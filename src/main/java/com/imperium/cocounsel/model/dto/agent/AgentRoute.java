package com.imperium.cocounsel.model.dto.agent;

import com.imperium.cocounsel.model.enums.AgentType;

import java.util.List;

/**
 * 单次请求的路由结果，不单独落库，摘要写入 assistant 轮次。
 *
 * @param agent      主路由 Agent
 * @param confidence 置信度，总分为 0 时固定 0.25
 * @param subAgents  协同 Agent，最多一个
 * @param reasoning  所有非零得分，审计用
 */
public record AgentRoute(AgentType agent, double confidence, List<AgentType> subAgents, String reasoning) {

    public AgentRoute {
        subAgents = subAgents == null ? List.of() : List.copyOf(subAgents);
    }

    public boolean isCoRouted() {
        return !subAgents.isEmpty();
    }
}
