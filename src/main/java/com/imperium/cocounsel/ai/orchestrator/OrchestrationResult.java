package com.imperium.cocounsel.ai.orchestrator;

import com.imperium.cocounsel.model.dto.agent.AgentOutput;
import com.imperium.cocounsel.model.dto.agent.AgentRoute;

/**
 * 一次编排的最终结果。
 *
 * @param output     合并并规范化后的输出，durationMs 为端到端耗时
 * @param route      路由结果
 * @param memoryUsed 是否带入了语义记忆
 */
public record OrchestrationResult(String sessionId, AgentOutput output, AgentRoute route, boolean memoryUsed) {
}
