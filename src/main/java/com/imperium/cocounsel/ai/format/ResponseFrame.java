package com.imperium.cocounsel.ai.format;

import com.imperium.cocounsel.model.dto.agent.AgentRoute;
import com.imperium.cocounsel.model.dto.agent.MatterContext;
import com.imperium.cocounsel.model.enums.AgentType;

import java.time.LocalDate;
import java.util.List;

/**
 * 规范化所需的请求级信息。
 *
 * @param agentsUsed 主 Agent 在前，随后是实际被调用的协同 Agent
 */
public record ResponseFrame(AgentRoute route,
                            List<AgentType> agentsUsed,
                            boolean memoryUsed,
                            String jurisdiction,
                            MatterContext matter,
                            LocalDate date) {

    public ResponseFrame {
        agentsUsed = agentsUsed == null ? List.of() : List.copyOf(agentsUsed);
        matter = matter == null ? MatterContext.empty() : matter;
    }
}
