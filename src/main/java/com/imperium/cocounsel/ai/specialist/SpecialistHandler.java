package com.imperium.cocounsel.ai.specialist;

import com.imperium.cocounsel.model.dto.agent.AgentInput;
import com.imperium.cocounsel.model.dto.agent.AgentOutput;
import com.imperium.cocounsel.model.enums.AgentType;

/**
 * 专家处理器。编排核心只依赖这一契约，输入只读，不同专家之间不共享可变状态。
 */
public interface SpecialistHandler {

    AgentType type();

    /**
     * 失败时直接抛出，由编排器决定是否降级。
     */
    AgentOutput handle(AgentInput input);
}
