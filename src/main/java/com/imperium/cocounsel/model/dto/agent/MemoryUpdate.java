package com.imperium.cocounsel.model.dto.agent;

import com.imperium.cocounsel.model.enums.AgentType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 专家建议写入记忆的一条事实候选。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemoryUpdate {

    private String key;
    private String value;
    private AgentType agentType;
    private double confidence;
}
