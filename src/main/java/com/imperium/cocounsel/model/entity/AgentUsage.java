package com.imperium.cocounsel.model.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 编排请求用量表实体，对应 agent_usage 表（可观测性）。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@TableName("agent_usage")
public class AgentUsage {

    /** 记录ID */
    @TableId
    private String id;

    @TableField("session_id")
    private String sessionId;

    @TableField("user_id")
    private String userId;

    @TableField("case_id")
    private Long caseId;

    /** 主路由 Agent */
    @TableField("agent_type")
    private String agentType;

    /** 协同 Agent，逗号分隔 */
    @TableField("sub_agents")
    private String subAgents;

    @TableField("tokens_used")
    private Integer tokensUsed;

    /** 端到端耗时（毫秒） */
    @TableField("duration_ms")
    private Long durationMs;

    private Double confidence;

    /** 是否命中语义记忆 */
    @TableField("memory_used")
    private Boolean memoryUsed;

    /** success | error */
    private String status;

    @TableField("created_at")
    private LocalDateTime createdAt;
}
