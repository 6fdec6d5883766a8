package com.imperium.cocounsel.model.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 会话轮次实体，对应 chat_turns 表。写入后不再修改，同一会话内按 created_at 排序。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@TableName("chat_turns")
public class ConversationTurn {

    /** 轮次ID */
    @TableId
    private String id;

    @TableField("session_id")
    private String sessionId;

    @TableField("case_id")
    private Long caseId;

    /** 角色：user | assistant */
    private String role;

    private String content;

    private String jurisdiction;

    /** 主路由 Agent（仅 assistant 轮次） */
    @TableField("agent_type")
    private String agentType;

    /** 路由置信度 [0,1] */
    private Double confidence;

    /** 协同 Agent，逗号分隔 */
    @TableField("sub_agents")
    private String subAgents;

    /** 风险提示，JSON 数组 */
    @TableField("risks_flagged")
    private String risksFlagged;

    /** 引用，JSON 数组 */
    private String citations;

    @TableField("tokens_used")
    private Integer tokensUsed;

    @TableField("duration_ms")
    private Long durationMs;

    /** 路由理由（审计用） */
    @TableField("routing_reasoning")
    private String routingReasoning;

    @TableField("created_at")
    private LocalDateTime createdAt;
}
