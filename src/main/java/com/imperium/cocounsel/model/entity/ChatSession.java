package com.imperium.cocounsel.model.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 会话表实体，对应 chat_sessions 表。首条消息时隐式创建，清空会话只删除轮次、不删本行。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@TableName("chat_sessions")
public class ChatSession {

    /** 会话ID（由调用方给出的不透明字符串） */
    @TableId("session_id")
    private String sessionId;

    /** 关联案件ID（可空） */
    @TableField("case_id")
    private Long caseId;

    /** 最近一次请求的调用者 */
    @TableField("user_id")
    private String userId;

    /** 最近一次主路由的 Agent */
    @TableField("last_agent")
    private String lastAgent;

    /** 用过的 Agent，逗号分隔 */
    @TableField("agents_used")
    private String agentsUsed;

    /** 累计 token */
    @TableField("cumulative_tokens")
    private Long cumulativeTokens;

    @TableField("created_at")
    private LocalDateTime createdAt;

    @TableField("updated_at")
    private LocalDateTime updatedAt;
}
