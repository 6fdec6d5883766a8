package com.imperium.cocounsel.model.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Agent 记忆事实，对应 memory_facts 表。关系库是权威来源，向量库只是派生索引。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@TableName("memory_facts")
public class MemoryFactRecord {

    @TableId
    private String id;

    @TableField("case_id")
    private Long caseId;

    @TableField("session_id")
    private String sessionId;

    @TableField("user_id")
    private String userId;

    /** 产生该事实的 Agent */
    @TableField("source_agent")
    private String sourceAgent;

    @TableField("memory_key")
    private String memoryKey;

    @TableField("memory_value")
    private String memoryValue;

    private Double confidence;

    private String jurisdiction;

    @TableField("created_at")
    private LocalDateTime createdAt;
}
