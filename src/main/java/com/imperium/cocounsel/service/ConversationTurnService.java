package com.imperium.cocounsel.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.imperium.cocounsel.model.entity.ConversationTurn;

import java.util.List;

/**
 * 会话轮次服务：按会话读最近 N 轮、列出历史、清空会话。
 */
public interface ConversationTurnService extends IService<ConversationTurn> {

    /**
     * 最近 limit 轮，按创建时间正序返回。
     */
    List<ConversationTurn> recentTurns(String sessionId, int limit);

    /**
     * 历史列表。caseId 非空时只返回该案件或未绑定案件的轮次。
     */
    List<ConversationTurn> listForSession(String sessionId, Long caseId, int limit);

    /**
     * 删除该会话全部轮次，返回删除条数。
     */
    long clearSession(String sessionId);
}
