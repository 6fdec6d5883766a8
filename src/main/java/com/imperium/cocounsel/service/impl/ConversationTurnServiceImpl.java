package com.imperium.cocounsel.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.imperium.cocounsel.mapper.ConversationTurnMapper;
import com.imperium.cocounsel.model.entity.ConversationTurn;
import com.imperium.cocounsel.service.ConversationTurnService;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Service
public class ConversationTurnServiceImpl extends ServiceImpl<ConversationTurnMapper, ConversationTurn>
        implements ConversationTurnService {

    @Override
    public List<ConversationTurn> recentTurns(String sessionId, int limit) {
        if (sessionId == null || sessionId.isBlank() || limit <= 0) {
            return List.of();
        }
        List<ConversationTurn> latest = lambdaQuery()
                .eq(ConversationTurn::getSessionId, sessionId)
                .orderByDesc(ConversationTurn::getCreatedAt)
                .last("LIMIT " + limit)
                .list();
        List<ConversationTurn> ordered = new ArrayList<>(latest);
        Collections.reverse(ordered);
        return ordered;
    }

    @Override
    public List<ConversationTurn> listForSession(String sessionId, Long caseId, int limit) {
        if (sessionId == null || sessionId.isBlank()) {
            return List.of();
        }
        var query = lambdaQuery().eq(ConversationTurn::getSessionId, sessionId);
        if (caseId != null) {
            query = query.and(w -> w.eq(ConversationTurn::getCaseId, caseId).or().isNull(ConversationTurn::getCaseId));
        }
        return query.orderByAsc(ConversationTurn::getCreatedAt)
                .last("LIMIT " + Math.max(1, limit))
                .list();
    }

    @Override
    public long clearSession(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return 0;
        }
        long count = lambdaQuery().eq(ConversationTurn::getSessionId, sessionId).count();
        lambdaUpdate().eq(ConversationTurn::getSessionId, sessionId).remove();
        return count;
    }
}
