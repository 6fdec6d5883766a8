package com.imperium.cocounsel.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.imperium.cocounsel.mapper.ChatSessionMapper;
import com.imperium.cocounsel.model.entity.ChatSession;
import com.imperium.cocounsel.service.ChatSessionService;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ChatSessionServiceImpl extends ServiceImpl<ChatSessionMapper, ChatSession> implements ChatSessionService {

    @Override
    public List<ChatSession> recentForUser(String userId, int limit) {
        if (userId == null || userId.isBlank()) {
            return List.of();
        }
        return lambdaQuery()
                .eq(ChatSession::getUserId, userId)
                .orderByDesc(ChatSession::getUpdatedAt)
                .last("LIMIT " + Math.max(1, limit))
                .list();
    }
}
