package com.imperium.cocounsel.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.imperium.cocounsel.model.entity.ChatSession;

import java.util.List;

/**
 * 会话元数据服务。
 */
public interface ChatSessionService extends IService<ChatSession> {

    /**
     * 调用者最近活跃的会话，按 updated_at 倒序。
     */
    List<ChatSession> recentForUser(String userId, int limit);
}
