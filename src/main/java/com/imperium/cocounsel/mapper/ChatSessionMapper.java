package com.imperium.cocounsel.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.imperium.cocounsel.model.entity.ChatSession;

public interface ChatSessionMapper extends BaseMapper<ChatSession> {
}
