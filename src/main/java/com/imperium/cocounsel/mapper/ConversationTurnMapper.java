package com.imperium.cocounsel.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.imperium.cocounsel.model.entity.ConversationTurn;

public interface ConversationTurnMapper extends BaseMapper<ConversationTurn> {
}
