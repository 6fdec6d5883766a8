package com.imperium.cocounsel.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.imperium.cocounsel.model.entity.AgentUsage;

public interface AgentUsageMapper extends BaseMapper<AgentUsage> {
}
