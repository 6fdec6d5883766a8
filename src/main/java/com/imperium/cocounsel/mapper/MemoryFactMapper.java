package com.imperium.cocounsel.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.imperium.cocounsel.model.entity.MemoryFactRecord;

public interface MemoryFactMapper extends BaseMapper<MemoryFactRecord> {
}
