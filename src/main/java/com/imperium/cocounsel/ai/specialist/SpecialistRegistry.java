package com.imperium.cocounsel.ai.specialist;

import com.imperium.cocounsel.model.enums.AgentType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 按 {@link AgentType} 查找专家，每个类别必须恰好一个实现。
 */
@Component
public class SpecialistRegistry {

    private final Map<AgentType, SpecialistHandler> handlers = new EnumMap<>(AgentType.class);

    public SpecialistRegistry(List<SpecialistHandler> handlers) {
        for (SpecialistHandler h : handlers) {
            SpecialistHandler previous = this.handlers.put(h.type(), h);
            if (previous != null) {
                throw new IllegalStateException("Duplicate specialist for " + h.type() + ": "
                        + previous.getClass().getSimpleName() + ", " + h.getClass().getSimpleName());
            }
        }
    }

    public SpecialistHandler get(AgentType type) {
        SpecialistHandler handler = handlers.get(type);
        if (handler == null) {
            throw new IllegalStateException("No specialist registered for " + type);
        }
        return handler;
    }
}
