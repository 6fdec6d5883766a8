package com.imperium.cocounsel.ai.specialist;

import com.imperium.cocounsel.ai.format.JurisdictionLabels;
import com.imperium.cocounsel.model.dto.agent.AgentInput;
import com.imperium.cocounsel.model.enums.AgentType;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.stereotype.Component;

/**
 * 策略规划：和解模型、情景推演、时间线、预算、ADR。
 */
@Component
public class StrategistSpecialist extends AbstractChatClientSpecialist {

    public StrategistSpecialist(ChatClient chatClient) {
        super(chatClient);
    }

    @Override
    public AgentType type() {
        return AgentType.STRATEGIST;
    }

    @Override
    protected String specialty() {
        return "Strategic planning specialist: settlement modeling, scenario planning, timeline generation, "
                + "budget projection, ADR strategy and proactive recommendations. Kansas (10th Circuit) and "
                + "Missouri (8th Circuit) expertise. Include comparative fault implications for both jurisdictions "
                + "and list concrete next actions with deadlines.";
    }

    @Override
    protected double baseConfidence() {
        return 0.82;
    }

    @Override
    protected String memoryKeyPrefix() {
        return "strategy";
    }

    @Override
    protected String memoryNote(AgentInput input) {
        String caseNumber = input.getMatter().hasCase() ? input.getMatter().getCaseSnapshot().getCaseNumber() : "matter";
        return "Strategy session for " + caseNumber + " (" + JurisdictionLabels.label(input.getJurisdiction()) + "): "
                + truncate(input.getMessage(), NOTE_MESSAGE_CHARS);
    }
}
