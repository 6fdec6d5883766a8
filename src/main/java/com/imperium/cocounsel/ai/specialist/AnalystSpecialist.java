package com.imperium.cocounsel.ai.specialist;

import com.imperium.cocounsel.model.dto.agent.AgentInput;
import com.imperium.cocounsel.model.enums.AgentType;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 风险评估：SWOT、比较过错计算、结果预测、风险敞口。
 */
@Component
public class AnalystSpecialist extends AbstractChatClientSpecialist {

    static final String SOL_NOT_TRACKED = "Statute of limitations not tracked";

    public AnalystSpecialist(ChatClient chatClient) {
        super(chatClient);
    }

    @Override
    public AgentType type() {
        return AgentType.ANALYST;
    }

    @Override
    protected String specialty() {
        return "Risk assessment and analytical specialist: score liability, damages, procedural, SOL and "
                + "comparative fault risk on a 1-10 scale, give a SWOT analysis, mitigation strategies and a "
                + "quantified exposure assessment. Contrast the Kansas 50% bar with Missouri pure comparative fault "
                + "where relevant.";
    }

    @Override
    protected double baseConfidence() {
        return 0.82;
    }

    @Override
    protected String memoryKeyPrefix() {
        return "analysis";
    }

    @Override
    protected List<String> standingRisks(AgentInput input) {
        return ResearcherSpecialist.missingSol(input) ? List.of(SOL_NOT_TRACKED) : List.of();
    }

    @Override
    protected String memoryNote(AgentInput input) {
        String caseNumber = input.getMatter().hasCase() ? input.getMatter().getCaseSnapshot().getCaseNumber() : "matter";
        return "Risk assessment for " + caseNumber + ": " + truncate(input.getMessage(), NOTE_MESSAGE_CHARS);
    }
}
