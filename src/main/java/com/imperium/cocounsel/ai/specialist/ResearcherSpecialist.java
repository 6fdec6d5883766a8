package com.imperium.cocounsel.ai.specialist;

import com.imperium.cocounsel.model.dto.agent.AgentInput;
import com.imperium.cocounsel.model.enums.AgentType;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 法律检索：判例、成文法、引注核验、先例匹配。
 */
@Component
public class ResearcherSpecialist extends AbstractChatClientSpecialist {

    static final String VERIFY_CITATIONS = "All citations require Shepardize/KeyCite verification";
    static final String SOL_NOT_RECORDED = "Statute of limitations not recorded for this matter";

    public ResearcherSpecialist(ChatClient chatClient) {
        super(chatClient);
    }

    @Override
    public AgentType type() {
        return AgentType.RESEARCHER;
    }

    @Override
    protected String specialty() {
        return "Legal research specialist: case law lookup, statute analysis, citation verification, "
                + "precedent matching. Ground every proposition in a pinpoint citation. Never hallucinate citations.";
    }

    @Override
    protected double baseConfidence() {
        return 0.85;
    }

    @Override
    protected String memoryKeyPrefix() {
        return "research";
    }

    @Override
    protected List<String> standingRisks(AgentInput input) {
        List<String> risks = new ArrayList<>();
        if (missingSol(input)) {
            risks.add(SOL_NOT_RECORDED);
        }
        risks.add(VERIFY_CITATIONS);
        return risks;
    }

    @Override
    protected String memoryNote(AgentInput input) {
        return "Researched: " + truncate(input.getMessage(), NOTE_MESSAGE_CHARS);
    }

    static boolean missingSol(AgentInput input) {
        var matter = input.getMatter();
        if (matter == null || !matter.hasCase()) {
            return false;
        }
        String sol = matter.getCaseSnapshot().getStatuteOfLimitations();
        return sol == null || sol.isBlank();
    }
}
