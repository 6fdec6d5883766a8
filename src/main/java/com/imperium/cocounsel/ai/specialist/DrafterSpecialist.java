package com.imperium.cocounsel.ai.specialist;

import com.imperium.cocounsel.model.dto.agent.AgentInput;
import com.imperium.cocounsel.model.enums.AgentType;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.stereotype.Component;

/**
 * 文书起草：诉状、动议、函件、合同。
 */
@Component
public class DrafterSpecialist extends AbstractChatClientSpecialist {

    public DrafterSpecialist(ChatClient chatClient) {
        super(chatClient);
    }

    @Override
    public AgentType type() {
        return AgentType.DRAFTER;
    }

    @Override
    protected String specialty() {
        return "Document drafting specialist: pleadings, motions, demand letters, contracts and engagement letters. "
                + "Produce a complete document in clean Markdown with caption, all required sections and signature "
                + "block. Apply Kansas (K.S.A. Chapter 60) or Missouri (fact pleading, Mo.Sup.Ct.R. 55.05) "
                + "requirements and cite the governing rules.";
    }

    @Override
    protected double baseConfidence() {
        return 0.88;
    }

    @Override
    protected String memoryKeyPrefix() {
        return "draft";
    }

    @Override
    protected String memoryNote(AgentInput input) {
        String caseNumber = input.getMatter().hasCase() ? input.getMatter().getCaseSnapshot().getCaseNumber() : "matter";
        return "Drafted for " + caseNumber + ": " + truncate(input.getMessage(), NOTE_MESSAGE_CHARS);
    }
}
