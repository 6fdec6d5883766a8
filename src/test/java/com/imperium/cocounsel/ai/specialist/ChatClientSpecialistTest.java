package com.imperium.cocounsel.ai.specialist;

import com.imperium.cocounsel.ai.context.MatterContextFormatter;
import com.imperium.cocounsel.model.dto.agent.AgentInput;
import com.imperium.cocounsel.model.dto.agent.AgentOutput;
import com.imperium.cocounsel.model.dto.agent.Citation;
import com.imperium.cocounsel.model.dto.agent.MatterContext;
import com.imperium.cocounsel.model.dto.agent.MemoryUpdate;
import com.imperium.cocounsel.model.entity.CaseSnapshot;
import com.imperium.cocounsel.model.entity.ConversationTurn;
import com.imperium.cocounsel.model.enums.AgentType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChatClientSpecialistTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 14);

    private final ResearcherSpecialist researcher = new ResearcherSpecialist(mock(ChatClient.class));
    private final AnalystSpecialist analyst = new AnalystSpecialist(mock(ChatClient.class));

    private static MatterContext matterWithoutSol() {
        CaseSnapshot c = new CaseSnapshot();
        c.setId(42L);
        c.setCaseNumber("2026-CV-0042");
        return MatterContext.builder().caseId(42L).caseSnapshot(c).build();
    }

    private static AgentInput input(MatterContext matter) {
        return AgentInput.builder()
                .message("What is the statute of limitations for negligence?")
                .jurisdiction("kansas")
                .matter(matter)
                .sessionId("s1")
                .userId("u1")
                .date(TODAY)
                .conversationHistory(List.of())
                .semanticMemoryText("")
                .build();
    }

    private static ConversationTurn turn(String role, String content) {
        ConversationTurn t = new ConversationTurn();
        t.setRole(role);
        t.setContent(content);
        return t;
    }

    @Nested
    @DisplayName("结构化输出解析")
    class Parsing {

        @Test
        void validJsonIsDeserialized() {
            SpecialistReply reply = researcher.parse("""
                    {"content":"### Summary\\nTwo years.","citations":[{"source":"statute","reference":"K.S.A. 60-513","verified":true}],
                     "risksFlagged":["SOL may have run"],"followUpActions":["Calendar SOL"],
                     "memoryUpdates":[{"key":"research_sol","value":"Two-year SOL","confidence":0.9}]}
                    """);

            assertThat(reply.getContent()).isEqualTo("### Summary\nTwo years.");
            assertThat(reply.getCitations()).extracting(Citation::getReference).containsExactly("K.S.A. 60-513");
            assertThat(reply.getMemoryUpdates()).hasSize(1);
        }

        @Test
        void plainTextFallsBackToRawContent() {
            SpecialistReply reply = researcher.parse("Just a markdown answer, no JSON.");

            assertThat(reply.getContent()).isEqualTo("Just a markdown answer, no JSON.");
            assertThat(reply.getCitations()).isEmpty();
        }

        @Test
        void jsonWithoutContentFallsBackToRaw() {
            String raw = "{\"risksFlagged\":[\"x\"]}";

            assertThat(researcher.parse(raw).getContent()).isEqualTo(raw);
        }
    }

    @Nested
    @DisplayName("输出组装")
    class Output {

        @Test
        void researcherAddsStandingRisksAndCaseNote() {
            SpecialistReply reply = new SpecialistReply();
            reply.setContent("answer");
            reply.setRisksFlagged(new ArrayList<>(List.of(ResearcherSpecialist.VERIFY_CITATIONS)));

            AgentOutput out = researcher.toOutput(input(matterWithoutSol()), reply, 321, 12L);

            assertThat(out.getAgentType()).isEqualTo(AgentType.RESEARCHER);
            assertThat(out.getConfidence()).isEqualTo(0.85);
            assertThat(out.getTokensUsed()).isEqualTo(321);
            assertThat(out.getRisksFlagged())
                    .containsExactly(ResearcherSpecialist.VERIFY_CITATIONS, ResearcherSpecialist.SOL_NOT_RECORDED);
            assertThat(out.getMemoryUpdates()).singleElement().satisfies(m -> {
                assertThat(m.getKey()).isEqualTo("research_2026-03-14");
                assertThat(m.getValue()).startsWith("Researched: What is the statute");
                assertThat(m.getAgentType()).isEqualTo(AgentType.RESEARCHER);
            });
        }

        @Test
        void noCaseMeansNoCaseNote() {
            SpecialistReply reply = new SpecialistReply();
            reply.setContent("answer");

            AgentOutput out = analyst.toOutput(input(MatterContext.empty()), reply, 10, 1L);

            assertThat(out.getMemoryUpdates()).isEmpty();
            assertThat(out.getRisksFlagged()).isEmpty();
        }

        @Test
        void modelNotesDefaultToBaseConfidence() {
            SpecialistReply reply = new SpecialistReply();
            reply.setContent("answer");
            reply.setMemoryUpdates(List.of(
                    new SpecialistReply.Note("analysis_exposure", "High exposure", 0),
                    new SpecialistReply.Note("blank", " ", 0.9)));
            reply.setCitations(List.of(Citation.builder().reference(" ").build()));

            AgentOutput out = analyst.toOutput(input(MatterContext.empty()), reply, 10, 1L);

            assertThat(out.getMemoryUpdates()).extracting(MemoryUpdate::getConfidence).containsExactly(0.82);
            assertThat(out.getCitations()).isEmpty();
        }
    }

    @Test
    void systemPromptCarriesMatterJurisdictionAndMemory() {
        AgentInput in = input(MatterContext.empty());
        in.setSemanticMemoryText("[Memory 1] prior fact");

        String prompt = researcher.systemPrompt(in);

        assertThat(prompt).startsWith(SpecialistPrompts.SYSTEM_IDENTITY);
        assertThat(prompt).contains("Jurisdiction: Kansas");
        assertThat(prompt).contains("Today: 2026-03-14");
        assertThat(prompt).contains(MatterContextFormatter.NO_MATTER);
        assertThat(prompt).contains("Prior Memory Context:\n[Memory 1] prior fact");
    }

    @Test
    void historyIsWindowedAndMappedByRole() {
        List<ConversationTurn> history = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            history.add(turn(i % 2 == 0 ? "user" : "assistant", "turn " + i));
        }

        List<Message> messages = researcher.historyMessages(history);

        assertThat(messages).hasSize(10);
        assertThat(messages.get(0)).isInstanceOf(UserMessage.class);
        assertThat(messages.get(0).getText()).isEqualTo("turn 2");
        assertThat(messages.get(9)).isInstanceOf(AssistantMessage.class);
    }

    @Nested
    @DisplayName("模型调用")
    class Invocation {

        @Test
        void handleSendsSystemHistoryAndUserMessage() {
            ChatModel chatModel = mock(ChatModel.class);
            when(chatModel.call(any(Prompt.class))).thenReturn(
                    new ChatResponse(List.of(new Generation(new AssistantMessage("Plain answer about limitations.")))));
            DrafterSpecialist drafter = new DrafterSpecialist(ChatClient.builder(chatModel).build());
            AgentInput in = input(MatterContext.empty());
            in.setConversationHistory(List.of(turn("user", "earlier question"), turn("assistant", "earlier answer")));

            AgentOutput out = drafter.handle(in);

            ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);
            verify(chatModel).call(captor.capture());
            List<Message> sent = captor.getValue().getInstructions();
            assertThat(sent.get(0)).isInstanceOf(SystemMessage.class);
            assertThat(sent.get(sent.size() - 1).getText()).isEqualTo(in.getMessage());
            assertThat(sent).extracting(Message::getText).contains("earlier question", "earlier answer");

            assertThat(out.getAgentType()).isEqualTo(AgentType.DRAFTER);
            assertThat(out.getContent()).isEqualTo("Plain answer about limitations.");
            assertThat(out.getTokensUsed()).isPositive();
        }

        @Test
        void emptyCompletionFails() {
            ChatModel chatModel = mock(ChatModel.class);
            when(chatModel.call(any(Prompt.class))).thenReturn(
                    new ChatResponse(List.of(new Generation(new AssistantMessage("")))));
            StrategistSpecialist strategist = new StrategistSpecialist(ChatClient.builder(chatModel).build());

            assertThatThrownBy(() -> strategist.handle(input(MatterContext.empty())))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("empty completion");
        }
    }

    @Nested
    @DisplayName("注册表")
    class Registry {

        @Test
        void resolvesEachType() {
            SpecialistRegistry registry = new SpecialistRegistry(List.of(researcher, analyst));

            assertThat(registry.get(AgentType.ANALYST)).isSameAs(analyst);
            assertThatThrownBy(() -> registry.get(AgentType.DRAFTER)).isInstanceOf(IllegalStateException.class);
        }

        @Test
        void duplicatesAreRejected() {
            ResearcherSpecialist another = new ResearcherSpecialist(mock(ChatClient.class));

            assertThatThrownBy(() -> new SpecialistRegistry(List.of(researcher, another)))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("Duplicate");
        }
    }
}
