package com.imperium.cocounsel.ai.routing;

import com.imperium.cocounsel.model.dto.agent.AgentRoute;
import com.imperium.cocounsel.model.entity.ConversationTurn;
import com.imperium.cocounsel.model.enums.AgentType;
import com.imperium.cocounsel.model.enums.TurnRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class IntentClassifierTest {

    private final IntentClassifier classifier = new IntentClassifier("researcher", 3);

    private static ConversationTurn assistantTurn(AgentType agent) {
        ConversationTurn turn = new ConversationTurn();
        turn.setRole(TurnRole.ASSISTANT.value());
        turn.setAgentType(agent.value());
        turn.setContent("previous answer");
        return turn;
    }

    private static ConversationTurn userTurn(String content) {
        ConversationTurn turn = new ConversationTurn();
        turn.setRole(TurnRole.USER.value());
        turn.setContent(content);
        return turn;
    }

    @Nested
    @DisplayName("无信号")
    class ZeroSignal {

        @Test
        void fallsBackToResearcherWithFixedConfidence() {
            AgentRoute route = classifier.classify("Hello there, good morning", List.of());

            assertThat(route.agent()).isEqualTo(AgentType.RESEARCHER);
            assertThat(route.confidence()).isEqualTo(IntentClassifier.ZERO_SIGNAL_CONFIDENCE);
            assertThat(route.subAgents()).isEmpty();
            assertThat(route.reasoning()).contains("falling back");
        }

        @Test
        void blankMessageCountsAsZeroSignal() {
            AgentRoute route = classifier.classify("", null);

            assertThat(route.agent()).isEqualTo(AgentType.RESEARCHER);
            assertThat(route.confidence()).isEqualTo(0.25);
        }

        @Test
        void configuredFallbackIsUsed() {
            IntentClassifier strategistFallback = new IntentClassifier("strategist", 3);

            assertThat(strategistFallback.classify("Hello there", List.of()).agent())
                    .isEqualTo(AgentType.STRATEGIST);
        }

        @Test
        void unknownFallbackIsRejected() {
            assertThatThrownBy(() -> new IntentClassifier("paralegal", 3))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("paralegal");
        }
    }

    @Nested
    @DisplayName("打分与路由")
    class Scoring {

        @Test
        void draftingRequestRoutesToDrafter() {
            AgentRoute route = classifier.classify("Draft a motion to dismiss", List.of());

            assertThat(route.agent()).isEqualTo(AgentType.DRAFTER);
            assertThat(route.confidence()).isGreaterThanOrEqualTo(0.5);
            assertThat(route.subAgents()).isEmpty();
        }

        @Test
        void confidenceIsCappedAtMaximum() {
            AgentRoute route = classifier.classify("Draft a motion to dismiss", List.of());

            // 只有 drafter 得分，0.5 + 0.5 * 1.0 被截到 0.98
            assertThat(route.confidence()).isEqualTo(IntentClassifier.MAX_CONFIDENCE);
        }

        @Test
        void gapQuestionScoresStrategistAndAnalyst() {
            IntentScores scores = classifier.score("What am I missing?", List.of());

            assertThat(scores.of(AgentType.STRATEGIST)).isEqualTo(8);
            assertThat(scores.of(AgentType.ANALYST)).isEqualTo(4);

            AgentRoute route = classifier.classify("What am I missing?", List.of());
            assertThat(route.agent()).isEqualTo(AgentType.STRATEGIST);
            assertThat(route.confidence()).isCloseTo(0.5 + 0.5 * 8 / 12.0, within(1e-9));
            assertThat(route.reasoning()).contains("strategist(8)").contains("analyst(4)");
        }

        @Test
        void closeScoresCoRouteSecondAgent() {
            AgentRoute route = classifier.classify("Review the deadline", List.of());

            // analyst 与 strategist 同分，按声明顺序 analyst 在前
            assertThat(route.agent()).isEqualTo(AgentType.ANALYST);
            assertThat(route.subAgents()).containsExactly(AgentType.STRATEGIST);
            assertThat(route.isCoRouted()).isTrue();
            assertThat(route.confidence()).isCloseTo(0.75, within(1e-9));
            assertThat(route.reasoning()).contains("Co-routing to: strategist");
        }

        @Test
        void widerThresholdCoRoutesGapQuestion() {
            IntentClassifier lenient = new IntentClassifier("researcher", 4);

            assertThat(lenient.classify("What am I missing?", List.of()).subAgents())
                    .containsExactly(AgentType.ANALYST);
        }

        @Test
        void topScoreIsNeverBelowAnyOther() {
            String message = "Research the Kansas statute of limitations and assess settlement risk";
            IntentScores scores = classifier.score(message, List.of());
            AgentRoute route = classifier.classify(message, List.of());

            for (AgentType type : AgentType.values()) {
                assertThat(scores.of(route.agent())).isGreaterThanOrEqualTo(scores.of(type));
            }
            assertThat(route.subAgents()).hasSizeLessThanOrEqualTo(1).doesNotContain(route.agent());
        }

        @Test
        void classificationIsDeterministic() {
            String message = "Evaluate the strengths and weaknesses, then recommend a settlement plan";
            List<ConversationTurn> history = List.of(userTurn("hi"), assistantTurn(AgentType.ANALYST));

            AgentRoute first = classifier.classify(message, history);
            AgentRoute second = classifier.classify(message, history);

            assertThat(second).isEqualTo(first);
        }
    }

    @Nested
    @DisplayName("连续性加分")
    class Continuity {

        @Test
        void lastAssistantAgentGetsBonus() {
            List<ConversationTurn> history = List.of(
                    userTurn("first question"),
                    assistantTurn(AgentType.DRAFTER),
                    userTurn("thanks"));

            IntentScores scores = classifier.score("Hello there", history);

            assertThat(scores.of(AgentType.DRAFTER)).isEqualTo(IntentRules.CONTINUITY_BONUS);
            assertThat(classifier.classify("Hello there", history).agent()).isEqualTo(AgentType.DRAFTER);
        }

        @Test
        void onlyMostRecentAssistantTurnCounts() {
            List<ConversationTurn> history = List.of(
                    assistantTurn(AgentType.ANALYST),
                    assistantTurn(AgentType.STRATEGIST));

            IntentScores scores = classifier.score("Hello there", history);

            assertThat(scores.of(AgentType.STRATEGIST)).isEqualTo(2);
            assertThat(scores.of(AgentType.ANALYST)).isZero();
        }

        @Test
        void userTurnsGiveNoBonus() {
            IntentScores scores = classifier.score("Hello there", List.of(userTurn("draft something")));

            assertThat(scores.total()).isZero();
        }
    }
}
