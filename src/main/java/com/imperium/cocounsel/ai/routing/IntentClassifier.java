package com.imperium.cocounsel.ai.routing;

import com.imperium.cocounsel.model.dto.agent.AgentRoute;
import com.imperium.cocounsel.model.entity.ConversationTurn;
import com.imperium.cocounsel.model.enums.AgentType;
import com.imperium.cocounsel.model.enums.TurnRole;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 意图分类：按规则表打分并选出主路由与至多一个协同 Agent。
 * <p>
 * 纯函数，无 I/O、无随机、不依赖时钟；相同 (message, history) 必得相同结果。
 * 三方及以上接近平分时只考虑第二名，排名更低的类别忽略。
 */
@Component
public class IntentClassifier {

    public static final double ZERO_SIGNAL_CONFIDENCE = 0.25;
    public static final double MAX_CONFIDENCE = 0.98;

    private final List<RoutingRule> rules;
    private final AgentType fallbackAgent;
    private final int tieBreakThreshold;

    @Autowired
    public IntentClassifier(@Value("${app.orchestrator.fallback-agent:researcher}") String fallbackAgent,
            @Value("${app.orchestrator.tie-break-threshold:3}") int tieBreakThreshold) {
        this(IntentRules.defaults(), requireAgent(fallbackAgent), tieBreakThreshold);
    }

    public IntentClassifier(List<RoutingRule> rules, AgentType fallbackAgent, int tieBreakThreshold) {
        this.rules = List.copyOf(rules);
        this.fallbackAgent = Objects.requireNonNull(fallbackAgent, "fallbackAgent");
        this.tieBreakThreshold = tieBreakThreshold;
    }

    /**
     * 只打分，不做路由决策。
     */
    public IntentScores score(String message, List<ConversationTurn> history) {
        String msg = message == null ? "" : message.toLowerCase(Locale.ROOT);
        EnumMap<AgentType, Integer> scores = new EnumMap<>(AgentType.class);
        for (AgentType type : AgentType.values()) {
            scores.put(type, 0);
        }
        for (RoutingRule rule : rules) {
            if (rule.matches(msg)) {
                scores.merge(rule.category(), rule.weight(), Integer::sum);
            }
        }

        AgentType previous = lastAssistantAgent(history);
        if (previous != null) {
            scores.merge(previous, IntentRules.CONTINUITY_BONUS, Integer::sum);
        }
        return new IntentScores(scores);
    }

    public AgentRoute classify(String message, List<ConversationTurn> history) {
        IntentScores scores = score(message, history);
        int total = scores.total();
        if (total == 0) {
            return new AgentRoute(fallbackAgent, ZERO_SIGNAL_CONFIDENCE, List.of(),
                    "No routing signals matched; falling back to \"" + fallbackAgent.value() + "\".");
        }

        List<Map.Entry<AgentType, Integer>> ranked = scores.ranked();
        AgentType top = ranked.get(0).getKey();
        int topScore = ranked.get(0).getValue();
        AgentType second = ranked.get(1).getKey();
        int secondScore = ranked.get(1).getValue();

        List<AgentType> subAgents = secondScore > 0 && (topScore - secondScore) <= tieBreakThreshold
                ? List.of(second)
                : List.of();

        double confidence = Math.min(MAX_CONFIDENCE, 0.5 + 0.5 * ((double) topScore / total));

        return new AgentRoute(top, confidence, subAgents, reasoning(top, topScore, total, confidence, ranked, subAgents));
    }

    private static String reasoning(AgentType top, int topScore, int total, double confidence,
            List<Map.Entry<AgentType, Integer>> ranked, List<AgentType> subAgents) {
        String signals = ranked.stream()
                .filter(e -> e.getValue() > 0)
                .map(e -> e.getKey().value() + "(" + e.getValue() + ")")
                .collect(Collectors.joining(", "));
        StringBuilder sb = new StringBuilder()
                .append("Classified as \"").append(top.value()).append("\" (score: ")
                .append(topScore).append('/').append(total)
                .append(", confidence: ").append(Math.round(confidence * 100)).append("%). ")
                .append("Signals: ").append(signals);
        if (!subAgents.isEmpty()) {
            sb.append(". Co-routing to: ")
                    .append(subAgents.stream().map(AgentType::value).collect(Collectors.joining(", ")));
        }
        return sb.toString();
    }

    private static AgentType lastAssistantAgent(List<ConversationTurn> history) {
        if (history == null) {
            return null;
        }
        for (int i = history.size() - 1; i >= 0; i--) {
            ConversationTurn turn = history.get(i);
            if (turn != null && TurnRole.ASSISTANT.value().equals(turn.getRole())) {
                return AgentType.fromValue(turn.getAgentType());
            }
        }
        return null;
    }

    private static AgentType requireAgent(String value) {
        AgentType type = AgentType.fromValue(value);
        if (type == null) {
            throw new IllegalArgumentException("Unknown fallback agent: " + value);
        }
        return type;
    }
}
