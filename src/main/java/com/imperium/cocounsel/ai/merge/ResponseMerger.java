package com.imperium.cocounsel.ai.merge;

import com.imperium.cocounsel.model.dto.agent.AgentOutput;
import com.imperium.cocounsel.model.dto.agent.Citation;
import com.imperium.cocounsel.model.enums.AgentType;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 合并主 Agent 与协同 Agent 的输出。主 Agent 正文原样保留，协同 Agent 只追加摘要或截断片段。
 */
@Component
public class ResponseMerger {

    /** "### Summary" 段落，直到下一个 ### 或文末 */
    private static final Pattern SUMMARY_SECTION = Pattern.compile("### Summary\\n([\\s\\S]*?)(?=###|$)");

    private static final int MAX_EXTRA_RISKS = 3;

    private final double subAgentTokenWeight;
    private final int excerptChars;

    public ResponseMerger(@Value("${app.orchestrator.sub-agent-token-weight:0.3}") double subAgentTokenWeight,
            @Value("${app.orchestrator.sub-agent-excerpt-chars:500}") int excerptChars) {
        this.subAgentTokenWeight = subAgentTokenWeight;
        this.excerptChars = excerptChars;
    }

    /**
     * @param sub 协同 Agent 输出，可为 null
     */
    public AgentOutput merge(AgentOutput primary, AgentOutput sub) {
        Objects.requireNonNull(primary, "primary");
        if (sub == null) {
            return primary;
        }

        List<AgentType> subAgents = new ArrayList<>(primary.getSubAgentsCalled());
        if (!subAgents.contains(sub.getAgentType())) {
            subAgents.add(sub.getAgentType());
        }

        List<Citation> citations = new ArrayList<>(primary.getCitations());
        Set<String> seenRefs = citations.stream().map(Citation::getReference).collect(Collectors.toSet());
        for (Citation c : sub.getCitations()) {
            if (seenRefs.add(c.getReference())) {
                citations.add(c);
            }
        }

        Set<String> risks = new LinkedHashSet<>(primary.getRisksFlagged());
        risks.addAll(sub.getRisksFlagged());

        List<String> actions = new ArrayList<>(primary.getFollowUpActions());
        sub.getFollowUpActions().stream().filter(a -> !actions.contains(a)).forEach(actions::add);

        var memory = new ArrayList<>(primary.getMemoryUpdates());
        memory.addAll(sub.getMemoryUpdates());

        int tokens = primary.getTokensUsed() + (int) Math.floor(sub.getTokensUsed() * subAgentTokenWeight);

        return primary.toBuilder()
                .content(primary.getContent() + contribution(sub))
                .subAgentsCalled(List.copyOf(subAgents))
                .citations(List.copyOf(citations))
                .risksFlagged(List.copyOf(risks))
                .followUpActions(List.copyOf(actions))
                .memoryUpdates(List.copyOf(memory))
                .tokensUsed(tokens)
                .build();
    }

    private String contribution(AgentOutput sub) {
        AgentType type = sub.getAgentType();
        StringBuilder sb = new StringBuilder("\n\n---\n### ")
                .append(type.emoji()).append(" Additional Input — ").append(type.displayName()).append(" Agent\n")
                .append(excerpt(sub.getContent()));
        if (!sub.getRisksFlagged().isEmpty()) {
            sb.append("\n**Additional Risks Flagged:** ")
                    .append(sub.getRisksFlagged().stream().limit(MAX_EXTRA_RISKS).collect(Collectors.joining("; ")))
                    .append('\n');
        }
        return sb.toString();
    }

    String excerpt(String content) {
        String text = content == null ? "" : content;
        Matcher m = SUMMARY_SECTION.matcher(text);
        if (m.find()) {
            return m.group(1).trim() + "\n";
        }
        if (text.length() <= excerptChars) {
            return text + "...\n";
        }
        int end = excerptChars;
        // 不切断代理对
        if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end) + "...\n";
    }
}
