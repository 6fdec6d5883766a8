package com.imperium.cocounsel.ai.specialist;

import com.imperium.cocounsel.ai.context.MatterContextFormatter;
import com.imperium.cocounsel.ai.format.JurisdictionLabels;
import com.imperium.cocounsel.model.dto.agent.AgentInput;
import com.imperium.cocounsel.model.dto.agent.AgentOutput;
import com.imperium.cocounsel.model.dto.agent.Citation;
import com.imperium.cocounsel.model.dto.agent.MemoryUpdate;
import com.imperium.cocounsel.model.entity.ConversationTurn;
import com.imperium.cocounsel.model.enums.TurnRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.beans.factory.annotation.Value;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 基于 {@link ChatClient} 的专家基类：组装提示 → 同步调用模型 → 解析结构化输出 → 补充固定风险与案件记忆。
 * <p>
 * 子类只提供专长描述和少量领域规则。
 */
public abstract class AbstractChatClientSpecialist implements SpecialistHandler {

    private static final Logger log = LoggerFactory.getLogger(AbstractChatClientSpecialist.class);

    /** 记忆摘要中引用的用户消息最大字符数 */
    static final int NOTE_MESSAGE_CHARS = 200;

    private final ChatClient chatClient;
    private final BeanOutputConverter<SpecialistReply> converter = new BeanOutputConverter<>(SpecialistReply.class);

    @Value("${app.specialist.max-history:10}")
    private int maxHistory = 10;

    @Value("${app.specialist.max-tokens:4000}")
    private int maxTokens = 4000;

    @Value("${app.specialist.temperature:0.3}")
    private double temperature = 0.3;

    protected AbstractChatClientSpecialist(ChatClient chatClient) {
        this.chatClient = chatClient;
    }

    /** 专长描述，拼入系统提示 */
    protected abstract String specialty();

    /** 该专家输出的基准置信度 */
    protected abstract double baseConfidence();

    /** 案件记忆键前缀，如 research */
    protected abstract String memoryKeyPrefix();

    /**
     * 与模型输出无关、始终需要提示的风险。
     */
    protected List<String> standingRisks(AgentInput input) {
        return List.of();
    }

    /** 案件记忆正文 */
    protected String memoryNote(AgentInput input) {
        return type().displayName() + " reviewed: " + truncate(input.getMessage(), NOTE_MESSAGE_CHARS);
    }

    @Override
    public AgentOutput handle(AgentInput input) {
        long start = System.nanoTime();

        ChatResponse response = chatClient.prompt()
                .system(systemPrompt(input))
                .messages(historyMessages(input.getConversationHistory()))
                .user(input.getMessage())
                .options(OpenAiChatOptions.builder().maxTokens(maxTokens).temperature(temperature).build())
                .call()
                .chatResponse();

        String raw = response != null && response.getResult() != null
                ? response.getResult().getOutput().getText()
                : null;
        if (raw == null || raw.isBlank()) {
            throw new IllegalStateException(type().value() + " specialist returned an empty completion");
        }

        SpecialistReply reply = parse(raw);
        long durationMs = (System.nanoTime() - start) / 1_000_000;
        return toOutput(input, reply, totalTokens(response, raw), durationMs);
    }

    String systemPrompt(AgentInput input) {
        StringBuilder sb = new StringBuilder(SpecialistPrompts.SYSTEM_IDENTITY)
                .append("\n\nSpecialty: ").append(specialty())
                .append("\n\nJurisdiction: ").append(JurisdictionLabels.label(input.getJurisdiction()))
                .append("\nToday: ").append(input.getDate())
                .append("\n\nCurrent Matter Context:\n").append(MatterContextFormatter.format(input.getMatter()));
        if (input.getSemanticMemoryText() != null && !input.getSemanticMemoryText().isEmpty()) {
            sb.append("\n\nPrior Memory Context:\n").append(input.getSemanticMemoryText());
        }
        sb.append("\n\nRespond in structured markdown inside the content field. "
                + "Include citations, risks and next actions in their own fields.\n\n")
                .append(converter.getFormat());
        return sb.toString();
    }

    List<Message> historyMessages(List<ConversationTurn> history) {
        if (history == null || history.isEmpty()) {
            return List.of();
        }
        List<ConversationTurn> window = history.size() > maxHistory
                ? history.subList(history.size() - maxHistory, history.size())
                : history;
        List<Message> messages = new ArrayList<>(window.size());
        for (ConversationTurn turn : window) {
            if (turn == null || turn.getContent() == null || turn.getContent().isBlank()) {
                continue;
            }
            if (TurnRole.ASSISTANT.value().equals(turn.getRole())) {
                messages.add(new AssistantMessage(turn.getContent()));
            } else {
                messages.add(new UserMessage(turn.getContent()));
            }
        }
        return messages;
    }

    /**
     * 模型未按 Schema 返回时把原文整体当作正文。
     */
    SpecialistReply parse(String raw) {
        try {
            SpecialistReply reply = converter.convert(raw);
            if (reply != null && reply.getContent() != null && !reply.getContent().isBlank()) {
                return reply;
            }
            log.warn("{} specialist returned structured output without content, using raw text", type().value());
        } catch (RuntimeException e) {
            log.warn("{} specialist output is not valid JSON, using raw text: {}", type().value(), e.getMessage());
        }
        SpecialistReply fallback = new SpecialistReply();
        fallback.setContent(raw);
        return fallback;
    }

    AgentOutput toOutput(AgentInput input, SpecialistReply reply, int tokensUsed, long durationMs) {
        List<Citation> citations = reply.getCitations() == null ? List.of()
                : reply.getCitations().stream()
                        .filter(c -> c != null && c.getReference() != null && !c.getReference().isBlank())
                        .toList();

        Set<String> risks = new LinkedHashSet<>();
        if (reply.getRisksFlagged() != null) {
            reply.getRisksFlagged().stream().filter(Objects::nonNull).forEach(risks::add);
        }
        risks.addAll(standingRisks(input));

        List<String> actions = reply.getFollowUpActions() == null ? List.of()
                : reply.getFollowUpActions().stream().filter(Objects::nonNull).toList();

        List<MemoryUpdate> memory = new ArrayList<>();
        if (reply.getMemoryUpdates() != null) {
            for (SpecialistReply.Note note : reply.getMemoryUpdates()) {
                if (note == null || note.getValue() == null || note.getValue().isBlank()) {
                    continue;
                }
                memory.add(MemoryUpdate.builder()
                        .key(note.getKey())
                        .value(note.getValue())
                        .agentType(type())
                        .confidence(note.getConfidence() > 0 ? note.getConfidence() : baseConfidence())
                        .build());
            }
        }
        if (input.getMatter() != null && input.getMatter().getCaseId() != null) {
            memory.add(MemoryUpdate.builder()
                    .key(memoryKeyPrefix() + "_" + input.getDate())
                    .value(memoryNote(input))
                    .agentType(type())
                    .confidence(baseConfidence())
                    .build());
        }

        return AgentOutput.builder()
                .content(reply.getContent())
                .agentType(type())
                .citations(citations)
                .risksFlagged(List.copyOf(risks))
                .followUpActions(actions)
                .memoryUpdates(List.copyOf(memory))
                .tokensUsed(tokensUsed)
                .durationMs(durationMs)
                .confidence(baseConfidence())
                .build()
                .requireWellFormed();
    }

    private static int totalTokens(ChatResponse response, String raw) {
        Usage usage = response.getMetadata() != null ? response.getMetadata().getUsage() : null;
        if (usage != null && usage.getTotalTokens() != null && usage.getTotalTokens() > 0) {
            return usage.getTotalTokens();
        }
        // 提供商未返回用量时按字符粗估
        return (int) Math.ceil(raw.length() / 3.2);
    }

    static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        return s.length() > max ? s.substring(0, max) : s;
    }
}
