package com.imperium.cocounsel.ai.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.imperium.cocounsel.model.dto.agent.AgentInput;
import com.imperium.cocounsel.model.dto.agent.AgentOutput;
import com.imperium.cocounsel.model.dto.agent.AgentRoute;
import com.imperium.cocounsel.model.entity.ChatSession;
import com.imperium.cocounsel.model.entity.ConversationTurn;
import com.imperium.cocounsel.model.enums.AgentType;
import com.imperium.cocounsel.model.enums.TurnRole;
import com.imperium.cocounsel.service.ChatSessionService;
import com.imperium.cocounsel.service.ConversationTurnService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 会话追踪：每次请求追加 user / assistant 两条轮次，并更新会话元数据（首次使用时隐式创建）。
 */
@Component
public class SessionTracker {

    private static final Logger log = LoggerFactory.getLogger(SessionTracker.class);

    private final ChatSessionService chatSessionService;
    private final ConversationTurnService conversationTurnService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public SessionTracker(ChatSessionService chatSessionService,
            ConversationTurnService conversationTurnService,
            ObjectMapper objectMapper,
            Clock clock) {
        this.chatSessionService = chatSessionService;
        this.conversationTurnService = conversationTurnService;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * @param startedAt 请求开始时间，作为 user 轮次的创建时间
     */
    public void record(AgentInput input, AgentRoute route, AgentOutput output, long durationMs, LocalDateTime startedAt) {
        Long caseId = input.getMatter() != null ? input.getMatter().getCaseId() : null;
        LocalDateTime now = LocalDateTime.now(clock);
        // 同一会话内按 created_at 排序，assistant 必须严格晚于 user
        LocalDateTime answeredAt = now.isAfter(startedAt) ? now : startedAt.plusNanos(1_000);

        ConversationTurn userTurn = new ConversationTurn();
        userTurn.setId(newTurnId());
        userTurn.setSessionId(input.getSessionId());
        userTurn.setCaseId(caseId);
        userTurn.setRole(TurnRole.USER.value());
        userTurn.setContent(input.getMessage());
        userTurn.setJurisdiction(input.getJurisdiction());
        userTurn.setCreatedAt(startedAt);

        ConversationTurn assistantTurn = new ConversationTurn();
        assistantTurn.setId(newTurnId());
        assistantTurn.setSessionId(input.getSessionId());
        assistantTurn.setCaseId(caseId);
        assistantTurn.setRole(TurnRole.ASSISTANT.value());
        assistantTurn.setContent(output.getContent());
        assistantTurn.setJurisdiction(input.getJurisdiction());
        assistantTurn.setAgentType(output.getAgentType().value());
        assistantTurn.setConfidence(route.confidence());
        assistantTurn.setSubAgents(joinAgents(output.getSubAgentsCalled()));
        assistantTurn.setRisksFlagged(toJson(output.getRisksFlagged()));
        assistantTurn.setCitations(toJson(output.getCitations()));
        assistantTurn.setTokensUsed(output.getTokensUsed());
        assistantTurn.setDurationMs(durationMs);
        assistantTurn.setRoutingReasoning(route.reasoning());
        assistantTurn.setCreatedAt(answeredAt);

        conversationTurnService.saveBatch(List.of(userTurn, assistantTurn));
        touchSession(input, caseId, output, now);
    }

    private void touchSession(AgentInput input, Long caseId, AgentOutput output, LocalDateTime now) {
        List<AgentType> used = new ArrayList<>();
        used.add(output.getAgentType());
        used.addAll(output.getSubAgentsCalled());

        ChatSession session = chatSessionService.getById(input.getSessionId());
        if (session == null) {
            session = new ChatSession();
            session.setSessionId(input.getSessionId());
            session.setCaseId(caseId);
            session.setUserId(input.getUserId());
            session.setLastAgent(output.getAgentType().value());
            session.setAgentsUsed(mergeAgents(null, used));
            session.setCumulativeTokens((long) output.getTokensUsed());
            session.setCreatedAt(now);
            session.setUpdatedAt(now);
            chatSessionService.save(session);
            return;
        }

        if (session.getCaseId() == null) {
            session.setCaseId(caseId);
        }
        session.setUserId(input.getUserId());
        session.setLastAgent(output.getAgentType().value());
        session.setAgentsUsed(mergeAgents(session.getAgentsUsed(), used));
        long previous = session.getCumulativeTokens() != null ? session.getCumulativeTokens() : 0L;
        session.setCumulativeTokens(previous + output.getTokensUsed());
        session.setUpdatedAt(now);
        chatSessionService.updateById(session);
    }

    static String mergeAgents(String existingCsv, List<AgentType> used) {
        Set<String> agents = new LinkedHashSet<>();
        if (existingCsv != null && !existingCsv.isBlank()) {
            Arrays.stream(existingCsv.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .forEach(agents::add);
        }
        used.forEach(a -> agents.add(a.value()));
        return String.join(",", agents);
    }

    private static String joinAgents(List<AgentType> agents) {
        if (agents == null || agents.isEmpty()) {
            return null;
        }
        return agents.stream().map(AgentType::value).collect(Collectors.joining(","));
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize turn metadata: {}", e.getMessage());
            return "[]";
        }
    }

    private static String newTurnId() {
        return "t_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }
}
