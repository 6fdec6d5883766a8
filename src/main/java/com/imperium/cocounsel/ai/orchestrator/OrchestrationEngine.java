package com.imperium.cocounsel.ai.orchestrator;

import com.imperium.cocounsel.ai.context.AssembledContext;
import com.imperium.cocounsel.ai.context.ContextAssembler;
import com.imperium.cocounsel.ai.format.JurisdictionLabels;
import com.imperium.cocounsel.ai.format.ResponseFrame;
import com.imperium.cocounsel.ai.format.ResponseNormalizer;
import com.imperium.cocounsel.ai.memory.MemoryScope;
import com.imperium.cocounsel.ai.memory.MemoryWriter;
import com.imperium.cocounsel.ai.memory.SessionTracker;
import com.imperium.cocounsel.ai.merge.ResponseMerger;
import com.imperium.cocounsel.ai.routing.IntentClassifier;
import com.imperium.cocounsel.ai.specialist.SpecialistRegistry;
import com.imperium.cocounsel.model.dto.agent.AgentInput;
import com.imperium.cocounsel.model.dto.agent.AgentOutput;
import com.imperium.cocounsel.model.dto.agent.AgentRoute;
import com.imperium.cocounsel.model.entity.AgentUsage;
import com.imperium.cocounsel.model.entity.ConversationTurn;
import com.imperium.cocounsel.model.enums.AgentType;
import com.imperium.cocounsel.service.UsageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * 编排引擎：一次请求/响应周期内组合上下文组装、意图分类、专家调用、合并、规范化与持久化。
 * <p>
 * 顺序：上下文 → 历史 → 分类 → 主/协同专家（并发） → 合并 → 规范化 → 记忆写入 → 会话追踪 → 用量记录。
 * 关键步骤失败抛 {@link OrchestrationException}；语义记忆、协同专家、会话追踪、用量记录失败只记日志。
 * 引擎本身不持有跨请求的可变状态。
 */
@Service
public class OrchestrationEngine {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationEngine.class);

    private final ContextAssembler contextAssembler;
    private final IntentClassifier intentClassifier;
    private final SpecialistRegistry specialistRegistry;
    private final ResponseMerger responseMerger;
    private final ResponseNormalizer responseNormalizer;
    private final MemoryWriter memoryWriter;
    private final SessionTracker sessionTracker;
    private final UsageService usageService;
    private final Executor specialistExecutor;
    private final Clock clock;

    public OrchestrationEngine(ContextAssembler contextAssembler,
            IntentClassifier intentClassifier,
            SpecialistRegistry specialistRegistry,
            ResponseMerger responseMerger,
            ResponseNormalizer responseNormalizer,
            MemoryWriter memoryWriter,
            SessionTracker sessionTracker,
            UsageService usageService,
            @Qualifier("specialistExecutor") Executor specialistExecutor,
            Clock clock) {
        this.contextAssembler = contextAssembler;
        this.intentClassifier = intentClassifier;
        this.specialistRegistry = specialistRegistry;
        this.responseMerger = responseMerger;
        this.responseNormalizer = responseNormalizer;
        this.memoryWriter = memoryWriter;
        this.sessionTracker = sessionTracker;
        this.usageService = usageService;
        this.specialistExecutor = specialistExecutor;
        this.clock = clock;
    }

    // ==================== 公开入口 ====================

    public OrchestrationResult handle(String message, String sessionId, Long caseId, String jurisdiction, String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId is required");
        }
        long startNanos = System.nanoTime();
        LocalDateTime startedAt = LocalDateTime.now(clock);
        String jx = JurisdictionLabels.normalize(jurisdiction);

        try {
            return run(message == null ? "" : message, sessionId, caseId, jx, userId, startNanos, startedAt);
        } catch (OrchestrationException e) {
            log.error("Orchestration failed at {} for session {}", e.getStage().value(), sessionId, e);
            recordUsage(sessionId, userId, caseId, null, null, null, 0, elapsedMs(startNanos), false, "error");
            throw e;
        }
    }

    // ==================== 私有：流水线 ====================

    private OrchestrationResult run(String message, String sessionId, Long caseId, String jx, String userId,
            long startNanos, LocalDateTime startedAt) {

        // ---------- 1. 上下文 ----------
        AssembledContext context;
        try {
            context = contextAssembler.assemble(message, sessionId, caseId, userId);
        } catch (RuntimeException e) {
            throw new OrchestrationException(OrchestrationStage.CONTEXT_ASSEMBLY, "Failed to assemble matter context", e);
        }

        // ---------- 2. 历史 ----------
        List<ConversationTurn> history;
        try {
            history = contextAssembler.loadHistory(sessionId);
        } catch (RuntimeException e) {
            throw new OrchestrationException(OrchestrationStage.CONTEXT_ASSEMBLY, "Failed to load conversation history", e);
        }

        // ---------- 3. 分类 ----------
        AgentRoute route;
        try {
            route = intentClassifier.classify(message, history);
        } catch (RuntimeException e) {
            throw new OrchestrationException(OrchestrationStage.CLASSIFICATION, "Failed to classify request", e);
        }
        log.info("Routing session {} -> {} ({}), sub-agents {}", sessionId, route.agent().value(),
                Math.round(route.confidence() * 100), route.subAgents());

        // ---------- 4/5. 专家调用 ----------
        AgentInput input = AgentInput.builder()
                .message(message)
                .jurisdiction(jx)
                .matter(context.matter())
                .sessionId(sessionId)
                .conversationHistory(history)
                .date(LocalDate.now(clock))
                .userId(userId)
                .semanticMemoryText(context.semanticMemoryText())
                .build();

        AgentOutput primary;
        AgentOutput sub;
        CompletableFuture<AgentOutput> primaryFuture;
        try {
            primaryFuture = invokeAsync(route.agent(), input);
        } catch (RejectedExecutionException e) {
            throw new OrchestrationException(OrchestrationStage.GENERATION,
                    "The " + route.agent().value() + " specialist could not be scheduled", e);
        }
        CompletableFuture<AgentOutput> subFuture = CompletableFuture.completedFuture(null);
        if (route.isCoRouted()) {
            try {
                subFuture = invokeAsync(route.subAgents().get(0), input);
            } catch (RejectedExecutionException e) {
                log.warn("Co-routed specialist {} rejected by executor, answering with primary only: {}",
                        route.subAgents().get(0).value(), e.getMessage());
            }
        }
        try {
            primary = primaryFuture.join();
        } catch (CompletionException e) {
            throw new OrchestrationException(OrchestrationStage.GENERATION,
                    "The " + route.agent().value() + " specialist failed to respond", unwrap(e));
        }
        try {
            sub = subFuture.join();
        } catch (CompletionException e) {
            log.warn("Co-routed specialist {} failed, answering with primary only: {}",
                    route.subAgents().get(0).value(), unwrap(e).getMessage());
            sub = null;
        }

        // ---------- 6. 合并 ----------
        AgentOutput merged = responseMerger.merge(primary, sub);

        // ---------- 7. 规范化 ----------
        List<AgentType> agentsUsed = new ArrayList<>();
        agentsUsed.add(merged.getAgentType());
        agentsUsed.addAll(merged.getSubAgentsCalled());
        String content;
        try {
            content = responseNormalizer.normalize(merged.getContent(),
                    new ResponseFrame(route, agentsUsed, context.memoryUsed(), jx, context.matter(), input.getDate()));
        } catch (RuntimeException e) {
            throw new OrchestrationException(OrchestrationStage.GENERATION, "Failed to format the response", e);
        }

        // ---------- 8. 记忆写入（关系库为关键步骤） ----------
        try {
            memoryWriter.write(merged.getMemoryUpdates(), new MemoryScope(userId, caseId, sessionId), jx);
        } catch (RuntimeException e) {
            throw new OrchestrationException(OrchestrationStage.PERSISTENCE, "Failed to persist matter memory", e);
        }

        long durationMs = elapsedMs(startNanos);
        AgentOutput result = merged.toBuilder()
                .content(content)
                .durationMs(durationMs)
                .confidence(route.confidence())
                .build();

        // ---------- 9. 会话追踪 ----------
        try {
            sessionTracker.record(input, route, result, durationMs, startedAt);
        } catch (RuntimeException e) {
            log.warn("Session tracking failed for {}: {}", sessionId, e.getMessage());
        }

        recordUsage(sessionId, userId, caseId, result.getAgentType(), result.getSubAgentsCalled(),
                route.confidence(), result.getTokensUsed(), durationMs, context.memoryUsed(), "success");

        return new OrchestrationResult(sessionId, result, route, context.memoryUsed());
    }

    private CompletableFuture<AgentOutput> invokeAsync(AgentType type, AgentInput input) {
        return CompletableFuture.supplyAsync(
                () -> specialistRegistry.get(type).handle(input).requireWellFormed(),
                specialistExecutor);
    }

    // ==================== 私有：可观测性 ====================

    private void recordUsage(String sessionId, String userId, Long caseId, AgentType agent, List<AgentType> subAgents,
            Double confidence, int tokens, long durationMs, boolean memoryUsed, String status) {
        AgentUsage usage = new AgentUsage();
        usage.setSessionId(sessionId);
        usage.setUserId(userId);
        usage.setCaseId(caseId);
        usage.setAgentType(agent != null ? agent.value() : null);
        usage.setSubAgents(subAgents == null || subAgents.isEmpty() ? null
                : subAgents.stream().map(AgentType::value).collect(Collectors.joining(",")));
        usage.setConfidence(confidence);
        usage.setTokensUsed(tokens);
        usage.setDurationMs(durationMs);
        usage.setMemoryUsed(memoryUsed);
        usage.setStatus(status);
        try {
            usageService.record(usage);
        } catch (RuntimeException e) {
            log.warn("Usage record failed for session {}: {}", sessionId, e.getMessage());
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    private static Throwable unwrap(Throwable e) {
        Throwable t = e;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
