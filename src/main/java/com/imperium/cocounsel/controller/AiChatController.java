package com.imperium.cocounsel.controller;

import com.imperium.cocounsel.ai.orchestrator.OrchestrationEngine;
import com.imperium.cocounsel.ai.orchestrator.OrchestrationResult;
import com.imperium.cocounsel.config.RequestIdSupport;
import com.imperium.cocounsel.model.dto.agent.AgentOutput;
import com.imperium.cocounsel.model.dto.request.ChatRequest;
import com.imperium.cocounsel.model.dto.response.ChatHistoryResponse;
import com.imperium.cocounsel.model.dto.response.ChatReplyResponse;
import com.imperium.cocounsel.model.dto.response.TurnDto;
import com.imperium.cocounsel.model.entity.AgentUsage;
import com.imperium.cocounsel.model.entity.ChatSession;
import com.imperium.cocounsel.model.entity.ConversationTurn;
import com.imperium.cocounsel.model.enums.AgentType;
import com.imperium.cocounsel.policy.RateLimitPolicy;
import com.imperium.cocounsel.service.ChatSessionService;
import com.imperium.cocounsel.service.ConversationTurnService;
import com.imperium.cocounsel.service.UsageService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * AI 对话接口：编排问答、会话历史、最近会话、清空会话、用量日志与统计。
 */
@RestController
@RequestMapping("/api/v0/ai")
@Tag(name = "AI Co-Counsel", description = "多 Agent 法律问答接口")
public class AiChatController {

    private static final int HISTORY_LIMIT_MAX = 100;
    private static final int LOGS_LIMIT_MAX = 100;
    private static final int SESSIONS_LIMIT = 20;

    private final OrchestrationEngine orchestrationEngine;
    private final ConversationTurnService conversationTurnService;
    private final ChatSessionService chatSessionService;
    private final UsageService usageService;
    private final RateLimitPolicy rateLimitPolicy;

    public AiChatController(OrchestrationEngine orchestrationEngine,
            ConversationTurnService conversationTurnService,
            ChatSessionService chatSessionService,
            UsageService usageService,
            RateLimitPolicy rateLimitPolicy) {
        this.orchestrationEngine = orchestrationEngine;
        this.conversationTurnService = conversationTurnService;
        this.chatSessionService = chatSessionService;
        this.usageService = usageService;
        this.rateLimitPolicy = rateLimitPolicy;
    }

    /**
     * 同步问答：分类 → 专家 → 合并 → 规范化，返回正文与路由元数据。
     */
    @PostMapping("/chat")
    @Operation(summary = "提问", description = "路由到专家 Agent 并返回合并后的回答，必须携带 X-User-Id")
    public ResponseEntity<?> chat(
            @Parameter(description = "调用者标识", required = true)
            @RequestHeader(value = ApiErrors.HEADER_USER_ID, required = false) String userId,
            @Valid @RequestBody ChatRequest body,
            HttpServletRequest request) {

        if (userId == null || userId.isBlank()) {
            return ApiErrors.missingUser();
        }
        if (!rateLimitPolicy.allow(userId, request.getRemoteAddr())) {
            return ApiErrors.error(HttpStatus.TOO_MANY_REQUESTS, "rate_limited", "Too many requests", null, null);
        }

        OrchestrationResult result = orchestrationEngine.handle(body.getMessage(), body.getSessionId(),
                body.getCaseId(), body.getJurisdiction(), userId);
        AgentOutput out = result.output();

        return ResponseEntity.ok(ChatReplyResponse.builder()
                .requestId(RequestIdSupport.resolve(request))
                .sessionId(result.sessionId())
                .content(out.getContent())
                .agentType(out.getAgentType().value())
                .confidence(result.route().confidence())
                .subAgents(out.getSubAgentsCalled().stream().map(AgentType::value).toList())
                .routingReasoning(result.route().reasoning())
                .tokensUsed(out.getTokensUsed())
                .durationMs(out.getDurationMs())
                .citations(out.getCitations())
                .risksFlagged(out.getRisksFlagged())
                .followUpActions(out.getFollowUpActions())
                .memoryUsed(result.memoryUsed())
                .build());
    }

    @GetMapping("/chat/history")
    @Operation(summary = "会话历史", description = "按时间正序返回会话轮次，最多 100 条；传 caseId 时只含该案件或未绑定案件的轮次")
    public ResponseEntity<?> history(
            @RequestHeader(value = ApiErrors.HEADER_USER_ID, required = false) String userId,
            @Parameter(description = "会话 ID", required = true)
            @RequestParam String sessionId,
            @Parameter(description = "案件 ID")
            @RequestParam(required = false) Long caseId,
            @Parameter(description = "条数，默认 100，最大 100")
            @RequestParam(defaultValue = "100") int limit) {

        if (userId == null || userId.isBlank()) {
            return ApiErrors.missingUser();
        }
        int safeLimit = Math.max(1, Math.min(limit, HISTORY_LIMIT_MAX));
        List<TurnDto> turns = conversationTurnService.listForSession(sessionId, caseId, safeLimit).stream()
                .map(AiChatController::toDto)
                .toList();
        return ResponseEntity.ok(ChatHistoryResponse.builder().sessionId(sessionId).turns(turns).build());
    }

    @DeleteMapping("/chat/{sessionId}")
    @Operation(summary = "清空会话", description = "删除该会话全部轮次；会话元数据保留")
    public ResponseEntity<?> clear(
            @RequestHeader(value = ApiErrors.HEADER_USER_ID, required = false) String userId,
            @PathVariable String sessionId) {

        if (userId == null || userId.isBlank()) {
            return ApiErrors.missingUser();
        }
        long deleted = conversationTurnService.clearSession(sessionId);
        return ResponseEntity.ok(Map.of("sessionId", sessionId, "deleted", deleted));
    }

    @GetMapping("/sessions")
    @Operation(summary = "最近会话", description = "调用者最近活跃的 20 个会话，按更新时间倒序")
    public ResponseEntity<?> sessions(
            @RequestHeader(value = ApiErrors.HEADER_USER_ID, required = false) String userId) {

        if (userId == null || userId.isBlank()) {
            return ApiErrors.missingUser();
        }
        List<ChatSession> sessions = chatSessionService.recentForUser(userId, SESSIONS_LIMIT);
        return ResponseEntity.ok(Map.of("sessions", sessions));
    }

    @GetMapping("/logs")
    @Operation(summary = "用量日志", description = "最近的编排请求记录，可按案件与 Agent 过滤")
    public ResponseEntity<?> logs(
            @RequestHeader(value = ApiErrors.HEADER_USER_ID, required = false) String userId,
            @RequestParam(required = false) Long caseId,
            @RequestParam(required = false) String agentType,
            @RequestParam(defaultValue = "50") int limit) {

        if (userId == null || userId.isBlank()) {
            return ApiErrors.missingUser();
        }
        List<AgentUsage> logs = usageService.recent(caseId, agentType, Math.max(1, Math.min(limit, LOGS_LIMIT_MAX)));
        return ResponseEntity.ok(Map.of("logs", logs));
    }

    @GetMapping("/stats")
    @Operation(summary = "用量统计", description = "总请求数、总 token、按 Agent 分组、最近 5 条")
    public ResponseEntity<?> stats(
            @RequestHeader(value = ApiErrors.HEADER_USER_ID, required = false) String userId) {
        if (userId == null || userId.isBlank()) {
            return ApiErrors.missingUser();
        }
        return ResponseEntity.ok(usageService.stats());
    }

    private static TurnDto toDto(ConversationTurn t) {
        List<String> subAgents = t.getSubAgents() == null || t.getSubAgents().isBlank()
                ? List.of()
                : Arrays.stream(t.getSubAgents().split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
        return TurnDto.builder()
                .id(t.getId())
                .role(t.getRole())
                .content(t.getContent())
                .agentType(t.getAgentType())
                .confidence(t.getConfidence())
                .subAgents(subAgents)
                .tokensUsed(t.getTokensUsed())
                .durationMs(t.getDurationMs())
                .createdAt(t.getCreatedAt())
                .build();
    }
}
