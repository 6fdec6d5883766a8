package com.imperium.cocounsel.controller;

import com.imperium.cocounsel.ai.memory.MemoryScope;
import com.imperium.cocounsel.ai.memory.SemanticFact;
import com.imperium.cocounsel.ai.memory.SemanticMemoryService;
import com.imperium.cocounsel.ai.memory.VectorStoreSemanticMemoryService;
import com.imperium.cocounsel.model.dto.response.MemorySearchResponse;
import com.imperium.cocounsel.model.dto.response.MemoryStatsResponse;
import com.imperium.cocounsel.model.entity.MemoryFactRecord;
import com.imperium.cocounsel.model.enums.AgentType;
import com.imperium.cocounsel.service.MemoryFactService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Agent 记忆接口：关系库记忆列表、记忆检索（语义优先，关键词回退）、记忆统计、语义记忆管理。
 */
@RestController
@RequestMapping("/api/v0/ai/memory")
@Tag(name = "Agent Memory", description = "共享案件记忆接口")
public class MemoryController {

    private static final Logger log = LoggerFactory.getLogger(MemoryController.class);

    static final String SOURCE_SEMANTIC = "semantic";
    static final String SOURCE_RELATIONAL = "relational";

    private static final int LIST_LIMIT = 50;
    private static final int SEARCH_LIMIT = 10;
    private static final int FALLBACK_LIST_LIMIT = 100;

    private final MemoryFactService memoryFactService;
    private final SemanticMemoryService semanticMemoryService;

    public MemoryController(MemoryFactService memoryFactService, SemanticMemoryService semanticMemoryService) {
        this.memoryFactService = memoryFactService;
        this.semanticMemoryService = semanticMemoryService;
    }

    @GetMapping
    @Operation(summary = "案件记忆", description = "按案件列出关系库中的记忆事实，可按 Agent 过滤")
    public ResponseEntity<?> list(
            @RequestHeader(value = ApiErrors.HEADER_USER_ID, required = false) String userId,
            @Parameter(description = "案件 ID", required = true)
            @RequestParam Long caseId,
            @Parameter(description = "researcher | drafter | analyst | strategist")
            @RequestParam(required = false) String agentType) {

        if (userId == null || userId.isBlank()) {
            return ApiErrors.missingUser();
        }
        AgentType type = AgentType.fromValue(agentType);
        if (agentType != null && !agentType.isBlank() && type == null) {
            return ApiErrors.error(HttpStatus.BAD_REQUEST, "invalid_argument", "Unknown agentType", "param", "agentType");
        }
        List<MemoryFactRecord> facts = memoryFactService.latestForCase(caseId, type, LIST_LIMIT);
        return ResponseEntity.ok(Map.of("caseId", caseId, "memories", facts));
    }

    @GetMapping("/search")
    @Operation(summary = "记忆检索", description = "语义库优先；不可用或无结果时回退到关系库关键词检索")
    public ResponseEntity<?> search(
            @RequestHeader(value = ApiErrors.HEADER_USER_ID, required = false) String userId,
            @Parameter(description = "检索词", required = true)
            @RequestParam("q") String query,
            @RequestParam(required = false) Long caseId) {

        if (userId == null || userId.isBlank()) {
            return ApiErrors.missingUser();
        }
        if (query == null || query.isBlank()) {
            return ApiErrors.error(HttpStatus.BAD_REQUEST, "invalid_argument", "q is required", "param", "q");
        }

        if (semanticMemoryService.isEnabled()) {
            try {
                List<SemanticFact> hits = semanticMemoryService.search(query, new MemoryScope(userId, caseId, null),
                        SEARCH_LIMIT);
                if (!hits.isEmpty()) {
                    return ResponseEntity.ok(MemorySearchResponse.builder()
                            .source(SOURCE_SEMANTIC)
                            .results(hits.stream().map(SemanticFact::text).toList())
                            .build());
                }
            } catch (Exception e) {
                log.warn("Semantic memory search failed, falling back to keyword search: {}", e.getMessage());
            }
        }

        List<String> results = memoryFactService.keywordSearch(query, caseId, SEARCH_LIMIT).stream()
                .map(f -> "[" + f.getMemoryKey() + "] " + f.getMemoryValue())
                .toList();
        return ResponseEntity.ok(MemorySearchResponse.builder().source(SOURCE_RELATIONAL).results(results).build());
    }

    @GetMapping("/semantic")
    @Operation(summary = "语义记忆列表", description = "列出当前调用者在语义库中的记忆")
    public ResponseEntity<?> listSemantic(
            @RequestHeader(value = ApiErrors.HEADER_USER_ID, required = false) String userId,
            @RequestParam(required = false) Long caseId) {

        if (userId == null || userId.isBlank()) {
            return ApiErrors.missingUser();
        }
        if (!semanticMemoryService.isEnabled()) {
            return ResponseEntity.ok(Map.of("enabled", false, "memories", List.of()));
        }
        try {
            List<SemanticFact> facts = semanticMemoryService.list(new MemoryScope(userId, caseId, null));
            return ResponseEntity.ok(Map.of("enabled", true, "source", SOURCE_SEMANTIC, "memories", facts));
        } catch (RuntimeException e) {
            log.warn("Semantic memory list failed, falling back to relational facts: {}", e.getMessage());
            List<MemoryFactRecord> facts = memoryFactService.latestForUser(userId, caseId, FALLBACK_LIST_LIMIT);
            return ResponseEntity.ok(Map.of("enabled", true, "source", SOURCE_RELATIONAL, "memories", facts));
        }
    }

    @GetMapping("/stats")
    @Operation(summary = "记忆统计", description = "关系库事实总数与按 Agent 分组；语义库启用时附带调用者的语义记忆统计")
    public ResponseEntity<?> stats(
            @RequestHeader(value = ApiErrors.HEADER_USER_ID, required = false) String userId) {

        if (userId == null || userId.isBlank()) {
            return ApiErrors.missingUser();
        }
        Map<String, Long> byAgent = memoryFactService.countBySourceAgent();
        long total = byAgent.values().stream().mapToLong(Long::longValue).sum();

        MemoryStatsResponse.Semantic semantic = new MemoryStatsResponse.Semantic(false, false, 0, Map.of());
        if (semanticMemoryService.isEnabled()) {
            try {
                List<SemanticFact> facts = semanticMemoryService.list(new MemoryScope(userId, null, null));
                Map<String, Long> semanticByAgent = facts.stream().collect(Collectors.groupingBy(
                        f -> String.valueOf(f.metadata().getOrDefault(
                                VectorStoreSemanticMemoryService.META_SOURCE_AGENT, "unknown")),
                        TreeMap::new, Collectors.counting()));
                semantic = new MemoryStatsResponse.Semantic(true, true, facts.size(), semanticByAgent);
            } catch (RuntimeException e) {
                log.warn("Semantic memory stats unavailable: {}", e.getMessage());
                semantic = new MemoryStatsResponse.Semantic(true, false, 0, Map.of());
            }
        }

        return ResponseEntity.ok(MemoryStatsResponse.builder()
                .relational(new MemoryStatsResponse.Relational(total, byAgent))
                .semantic(semantic)
                .build());
    }

    @DeleteMapping("/semantic/{memoryId}")
    @Operation(summary = "删除语义记忆")
    public ResponseEntity<?> deleteSemantic(
            @RequestHeader(value = ApiErrors.HEADER_USER_ID, required = false) String userId,
            @PathVariable String memoryId) {

        if (userId == null || userId.isBlank()) {
            return ApiErrors.missingUser();
        }
        if (!semanticMemoryService.isEnabled()) {
            return ApiErrors.error(HttpStatus.SERVICE_UNAVAILABLE, "semantic_memory_disabled",
                    "Semantic memory is not enabled", null, null);
        }
        try {
            semanticMemoryService.delete(memoryId);
        } catch (RuntimeException e) {
            log.warn("Semantic memory delete failed for {}: {}", memoryId, e.getMessage());
            return ApiErrors.error(HttpStatus.SERVICE_UNAVAILABLE, "semantic_memory_unavailable",
                    "Semantic memory is temporarily unavailable", "id", memoryId);
        }
        return ResponseEntity.ok(Map.of("deleted", true, "id", memoryId));
    }
}
