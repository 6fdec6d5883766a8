package com.imperium.cocounsel.ai.context;

import com.imperium.cocounsel.ai.memory.MemoryScope;
import com.imperium.cocounsel.ai.memory.SemanticFact;
import com.imperium.cocounsel.ai.memory.SemanticMemoryService;
import com.imperium.cocounsel.mapper.CaseSnapshotMapper;
import com.imperium.cocounsel.model.dto.agent.MatterContext;
import com.imperium.cocounsel.model.entity.CaseSnapshot;
import com.imperium.cocounsel.model.entity.ConversationTurn;
import com.imperium.cocounsel.model.enums.AgentType;
import com.imperium.cocounsel.service.ConversationTurnService;
import com.imperium.cocounsel.service.MemoryFactService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 上下文组装：案件快照 + 案件既有记忆、语义记忆命中、最近会话历史。只读。
 * <p>
 * 关系库查询失败直接抛出；语义记忆任何异常都降级为空串。
 */
@Component
public class ContextAssembler {

    private static final Logger log = LoggerFactory.getLogger(ContextAssembler.class);

    /** 每类既有记忆最多带入条数 */
    static final int PRIOR_FACTS_LIMIT = 5;

    private final CaseSnapshotMapper caseSnapshotMapper;
    private final MemoryFactService memoryFactService;
    private final ConversationTurnService conversationTurnService;
    private final SemanticMemoryService semanticMemoryService;

    @Value("${app.orchestrator.history-window:30}")
    private int historyWindow = 30;

    @Value("${app.orchestrator.semantic-limit:5}")
    private int semanticLimit = 5;

    public ContextAssembler(CaseSnapshotMapper caseSnapshotMapper,
            MemoryFactService memoryFactService,
            ConversationTurnService conversationTurnService,
            SemanticMemoryService semanticMemoryService) {
        this.caseSnapshotMapper = caseSnapshotMapper;
        this.memoryFactService = memoryFactService;
        this.conversationTurnService = conversationTurnService;
        this.semanticMemoryService = semanticMemoryService;
    }

    public AssembledContext assemble(String message, String sessionId, Long caseId, String userId) {
        MatterContext matter = loadMatter(caseId);
        String memoryText = recallSemantic(message, new MemoryScope(userId, caseId, sessionId));
        return new AssembledContext(matter, memoryText);
    }

    /**
     * 案件不存在时返回只带 caseId 的空快照，不中断请求。
     */
    public MatterContext loadMatter(Long caseId) {
        if (caseId == null) {
            return MatterContext.empty();
        }
        CaseSnapshot snapshot = caseSnapshotMapper.selectSnapshot(caseId);
        if (snapshot == null) {
            log.warn("Case {} not found, continuing without matter snapshot", caseId);
            return MatterContext.builder().caseId(caseId).build();
        }
        return MatterContext.builder()
                .caseId(caseId)
                .caseSnapshot(snapshot)
                .priorResearch(memoryFactService.latestForCase(caseId, AgentType.RESEARCHER, PRIOR_FACTS_LIMIT))
                .priorAnalysis(memoryFactService.latestForCase(caseId, AgentType.ANALYST, PRIOR_FACTS_LIMIT))
                .build();
    }

    /**
     * 形如 "[Memory 1] ..." 的多行文本；不可用、无命中或异常时为空串。
     */
    public String recallSemantic(String message, MemoryScope scope) {
        if (!semanticMemoryService.isEnabled() || message == null || message.isBlank()) {
            return "";
        }
        try {
            List<SemanticFact> facts = semanticMemoryService.search(message, scope, semanticLimit);
            if (facts == null || facts.isEmpty()) {
                return "";
            }
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < facts.size(); i++) {
                if (i > 0) {
                    sb.append('\n');
                }
                sb.append("[Memory ").append(i + 1).append("] ").append(facts.get(i).text());
            }
            return sb.toString();
        } catch (Exception e) {
            log.warn("Semantic memory lookup failed, continuing without it: {}", e.getMessage());
            return "";
        }
    }

    /**
     * 最近 N 轮，按时间正序。
     */
    public List<ConversationTurn> loadHistory(String sessionId) {
        return conversationTurnService.recentTurns(sessionId, historyWindow);
    }
}
