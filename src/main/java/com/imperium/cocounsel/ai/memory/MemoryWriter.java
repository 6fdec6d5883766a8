package com.imperium.cocounsel.ai.memory;

import com.imperium.cocounsel.model.dto.agent.MemoryUpdate;
import com.imperium.cocounsel.model.entity.MemoryFactRecord;
import com.imperium.cocounsel.model.enums.AgentType;
import com.imperium.cocounsel.service.MemoryFactService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 记忆写入：先写关系库（失败直接抛出），再尽力写语义库（失败只记日志）。
 */
@Component
public class MemoryWriter {

    private static final Logger log = LoggerFactory.getLogger(MemoryWriter.class);

    private final MemoryFactService memoryFactService;
    private final SemanticMemoryService semanticMemoryService;
    private final Clock clock;

    public MemoryWriter(MemoryFactService memoryFactService,
            SemanticMemoryService semanticMemoryService,
            Clock clock) {
        this.memoryFactService = memoryFactService;
        this.semanticMemoryService = semanticMemoryService;
        this.clock = clock;
    }

    /**
     * 写入专家给出的记忆候选。
     *
     * @return 已落库的记录；无候选时为空列表
     */
    public List<MemoryFactRecord> write(List<MemoryUpdate> updates, MemoryScope scope, String jurisdiction) {
        if (updates == null || updates.isEmpty()) {
            return List.of();
        }
        LocalDateTime now = LocalDateTime.now(clock);
        List<MemoryFactRecord> records = new ArrayList<>(updates.size());
        for (MemoryUpdate u : updates) {
            if (u == null || u.getValue() == null || u.getValue().isBlank()) {
                continue;
            }
            MemoryFactRecord record = new MemoryFactRecord();
            record.setId("mf_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16));
            record.setCaseId(scope.caseId());
            record.setSessionId(scope.sessionId());
            record.setUserId(scope.userId());
            record.setSourceAgent(u.getAgentType() != null ? u.getAgentType().value() : null);
            record.setMemoryKey(u.getKey() != null ? u.getKey() : "note");
            record.setMemoryValue(u.getValue());
            record.setConfidence(u.getConfidence());
            record.setJurisdiction(jurisdiction);
            record.setCreatedAt(now);
            records.add(record);
        }
        if (records.isEmpty()) {
            return List.of();
        }

        // 权威写入，异常向上抛
        memoryFactService.saveBatch(records);

        if (semanticMemoryService.isEnabled()) {
            for (MemoryFactRecord r : records) {
                indexSemantic(r, scope);
            }
        }
        return records;
    }

    private void indexSemantic(MemoryFactRecord record, MemoryScope scope) {
        String text = "[" + record.getMemoryKey() + "] " + record.getMemoryValue();
        try {
            semanticMemoryService.write(text, scope,
                    AgentType.fromValue(record.getSourceAgent()),
                    record.getJurisdiction(),
                    record.getConfidence() != null ? record.getConfidence() : 0.8);
        } catch (Exception e) {
            log.warn("Semantic memory write failed for {}: {}", record.getId(), e.getMessage());
        }
    }
}
