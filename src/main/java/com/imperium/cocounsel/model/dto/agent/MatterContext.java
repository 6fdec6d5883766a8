package com.imperium.cocounsel.model.dto.agent;

import com.imperium.cocounsel.model.entity.CaseSnapshot;
import com.imperium.cocounsel.model.entity.MemoryFactRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 每次请求重新组装的案件上下文，只读，不落库。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatterContext {

    /** 请求携带的案件ID，可空 */
    private Long caseId;

    /** 案件快照；未选案件或案件不存在时为 null */
    private CaseSnapshot caseSnapshot;

    /** 该案件最近的 researcher 记忆 */
    @Builder.Default
    private List<MemoryFactRecord> priorResearch = List.of();

    /** 该案件最近的 analyst 记忆 */
    @Builder.Default
    private List<MemoryFactRecord> priorAnalysis = List.of();

    public static MatterContext empty() {
        return MatterContext.builder().build();
    }

    public boolean hasCase() {
        return caseSnapshot != null;
    }
}
