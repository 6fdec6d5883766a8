package com.imperium.cocounsel.model.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 记忆统计：关系库总数与按 Agent 分组；语义库仅在启用且可达时给出总数。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemoryStatsResponse {

    private Relational relational;
    private Semantic semantic;

    public record Relational(long total, Map<String, Long> byAgent) {}

    /** available=false 表示已启用但本次查询失败 */
    public record Semantic(boolean enabled, boolean available, long total, Map<String, Long> byAgent) {}
}
