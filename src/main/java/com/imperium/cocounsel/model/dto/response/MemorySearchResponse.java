package com.imperium.cocounsel.model.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 记忆检索结果。source 表示由哪一侧给出：semantic | relational。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemorySearchResponse {

    private String source;
    private List<String> results;
}
