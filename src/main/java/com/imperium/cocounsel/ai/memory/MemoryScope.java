package com.imperium.cocounsel.ai.memory;

/**
 * 语义记忆的归属范围。userId 必填；caseId 为空表示不限定案件。
 */
public record MemoryScope(String userId, Long caseId, String sessionId) {

    public MemoryScope {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required for memory scope");
        }
    }

    public static MemoryScope ofUser(String userId) {
        return new MemoryScope(userId, null, null);
    }

    public boolean hasCase() {
        return caseId != null;
    }
}
