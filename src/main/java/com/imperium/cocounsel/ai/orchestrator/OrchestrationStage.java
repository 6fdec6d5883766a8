package com.imperium.cocounsel.ai.orchestrator;

/**
 * 对外可见的失败阶段，不暴露内部细节。
 */
public enum OrchestrationStage {

    CLASSIFICATION("classification"),
    CONTEXT_ASSEMBLY("context_assembly"),
    GENERATION("generation"),
    PERSISTENCE("persistence");

    private final String value;

    OrchestrationStage(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
