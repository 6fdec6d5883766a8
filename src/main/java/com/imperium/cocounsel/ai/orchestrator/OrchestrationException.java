package com.imperium.cocounsel.ai.orchestrator;

/**
 * 编排关键步骤失败。保留原始 cause，message 只描述阶段，可直接返回给调用方。
 */
public class OrchestrationException extends RuntimeException {

    private final OrchestrationStage stage;

    public OrchestrationException(OrchestrationStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public OrchestrationStage getStage() {
        return stage;
    }
}
