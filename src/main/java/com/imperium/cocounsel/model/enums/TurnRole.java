package com.imperium.cocounsel.model.enums;

/**
 * 会话轮次角色，落库为小写字符串。
 */
public enum TurnRole {

    USER("user"),
    ASSISTANT("assistant");

    private final String value;

    TurnRole(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
