package com.imperium.cocounsel.model.enums;

import java.util.Locale;

/**
 * 专家 Agent 类别。声明顺序即同分时的排序顺序，不可随意调整。
 */
public enum AgentType {

    RESEARCHER("researcher", "Researcher", "🔍"),
    DRAFTER("drafter", "Drafter", "📝"),
    ANALYST("analyst", "Analyst", "🧠"),
    STRATEGIST("strategist", "Strategist", "🎯");

    private final String value;
    private final String displayName;
    private final String emoji;

    AgentType(String value, String displayName, String emoji) {
        this.value = value;
        this.displayName = displayName;
        this.emoji = emoji;
    }

    /** 落库与对外 JSON 使用的小写名称 */
    public String value() {
        return value;
    }

    public String displayName() {
        return displayName;
    }

    public String emoji() {
        return emoji;
    }

    /** 形如 "🔍 Researcher Agent" 的展示标签 */
    public String label() {
        return emoji + " " + displayName + " Agent";
    }

    /**
     * 宽松解析：大小写不敏感，无法识别时返回 null。
     */
    public static AgentType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (AgentType type : values()) {
            if (type.value.equals(v)) {
                return type;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return value;
    }
}
