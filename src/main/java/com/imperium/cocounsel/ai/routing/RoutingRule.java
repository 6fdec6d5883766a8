package com.imperium.cocounsel.ai.routing;

import com.imperium.cocounsel.model.enums.AgentType;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 路由规则表中的一行：{类别, 关键词或正则, 权重}。
 * 关键词按小写子串匹配；正则大小写不敏感、find 语义。
 */
public record RoutingRule(AgentType category, String keyword, Pattern pattern, int weight) {

    public RoutingRule {
        Objects.requireNonNull(category, "category");
        if ((keyword == null) == (pattern == null)) {
            throw new IllegalArgumentException("exactly one of keyword or pattern must be set");
        }
        if (weight <= 0) {
            throw new IllegalArgumentException("weight must be positive: " + weight);
        }
    }

    public static RoutingRule keyword(AgentType category, String keyword, int weight) {
        return new RoutingRule(category, keyword.toLowerCase(Locale.ROOT), null, weight);
    }

    public static RoutingRule pattern(AgentType category, String regex, int weight) {
        return new RoutingRule(category, null, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), weight);
    }

    /**
     * @param normalizedMessage 已转小写的消息
     */
    public boolean matches(String normalizedMessage) {
        if (keyword != null) {
            return normalizedMessage.contains(keyword);
        }
        return pattern.matcher(normalizedMessage).find();
    }

    public String describe() {
        return category.value() + ":" + (keyword != null ? keyword : "/" + pattern.pattern() + "/") + "(+" + weight + ")";
    }
}
