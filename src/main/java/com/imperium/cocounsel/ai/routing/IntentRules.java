package com.imperium.cocounsel.ai.routing;

import com.imperium.cocounsel.model.enums.AgentType;

import java.util.ArrayList;
import java.util.List;

import static com.imperium.cocounsel.model.enums.AgentType.ANALYST;
import static com.imperium.cocounsel.model.enums.AgentType.DRAFTER;
import static com.imperium.cocounsel.model.enums.AgentType.RESEARCHER;
import static com.imperium.cocounsel.model.enums.AgentType.STRATEGIST;

/**
 * 默认路由规则表（Kansas / Missouri 双法域）。
 * 关键词命中 +3；高特异性正则 +3 ~ +6。类别间独立累加，一条消息可同时抬高多个类别。
 */
public final class IntentRules {

    public static final int KEYWORD_WEIGHT = 3;

    /** 上一轮 assistant 所用 Agent 的连续性加分 */
    public static final int CONTINUITY_BONUS = 2;

    private static final List<String> RESEARCHER_KEYWORDS = List.of(
            "research", "case law", "precedent", "statute", "find", "search", "cite", "citation",
            "authority", "holding", "ruling", "sol", "limitation", "rule", "regulation", "code", "preemption");

    private static final List<String> DRAFTER_KEYWORDS = List.of(
            "draft", "write", "prepare", "create", "generate", "motion", "complaint", "letter", "brief",
            "contract", "agreement", "petition", "template", "engagement", "demand", "discovery request");

    private static final List<String> ANALYST_KEYWORDS = List.of(
            "risk", "assess", "evaluat", "analyz", "review", "strength", "weakness", "exposure", "damage",
            "inconsisten", "deposition", "enforceab", "score", "audit", "calculate", "comparative fault");

    private static final List<String> STRATEGIST_KEYWORDS = List.of(
            "strateg", "settle", "settlement", "timeline", "calendar", "deadline", "budget", "scenario",
            "option", "plan", "mediat", "arbitrat", "trial", "recommend", "proactive", "missing",
            "next step", "appeal");

    private static final List<RoutingRule> DEFAULTS = build();

    private IntentRules() {}

    public static List<RoutingRule> defaults() {
        return DEFAULTS;
    }

    private static List<RoutingRule> build() {
        List<RoutingRule> rules = new ArrayList<>();
        addKeywords(rules, RESEARCHER, RESEARCHER_KEYWORDS);
        // Kansas 成文法引用
        rules.add(RoutingRule.pattern(RESEARCHER, "k\\.?s\\.?a\\.?\\s|kansas\\sstatute|chapter\\s60|10th\\scircuit", 6));
        // Missouri 成文法引用
        rules.add(RoutingRule.pattern(RESEARCHER,
                "rsmo\\s|r\\.?s\\.?mo\\.?\\s|missouri\\sstatute|missouri\\ssupreme\\scourt\\srule|8th\\scircuit", 6));
        rules.add(RoutingRule.pattern(RESEARCHER, "sol\\b|statute\\s+of\\s+limitation|60-513|2[- ]year", 4));
        rules.add(RoutingRule.pattern(RESEARCHER, "50%\\s*bar|comparative\\s+fault|60-258a|proportional\\s+fault", 4));
        rules.add(RoutingRule.pattern(RESEARCHER, "516\\.120|5[- ]year\\s+sol|five[- ]year", 4));
        rules.add(RoutingRule.pattern(RESEARCHER, "pure\\s+comparative|537\\.765|537\\.067|joint\\s+(and|&)\\s+several", 4));
        rules.add(RoutingRule.pattern(RESEARCHER, "fact\\s+plead|esi\\b|proportionality|discovery\\s+cost", 3));
        rules.add(RoutingRule.pattern(RESEARCHER, "what\\s+(is|are)\\s+the\\s+(law|rule|statute|standard)", 4));

        addKeywords(rules, DRAFTER, DRAFTER_KEYWORDS);
        rules.add(RoutingRule.pattern(DRAFTER, "draft\\s+(a|the|my)\\s", 5));
        rules.add(RoutingRule.pattern(DRAFTER, "motion\\s+to\\s+(dismiss|compel|strike|suppress)", 6));

        addKeywords(rules, ANALYST, ANALYST_KEYWORDS);
        rules.add(RoutingRule.pattern(ANALYST, "risk\\s+assess", 5));
        rules.add(RoutingRule.pattern(ANALYST, "strength.+weakness|weakness.+strength", 5));
        rules.add(RoutingRule.pattern(ANALYST, "what\\s+am\\s+i\\s+missing", 4));
        rules.add(RoutingRule.pattern(ANALYST, "50%\\s+bar|pure\\s+comparative|comparative\\s+fault", 4));

        addKeywords(rules, STRATEGIST, STRATEGIST_KEYWORDS);
        rules.add(RoutingRule.pattern(STRATEGIST, "propose\\s+\\d+\\s+", 5));
        rules.add(RoutingRule.pattern(STRATEGIST, "what\\s+(should|can)\\s+(i|we)\\s+do", 4));
        rules.add(RoutingRule.pattern(STRATEGIST, "pros?\\s+(and|&)\\s+cons?", 5));
        rules.add(RoutingRule.pattern(STRATEGIST, "what\\s+am\\s+i\\s+missing", 5));
        return List.copyOf(rules);
    }

    private static void addKeywords(List<RoutingRule> rules, AgentType category, List<String> keywords) {
        for (String k : keywords) {
            rules.add(RoutingRule.keyword(category, k, KEYWORD_WEIGHT));
        }
    }
}
