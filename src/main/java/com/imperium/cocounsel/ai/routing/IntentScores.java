package com.imperium.cocounsel.ai.routing;

import com.imperium.cocounsel.model.enums.AgentType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 各类别最终得分。ranked() 按得分降序，同分保持 {@link AgentType} 声明顺序。
 */
public final class IntentScores {

    private final EnumMap<AgentType, Integer> scores;

    IntentScores(EnumMap<AgentType, Integer> scores) {
        this.scores = new EnumMap<>(scores);
    }

    public int of(AgentType type) {
        return scores.getOrDefault(type, 0);
    }

    public int total() {
        int sum = 0;
        for (int s : scores.values()) {
            sum += s;
        }
        return sum;
    }

    public List<Map.Entry<AgentType, Integer>> ranked() {
        List<Map.Entry<AgentType, Integer>> entries = new ArrayList<>(scores.entrySet());
        // List.sort 是稳定排序，EnumMap 迭代顺序即声明顺序
        entries.sort(Map.Entry.<AgentType, Integer>comparingByValue(Comparator.reverseOrder()));
        return Collections.unmodifiableList(entries);
    }

    public Map<AgentType, Integer> asMap() {
        return Collections.unmodifiableMap(scores);
    }
}
