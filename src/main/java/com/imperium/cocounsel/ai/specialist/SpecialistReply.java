package com.imperium.cocounsel.ai.specialist;

import com.imperium.cocounsel.model.dto.agent.Citation;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 模型结构化输出，由 BeanOutputConverter 生成 JSON Schema 并反序列化。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SpecialistReply {

    /** Markdown 正文 */
    private String content;
    private List<Citation> citations = new ArrayList<>();
    private List<String> risksFlagged = new ArrayList<>();
    private List<String> followUpActions = new ArrayList<>();
    private List<Note> memoryUpdates = new ArrayList<>();

    /**
     * 值得长期记住的事实。
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Note {
        private String key;
        private String value;
        private double confidence;
    }
}
