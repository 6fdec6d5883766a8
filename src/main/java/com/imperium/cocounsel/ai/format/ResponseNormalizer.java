package com.imperium.cocounsel.ai.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.imperium.cocounsel.model.dto.agent.AgentRoute;
import com.imperium.cocounsel.model.dto.agent.MatterContext;
import com.imperium.cocounsel.model.entity.CaseSnapshot;
import com.imperium.cocounsel.model.enums.AgentType;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 最终输出的一次性规范化：路由头、占位符替换、Agents Used、免责声明、结束语、元数据页脚。
 * <p>
 * 幂等：对已规范化的文本再次执行结果不变。各段是否已存在在开头一次性判定。
 */
@Component
public class ResponseNormalizer {

    public static final String DISCLAIMER_MARKER = "Human review required";
    public static final String DISCLAIMER = "⚠️ **Human review required.** This AI-generated analysis is for attorney "
            + "work product only and does not constitute legal advice.";
    public static final String DEFAULT_CLOSING_LINE = "How else can I assist as your Kansas-Missouri AI Co-Counsel today?";
    public static final String LEGACY_CLOSING_LINE = "How else can I assist as your Kansas-Missouri AI partner today?";
    public static final String AGENTS_USED_MARKER = "Agents Used";

    static final String PLACEHOLDER_DATE = "{{current_date}}";
    static final String PLACEHOLDER_JURISDICTION = "{{matter_jurisdiction}}";
    static final String PLACEHOLDER_MATTER_JSON = "{{full_matter_json}}";

    private final ObjectMapper objectMapper;
    private final String closingLine;

    public ResponseNormalizer(ObjectMapper objectMapper,
            @Value("${app.response.closing-line:" + DEFAULT_CLOSING_LINE + "}") String closingLine) {
        this.objectMapper = objectMapper;
        this.closingLine = closingLine;
    }

    public String normalize(String content, ResponseFrame frame) {
        String body = content == null ? "" : content;
        String jurisdictionLabel = JurisdictionLabels.label(frame.jurisdiction());
        String header = routingHeader(frame.route(), frame.memoryUsed());
        String footer = footer(frame, jurisdictionLabel);

        body = body.replace(LEGACY_CLOSING_LINE, closingLine);

        boolean hasHeader = body.startsWith(header);
        boolean hasAgentsUsed = body.contains(AGENTS_USED_MARKER);
        boolean hasDisclaimer = body.contains(DISCLAIMER_MARKER);
        boolean hasClosing = body.contains(closingLine);
        boolean hasFooter = body.contains(footer);

        StringBuilder sb = new StringBuilder();
        if (!hasHeader) {
            sb.append(header).append("\n\n");
        }
        sb.append(body.replace(PLACEHOLDER_DATE, frame.date().toString())
                .replace(PLACEHOLDER_JURISDICTION, jurisdictionLabel)
                .replace(PLACEHOLDER_MATTER_JSON, matterJson(frame.matter(), jurisdictionLabel)));

        if (!hasAgentsUsed && !frame.agentsUsed().isEmpty()) {
            sb.append("\n\n### 6. Agents Used\n")
                    .append(frame.agentsUsed().stream().map(AgentType::label).collect(Collectors.joining(", ")));
        }
        if (!hasDisclaimer) {
            sb.append("\n\n---\n").append(DISCLAIMER);
        }
        if (!hasClosing) {
            sb.append("\n\n").append(closingLine);
        }
        if (!hasFooter) {
            sb.append("\n\n").append(footer);
        }
        return sb.toString();
    }

    /**
     * 形如 "> 🔍 **Researcher Agent** (85% confidence) → co-routed: 🧠 analyst | 💾 Memory loaded"。
     */
    static String routingHeader(AgentRoute route, boolean memoryUsed) {
        AgentType agent = route.agent();
        StringBuilder sb = new StringBuilder("> ")
                .append(agent.emoji()).append(" **").append(agent.displayName()).append(" Agent** (")
                .append(Math.round(route.confidence() * 100)).append("% confidence)");
        if (route.isCoRouted()) {
            sb.append(" → co-routed: ")
                    .append(route.subAgents().stream()
                            .map(a -> a.emoji() + " " + a.value())
                            .collect(Collectors.joining(", ")));
        }
        if (memoryUsed) {
            sb.append(" | 💾 Memory loaded");
        }
        return sb.toString();
    }

    private static String footer(ResponseFrame frame, String jurisdictionLabel) {
        CaseSnapshot snapshot = frame.matter().getCaseSnapshot();
        String matterRef = snapshot != null && snapshot.getCaseNumber() != null ? snapshot.getCaseNumber() : "General";
        return "<small>Date: " + frame.date() + " | Jurisdiction: " + jurisdictionLabel
                + " | Matter: " + matterRef + "</small>";
    }

    private String matterJson(MatterContext matter, String jurisdictionLabel) {
        if (matter.getCaseId() == null) {
            return "null";
        }
        CaseSnapshot c = matter.getCaseSnapshot();
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("case_id", c != null && c.getId() != null ? c.getId() : matter.getCaseId());
        json.put("case_number", c != null ? c.getCaseNumber() : null);
        json.put("case_type", c != null ? c.getCaseType() : null);
        json.put("client_name", c != null ? c.getClientName() : null);
        json.put("status", c != null ? c.getStatus() : null);
        json.put("jurisdiction", jurisdictionLabel);
        json.put("date_filed", c != null ? c.getDateFiled() : null);
        try {
            return objectMapper.writeValueAsString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render matter placeholder", e);
        }
    }
}
