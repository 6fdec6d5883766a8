package com.imperium.cocounsel.ai.context;

import com.imperium.cocounsel.model.dto.agent.MatterContext;
import com.imperium.cocounsel.model.entity.CaseSnapshot;
import com.imperium.cocounsel.model.entity.MemoryFactRecord;

import java.text.NumberFormat;
import java.util.List;
import java.util.Locale;

/**
 * 把案件上下文渲染为交给专家的提示文本。
 */
public final class MatterContextFormatter {

    public static final String NO_MATTER = "[No matter currently selected - providing general analysis]";

    private static final int PRIOR_NOTES_SHOWN = 3;
    private static final int PRIOR_NOTE_CHARS = 200;

    private MatterContextFormatter() {}

    public static String format(MatterContext matter) {
        if (matter == null || !matter.hasCase()) {
            return NO_MATTER;
        }
        CaseSnapshot c = matter.getCaseSnapshot();
        StringBuilder sb = new StringBuilder()
                .append("====== CURRENT MATTER CONTEXT ======\n")
                .append("Case: ").append(c.getCaseNumber()).append(" - ").append(c.getTitle()).append('\n')
                .append("Type: ").append(c.getCaseType())
                .append(" | Status: ").append(c.getStatus())
                .append(" | Priority: ").append(c.getPriority()).append('\n')
                .append("Client: ").append(c.getClientName()).append(" (").append(c.getClientType()).append(")\n")
                .append("Lead Attorney: ").append(c.getAttorneyName()).append('\n')
                .append("Court: ").append(orNa(c.getCourtName()))
                .append(" | Judge: ").append(orNa(c.getJudgeName())).append('\n')
                .append("Opposing Counsel: ").append(orNa(c.getOpposingCounsel())).append('\n')
                .append("Opposing Party: ").append(orNa(c.getOpposingParty())).append('\n')
                .append("Filed: ").append(orNa(c.getDateFiled())).append('\n')
                .append("Est. Value: ").append(money(c.getEstimatedValue())).append('\n')
                .append("SOL: ").append(c.getStatuteOfLimitations() != null && !c.getStatuteOfLimitations().isBlank()
                        ? c.getStatuteOfLimitations()
                        : "Not set - VERIFY IMMEDIATELY").append('\n')
                .append("Description: ").append(orNa(c.getDescription()));

        appendNotes(sb, "Prior Research Notes", matter.getPriorResearch());
        appendNotes(sb, "Prior Analysis Notes", matter.getPriorAnalysis());
        return sb.toString();
    }

    private static void appendNotes(StringBuilder sb, String title, List<MemoryFactRecord> notes) {
        if (notes == null || notes.isEmpty()) {
            return;
        }
        sb.append("\n\n-- ").append(title).append(" --");
        notes.stream().limit(PRIOR_NOTES_SHOWN).forEach(n -> {
            String value = n.getMemoryValue() != null ? n.getMemoryValue() : "";
            if (value.length() > PRIOR_NOTE_CHARS) {
                value = value.substring(0, PRIOR_NOTE_CHARS) + "...";
            }
            sb.append("\n- [").append(n.getMemoryKey() != null ? n.getMemoryKey() : "note").append("] ").append(value);
        });
    }

    private static String orNa(String v) {
        return v == null || v.isBlank() ? "N/A" : v;
    }

    private static String money(Double v) {
        if (v == null || v == 0d) {
            return "N/A";
        }
        return "$" + NumberFormat.getNumberInstance(Locale.US).format(v);
    }
}
