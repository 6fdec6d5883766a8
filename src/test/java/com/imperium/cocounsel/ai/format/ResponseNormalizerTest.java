package com.imperium.cocounsel.ai.format;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.imperium.cocounsel.model.dto.agent.AgentRoute;
import com.imperium.cocounsel.model.dto.agent.MatterContext;
import com.imperium.cocounsel.model.entity.CaseSnapshot;
import com.imperium.cocounsel.model.enums.AgentType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseNormalizerTest {

    private static final LocalDate DATE = LocalDate.of(2026, 3, 14);

    private final ResponseNormalizer normalizer =
            new ResponseNormalizer(new ObjectMapper(), ResponseNormalizer.DEFAULT_CLOSING_LINE);

    private static final AgentRoute ROUTE = new AgentRoute(AgentType.RESEARCHER, 0.85, List.of(), "test");

    private static ResponseFrame generalFrame() {
        return new ResponseFrame(ROUTE, List.of(AgentType.RESEARCHER), false, "kansas", MatterContext.empty(), DATE);
    }

    private static ResponseFrame matterFrame() {
        CaseSnapshot snapshot = new CaseSnapshot();
        snapshot.setId(42L);
        snapshot.setCaseNumber("2026-CV-0042");
        snapshot.setCaseType("personal_injury");
        snapshot.setClientName("Acme Freight");
        snapshot.setStatus("active");
        snapshot.setDateFiled("2026-01-05");
        MatterContext matter = MatterContext.builder().caseId(42L).caseSnapshot(snapshot).build();
        AgentRoute route = new AgentRoute(AgentType.ANALYST, 0.75, List.of(AgentType.STRATEGIST), "test");
        return new ResponseFrame(route, List.of(AgentType.ANALYST, AgentType.STRATEGIST), true, "missouri", matter, DATE);
    }

    private static int occurrences(String haystack, String needle) {
        int count = 0;
        int idx = haystack.indexOf(needle);
        while (idx >= 0) {
            count++;
            idx = haystack.indexOf(needle, idx + needle.length());
        }
        return count;
    }

    @Nested
    @DisplayName("段落补全")
    class Sections {

        @Test
        void addsAllSectionsToBareContent() {
            String out = normalizer.normalize("Body text", generalFrame());

            assertThat(out).startsWith("> 🔍 **Researcher Agent** (85% confidence)\n\nBody text");
            assertThat(out).contains("### 6. Agents Used\n🔍 Researcher Agent");
            assertThat(out).contains("\n\n---\n" + ResponseNormalizer.DISCLAIMER);
            assertThat(out).contains(ResponseNormalizer.DEFAULT_CLOSING_LINE);
            assertThat(out).endsWith("<small>Date: 2026-03-14 | Jurisdiction: Kansas | Matter: General</small>");
        }

        @Test
        void headerShowsCoRoutingAndMemory() {
            String out = normalizer.normalize("Body", matterFrame());

            assertThat(out).startsWith("> 🧠 **Analyst Agent** (75% confidence) → co-routed: 🎯 strategist | 💾 Memory loaded");
            assertThat(out).contains("🧠 Analyst Agent, 🎯 Strategist Agent");
            assertThat(out).endsWith("| Jurisdiction: Missouri | Matter: 2026-CV-0042</small>");
        }

        @Test
        void existingDisclaimerAndClosingAreNotDuplicated() {
            String content = "Body\n\n" + ResponseNormalizer.DISCLAIMER + "\n\n" + ResponseNormalizer.DEFAULT_CLOSING_LINE;

            String out = normalizer.normalize(content, generalFrame());

            assertThat(occurrences(out, ResponseNormalizer.DISCLAIMER_MARKER)).isEqualTo(1);
            assertThat(occurrences(out, ResponseNormalizer.DEFAULT_CLOSING_LINE)).isEqualTo(1);
        }

        @Test
        void legacyClosingIsRewritten() {
            String out = normalizer.normalize("Body\n\n" + ResponseNormalizer.LEGACY_CLOSING_LINE, generalFrame());

            assertThat(out).doesNotContain(ResponseNormalizer.LEGACY_CLOSING_LINE);
            assertThat(occurrences(out, ResponseNormalizer.DEFAULT_CLOSING_LINE)).isEqualTo(1);
        }

        @Test
        void configuredClosingLineIsUsed() {
            ResponseNormalizer custom = new ResponseNormalizer(new ObjectMapper(), "Anything else, counsel?");

            String out = custom.normalize("Body " + ResponseNormalizer.LEGACY_CLOSING_LINE, generalFrame());

            assertThat(out).contains("Anything else, counsel?");
            assertThat(out).doesNotContain(ResponseNormalizer.DEFAULT_CLOSING_LINE);
        }
    }

    @Nested
    @DisplayName("占位符")
    class Placeholders {

        @Test
        void dateAndJurisdictionAreSubstituted() {
            String out = normalizer.normalize(
                    "As of {{current_date}} in {{matter_jurisdiction}}", generalFrame());

            assertThat(out).contains("As of 2026-03-14 in Kansas");
            assertThat(out).doesNotContain("{{");
        }

        @Test
        void matterJsonIsNullWithoutCase() {
            String out = normalizer.normalize("Matter: {{full_matter_json}}", generalFrame());

            assertThat(out).contains("Matter: null");
        }

        @Test
        void matterJsonRendersSnapshot() {
            String out = normalizer.normalize("Matter: {{full_matter_json}}", matterFrame());

            assertThat(out).contains("\"case_id\":42")
                    .contains("\"case_number\":\"2026-CV-0042\"")
                    .contains("\"jurisdiction\":\"Missouri\"");
        }
    }

    @Nested
    @DisplayName("幂等")
    class Idempotence {

        @Test
        void normalizingTwiceChangesNothing() {
            String once = normalizer.normalize("Body with {{current_date}}", matterFrame());
            String twice = normalizer.normalize(once, matterFrame());

            assertThat(twice).isEqualTo(once);
        }

        @Test
        void generalFrameIsIdempotentToo() {
            String once = normalizer.normalize("Short answer", generalFrame());

            assertThat(normalizer.normalize(once, generalFrame())).isEqualTo(once);
        }
    }

    @Test
    void jurisdictionLabelsFallBackToMultiState() {
        assertThat(JurisdictionLabels.label("federal")).isEqualTo("US Federal");
        assertThat(JurisdictionLabels.label("both")).isEqualTo(JurisdictionLabels.MULTI_STATE);
        assertThat(JurisdictionLabels.label(null)).isEqualTo(JurisdictionLabels.MULTI_STATE);
        assertThat(JurisdictionLabels.normalize("  ")).isEqualTo("both");
        assertThat(JurisdictionLabels.normalize("Kansas")).isEqualTo("kansas");
    }
}
