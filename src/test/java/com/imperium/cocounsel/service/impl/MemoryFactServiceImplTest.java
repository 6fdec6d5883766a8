package com.imperium.cocounsel.service.impl;

import com.baomidou.mybatisplus.test.autoconfigure.MybatisPlusTest;
import com.imperium.cocounsel.model.entity.MemoryFactRecord;
import com.imperium.cocounsel.model.enums.AgentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.jdbc.Sql;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@MybatisPlusTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Sql("classpath:schema.sql")
@Import(MemoryFactServiceImpl.class)
class MemoryFactServiceImplTest {

    @Autowired
    private MemoryFactServiceImpl service;

    private static MemoryFactRecord fact(String id, Long caseId, AgentType agent, String key, String value, int minute) {
        MemoryFactRecord r = new MemoryFactRecord();
        r.setId(id);
        r.setCaseId(caseId);
        r.setUserId("u1");
        r.setSourceAgent(agent.value());
        r.setMemoryKey(key);
        r.setMemoryValue(value);
        r.setConfidence(0.8);
        r.setJurisdiction("kansas");
        r.setCreatedAt(LocalDateTime.of(2026, 3, 14, 10, minute));
        return r;
    }

    @BeforeEach
    void seed() {
        service.saveBatch(List.of(
                fact("m1", 42L, AgentType.RESEARCHER, "research_sol", "Two-year SOL under K.S.A. 60-513", 0),
                fact("m2", 42L, AgentType.ANALYST, "analysis_fault", "Kansas 50% comparative fault bar applies", 1),
                fact("m3", 42L, AgentType.RESEARCHER, "research_venue", "Venue proper in Johnson County", 2),
                fact("m4", 7L, AgentType.RESEARCHER, "research_sol", "Five-year SOL under RSMo 516.120", 3)));
    }

    @Test
    void latestForCaseIsNewestFirstAndFiltered() {
        List<MemoryFactRecord> research = service.latestForCase(42L, AgentType.RESEARCHER, 5);

        assertThat(research).extracting(MemoryFactRecord::getId).containsExactly("m3", "m1");
        assertThat(service.latestForCase(42L, null, 5)).hasSize(3);
        assertThat(service.latestForCase(42L, null, 1)).extracting(MemoryFactRecord::getId).containsExactly("m3");
        assertThat(service.latestForCase(null, null, 5)).isEmpty();
    }

    @Test
    void keywordSearchMatchesValueOrKey() {
        assertThat(service.keywordSearch("SOL", null, 10)).extracting(MemoryFactRecord::getId)
                .containsExactlyInAnyOrder("m1", "m4");
        assertThat(service.keywordSearch("venue", 42L, 10)).extracting(MemoryFactRecord::getId)
                .containsExactly("m3");
        assertThat(service.keywordSearch("SOL", 7L, 10)).extracting(MemoryFactRecord::getId)
                .containsExactly("m4");
        assertThat(service.keywordSearch(" ", null, 10)).isEmpty();
    }

    @Test
    void latestForUserIsScopedAndNewestFirst() {
        MemoryFactRecord other = fact("m5", 42L, AgentType.DRAFTER, "draft_motion", "Motion outline", 4);
        other.setUserId("u2");
        service.save(other);

        assertThat(service.latestForUser("u1", null, 10)).extracting(MemoryFactRecord::getId)
                .containsExactly("m4", "m3", "m2", "m1");
        assertThat(service.latestForUser("u1", 42L, 10)).extracting(MemoryFactRecord::getId)
                .containsExactly("m3", "m2", "m1");
        assertThat(service.latestForUser(" ", null, 10)).isEmpty();
    }

    @Test
    void countBySourceAgentGroupsFacts() {
        assertThat(service.countBySourceAgent())
                .containsExactly(Map.entry("analyst", 1L), Map.entry("researcher", 3L));
    }
}
