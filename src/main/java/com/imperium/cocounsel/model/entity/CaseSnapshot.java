package com.imperium.cocounsel.model.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 案件快照（只读），由 cases_matters 联表 clients / users_attorneys 查询得到。
 * 案件本身由外部模块维护，这里不映射表。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class CaseSnapshot {

    private Long id;
    private String caseNumber;
    private String title;
    private String caseType;
    private String status;
    private String priority;
    private String clientName;
    private String clientType;
    private String attorneyName;
    private String courtName;
    private String judgeName;
    private String opposingCounsel;
    private String opposingParty;
    private String dateFiled;
    private Double estimatedValue;
    private String statuteOfLimitations;
    private String description;
}
