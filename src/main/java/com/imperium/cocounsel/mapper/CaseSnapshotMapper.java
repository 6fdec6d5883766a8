package com.imperium.cocounsel.mapper;

import com.imperium.cocounsel.model.entity.CaseSnapshot;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

/**
 * 只读访问外部案件模块的表。
 */
public interface CaseSnapshotMapper {

    @Select("""
            SELECT cm.id, cm.case_number, cm.title, cm.case_type, cm.status, cm.priority,
                   CONCAT(c.first_name, ' ', c.last_name) AS client_name, c.client_type,
                   u.full_name AS attorney_name, cm.court_name, cm.judge_name,
                   cm.opposing_counsel, cm.opposing_party, cm.date_filed, cm.estimated_value,
                   cm.statute_of_limitations, cm.description
            FROM cases_matters cm
            LEFT JOIN clients c ON cm.client_id = c.id
            LEFT JOIN users_attorneys u ON cm.lead_attorney_id = u.id
            WHERE cm.id = #{caseId}
            """)
    CaseSnapshot selectSnapshot(@Param("caseId") Long caseId);
}
