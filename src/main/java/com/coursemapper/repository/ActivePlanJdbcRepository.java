package com.coursemapper.repository;

import com.coursemapper.domain.DomainModels.ActivePlan;
import com.coursemapper.domain.DomainModels.PlanDescriptor;
import com.coursemapper.domain.DomainModels.RequirementBlock;
import com.coursemapper.domain.DomainModels.SubplanDescriptor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.*;

/**
 * Plans with an active requirement block, each with its subplans whose blocks are active too.
 * Ordered by institution and plan so that requirement keys are stable between runs.
 */
@Repository
public class ActivePlanJdbcRepository {
    private static final String PLAN_SQL = """
            SELECT p.institution, p.plan, p.plan_type, p.description, p.effective_date, p.cip_code,
                   p.active_terms, p.enrollment,
                   b.requirement_id, b.block_type, b.block_value, b.title, b.period_start, b.period_stop, b.major1, b.parse_tree
              FROM acad_plans p
              JOIN requirement_blocks b ON b.institution = p.institution AND b.requirement_id = p.requirement_id
             WHERE b.active = TRUE
            """;
    private static final String SUBPLAN_SQL = """
            SELECT s.subplan, s.subplan_type, s.description, s.effective_date, s.cip_code,
                   s.active_terms, s.enrollment,
                   b.institution, b.requirement_id, b.block_type, b.block_value, b.title, b.period_start, b.period_stop, b.major1, b.parse_tree
              FROM acad_subplans s
              JOIN requirement_blocks b ON b.institution = s.institution AND b.requirement_id = s.requirement_id
             WHERE b.active = TRUE AND s.institution = ? AND s.plan = ?
             ORDER BY s.subplan
            """;

    private final JdbcTemplate jdbcTemplate;

    public ActivePlanJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /** All active plans, or those of the given institutions when the list is not empty. */
    public List<ActivePlan> findActivePlans(Collection<String> institutions) {
        List<Object> args = new ArrayList<>();
        StringBuilder sql = new StringBuilder(PLAN_SQL);
        if (institutions != null && !institutions.isEmpty()) {
            sql.append(" AND p.institution IN (").append(String.join(",", Collections.nCopies(institutions.size(), "?"))).append(")");
            args.addAll(institutions);
        }
        sql.append(" ORDER BY p.institution, p.plan");

        List<PlanRow> rows = jdbcTemplate.query(sql.toString(), (rs, n) -> new PlanRow(
                rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4), rs.getString(5), rs.getString(6),
                rs.getInt(7), rs.getInt(8),
                new RequirementBlock(rs.getString(1), rs.getString(9), rs.getString(10), rs.getString(11),
                        rs.getString(12), rs.getString(13), rs.getString(14), rs.getString(15), rs.getString(16))),
                args.toArray());

        return rows.stream()
                .map(r -> new ActivePlan(new PlanDescriptor(r.plan(), r.planType(), r.description(), r.effectiveDate(),
                        r.cipCode(), r.activeTerms(), r.enrollment(), subplans(r.institution(), r.plan())), r.block()))
                .toList();
    }

    private List<SubplanDescriptor> subplans(String institution, String plan) {
        return jdbcTemplate.query(SUBPLAN_SQL, (rs, n) -> new SubplanDescriptor(
                rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4), rs.getString(5),
                rs.getInt(6), rs.getInt(7),
                new RequirementBlock(rs.getString(8), rs.getString(9), rs.getString(10), rs.getString(11),
                        rs.getString(12), rs.getString(13), rs.getString(14), rs.getString(15), rs.getString(16))),
                institution, plan);
    }

    public void savePlan(String institution, PlanDescriptor plan, String requirementId) {
        jdbcTemplate.update(
                "MERGE INTO acad_plans(institution, plan, plan_type, description, effective_date, cip_code, requirement_id, active_terms, enrollment) KEY(institution, plan) VALUES (?,?,?,?,?,?,?,?,?)",
                institution, plan.planName(), plan.planType(), plan.description(), plan.effectiveDate(),
                plan.cipCode(), requirementId, plan.activeTerms(), plan.enrollment());
        plan.subplans().forEach(s -> jdbcTemplate.update(
                "MERGE INTO acad_subplans(institution, plan, subplan, subplan_type, description, effective_date, cip_code, requirement_id, active_terms, enrollment) KEY(institution, plan, subplan) VALUES (?,?,?,?,?,?,?,?,?,?)",
                institution, plan.planName(), s.subplanName(), s.subplanType(), s.description(), s.effectiveDate(),
                s.cipCode(), s.block().requirementId(), s.activeTerms(), s.enrollment()));
    }

    private record PlanRow(String institution, String plan, String planType, String description, String effectiveDate,
                           String cipCode, int activeTerms, int enrollment, RequirementBlock block) {}
}
