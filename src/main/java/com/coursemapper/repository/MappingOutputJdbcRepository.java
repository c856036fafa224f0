package com.coursemapper.repository;

import com.coursemapper.domain.DomainModels.CourseMappingRow;
import com.coursemapper.domain.DomainModels.ProgramRow;
import com.coursemapper.domain.DomainModels.RequirementRow;
import com.coursemapper.store.MappingOutput;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class MappingOutputJdbcRepository implements MappingOutput {
    private final JdbcTemplate jdbcTemplate;

    public MappingOutputJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void reset() {
        jdbcTemplate.update("DELETE FROM mapper_course_mappings");
        jdbcTemplate.update("DELETE FROM mapper_requirements");
        jdbcTemplate.update("DELETE FROM mapper_programs");
    }

    @Override
    public void writeProgram(ProgramRow r) {
        jdbcTemplate.update(
                "MERGE INTO mapper_programs(institution, requirement_id, block_type, block_value, title, total_credits, max_transfer, min_residency, min_grade, min_gpa, other, generated_date) KEY(institution, requirement_id) VALUES (?,?,?,?,?,?,?,?,?,?,?,?)",
                r.institution(), r.requirementId(), r.blockType(), r.blockValue(), r.title(),
                r.totalCredits(), r.maxTransfer(), r.minResidency(), r.minGrade(), r.minGpa(), r.other(),
                r.generatedDate());
    }

    @Override
    public void writeRequirement(RequirementRow r) {
        jdbcTemplate.update(
                "INSERT INTO mapper_requirements(institution, plan_name, plan_type, subplan_name, requirement_ids, conditions, requirement_key, program_name, context, generated_date) VALUES (?,?,?,?,?,?,?,?,?,?)",
                r.institution(), r.planName(), r.planType(), r.subplanName(), r.requirementIds(), r.conditions(),
                r.requirementKey(), r.programName(), r.context(), r.generatedDate());
    }

    @Override
    public void writeCourseMapping(CourseMappingRow r) {
        jdbcTemplate.update(
                "MERGE INTO mapper_course_mappings(requirement_key, course_id, career, course, with_clause, generated_date) KEY(requirement_key, course_id, with_clause) VALUES (?,?,?,?,?,?)",
                r.requirementKey(), r.courseId(), r.career(), r.course(), r.withClause(), r.generatedDate());
    }

    public List<ProgramRow> findPrograms() {
        return jdbcTemplate.query(
                "SELECT institution, requirement_id, block_type, block_value, title, total_credits, max_transfer, min_residency, min_grade, min_gpa, other, generated_date FROM mapper_programs ORDER BY institution, requirement_id",
                (rs, n) -> new ProgramRow(rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4),
                        rs.getString(5), rs.getString(6), rs.getString(7), rs.getString(8), rs.getString(9),
                        rs.getString(10), rs.getString(11), rs.getString(12)));
    }

    public List<RequirementRow> findRequirements() {
        return jdbcTemplate.query(
                "SELECT institution, plan_name, plan_type, subplan_name, requirement_ids, conditions, requirement_key, program_name, context, generated_date FROM mapper_requirements ORDER BY requirement_key",
                (rs, n) -> new RequirementRow(rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4),
                        rs.getString(5), rs.getString(6), rs.getInt(7), rs.getString(8), rs.getString(9),
                        rs.getString(10)));
    }

    public List<CourseMappingRow> findCourseMappings(int requirementKey) {
        return jdbcTemplate.query(
                "SELECT requirement_key, course_id, career, course, with_clause, generated_date FROM mapper_course_mappings WHERE requirement_key = ? ORDER BY course_id",
                (rs, n) -> new CourseMappingRow(rs.getInt(1), rs.getString(2), rs.getString(3), rs.getString(4),
                        rs.getString(5), rs.getString(6)),
                requirementKey);
    }
}
