package com.coursemapper.repository;

import com.coursemapper.domain.DomainModels.RequirementBlock;
import com.coursemapper.store.BlockStore;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class RequirementBlockJdbcRepository implements BlockStore {
    private static final String COLUMNS =
            "institution, requirement_id, block_type, block_value, title, period_start, period_stop, major1, parse_tree";
    private static final RowMapper<RequirementBlock> BLOCK = (rs, n) -> new RequirementBlock(
            rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4), rs.getString(5),
            rs.getString(6), rs.getString(7), rs.getString(8), rs.getString(9));

    private final JdbcTemplate jdbcTemplate;

    public RequirementBlockJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<RequirementBlock> findActive(String institution, String blockType, String blockValue) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM requirement_blocks WHERE active = TRUE AND institution = ? AND block_type = ? AND block_value = ? ORDER BY requirement_id",
                BLOCK, institution, blockType, blockValue);
    }

    @Override
    public Optional<RequirementBlock> findCurrent(String institution, String requirementId) {
        List<RequirementBlock> rows = jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM requirement_blocks WHERE institution = ? AND requirement_id = ? AND period_stop LIKE '9%'",
                BLOCK, institution, requirementId);
        return rows.size() == 1 ? Optional.of(rows.get(0)) : Optional.empty();
    }

    public void save(RequirementBlock b) {
        jdbcTemplate.update(
                "MERGE INTO requirement_blocks(" + COLUMNS + ", active) KEY(institution, requirement_id) VALUES (?,?,?,?,?,?,?,?,?,?)",
                b.institution(), b.requirementId(), b.blockType(), b.blockValue(), b.title(),
                b.periodStart(), b.periodStop(), b.discriminator(), b.parseTreeJson(), true);
    }

    public void deactivate(String institution, String requirementId) {
        jdbcTemplate.update("UPDATE requirement_blocks SET active = FALSE WHERE institution = ? AND requirement_id = ?",
                institution, requirementId);
    }
}
