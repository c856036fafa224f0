package com.coursemapper.repository;

import com.coursemapper.domain.DomainModels.BlockId;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Set;

@Repository
public class QuarantineJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public QuarantineJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /** The quarantined blocks as of now; a run never sees later changes. */
    public Set<BlockId> snapshot() {
        return Set.copyOf(jdbcTemplate.query(
                "SELECT institution, requirement_id FROM quarantined_blocks",
                (rs, n) -> new BlockId(rs.getString(1), rs.getString(2))));
    }

    public void quarantine(BlockId id, String reason) {
        jdbcTemplate.update(
                "MERGE INTO quarantined_blocks(institution, requirement_id, reason) KEY(institution, requirement_id) VALUES (?,?,?)",
                id.institution(), id.requirementId(), reason);
    }
}
