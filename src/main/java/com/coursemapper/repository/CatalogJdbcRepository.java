package com.coursemapper.repository;

import com.coursemapper.courses.CatalogNumberPattern;
import com.coursemapper.domain.DomainModels.CatalogCourse;
import com.coursemapper.store.CatalogLookup;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Active catalog courses. Patterns are matched in memory against the institution's courses, which
 * are loaded once; expansions are cached per pattern.
 */
@Repository
public class CatalogJdbcRepository implements CatalogLookup {
    private static final RowMapper<CatalogCourse> COURSE = (rs, n) -> new CatalogCourse(
            rs.getInt(1), rs.getInt(2), rs.getString(3), rs.getString(4),
            rs.getString(5), rs.getString(6), rs.getString(7));

    private final JdbcTemplate jdbcTemplate;
    private final Map<String, List<CatalogCourse>> institutionCourses = new ConcurrentHashMap<>();
    private final Map<String, List<CatalogCourse>> expansions = new ConcurrentHashMap<>();

    public CatalogJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<CatalogCourse> expand(String institution, String disciplinePattern, String catalogNumberPattern) {
        String key = institution + "|" + disciplinePattern + "|" + catalogNumberPattern;
        return expansions.computeIfAbsent(key, k -> {
            CatalogNumberPattern discipline = CatalogNumberPattern.of(disciplinePattern);
            CatalogNumberPattern catalogNumber = CatalogNumberPattern.of(catalogNumberPattern);
            return courses(institution).stream()
                    .filter(c -> discipline.test(c.discipline()) && catalogNumber.test(c.catalogNumber()))
                    .toList();
        });
    }

    public void save(String institution, CatalogCourse c, boolean active) {
        jdbcTemplate.update(
                "MERGE INTO courses(institution, course_id, offer_nbr, title, credits, career, discipline, catalog_number, course_status) KEY(course_id, offer_nbr) VALUES (?,?,?,?,?,?,?,?,?)",
                institution, c.courseId(), c.offerNumber(), c.title(), c.credits(), c.career(),
                c.discipline(), c.catalogNumber(), active ? "A" : "I");
        institutionCourses.remove(institution);
        expansions.clear();
    }

    private List<CatalogCourse> courses(String institution) {
        return institutionCourses.computeIfAbsent(institution, i -> jdbcTemplate.query(
                "SELECT course_id, offer_nbr, title, credits, career, discipline, catalog_number FROM courses WHERE institution = ? AND course_status = 'A' ORDER BY course_id, offer_nbr",
                COURSE, i));
    }
}
