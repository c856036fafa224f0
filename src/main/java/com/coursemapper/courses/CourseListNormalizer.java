package com.coursemapper.courses;

import com.coursemapper.domain.DomainModels.CatalogCourse;
import com.coursemapper.parsetree.ParseTreeModels.CourseList;
import com.coursemapper.parsetree.ParseTreeModels.CourseTriple;
import com.coursemapper.report.MappingReport;
import com.coursemapper.report.ReportChannel;
import com.coursemapper.store.CatalogLookup;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Resolves a scribed course list against the catalog. Scribed areas are flattened, wildcards and
 * ranges expanded, the exclude list subtracted. With-clauses are spread over every course their
 * pattern expanded to; the first one seen for a course wins.
 */
@Component
public class CourseListNormalizer {
    private final CatalogLookup catalog;

    public CourseListNormalizer(CatalogLookup catalog) {
        this.catalog = catalog;
    }

    /** Returns the resolved courses ordered by course id; an empty list is a valid result. */
    public List<CanonicalCourse> normalize(String institution, String requirementId, CourseList courseList,
                                           MappingReport report) {
        if (courseList == null) return List.of();
        if (!courseList.include().isEmpty()) {
            report.record(ReportChannel.IGNORED, institution, requirementId, "Non-empty include list (ignored)");
        }
        if (courseList.scribedAreas().size() > 1) {
            report.record(ReportChannel.HANDLED, institution, requirementId,
                    "Course list with " + courseList.scribedAreas().size() + " areas flattened");
        }

        Set<CourseTriple> scribed = new LinkedHashSet<>();
        courseList.scribedAreas().forEach(scribed::addAll);

        Map<String, CatalogCourse> included = new TreeMap<>();
        Map<String, String> withClauses = new HashMap<>();
        for (CourseTriple triple : scribed) {
            String withClause = durableWithClause(institution, requirementId, triple.withClause(), report);
            for (CatalogCourse course : catalog.expand(institution, triple.discipline(), triple.catalogNumber())) {
                String id = course.courseIdString();
                included.putIfAbsent(id, course);
                if (withClause == null) continue;
                String previous = withClauses.putIfAbsent(id, withClause);
                if (previous != null && !previous.equals(withClause)) {
                    report.record(ReportChannel.HANDLED, institution, requirementId,
                            "Multiple with-clauses for " + id + ": kept '" + previous + "', dropped '" + withClause + "'");
                }
            }
        }

        Set<String> excluded = new HashSet<>();
        for (CourseTriple triple : new LinkedHashSet<>(courseList.exclude())) {
            logExcludeWithClause(institution, requirementId, triple.withClause(), report);
            catalog.expand(institution, triple.discipline(), triple.catalogNumber())
                    .forEach(c -> excluded.add(c.courseIdString()));
        }
        if (!excluded.isEmpty()) {
            report.record(ReportChannel.HANDLED, institution, requirementId, "Non-empty exclude list");
        }
        included.keySet().removeAll(excluded);

        List<CanonicalCourse> result = new ArrayList<>(included.size());
        included.forEach((id, course) -> result.add(CanonicalCourse.of(course, withClauses.get(id))));
        return result;
    }

    /** Lower-cased with-clause, or null when absent or scoped to a term or course attribute. */
    private String durableWithClause(String institution, String requirementId, String withClause,
                                     MappingReport report) {
        if (withClause == null || withClause.isBlank()) return null;
        String lower = withClause.toLowerCase(Locale.ROOT).trim();
        if (lower.contains("dwterm") || lower.contains("attribute")) {
            report.record(ReportChannel.IGNORED, institution, requirementId, "With-clause dropped: " + lower);
            return null;
        }
        return lower;
    }

    private void logExcludeWithClause(String institution, String requirementId, String withClause,
                                      MappingReport report) {
        if (withClause == null || withClause.isBlank()) return;
        if (withClause.toLowerCase(Locale.ROOT).contains("dwterm")) {
            report.record(ReportChannel.IGNORED, institution, requirementId, "Exclude course based on DWTerm (ignored)");
        } else {
            report.record(ReportChannel.TODO, institution, requirementId, "Exclude with " + withClause);
        }
    }
}
