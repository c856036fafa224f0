package com.coursemapper.courses;

import com.coursemapper.domain.DomainModels.CatalogCourse;
import com.coursemapper.parsetree.ParseTreeModels.CourseList;
import com.coursemapper.parsetree.ParseTreeModels.CourseTriple;
import com.coursemapper.report.MappingReport;
import com.coursemapper.report.ReportChannel;
import com.coursemapper.support.InMemoryCurriculum;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class CourseListNormalizerTest {
    private InMemoryCurriculum curriculum;
    private CourseListNormalizer normalizer;
    private MappingReport report;
    private CatalogCourse bio100;
    private CatalogCourse bio101;
    private CatalogCourse bio102;

    @BeforeEach
    void setUp() {
        curriculum = new InMemoryCurriculum();
        bio100 = curriculum.course("QNS01", "BIO", "100", "Biology Seminar", "1");
        bio101 = curriculum.course("QNS01", "BIO", "101", "General Biology I", "3");
        bio102 = curriculum.course("QNS01", "BIO", "102", "General Biology II", "4");
        curriculum.course("QNS01", "CHEM", "101", "General Chemistry", "4");
        curriculum.course("BKL01", "BIO", "101", "Other College Biology", "3");
        normalizer = new CourseListNormalizer(curriculum);
        report = new MappingReport();
    }

    @Test
    void excludeIsSetDifference() {
        CourseList list = new CourseList(
                List.of(List.of(new CourseTriple("BIO", "1@", null))),
                List.of(new CourseTriple("BIO", "100", null)), List.of(), null);

        Set<String> ids = ids(normalizer.normalize("QNS01", "RA000001", list, report));

        assertEquals(Set.of(bio101.courseIdString(), bio102.courseIdString()), ids);
        assertFalse(ids.contains(bio100.courseIdString()));
        assertTrue(report.contains(ReportChannel.HANDLED, "Non-empty exclude list"));
    }

    @Test
    void flattensAreasAndDropsDuplicateScribes() {
        CourseList list = new CourseList(
                List.of(List.of(new CourseTriple("BIO", "101", null), new CourseTriple("BIO", "101", null)),
                        List.of(new CourseTriple("@", "101", null))),
                List.of(), List.of(), null);

        List<CanonicalCourse> courses = normalizer.normalize("QNS01", "RA000001", list, report);

        assertEquals(2, courses.size());
        assertEquals("BIO 101: General Biology I", courses.get(0).course());
        assertEquals("CHEM 101: General Chemistry", courses.get(1).course());
    }

    @Test
    void normalizingACanonicalCourseReturnsIt() {
        CourseList scribed = new CourseList(
                List.of(List.of(new CourseTriple("BIO", "101", "Grade >= C"))), List.of(), List.of(), null);
        CanonicalCourse first = normalizer.normalize("QNS01", "RA000001", scribed, report).get(0);

        CourseList canonical = new CourseList(
                List.of(List.of(new CourseTriple(bio101.discipline(), bio101.catalogNumber(), first.withClause()))),
                List.of(), List.of(), null);
        List<CanonicalCourse> again = normalizer.normalize("QNS01", "RA000001", canonical, report);

        assertEquals(List.of(first), again);
        assertEquals("grade >= c", first.withClause());
    }

    @Test
    void firstWithClauseWinsAndConflictIsReported() {
        CourseList list = new CourseList(
                List.of(List.of(new CourseTriple("BIO", "101", "DWResident=Y")),
                        List.of(new CourseTriple("BIO", "10@", "Grade >= B"))),
                List.of(), List.of(), null);

        List<CanonicalCourse> courses = normalizer.normalize("QNS01", "RA000001", list, report);

        assertEquals("dwresident=y", courses.stream().filter(c -> c.courseId().equals(bio101.courseIdString()))
                .findFirst().orElseThrow().withClause());
        assertEquals("grade >= b", courses.stream().filter(c -> c.courseId().equals(bio102.courseIdString()))
                .findFirst().orElseThrow().withClause());
        assertTrue(report.contains(ReportChannel.HANDLED, "Multiple with-clauses"));
    }

    @Test
    void termAndAttributeWithClausesAreDroppedButCoursesKept() {
        CourseList list = new CourseList(
                List.of(List.of(new CourseTriple("BIO", "101", "DWTerm = 1202"),
                        new CourseTriple("BIO", "102", "ATTRIBUTE=FCER"))),
                List.of(new CourseTriple("BIO", "100", "DWTerm = 1202")), List.of(), null);

        List<CanonicalCourse> courses = normalizer.normalize("QNS01", "RA000001", list, report);

        assertEquals(2, courses.size());
        assertTrue(courses.stream().allMatch(c -> c.withClause().isEmpty()));
        assertEquals(2, report.events(ReportChannel.IGNORED).stream()
                .filter(e -> e.message().startsWith("With-clause dropped")).count());
        assertTrue(report.contains(ReportChannel.IGNORED, "DWTerm"));
    }

    @Test
    void rangesAndInstitutionsAreRespected() {
        CourseList list = new CourseList(
                List.of(List.of(new CourseTriple("BIO", "101:200", null))), List.of(), List.of(), null);

        Set<String> ids = ids(normalizer.normalize("QNS01", "RA000001", list, report));

        assertEquals(Set.of(bio101.courseIdString(), bio102.courseIdString()), ids);
    }

    @Test
    void emptyResultIsValidAndIncludeListsAreOnlyLogged() {
        CourseList list = new CourseList(
                List.of(List.of(new CourseTriple("PHYS", "@", null))), List.of(),
                List.of(new CourseTriple("BIO", "101", null)), null);

        assertTrue(normalizer.normalize("QNS01", "RA000001", list, report).isEmpty());
        assertTrue(report.contains(ReportChannel.IGNORED, "include list"));
    }

    private static Set<String> ids(List<CanonicalCourse> courses) {
        return courses.stream().map(CanonicalCourse::courseId).collect(Collectors.toSet());
    }
}
