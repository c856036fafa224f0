package com.coursemapper.courses;

import com.coursemapper.domain.DomainModels.CatalogCourse;

/**
 * A catalog-resolved course as it appears in a requirement's mappings. Two records are the same
 * course when their {@code courseId} strings match, whatever triple produced them.
 */
public record CanonicalCourse(String courseId, String course, String title, String credits,
                              String career, String withClause) {

    public static CanonicalCourse of(CatalogCourse c, String withClause) {
        return new CanonicalCourse(c.courseIdString(),
                c.discipline() + " " + c.catalogNumber() + ": " + c.title(),
                c.title(), c.credits(), c.career(), withClause == null ? "" : withClause);
    }
}
