package com.coursemapper.store;

import com.coursemapper.domain.DomainModels.CatalogCourse;

import java.util.List;

public interface CatalogLookup {

    /**
     * Active courses matching a scribed discipline and catalog number. Either pattern may use
     * {@code @} as a wildcard; a catalog number of the form {@code lo:hi} is a numeric range.
     */
    List<CatalogCourse> expand(String institution, String disciplinePattern, String catalogNumberPattern);
}
