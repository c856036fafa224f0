package com.coursemapper.store;

import com.coursemapper.domain.DomainModels.CourseMappingRow;
import com.coursemapper.domain.DomainModels.ProgramRow;
import com.coursemapper.domain.DomainModels.RequirementRow;

/** Sink for the three output streams. Rows are appended in emission order by a single writer. */
public interface MappingOutput {

    /** Discards the output of any previous run. */
    void reset();

    void writeProgram(ProgramRow row);

    void writeRequirement(RequirementRow row);

    void writeCourseMapping(CourseMappingRow row);
}
