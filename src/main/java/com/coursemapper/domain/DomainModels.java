package com.coursemapper.domain;

import java.util.List;

public class DomainModels {
    public record BlockId(String institution, String requirementId) {
        @Override
        public String toString() {
            return institution + " " + requirementId;
        }
    }

    /**
     * A requirement block as stored. {@code discriminator} is the field used to pick one block when
     * several active blocks share a block type and value; {@code parseTreeJson} may be null or "{}"
     * when the block has not been parsed yet.
     */
    public record RequirementBlock(String institution, String requirementId,
                                   String blockType, String blockValue, String title,
                                   String periodStart, String periodStop,
                                   String discriminator, String parseTreeJson) {
        public BlockId id() {
            return new BlockId(institution, requirementId);
        }

        public String catalogYears() {
            return (periodStart == null ? "" : periodStart) + "-" + (periodStop == null ? "" : periodStop);
        }
    }

    public record PlanDescriptor(String planName, String planType, String description,
                                 String effectiveDate, String cipCode,
                                 int activeTerms, int enrollment,
                                 List<SubplanDescriptor> subplans) {}

    public record SubplanDescriptor(String subplanName, String subplanType, String description,
                                    String effectiveDate, String cipCode,
                                    int activeTerms, int enrollment,
                                    RequirementBlock block) {}

    public record ActivePlan(PlanDescriptor plan, RequirementBlock block) {}

    public record CatalogCourse(int courseId, int offerNumber, String title, String credits,
                                String career, String discipline, String catalogNumber) {
        public String courseIdString() {
            return String.format("%06d:%d", courseId, offerNumber);
        }
    }

    public record ProgramRow(String institution, String requirementId, String blockType, String blockValue,
                             String title, String totalCredits, String maxTransfer, String minResidency,
                             String minGrade, String minGpa, String other, String generatedDate) {}

    public record RequirementRow(String institution, String planName, String planType, String subplanName,
                                 String requirementIds, String conditions, int requirementKey,
                                 String programName, String context, String generatedDate) {}

    public record CourseMappingRow(int requirementKey, String courseId, String career, String course,
                                   String withClause, String generatedDate) {}
}
