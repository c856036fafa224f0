package com.coursemapper.exception;

/**
 * Thrown when a parse tree has a shape the interpreter does not model: a node that is not a
 * single-key record, or a body rule kind nothing handles. Aborts the run.
 */
public class StructuralException extends RuntimeException {

    private final String institution;
    private final String requirementId;
    private final String node;

    public StructuralException(String institution, String requirementId, String node, String message) {
        super(institution + " " + requirementId + ": " + message + " [" + node + "]");
        this.institution = institution;
        this.requirementId = requirementId;
        this.node = node;
    }

    public String getInstitution() {
        return institution;
    }

    public String getRequirementId() {
        return requirementId;
    }

    public String getNode() {
        return node;
    }
}
