package com.coursemapper.parsetree;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Typed view of a requirement block's parse tree. Body rules and header items are closed
 * hierarchies; whatever the reader cannot classify arrives as {@link Unrecognized} or
 * {@link UnrecognizedHeader} so the interpreter decides whether it is fatal.
 */
public class ParseTreeModels {

    /** {@code body} is null when the tree has no body_list at all. */
    public record ParseTree(List<HeaderItem> header, List<BodyRule> body, String error) {
        public static ParseTree failed(String error) {
            return new ParseTree(List.of(), List.of(), error);
        }

        public boolean hasError() {
            return error != null;
        }
    }

    public record CourseTriple(String discipline, String catalogNumber, String withClause) {}

    public record CourseList(List<List<CourseTriple>> scribedAreas,
                             List<CourseTriple> exclude,
                             List<CourseTriple> include,
                             String label) {
        public int scribedCount() {
            return scribedAreas.stream().mapToInt(List::size).sum();
        }
    }

    /** Qualifiers carried by a labelled rule: max-transfer copied as scribed, min-grade as a letter. */
    public record Restrictions(JsonNode maxTransfer, String minGrade) {
        public static final Restrictions NONE = new Restrictions(null, null);
    }

    // Body rules -------------------------------------------------------------------------------

    public sealed interface BodyRule permits RuleList, Remark, BlockRef, BlockTypeRef, ClassCredit,
            CourseListRule, Conditional, CopyRules, GroupRequirement, Subset, SubsetQualifier,
            ProxyAdvice, RuleComplete, NonCourse, Unrecognized {
        String kind();
    }

    public record RuleList(List<BodyRule> rules) implements BodyRule {
        public String kind() { return "list"; }
    }

    public record Remark(String text) implements BodyRule {
        public String kind() { return "remark"; }
    }

    public record BlockRef(String label, int number, String institution, String blockType, String blockValue,
                           Restrictions restrictions) implements BodyRule {
        public String kind() { return "block"; }
    }

    public record BlockTypeRef(String label, int number, String blockType,
                               Restrictions restrictions) implements BodyRule {
        public String kind() { return "blocktype"; }
    }

    public record ClassCredit(String label, Integer minClasses, Integer maxClasses,
                              Double minCredits, Double maxCredits, String conjunction,
                              Integer allowClasses, Double allowCredits,
                              CourseList courseList, Restrictions restrictions) implements BodyRule {
        public String kind() { return "class_credit"; }
    }

    public record CourseListRule(String label, CourseList courseList, Restrictions restrictions) implements BodyRule {
        public String kind() { return "course_list_rule"; }
    }

    /** {@code ifFalse} is null when the conditional has no else leg. */
    public record Conditional(String condition, List<BodyRule> ifTrue, List<BodyRule> ifFalse) implements BodyRule {
        public String kind() { return "conditional"; }
    }

    public record CopyRules(String label, String institution, String requirementId) implements BodyRule {
        public String kind() { return "copy_rules"; }
    }

    public record GroupRequirement(String label, int numRequired, List<List<BodyRule>> groups,
                                   Restrictions restrictions) implements BodyRule {
        public String kind() { return "group_requirement"; }
    }

    public record Subset(String label, List<BodyRule> rules, String remark, JsonNode proxyAdvice,
                         Restrictions restrictions) implements BodyRule {
        public String kind() { return "subset"; }
    }

    /** Qualifier kinds that only occur inside a subset and carry nothing to map. */
    public record SubsetQualifier(String kind, JsonNode value) implements BodyRule {}

    public record ProxyAdvice(JsonNode advice) implements BodyRule {
        public String kind() { return "proxy_advice"; }
    }

    public record RuleComplete(boolean complete) implements BodyRule {
        public String kind() { return "rule_complete"; }
    }

    public record NonCourse(String label) implements BodyRule {
        public String kind() { return "noncourse"; }
    }

    public record Unrecognized(String kind, JsonNode value) implements BodyRule {}

    // Header items -----------------------------------------------------------------------------

    public sealed interface HeaderItem permits HeaderClassCredit, HeaderMaxTransfer, HeaderMinResidency,
            HeaderMinGpa, HeaderMinGrade, HeaderCourseLimit, HeaderQualifier, HeaderProxyAdvice,
            HeaderRemark, HeaderConditional, IgnoredHeader, UnrecognizedHeader {
        String kind();
    }

    public record HeaderClassCredit(String label, Integer minClasses, Integer maxClasses,
                                    Double minCredits, Double maxCredits, String conjunction,
                                    boolean pseudo, JsonNode proxyAdvice) implements HeaderItem {
        public String kind() { return "header_class_credit"; }
    }

    public record HeaderMaxTransfer(String label, double number, String classOrCredit,
                                    JsonNode transferTypes) implements HeaderItem {
        public String kind() { return "header_maxtransfer"; }
    }

    public record HeaderMinResidency(String label, Integer minClasses, Double minCredits) implements HeaderItem {
        public String kind() { return "header_minres"; }
    }

    public record HeaderMinGpa(String label, JsonNode mingpa) implements HeaderItem {
        public String kind() { return "header_mingpa"; }
    }

    public record HeaderMinGrade(String label, double number, JsonNode mingrade) implements HeaderItem {
        public String kind() { return "header_mingrade"; }
    }

    /** header_maxclass or header_maxcredit: a numeric cap over a course list. */
    public record HeaderCourseLimit(String kind, String label, double number, CourseList courseList) implements HeaderItem {}

    /** header_maxpassfail, header_maxperdisc, header_minclass, header_mincredit, header_minperdisc. */
    public record HeaderQualifier(String kind, String label, JsonNode value) implements HeaderItem {}

    public record HeaderProxyAdvice(JsonNode advice) implements HeaderItem {
        public String kind() { return "proxy_advice"; }
    }

    public record HeaderRemark(String text) implements HeaderItem {
        public String kind() { return "remark"; }
    }

    public record HeaderConditional(String condition, List<HeaderItem> ifTrue, List<HeaderItem> ifFalse) implements HeaderItem {
        public String kind() { return "conditional"; }
    }

    public record IgnoredHeader(String kind) implements HeaderItem {}

    public record UnrecognizedHeader(String kind) implements HeaderItem {}
}
