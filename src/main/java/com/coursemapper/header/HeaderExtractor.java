package com.coursemapper.header;

import com.coursemapper.config.CourseMapperProperties;
import com.coursemapper.context.ContextFrame.ConditionTag;
import com.coursemapper.courses.CanonicalCourse;
import com.coursemapper.courses.CourseListNormalizer;
import com.coursemapper.courses.LetterGrades;
import com.coursemapper.parsetree.ParseTreeModels.*;
import com.coursemapper.report.MappingReport;
import com.coursemapper.report.ReportChannel;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Single pass over a block's header list. Header conditionals write both legs into the same
 * qualifier lists: the first entry a leg adds to a list is preceded by an open tag, and once the
 * conditional is done every list either leg opened is closed with an {@code endif} tag.
 */
@Component
public class HeaderExtractor {
    private final CourseListNormalizer normalizer;
    private final CourseMapperProperties properties;

    public HeaderExtractor(CourseListNormalizer normalizer, CourseMapperProperties properties) {
        this.normalizer = normalizer;
        this.properties = properties;
    }

    public HeaderQualifiers extract(String institution, String requirementId, ParseTree tree, MappingReport report) {
        HeaderQualifiers qualifiers = new HeaderQualifiers();
        if (tree.header() == null || tree.header().isEmpty()) {
            report.record(ReportChannel.HANDLED, institution, requirementId, "Empty header");
            return qualifiers;
        }
        Pass pass = new Pass(institution, requirementId, qualifiers, report);
        tree.header().forEach(item -> pass.item(item, null));
        return qualifiers;
    }

    private final class Pass {
        private final String institution;
        private final String requirementId;
        private final HeaderQualifiers qualifiers;
        private final MappingReport report;

        Pass(String institution, String requirementId, HeaderQualifiers qualifiers, MappingReport report) {
            this.institution = institution;
            this.requirementId = requirementId;
            this.qualifiers = qualifiers;
            this.report = report;
        }

        void item(HeaderItem item, Leg leg) {
            if (item instanceof HeaderClassCredit cc) {
                append(QualifierList.TOTAL_CREDITS, classCredit(cc), leg);
            } else if (item instanceof HeaderMaxTransfer mt) {
                append(QualifierList.MAX_TRANSFER, maxTransfer(mt), leg);
            } else if (item instanceof HeaderMinResidency mr) {
                minResidency(mr).ifPresent(entry -> append(QualifierList.MIN_RESIDENCY, entry, leg));
            } else if (item instanceof HeaderMinGpa gpa) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("mingpa", gpa.mingpa());
                entry.put("label", gpa.label());
                append(QualifierList.MIN_GPA, entry, leg);
            } else if (item instanceof HeaderMinGrade mg) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("mingrade", mg.mingrade());
                entry.put("letter_grade", LetterGrades.letterGrade(mg.number()));
                entry.put("label", mg.label());
                append(QualifierList.MIN_GRADE, entry, leg);
            } else if (item instanceof HeaderCourseLimit limit) {
                append(QualifierList.forHeaderKind(limit.kind()), courseLimit(limit), leg);
            } else if (item instanceof HeaderQualifier q) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put(q.kind().substring("header_".length()), q.value());
                entry.put("label", q.label());
                append(QualifierList.forHeaderKind(q.kind()), entry, leg);
            } else if (item instanceof HeaderProxyAdvice advice) {
                if (properties.proxyAdvice()) {
                    append(QualifierList.PROXY_ADVICE, advice.advice(), leg);
                } else {
                    report.record(ReportChannel.IGNORED, institution, requirementId, "Header proxy_advice (disabled)");
                }
            } else if (item instanceof HeaderRemark remark) {
                qualifiers.addRemark(remark.text());
            } else if (item instanceof HeaderConditional conditional) {
                conditional(conditional, leg);
            } else if (item instanceof IgnoredHeader ignored) {
                report.record(ReportChannel.IGNORED, institution, requirementId, "Header " + ignored.kind());
            } else if (item instanceof UnrecognizedHeader unknown) {
                report.record(ReportChannel.TODO, institution, requirementId, "Header " + unknown.kind() + " not implemented (yet)");
            }
        }

        private void conditional(HeaderConditional conditional, Leg enclosing) {
            boolean concise = properties.conciseConditionals();
            String condition = conditional.condition() == null ? "" : conditional.condition();

            Leg trueLeg = new Leg(ConditionTag.opening(concise), condition, enclosing);
            conditional.ifTrue().forEach(item -> item(item, trueLeg));

            Leg falseLeg = new Leg(ConditionTag.alternative(concise), condition, enclosing);
            if (conditional.ifFalse() != null) {
                conditional.ifFalse().forEach(item -> item(item, falseLeg));
            }

            Set<QualifierList> opened = EnumSet.noneOf(QualifierList.class);
            opened.addAll(trueLeg.opened);
            opened.addAll(falseLeg.opened);
            for (QualifierList list : opened) qualifiers.append(list, Map.of("endif", condition));

            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("condition", condition);
            summary.put(ConditionTag.opening(concise).tag(), trueLeg.opened.stream().map(QualifierList::key).toList());
            if (conditional.ifFalse() != null) {
                summary.put(ConditionTag.alternative(concise).tag(), falseLeg.opened.stream().map(QualifierList::key).toList());
            }
            append(QualifierList.CONDITIONAL, summary, enclosing);
        }

        private void append(QualifierList list, Object entry, Leg leg) {
            if (leg != null) leg.open(list, qualifiers);
            qualifiers.append(list, entry);
        }

        private Map<String, Object> classCredit(HeaderClassCredit cc) {
            Map<String, Object> entry = new LinkedHashMap<>();
            if (cc.label() != null && !cc.label().isBlank()) entry.put("label", cc.label());
            if (cc.proxyAdvice() != null && properties.proxyAdvice()) entry.put("proxy_advice", cc.proxyAdvice());
            entry.put("is_pseudo", cc.pseudo());

            String classes = range(cc.minClasses() == null ? null : cc.minClasses().doubleValue(),
                    cc.maxClasses() == null ? null : cc.maxClasses().doubleValue(), false, "classes");
            String credits = range(cc.minCredits(), cc.maxCredits(), true, "credits");
            if (!classes.isEmpty() && !credits.isEmpty()) {
                String conjunction = cc.conjunction() == null ? "and" : cc.conjunction().toLowerCase(Locale.ROOT);
                entry.put("size", classes + " " + conjunction + " " + credits);
            } else if (!classes.isEmpty() || !credits.isEmpty()) {
                entry.put("size", classes + credits);
            } else {
                report.record(ReportChannel.FAIL, institution, requirementId, "Header class_credit without classes or credits");
            }
            return entry;
        }

        private Map<String, Object> maxTransfer(HeaderMaxTransfer mt) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("label", mt.label());
            if ("credit".equalsIgnoreCase(mt.classOrCredit())) {
                entry.put("limit", String.format(Locale.ROOT, "%.1f credits", mt.number()));
            } else {
                int number = (int) mt.number();
                entry.put("limit", number + (number == 1 ? " class" : " classes"));
            }
            if (mt.transferTypes() != null) entry.put("transfer_types", mt.transferTypes());
            return entry;
        }

        private Optional<Map<String, Object>> minResidency(HeaderMinResidency mr) {
            String minres;
            if (mr.minClasses() != null && mr.minCredits() == null) {
                minres = mr.minClasses() + " classes";
            } else if (mr.minClasses() == null && mr.minCredits() != null) {
                minres = String.format(Locale.ROOT, "%.1f credits", mr.minCredits());
            } else {
                report.record(ReportChannel.FAIL, institution, requirementId, "Invalid minres: classes and credits must not both be given");
                return Optional.empty();
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("minres", minres);
            entry.put("label", mr.label());
            return Optional.of(entry);
        }

        private Map<String, Object> courseLimit(HeaderCourseLimit limit) {
            List<Map<String, String>> courses = new ArrayList<>();
            for (CanonicalCourse course : normalizer.normalize(institution, requirementId, limit.courseList(), report)) {
                Map<String, String> c = new LinkedHashMap<>();
                c.put("course_id", course.courseId());
                c.put("course", course.course());
                c.put("with", course.withClause());
                courses.add(c);
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("label", limit.label());
            entry.put("number", "header_maxclass".equals(limit.kind()) ? (Object) (int) limit.number() : limit.number());
            entry.put("courses", courses);
            return entry;
        }
    }

    /** One leg of a header conditional and the lists it has opened so far. */
    private static final class Leg {
        private final ConditionTag tag;
        private final String condition;
        private final Leg enclosing;
        private final Set<QualifierList> opened = EnumSet.noneOf(QualifierList.class);

        Leg(ConditionTag tag, String condition, Leg enclosing) {
            this.tag = tag;
            this.condition = condition;
            this.enclosing = enclosing;
        }

        void open(QualifierList list, HeaderQualifiers qualifiers) {
            if (enclosing != null) enclosing.open(list, qualifiers);
            if (opened.add(list)) qualifiers.append(list, Map.of(tag.tag(), condition));
        }
    }

    static String range(Double min, Double max, boolean decimal, String unit) {
        if (min == null && max == null) return "";
        if ((min == null || min == 0) && (max == null || max == 0)) return "";
        double lo = min == null ? max : min;
        double hi = max == null ? min : max;
        if (lo == hi) return number(hi, decimal) + " " + unit;
        return number(lo, decimal) + "-" + number(hi, decimal) + " " + unit;
    }

    private static String number(double value, boolean decimal) {
        return decimal ? String.format(Locale.ROOT, "%.1f", value) : String.valueOf((int) value);
    }
}
