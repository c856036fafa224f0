package com.coursemapper.interpreter;

import com.coursemapper.context.ContextFrame;
import com.coursemapper.context.ContextFrame.BlockFrame;
import com.coursemapper.context.ContextFrame.RequirementFrame;
import com.coursemapper.context.ContextSerializer;
import com.coursemapper.context.ContextStack;
import com.coursemapper.context.PlanInfo;
import com.coursemapper.context.SubplanInfo;
import com.coursemapper.courses.CanonicalCourse;
import com.coursemapper.courses.CourseListNormalizer;
import com.coursemapper.domain.DomainModels.CourseMappingRow;
import com.coursemapper.domain.DomainModels.RequirementRow;
import com.coursemapper.parsetree.ParseTreeModels.CourseList;
import com.coursemapper.parsetree.ParseTreeModels.CourseTriple;
import com.coursemapper.report.MappingReport;
import com.coursemapper.report.ReportChannel;
import com.coursemapper.store.MappingOutput;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a labelled rule with a course list into one requirement row and its course-mapping rows.
 * Nothing is written, and no key is used up, when the course list resolves to no courses.
 */
@Component
public class RequirementEmitter {
    private static final Pattern COURSE_TITLE = Pattern.compile("<COURSETITLE>", Pattern.CASE_INSENSITIVE);
    private static final Pattern COURSE_CREDITS = Pattern.compile("<COURSECREDITS>", Pattern.CASE_INSENSITIVE);

    private final CourseListNormalizer normalizer;
    private final ContextSerializer serializer;
    private final MappingOutput output;

    public RequirementEmitter(CourseListNormalizer normalizer, ContextSerializer serializer, MappingOutput output) {
        this.normalizer = normalizer;
        this.serializer = serializer;
        this.output = output;
    }

    /**
     * @param stack  context ending in the rule's {@link RequirementFrame}
     * @param detail the rule's own fields, written as the last element of the context column
     * @return the requirement key, if a requirement was written
     */
    public OptionalInt emit(ContextStack stack, CourseList courseList, Map<String, Object> detail, MappingRun run) {
        MappingReport report = run.report();
        BlockFrame block = stack.currentBlock();
        List<CanonicalCourse> courses = normalizer.normalize(block.institution(), block.requirementId(), courseList, report);
        if (courses.isEmpty()) {
            report.record(ReportChannel.NO_COURSES, block.institution(), block.requirementId(),
                    String.valueOf(detail.get("label")));
            return OptionalInt.empty();
        }

        Map<String, Object> requirement = new LinkedHashMap<>(detail);
        requirement.put("course_list", describe(courseList));
        requirement.put("num_courses", courses.size());

        ContextFrame top = stack.top();
        if (top instanceof RequirementFrame frame && frame.name() != null) {
            String name = applyTemplates(frame.name(), courses.get(0));
            if (!name.equals(frame.name())) {
                report.record(ReportChannel.LABELS, block.institution(), block.requirementId(), frame.name() + " => " + name);
                stack = stack.replaceTop(frame.withName(name));
                requirement.put("label", name);
            }
        }

        int key = run.nextRequirementKey();
        Optional<PlanInfo> plan = stack.plan();
        RequirementRow row = new RequirementRow(
                block.institution(),
                plan.map(PlanInfo::planName).orElse(""),
                plan.map(PlanInfo::planType).orElse(""),
                subplanName(stack, report),
                stack.requirementIds(),
                ConditionExpressions.summarize(stack.conditions()),
                key,
                block.title(),
                serializer.serialize(stack, requirement),
                run.generatedDate());
        output.writeRequirement(row);

        for (CanonicalCourse course : courses) {
            output.writeCourseMapping(new CourseMappingRow(key, course.courseId(), course.career(), course.course(),
                    serializer.write(course.withClause()), run.generatedDate()));
        }
        run.addCourseMappings(courses.size());
        return OptionalInt.of(key);
    }

    static String applyTemplates(String name, CanonicalCourse first) {
        String out = COURSE_TITLE.matcher(name).replaceAll(Matcher.quoteReplacement(nullToEmpty(first.title()).trim()));
        return COURSE_CREDITS.matcher(out).replaceAll(Matcher.quoteReplacement(nullToEmpty(first.credits())));
    }

    /** The plan's subplan whose block encloses this requirement, or empty for a plan-level one. */
    private String subplanName(ContextStack stack, MappingReport report) {
        Optional<PlanInfo> plan = stack.plan();
        List<BlockFrame> enclosing = stack.blockFrames();
        if (plan.isEmpty() || enclosing.size() < 2) return "";

        List<BlockFrame> nested = enclosing.subList(1, enclosing.size());
        for (BlockFrame frame : nested) {
            Optional<SubplanInfo> subplan = plan.get().subplanFor(frame.requirementId());
            if (subplan.isPresent()) return subplan.get().name();
        }
        BlockFrame root = stack.root();
        report.record(ReportChannel.SUBPLANS, root.institution(), root.requirementId(),
                "Block(s) " + nested.stream().map(BlockFrame::requirementId).toList() + " not subplan of the plan");
        return "";
    }

    private static Map<String, Object> describe(CourseList courseList) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("scribed_courses", courseList.scribedAreas().stream().map(RequirementEmitter::triples).toList());
        out.put("except_courses", triples(courseList.exclude()));
        out.put("include_courses", triples(courseList.include()));
        if (courseList.label() != null) out.put("label", courseList.label());
        return out;
    }

    private static List<List<String>> triples(List<CourseTriple> triples) {
        return triples.stream()
                .map(t -> Arrays.asList(t.discipline(), t.catalogNumber(), t.withClause()))
                .toList();
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
