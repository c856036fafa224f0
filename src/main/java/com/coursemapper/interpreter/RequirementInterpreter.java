package com.coursemapper.interpreter;

import com.coursemapper.config.CourseMapperProperties;
import com.coursemapper.context.ContextFrame.*;
import com.coursemapper.context.ContextSerializer;
import com.coursemapper.context.ContextStack;
import com.coursemapper.context.PlanInfo;
import com.coursemapper.context.SubplanInfo;
import com.coursemapper.domain.DomainModels.ActivePlan;
import com.coursemapper.domain.DomainModels.BlockId;
import com.coursemapper.domain.DomainModels.ProgramRow;
import com.coursemapper.domain.DomainModels.RequirementBlock;
import com.coursemapper.exception.StructuralException;
import com.coursemapper.header.HeaderExtractor;
import com.coursemapper.header.HeaderQualifiers;
import com.coursemapper.header.QualifierList;
import com.coursemapper.parsetree.ParseTreeModels.*;
import com.coursemapper.report.MappingReport;
import com.coursemapper.report.ReportChannel;
import com.coursemapper.store.MappingOutput;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Depth-first walk over requirement blocks. Every nested construct is interpreted against a copy of
 * the context stack extended by one or more frames; labelled rules with course lists are handed to
 * the {@link RequirementEmitter}. Only a {@link StructuralException} stops a run, everything else
 * is reported and skipped.
 */
@Component
public class RequirementInterpreter {
    private static final String UNNAMED = "Unnamed Requirement";

    private final HeaderExtractor headerExtractor;
    private final ReferenceResolver resolver;
    private final RequirementEmitter emitter;
    private final ContextSerializer serializer;
    private final MappingOutput output;
    private final CourseMapperProperties properties;

    public RequirementInterpreter(HeaderExtractor headerExtractor,
                                  ReferenceResolver resolver,
                                  RequirementEmitter emitter,
                                  ContextSerializer serializer,
                                  MappingOutput output,
                                  CourseMapperProperties properties) {
        this.headerExtractor = headerExtractor;
        this.resolver = resolver;
        this.emitter = emitter;
        this.serializer = serializer;
        this.output = output;
        this.properties = properties;
    }

    /**
     * Interprets a plan's block, then every subplan the plan's rules never led to, anchored directly
     * under the plan.
     */
    public void processPlan(ActivePlan activePlan, MappingRun run) {
        RequirementBlock block = activePlan.block();
        MappingReport report = run.report();
        if (!run.claimPlan(block.id())) {
            report.record(ReportChannel.ANOMALY, block.institution(), block.requirementId(),
                    "Plan " + activePlan.plan().planName() + " already interpreted (skipped)");
            return;
        }
        if (!"MAJOR".equals(block.blockType()) && !"MINOR".equals(block.blockType())) {
            report.record(ReportChannel.ANOMALY, block.institution(), block.requirementId(),
                    "Plan " + activePlan.plan().planName() + " has block type " + block.blockType());
        }

        PlanInfo planInfo = new PlanInfo(activePlan.plan(), block);
        if (!processBlock(block, ContextStack.empty(), planInfo, run)) return;

        List<SubplanInfo> orphans = new ArrayList<>();
        for (SubplanInfo subplan : planInfo.subplans()) {
            int references = subplan.referenceCount();
            if (references == 0) {
                orphans.add(subplan);
                report.record(ReportChannel.SUBPLANS, block.institution(), block.requirementId(),
                        String.format(Locale.ROOT, "Subplan %s not referenced; %,d enrolled", subplan.name(), subplan.enrollment()));
            } else if (references > 1) {
                report.record(ReportChannel.ANOMALY, block.institution(), block.requirementId(),
                        String.format(Locale.ROOT, "Subplan %s referenced %d times; %,d enrolled",
                                subplan.name(), references, subplan.enrollment()));
            }
        }
        ContextStack planStack = ContextStack.empty().push(new BlockFrame(block, planInfo));
        for (SubplanInfo orphan : orphans) {
            processBlock(orphan.block(), planStack, null, run);
        }

        int others = planInfo.others().size();
        if (others > 0) {
            report.record(ReportChannel.SUBPLANS, block.institution(), block.requirementId(),
                    others + " other block" + (others == 1 ? "" : "s") + " referenced");
        }
    }

    /**
     * Interprets one block under {@code stack}. {@code planInfo} is given only when the block is
     * itself a plan, in which case the stack is empty.
     *
     * @return false when the block was skipped without walking its body
     */
    boolean processBlock(RequirementBlock block, ContextStack stack, PlanInfo planInfo, MappingRun run) {
        MappingReport report = run.report();
        BlockId id = block.id();
        run.countReference(id);

        if (run.isQuarantined(id)) {
            report.record(ReportChannel.IGNORED, block.institution(), block.requirementId(), "Quarantined block (ignored)");
            return false;
        }
        if (stack.depth() >= properties.maxDepth()) {
            report.record(ReportChannel.FAIL, block.institution(), block.requirementId(),
                    "Context depth " + stack.depth() + " reached max-depth (block skipped)");
            return false;
        }
        ParseTree tree = run.trees().get(block, report);
        if (tree.hasError()) {
            report.record(ReportChannel.FAIL, block.institution(), block.requirementId(), tree.error());
            return false;
        }

        if (planInfo == null) accountForNestedBlock(block, stack);

        HeaderQualifiers header = null;
        if (run.claimProgram(id)) {
            header = headerExtractor.extract(block.institution(), block.requirementId(), tree, report);
        }
        run.countBlock(block.blockType());
        report.record(ReportChannel.BLOCKS, block.institution(), block.requirementId(),
                (planInfo != null ? "Top-level " : "nested ") + block.blockType() + " " + block.blockValue());

        ContextStack blockStack = stack.push(new BlockFrame(block, planInfo));
        if (tree.body() == null) {
            report.record(ReportChannel.FAIL, block.institution(), block.requirementId(), "Missing body");
            return false;
        }
        if (tree.body().isEmpty()) {
            report.record(ReportChannel.HANDLED, block.institution(), block.requirementId(), "Empty body");
        } else {
            interpret(new RuleList(tree.body()), blockStack, run);
        }

        if (header != null) {
            // subplan counts are final only once the body has been walked
            if (planInfo != null) header.setPlanInfo(planInfo.describe());
            output.writeProgram(programRow(block, header, run));
        }
        return true;
    }

    /** Dispatches one body rule. */
    void interpret(BodyRule rule, ContextStack stack, MappingRun run) {
        MappingReport report = run.report();
        BlockFrame current = stack.currentBlock();
        String institution = current.institution();
        String requirementId = current.requirementId();
        run.countDispatch(rule instanceof RuleList ? "list" : rule.kind());

        if (stack.depth() > properties.maxDepth()) {
            report.record(ReportChannel.FAIL, institution, requirementId,
                    "Context depth " + stack.depth() + " exceeds max-depth (" + rule.kind() + " skipped)");
            return;
        }

        if (rule instanceof RuleList list) {
            ContextStack siblings = stack;
            for (BodyRule item : list.rules()) {
                if (item instanceof Remark remark && remark.text() != null) {
                    if (properties.remarks()) {
                        report.record(ReportChannel.HANDLED, institution, requirementId, "Body remark");
                        siblings = siblings.push(new RemarkFrame(remark.text()));
                    } else {
                        report.record(ReportChannel.IGNORED, institution, requirementId, "Body remark (ignored)");
                    }
                    continue;
                }
                interpret(item, siblings, run);
            }
        } else if (rule instanceof BlockRef ref) {
            blockReference(ref, stack, run);
        } else if (rule instanceof BlockTypeRef ref) {
            ContextStack requirementStack = stack.push(requirementFrame(ref.label(), ref.restrictions(), rule, current, report));
            for (SubplanInfo subplan : resolver.resolveSubplans(ref, stack, report)) {
                enterBlock(subplan.block(), requirementStack, run);
            }
        } else if (rule instanceof ClassCredit cc) {
            if (cc.courseList() == null) {
                report.record(ReportChannel.HANDLED, institution, requirementId, "Body class_credit without course list");
                return;
            }
            RequirementFrame frame = requirementFrame(cc.label(), cc.restrictions(), rule, current, report);
            emitter.emit(stack.push(frame), cc.courseList(), classCreditDetail(cc, frame.name()), run);
        } else if (rule instanceof CourseListRule clr) {
            if (clr.courseList() == null) {
                report.record(ReportChannel.FAIL, institution, requirementId, "Body course_list_rule w/o a course list");
                return;
            }
            RequirementFrame frame = requirementFrame(clr.label(), clr.restrictions(), rule, current, report);
            emitter.emit(stack.push(frame), clr.courseList(), courseListDetail(clr.courseList(), frame.name()), run);
        } else if (rule instanceof Conditional conditional) {
            boolean concise = properties.conciseConditionals();
            interpret(new RuleList(conditional.ifTrue()),
                    stack.push(new ConditionFrame(ConditionTag.opening(concise), conditional.condition())), run);
            if (conditional.ifFalse() != null) {
                interpret(new RuleList(conditional.ifFalse()),
                        stack.push(new ConditionFrame(ConditionTag.alternative(concise), conditional.condition())), run);
            }
        } else if (rule instanceof CopyRules copy) {
            copyRules(copy, stack, run);
        } else if (rule instanceof GroupRequirement group) {
            groupRequirement(group, stack, run);
        } else if (rule instanceof Subset subset) {
            subset(subset, stack, run);
        } else if (rule instanceof Remark) {
            report.record(properties.remarks() ? ReportChannel.HANDLED : ReportChannel.IGNORED,
                    institution, requirementId, "Body remark");
        } else if (rule instanceof ProxyAdvice) {
            if (properties.proxyAdvice()) {
                report.record(ReportChannel.TODO, institution, requirementId, "Body proxy_advice");
            } else {
                report.record(ReportChannel.IGNORED, institution, requirementId, "Body proxy_advice (ignored)");
            }
        } else if (rule instanceof RuleComplete || rule instanceof NonCourse || rule instanceof SubsetQualifier) {
            report.record(ReportChannel.IGNORED, institution, requirementId, "Body " + rule.kind() + " (ignored)");
        } else if (rule instanceof Unrecognized unknown) {
            throw new StructuralException(institution, requirementId, unknown.kind(),
                    "Unhandled requirement type " + unknown.kind());
        } else {
            throw new IllegalStateException("No handler for " + rule.getClass().getSimpleName());
        }
    }

    private void blockReference(BlockRef ref, ContextStack stack, MappingRun run) {
        MappingReport report = run.report();
        BlockFrame current = stack.currentBlock();
        if (ref.number() != 1) {
            report.record(ReportChannel.TODO, current.institution(), current.requirementId(),
                    "Body block: number required is " + ref.number());
            return;
        }
        if (properties.isIgnoredBlockValue(ref.blockValue())) {
            report.record(ReportChannel.IGNORED, current.institution(), current.requirementId(),
                    "Body block: " + ref.blockValue() + " (ignored)");
            return;
        }
        RequirementFrame frame = requirementFrame(ref.label(), ref.restrictions(), ref, current, report);
        resolver.resolve(ref, stack, report).ifPresent(target -> {
            enterBlock(target, stack.push(frame), run);
            report.record(ReportChannel.HANDLED, current.institution(), current.requirementId(),
                    "Body block " + target.blockType() + " from " + current.blockType());
        });
    }

    private void enterBlock(RequirementBlock target, ContextStack stack, MappingRun run) {
        if (stack.containsRequirementId(target.requirementId())) {
            BlockFrame current = stack.currentBlock();
            run.report().record(ReportChannel.FAIL, current.institution(), current.requirementId(),
                    "Circular reference to " + target.requirementId() + " (refused)");
            return;
        }
        processBlock(target, stack, null, run);
    }

    private void copyRules(CopyRules copy, ContextStack stack, MappingRun run) {
        MappingReport report = run.report();
        BlockFrame current = stack.currentBlock();
        String institution = current.institution();
        String requirementId = current.requirementId();

        if (copy.institution() != null && !copy.institution().equals(institution)) {
            report.record(ReportChannel.FAIL, institution, requirementId,
                    "Body copy_rules: cross-institution copy from " + copy.institution() + " " + copy.requirementId());
            return;
        }
        Optional<RequirementBlock> resolved = resolver.resolveCopy(copy.requirementId(), stack, report);
        if (resolved.isEmpty()) return;
        RequirementBlock target = resolved.get();

        if (stack.containsRequirementId(target.requirementId())) {
            report.record(ReportChannel.FAIL, institution, requirementId, "Body circular copy_rules " + target.requirementId());
            return;
        }
        if (run.isQuarantined(target.id())) {
            report.record(ReportChannel.IGNORED, institution, requirementId,
                    "Body copy_rules: " + target.requirementId() + " quarantined (ignored)");
            return;
        }
        ParseTree tree = run.trees().get(target, report);
        if (tree.hasError()) {
            report.record(ReportChannel.FAIL, institution, requirementId, "Body copy_rules " + tree.error());
            return;
        }
        if (tree.body() == null || tree.body().isEmpty()) {
            report.record(ReportChannel.FAIL, institution, requirementId, "Body copy_rules: empty body_list");
            return;
        }
        String label = copy.label() == null ? UNNAMED : copy.label();
        ContextStack copied = stack.push(RequirementFrame.of(label, Restrictions.NONE),
                new CopyRulesFrame(institution, target.requirementId(), target.title()));
        interpret(new RuleList(tree.body()), copied, run);
        report.record(ReportChannel.HANDLED, institution, requirementId, "Body copy_rules " + target.requirementId());
    }

    private void groupRequirement(GroupRequirement group, ContextStack stack, MappingRun run) {
        MappingReport report = run.report();
        BlockFrame current = stack.currentBlock();
        int numGroups = group.groups().size();
        if (group.label() != null) {
            report.record(ReportChannel.LABELS, current.institution(), current.requirementId(), group.label());
        }
        String name = GroupDescriptions.label(group.label(), numGroups, group.numRequired());
        RequirementFrame frame = RequirementFrame.of(name, group.restrictions()).withGroups(numGroups, group.numRequired());
        ContextStack groupStack = stack.push(frame);

        for (int i = 0; i < numGroups; i++) {
            GroupFrame groupFrame = new GroupFrame(i + 1, GroupDescriptions.ordinal(i + 1, numGroups));
            interpret(new RuleList(group.groups().get(i)), groupStack.push(groupFrame), run);
        }
    }

    private void subset(Subset subset, ContextStack stack, MappingRun run) {
        MappingReport report = run.report();
        BlockFrame current = stack.currentBlock();
        String institution = current.institution();
        String requirementId = current.requirementId();

        RequirementFrame frame;
        if (subset.label() == null) {
            report.record(ReportChannel.FAIL, institution, requirementId, "Subset with no label");
            frame = RequirementFrame.of("No requirement name available", subset.restrictions());
        } else {
            report.record(ReportChannel.LABELS, institution, requirementId, subset.label());
            frame = RequirementFrame.of(subset.label(), subset.restrictions());
        }
        if (subset.remark() != null) frame = frame.withRemark(subset.remark());
        if (subset.proxyAdvice() != null && properties.proxyAdvice()) frame = frame.withProxyAdvice(subset.proxyAdvice());
        for (BodyRule rule : subset.rules()) {
            if (!(rule instanceof ProxyAdvice advice)) continue;
            if (!properties.proxyAdvice()) {
                report.record(ReportChannel.IGNORED, institution, requirementId, "Subset proxy_advice (ignored)");
            } else if (frame.proxyAdvice() != null) {
                report.record(ReportChannel.FAIL, institution, requirementId, "Subset with repeated proxy_advice");
            } else {
                frame = frame.withProxyAdvice(advice.advice());
            }
        }

        ContextStack subsetStack = stack.push(frame);
        for (BodyRule rule : subset.rules()) {
            if (rule instanceof ProxyAdvice) continue;
            if (rule instanceof SubsetQualifier qualifier) {
                run.countDispatch(qualifier.kind());
                report.record(ReportChannel.IGNORED, institution, requirementId, "Subset " + qualifier.kind() + " (ignored)");
            } else if (rule instanceof Unrecognized unknown) {
                run.countDispatch(unknown.kind());
                report.record(ReportChannel.FAIL, institution, requirementId, "Unhandled subset kind " + unknown.kind());
            } else {
                interpret(rule, subsetStack, run);
            }
        }
    }

    /** Records a non-plan block against the subplan or plan it was reached from. */
    private void accountForNestedBlock(RequirementBlock block, ContextStack stack) {
        Optional<PlanInfo> plan = stack.plan();
        if (plan.isEmpty() || block.requirementId().equals(stack.root().requirementId())) return;

        Optional<SubplanInfo> subplan = plan.get().subplanFor(block.requirementId());
        if (subplan.isPresent()) {
            subplan.get().reference();
            return;
        }
        List<BlockFrame> frames = stack.blockFrames();
        for (int i = frames.size() - 1; i > 0; i--) {
            Optional<SubplanInfo> enclosing = plan.get().subplanFor(frames.get(i).requirementId());
            if (enclosing.isPresent()) {
                enclosing.get().addOther(block.id());
                return;
            }
        }
        plan.get().addOther(block.id());
    }

    private RequirementFrame requirementFrame(String label, Restrictions restrictions, BodyRule rule,
                                              BlockFrame current, MappingReport report) {
        if (label == null) {
            report.record(ReportChannel.HANDLED, current.institution(), current.requirementId(),
                    "Body " + rule.kind() + " with no label");
            return RequirementFrame.of(UNNAMED, restrictions);
        }
        report.record(ReportChannel.LABELS, current.institution(), current.requirementId(), label);
        return RequirementFrame.of(label, restrictions);
    }

    private static Map<String, Object> classCreditDetail(ClassCredit cc, String label) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("label", label);
        detail.put("conjunction", cc.conjunction());
        detail.put("min_classes", cc.minClasses());
        detail.put("max_classes", cc.maxClasses());
        detail.put("min_credits", cc.minCredits());
        detail.put("max_credits", cc.maxCredits());
        detail.put("allow_classes", cc.allowClasses());
        detail.put("allow_credits", cc.allowCredits());
        return detail;
    }

    /** A bare course list requires every scribed course. */
    private static Map<String, Object> courseListDetail(CourseList courseList, String label) {
        int scribed = courseList.scribedCount();
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("label", label);
        detail.put("conjunction", null);
        detail.put("min_classes", scribed);
        detail.put("max_classes", scribed);
        detail.put("min_credits", null);
        detail.put("max_credits", null);
        detail.put("allow_classes", null);
        detail.put("allow_credits", null);
        return detail;
    }

    private ProgramRow programRow(RequirementBlock block, HeaderQualifiers header, MappingRun run) {
        String institution = block.institution();
        return new ProgramRow(
                institution.length() > 3 ? institution.substring(0, 3) : institution,
                block.requirementId(),
                block.blockType(),
                block.blockValue(),
                block.title(),
                serializer.write(header.list(QualifierList.TOTAL_CREDITS)),
                serializer.write(header.list(QualifierList.MAX_TRANSFER)),
                serializer.write(header.list(QualifierList.MIN_RESIDENCY)),
                serializer.write(header.list(QualifierList.MIN_GRADE)),
                serializer.write(header.list(QualifierList.MIN_GPA)),
                serializer.write(header.other()),
                run.generatedDate());
    }
}
