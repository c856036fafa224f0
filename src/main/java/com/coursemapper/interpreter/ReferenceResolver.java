package com.coursemapper.interpreter;

import com.coursemapper.context.ContextStack;
import com.coursemapper.context.PlanInfo;
import com.coursemapper.context.SubplanInfo;
import com.coursemapper.domain.DomainModels.RequirementBlock;
import com.coursemapper.parsetree.ParseTreeModels.BlockRef;
import com.coursemapper.parsetree.ParseTreeModels.BlockTypeRef;
import com.coursemapper.report.MappingReport;
import com.coursemapper.report.ReportChannel;
import com.coursemapper.store.BlockStore;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Finds the blocks a rule refers to. Failures to resolve are reported and yield nothing; the
 * caller skips the reference and carries on.
 */
@Component
public class ReferenceResolver {
    private final BlockStore blockStore;

    public ReferenceResolver(BlockStore blockStore) {
        this.blockStore = blockStore;
    }

    /**
     * Zero or one active block for a block reference. When several blocks share the type and value,
     * the one whose discriminator names a block value already on the stack is taken, if it is the
     * only such block.
     */
    public Optional<RequirementBlock> resolve(BlockRef ref, ContextStack stack, MappingReport report) {
        String institution = stack.currentBlock().institution();
        String requirementId = stack.currentBlock().requirementId();
        String target = ref.blockType() + " " + ref.blockValue();

        List<RequirementBlock> candidates = blockStore.findActive(ref.institution(), ref.blockType(), ref.blockValue());
        if (candidates.isEmpty()) {
            report.record(ReportChannel.FAIL, institution, requirementId, "Body block: no active " + target + " blocks");
            return Optional.empty();
        }
        if (candidates.size() == 1) return Optional.of(candidates.get(0));

        List<String> blockValues = stack.blockValues();
        List<RequirementBlock> matching = candidates.stream()
                .filter(b -> b.discriminator() != null && blockValues.contains(b.discriminator()))
                .toList();
        if (matching.size() == 1) return Optional.of(matching.get(0));

        report.record(ReportChannel.FAIL, institution, requirementId, "Body block: " + candidates.size() + " active "
                + target + " blocks; " + matching.size() + " discriminator matches in " + blockValues);
        return Optional.empty();
    }

    /** The still-valid version of a block whose rules are copied into the current block. */
    public Optional<RequirementBlock> resolveCopy(String requirementId, ContextStack stack, MappingReport report) {
        String institution = stack.currentBlock().institution();
        Optional<RequirementBlock> target = blockStore.findCurrent(institution, requirementId);
        if (target.isEmpty()) {
            report.record(ReportChannel.FAIL, institution, stack.currentBlock().requirementId(),
                    "Body copy_rules: " + requirementId + " not current");
        }
        return target;
    }

    /**
     * The plan's subplans a block-type reference leads to. Only concentrations qualify; when the
     * enclosing conditions name concentrations, only those are taken.
     */
    public List<SubplanInfo> resolveSubplans(BlockTypeRef ref, ContextStack stack, MappingReport report) {
        String institution = stack.currentBlock().institution();
        String requirementId = stack.currentBlock().requirementId();

        Optional<PlanInfo> plan = stack.plan();
        if (plan.isEmpty()) {
            report.record(ReportChannel.FAIL, institution, requirementId, "Body blocktype: not under a plan");
            return List.of();
        }
        if (plan.get().subplans().isEmpty()) {
            report.record(ReportChannel.FAIL, institution, requirementId, "Body blocktype: plan has no active subplans");
            return List.of();
        }
        if (!"CONC".equalsIgnoreCase(ref.blockType())) {
            report.record(ReportChannel.TODO, institution, requirementId,
                    "Body blocktype: required blocktype is " + ref.blockType() + " (ignored)");
            return List.of();
        }
        if (ref.number() > 1) {
            report.record(ReportChannel.HANDLED, institution, requirementId, "Body blocktype: " + ref.number() + " subplans required");
        }

        List<String> eligible = ConditionExpressions.eligibleConcentrations(ConditionExpressions.summarize(stack.conditions()));
        if (eligible.size() > 1) {
            report.record(ReportChannel.HANDLED, institution, requirementId, "Body blocktype with multiple conditions " + eligible);
        }
        List<SubplanInfo> selected = plan.get().subplans().stream()
                .filter(s -> eligible.isEmpty() || eligible.contains(s.name()))
                .toList();
        report.record(ReportChannel.HANDLED, institution, requirementId,
                "Body blocktype: " + selected.size() + " of " + plan.get().subplans().size() + " subplans");
        return selected;
    }
}
