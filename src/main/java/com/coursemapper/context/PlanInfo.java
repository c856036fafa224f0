package com.coursemapper.context;

import com.coursemapper.domain.DomainModels.BlockId;
import com.coursemapper.domain.DomainModels.PlanDescriptor;
import com.coursemapper.domain.DomainModels.RequirementBlock;

import java.util.*;

/**
 * Plan-wide metadata carried by the outermost frame. Subplan counters and the "others" list are
 * updated while the plan's body is interpreted and read once it is done.
 */
public class PlanInfo {
    private final PlanDescriptor descriptor;
    private final String catalogYears;
    private final List<SubplanInfo> subplans;
    private final List<BlockId> others = new ArrayList<>();

    public PlanInfo(PlanDescriptor descriptor, RequirementBlock block) {
        this.descriptor = descriptor;
        this.catalogYears = block.catalogYears();
        this.subplans = descriptor.subplans() == null ? List.of()
                : descriptor.subplans().stream().map(SubplanInfo::new).toList();
    }

    public String planName() {
        return descriptor.planName();
    }

    public String planType() {
        return descriptor.planType();
    }

    public List<SubplanInfo> subplans() {
        return subplans;
    }

    public Optional<SubplanInfo> subplanFor(String requirementId) {
        return subplans.stream().filter(s -> s.block().requirementId().equals(requirementId)).findFirst();
    }

    public List<BlockId> others() {
        return List.copyOf(others);
    }

    public void addOther(BlockId block) {
        if (!others.contains(block)) others.add(block);
    }

    public Map<String, Object> describe() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("plan_name", descriptor.planName());
        out.put("plan_type", descriptor.planType());
        out.put("plan_description", descriptor.description());
        out.put("plan_catalog_years", catalogYears);
        out.put("plan_effective_date", descriptor.effectiveDate());
        out.put("plan_cip_code", descriptor.cipCode());
        out.put("plan_active_terms", descriptor.activeTerms());
        out.put("plan_enrollment", descriptor.enrollment());
        out.put("subplans", subplans.stream().map(SubplanInfo::describe).toList());
        out.put("others", others.stream().map(BlockId::toString).toList());
        return out;
    }
}
