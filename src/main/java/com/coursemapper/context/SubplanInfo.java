package com.coursemapper.context;

import com.coursemapper.domain.DomainModels.BlockId;
import com.coursemapper.domain.DomainModels.RequirementBlock;
import com.coursemapper.domain.DomainModels.SubplanDescriptor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** A plan's subplan plus how often the plan's requirements led into it. */
public class SubplanInfo {
    private final SubplanDescriptor descriptor;
    private int referenceCount;
    private final List<BlockId> others = new ArrayList<>();

    public SubplanInfo(SubplanDescriptor descriptor) {
        this.descriptor = descriptor;
    }

    public String name() {
        return descriptor.subplanName();
    }

    public RequirementBlock block() {
        return descriptor.block();
    }

    public int enrollment() {
        return descriptor.enrollment();
    }

    public int referenceCount() {
        return referenceCount;
    }

    public void reference() {
        referenceCount++;
    }

    public List<BlockId> others() {
        return List.copyOf(others);
    }

    public void addOther(BlockId block) {
        if (!others.contains(block)) others.add(block);
    }

    public Map<String, Object> describe() {
        Map<String, Object> out = new LinkedHashMap<>();
        RequirementBlock block = descriptor.block();
        Map<String, Object> blockInfo = new LinkedHashMap<>();
        blockInfo.put("institution", block.institution());
        blockInfo.put("requirement_id", block.requirementId());
        blockInfo.put("block_type", block.blockType());
        blockInfo.put("block_value", block.blockValue());
        blockInfo.put("block_title", block.title());
        out.put("subplan_block_info", blockInfo);
        out.put("subplan_name", descriptor.subplanName());
        out.put("subplan_type", descriptor.subplanType());
        out.put("subplan_description", descriptor.description());
        out.put("subplan_effective_date", descriptor.effectiveDate());
        out.put("subplan_cip_code", descriptor.cipCode());
        out.put("subplan_active_terms", descriptor.activeTerms());
        out.put("subplan_enrollment", descriptor.enrollment());
        out.put("subplan_reference_count", referenceCount);
        out.put("subplan_others", others.stream().map(BlockId::toString).toList());
        return out;
    }
}
