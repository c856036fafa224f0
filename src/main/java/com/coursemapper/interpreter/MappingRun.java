package com.coursemapper.interpreter;

import com.coursemapper.domain.DomainModels.BlockId;
import com.coursemapper.report.MappingReport;

import java.util.*;

/**
 * Mutable state of one mapping run, threaded through the interpreter: the requirement-key counter,
 * the parse-tree cache, reference and dispatch counters, and the read-only quarantine snapshot.
 */
public class MappingRun {
    private final String generatedDate;
    private final Set<BlockId> quarantine;
    private final ParseTreeCache trees;
    private final MappingReport report;

    private int lastRequirementKey;
    private int courseMappings;
    private final Map<BlockId, Integer> referenceCounts = new HashMap<>();
    private final Set<BlockId> programBlocks = new HashSet<>();
    private final Set<BlockId> interpretedPlans = new HashSet<>();
    private final Map<String, Integer> dispatchCounts = new TreeMap<>();
    private final Map<String, Integer> blocksByType = new TreeMap<>();

    public MappingRun(String generatedDate, Set<BlockId> quarantine, ParseTreeCache trees, MappingReport report) {
        this.generatedDate = generatedDate;
        this.quarantine = Set.copyOf(quarantine);
        this.trees = trees;
        this.report = report;
    }

    public String generatedDate() {
        return generatedDate;
    }

    public MappingReport report() {
        return report;
    }

    public ParseTreeCache trees() {
        return trees;
    }

    public boolean isQuarantined(BlockId id) {
        return quarantine.contains(id);
    }

    /** Next requirement key; keys start at 1 and are never reused within a run. */
    public int nextRequirementKey() {
        return ++lastRequirementKey;
    }

    public int requirementCount() {
        return lastRequirementKey;
    }

    void addCourseMappings(int count) {
        courseMappings += count;
    }

    public int courseMappingCount() {
        return courseMappings;
    }

    void countReference(BlockId id) {
        referenceCounts.merge(id, 1, Integer::sum);
    }

    public int referenceCount(BlockId id) {
        return referenceCounts.getOrDefault(id, 0);
    }

    /** True the first time a block is seen, when its programs row is due. */
    boolean claimProgram(BlockId id) {
        return programBlocks.add(id);
    }

    /** True the first time a block is interpreted as a plan. */
    boolean claimPlan(BlockId id) {
        return interpretedPlans.add(id);
    }

    void countDispatch(String kind) {
        dispatchCounts.merge(kind, 1, Integer::sum);
    }

    public Map<String, Integer> dispatchCounts() {
        return Collections.unmodifiableMap(dispatchCounts);
    }

    void countBlock(String blockType) {
        blocksByType.merge(blockType == null ? "UNKNOWN" : blockType, 1, Integer::sum);
    }

    public Map<String, Integer> blocksByType() {
        return Collections.unmodifiableMap(blocksByType);
    }
}
