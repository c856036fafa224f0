package com.coursemapper.context;

import com.coursemapper.context.ContextFrame.BlockFrame;
import com.coursemapper.context.ContextFrame.ConditionFrame;
import com.coursemapper.context.ContextFrame.CopyRulesFrame;

import java.util.*;

/**
 * Immutable chain of frames from the owning block down to the rule being interpreted. Pushing
 * returns a new stack, so a caller's stack is what it was once the callee returns. Frame 0 is
 * always the owning block's frame.
 */
public final class ContextStack {
    private static final ContextStack EMPTY = new ContextStack(List.of());

    private final List<ContextFrame> frames;

    private ContextStack(List<ContextFrame> frames) {
        this.frames = frames;
    }

    public static ContextStack empty() {
        return EMPTY;
    }

    public ContextStack push(ContextFrame frame) {
        if (frames.isEmpty() && !(frame instanceof BlockFrame)) {
            throw new IllegalStateException("The first frame must be a block frame, got " + frame);
        }
        List<ContextFrame> next = new ArrayList<>(frames.size() + 1);
        next.addAll(frames);
        next.add(frame);
        return new ContextStack(Collections.unmodifiableList(next));
    }

    public ContextStack push(ContextFrame first, ContextFrame... more) {
        ContextStack stack = push(first);
        for (ContextFrame frame : more) stack = stack.push(frame);
        return stack;
    }

    /** Replaces the innermost frame; used only to attach a resolved display name. */
    public ContextStack replaceTop(ContextFrame frame) {
        if (frames.size() < 2) throw new IllegalStateException("Cannot replace the owning block frame");
        List<ContextFrame> next = new ArrayList<>(frames);
        next.set(next.size() - 1, frame);
        return new ContextStack(Collections.unmodifiableList(next));
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    public int depth() {
        return frames.size();
    }

    public List<ContextFrame> frames() {
        return frames;
    }

    public ContextFrame top() {
        return frames.get(frames.size() - 1);
    }

    public BlockFrame root() {
        return (BlockFrame) frames.get(0);
    }

    public Optional<PlanInfo> plan() {
        return frames.isEmpty() ? Optional.empty() : Optional.ofNullable(root().planInfo());
    }

    public BlockFrame currentBlock() {
        for (int i = frames.size() - 1; i >= 0; i--) {
            if (frames.get(i) instanceof BlockFrame block) return block;
        }
        throw new IllegalStateException("Context stack has no block frame");
    }

    public List<BlockFrame> blockFrames() {
        return frames.stream().filter(BlockFrame.class::isInstance).map(BlockFrame.class::cast).toList();
    }

    public List<ConditionFrame> conditions() {
        return frames.stream().filter(ConditionFrame.class::isInstance).map(ConditionFrame.class::cast).toList();
    }

    /** Distinct block values of the enclosing blocks, outermost first. */
    public List<String> blockValues() {
        return blockFrames().stream().map(BlockFrame::blockValue).filter(Objects::nonNull).distinct().toList();
    }

    /** Colon-joined requirement ids of the enclosing blocks, duplicates removed. */
    public String requirementIds() {
        return String.join(":", blockFrames().stream().map(BlockFrame::requirementId).distinct().toList());
    }

    /** True if a block or copied-rules frame for this requirement id is already on the stack. */
    public boolean containsRequirementId(String requirementId) {
        for (ContextFrame frame : frames) {
            if (frame instanceof BlockFrame block && block.requirementId().equals(requirementId)) return true;
            if (frame instanceof CopyRulesFrame copy && copy.requirementId().equals(requirementId)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return "ContextStack" + frames;
    }
}
