package com.coursemapper.context;

import com.coursemapper.context.ContextFrame.*;
import com.coursemapper.domain.DomainModels.RequirementBlock;
import com.coursemapper.parsetree.ParseTreeModels.Restrictions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContextStackTest {
    private static RequirementBlock block(String requirementId, String blockValue) {
        return new RequirementBlock("QNS01", requirementId, "MAJOR", blockValue, blockValue + " title",
                "2020-09-01", "99999999", null, "{}");
    }

    @Test
    void pushLeavesTheOriginalUntouched() {
        var base = ContextStack.empty().push(new BlockFrame(block("RA000001", "BIO-BS"), null));
        var extended = base.push(RequirementFrame.of("Core", Restrictions.NONE));

        assertEquals(1, base.depth());
        assertEquals(2, extended.depth());
        assertTrue(extended.top() instanceof RequirementFrame);
        assertEquals("RA000001", extended.currentBlock().requirementId());
    }

    @Test
    void firstFrameMustBeABlock() {
        assertThrows(IllegalStateException.class,
                () -> ContextStack.empty().push(new RemarkFrame("hello")));
    }

    @Test
    void ownerBlockCannotBeReplaced() {
        var base = ContextStack.empty().push(new BlockFrame(block("RA000001", "BIO-BS"), null));
        assertThrows(IllegalStateException.class, () -> base.replaceTop(new RemarkFrame("x")));
    }

    @Test
    void collectsBlockIdentifiersAndConditions() {
        var stack = ContextStack.empty().push(
                new BlockFrame(block("RA000001", "BIO-BS"), null),
                new ConditionFrame(ConditionTag.IF, "conc = GEN"),
                RequirementFrame.of("Core", Restrictions.NONE),
                new BlockFrame(block("RA000002", "BIO-GEN"), null),
                new CopyRulesFrame("QNS01", "RA000003", "Shared rules"),
                new BlockFrame(block("RA000001", "BIO-BS"), null));

        assertEquals("RA000001:RA000002", stack.requirementIds());
        assertEquals(List.of("BIO-BS", "BIO-GEN"), stack.blockValues());
        assertEquals(1, stack.conditions().size());
        assertTrue(stack.containsRequirementId("RA000003"));
        assertFalse(stack.containsRequirementId("RA000004"));
        assertTrue(stack.plan().isEmpty());
    }
}
