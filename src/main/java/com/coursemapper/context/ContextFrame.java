package com.coursemapper.context;

import com.coursemapper.domain.DomainModels.RequirementBlock;
import com.coursemapper.parsetree.ParseTreeModels.Restrictions;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.Map;

/** One level of scope pushed while walking a block body. */
public sealed interface ContextFrame permits ContextFrame.BlockFrame, ContextFrame.ConditionFrame,
        ContextFrame.RequirementFrame, ContextFrame.GroupFrame, ContextFrame.CopyRulesFrame, ContextFrame.RemarkFrame {

    /** Single-key map in the shape written to the requirement's context column. */
    Map<String, Object> describe();

    /** Entry into a requirement block; only the outermost one of a plan carries {@link PlanInfo}. */
    record BlockFrame(RequirementBlock block, PlanInfo planInfo) implements ContextFrame {
        public String institution() { return block.institution(); }
        public String requirementId() { return block.requirementId(); }
        public String blockType() { return block.blockType(); }
        public String blockValue() { return block.blockValue(); }
        public String title() { return block.title(); }

        public Map<String, Object> describe() {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("institution", block.institution());
            info.put("requirement_id", block.requirementId());
            info.put("block_type", block.blockType());
            info.put("block_value", block.blockValue());
            info.put("block_title", block.title());
            info.put("catalog_years", block.catalogYears());
            if (planInfo != null) info.put("plan_info", planInfo.describe());
            return Map.of("block_info", info);
        }
    }

    enum ConditionTag {
        IF("if"), ELSE("else"), IF_TRUE("if_true"), IF_FALSE("if_false");

        private final String tag;

        ConditionTag(String tag) {
            this.tag = tag;
        }

        public String tag() {
            return tag;
        }

        public boolean negated() {
            return this == ELSE || this == IF_FALSE;
        }

        public static ConditionTag opening(boolean concise) {
            return concise ? IF : IF_TRUE;
        }

        public static ConditionTag alternative(boolean concise) {
            return concise ? ELSE : IF_FALSE;
        }
    }

    record ConditionFrame(ConditionTag tag, String condition) implements ContextFrame {
        public Map<String, Object> describe() {
            return Map.of(tag.tag(), condition == null ? "" : condition);
        }
    }

    /** A labelled rule. The name may be replaced once, after label templating. */
    record RequirementFrame(String name, Restrictions restrictions, Integer numGroups, Integer numRequired,
                            String remark, JsonNode proxyAdvice) implements ContextFrame {
        public static RequirementFrame of(String name, Restrictions restrictions) {
            return new RequirementFrame(name, restrictions, null, null, null, null);
        }

        public RequirementFrame withName(String newName) {
            return new RequirementFrame(newName, restrictions, numGroups, numRequired, remark, proxyAdvice);
        }

        public RequirementFrame withGroups(int groups, int required) {
            return new RequirementFrame(name, restrictions, groups, required, remark, proxyAdvice);
        }

        public RequirementFrame withRemark(String text) {
            return new RequirementFrame(name, restrictions, numGroups, numRequired, text, proxyAdvice);
        }

        public RequirementFrame withProxyAdvice(JsonNode advice) {
            return new RequirementFrame(name, restrictions, numGroups, numRequired, remark, advice);
        }

        public Map<String, Object> describe() {
            Map<String, Object> out = new LinkedHashMap<>();
            if (restrictions != null) {
                if (restrictions.maxTransfer() != null) out.put("maxtransfer", restrictions.maxTransfer());
                if (restrictions.minGrade() != null) out.put("mingrade", restrictions.minGrade());
            }
            out.put("requirement_name", name);
            if (numGroups != null) out.put("num_groups", numGroups);
            if (numRequired != null) out.put("num_required", numRequired);
            if (remark != null) out.put("remark", remark);
            if (proxyAdvice != null) out.put("proxy_advice", proxyAdvice);
            return out;
        }
    }

    record GroupFrame(int groupNumber, String description) implements ContextFrame {
        public Map<String, Object> describe() {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("group_number", groupNumber);
            out.put("group_number_str", description);
            return out;
        }
    }

    /** Rules spliced in from another block of the same institution. */
    record CopyRulesFrame(String institution, String requirementId, String title) implements ContextFrame {
        public Map<String, Object> describe() {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("institution", institution);
            out.put("requirement_id", requirementId);
            out.put("requirement_name", title);
            return out;
        }
    }

    record RemarkFrame(String text) implements ContextFrame {
        public Map<String, Object> describe() {
            return Map.of("remark", text);
        }
    }
}
