package com.coursemapper.parsetree;

import com.coursemapper.courses.LetterGrades;
import com.coursemapper.exception.StructuralException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.*;

import static com.coursemapper.parsetree.ParseTreeModels.*;

/**
 * Turns the JSON produced by the requirement grammar parser into {@link ParseTreeModels} records.
 * Every header and body item must be a single-key record; anything else is a
 * {@link StructuralException}.
 */
@Component
public class ParseTreeReader {
    private static final Set<String> IGNORED_HEADERS = Set.of(
            "header_maxterm", "header_minterm", "header_lastres", "lastres", "noncourse", "optional",
            "rule_complete", "standalone", "header_share", "header_tag", "under");
    private static final Set<String> HEADER_QUALIFIERS = Set.of(
            "header_maxpassfail", "header_maxperdisc", "header_minclass", "header_mincredit", "header_minperdisc");
    private static final Set<String> SUBSET_QUALIFIERS = Set.of(
            "maxpassfail", "maxperdisc", "mingpa", "minspread", "noncourse", "share");

    private final ObjectMapper objectMapper;

    public ParseTreeReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonNode toJson(String institution, String requirementId, String json) {
        if (json == null || json.isBlank()) return objectMapper.createObjectNode();
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new StructuralException(institution, requirementId, "parse_tree", "Parse tree is not valid JSON: " + e.getOriginalMessage());
        }
    }

    /** A null body means the tree has no body_list at all, which is different from an empty one. */
    public ParseTree read(String institution, String requirementId, JsonNode root) {
        Source src = new Source(institution, requirementId);
        if (root.hasNonNull("error")) {
            return ParseTree.failed(root.get("error").asText());
        }
        List<HeaderItem> header = new ArrayList<>();
        JsonNode headerList = root.get("header_list");
        if (headerList != null && !headerList.isNull()) {
            if (!headerList.isArray()) throw src.error(headerList, "header_list is not a list");
            headerList.forEach(item -> header.add(readHeaderItem(src, item)));
        }
        JsonNode bodyList = root.get("body_list");
        List<BodyRule> body = null;
        if (bodyList != null && !bodyList.isNull()) {
            body = readRules(src, bodyList);
        }
        return new ParseTree(header, body, null);
    }

    // Header -----------------------------------------------------------------------------------

    private List<HeaderItem> readHeaderItems(Source src, JsonNode node) {
        if (node == null || node.isNull()) return List.of();
        if (!node.isArray()) return List.of(readHeaderItem(src, node));
        List<HeaderItem> items = new ArrayList<>();
        node.forEach(item -> items.add(readHeaderItem(src, item)));
        return items;
    }

    private HeaderItem readHeaderItem(Source src, JsonNode item) {
        if (!item.isObject() || item.size() != 1) {
            throw src.error(item, "Header item is not a single-key record");
        }
        String key = item.fieldNames().next();
        JsonNode value = item.get(key);

        if (IGNORED_HEADERS.contains(key)) return new IgnoredHeader(key);
        if (HEADER_QUALIFIERS.contains(key)) {
            return new HeaderQualifier(key, text(value, "label"), value.get(key.substring("header_".length())));
        }

        return switch (key) {
            case "header_class_credit" -> new HeaderClassCredit(
                    text(value, "label"),
                    integer(value, "min_classes"), integer(value, "max_classes"),
                    decimal(value, "min_credits"), decimal(value, "max_credits"),
                    text(value, "conjunction"),
                    value.path("is_pseudo").asBoolean(false),
                    value.get("proxy_advice"));
            case "header_maxtransfer" -> new HeaderMaxTransfer(
                    text(value, "label"),
                    Optional.ofNullable(decimal(value.path("maxtransfer"), "number")).orElse(0.0),
                    text(value.path("maxtransfer"), "class_or_credit"),
                    value.get("transfer_types"));
            case "header_minres" -> new HeaderMinResidency(
                    text(value, "label"),
                    integer(value.path("minres"), "min_classes"),
                    decimal(value.path("minres"), "min_credits"));
            case "header_mingpa" -> new HeaderMinGpa(text(value, "label"), value.get("mingpa"));
            case "header_mingrade" -> new HeaderMinGrade(
                    text(value, "label"),
                    Optional.ofNullable(decimal(value.path("mingrade"), "number")).orElse(0.0),
                    value.get("mingrade"));
            case "header_maxclass", "header_maxcredit" -> {
                JsonNode limit = value.path(key.substring("header_".length()));
                yield new HeaderCourseLimit(key, text(value, "label"),
                        Optional.ofNullable(decimal(limit, "number")).orElse(0.0),
                        courseList(src, limit.get("course_list")));
            }
            case "proxy_advice" -> new HeaderProxyAdvice(value);
            case "remark" -> new HeaderRemark(value.isTextual() ? value.asText() : text(value, "remark"));
            case "conditional" -> new HeaderConditional(
                    text(value, "condition_str"),
                    readHeaderItems(src, value.get("if_true")),
                    value.has("if_false") ? readHeaderItems(src, value.get("if_false")) : null);
            default -> new UnrecognizedHeader(key);
        };
    }

    // Body -------------------------------------------------------------------------------------

    private List<BodyRule> readRules(Source src, JsonNode node) {
        if (node == null || node.isNull()) return List.of();
        List<BodyRule> rules = new ArrayList<>();
        if (node.isArray()) node.forEach(item -> rules.add(readRule(src, item)));
        else rules.add(readRule(src, node));
        return rules;
    }

    private BodyRule readRule(Source src, JsonNode node) {
        if (node.isArray()) return new RuleList(readRules(src, node));
        if (!node.isObject()) throw src.error(node, "Unhandled node type " + node.getNodeType());
        if (node.size() != 1) throw src.error(node, "Body item is not a single-key record: " + fieldNames(node));

        String key = node.fieldNames().next();
        JsonNode value = node.get(key);

        if (value.isTextual()) {
            if (!"remark".equals(key)) throw src.error(node, "String value for " + key);
            return new Remark(value.asText());
        }
        if (value.isArray()) {
            List<BodyRule> items = new ArrayList<>();
            value.forEach(item -> items.add(readRule(src, item)));
            return new RuleList(items);
        }
        if (!value.isObject()) throw src.error(node, "Unhandled value type for " + key);

        return switch (key) {
            case "block" -> new BlockRef(text(value, "label"),
                    Optional.ofNullable(integer(value, "number")).orElse(1),
                    Optional.ofNullable(text(value, "institution")).orElse(src.institution()),
                    text(value, "block_type"), text(value, "block_value"),
                    restrictions(value));
            case "blocktype" -> new BlockTypeRef(text(value, "label"),
                    Optional.ofNullable(integer(value, "number")).orElse(1),
                    text(value, "block_type"), restrictions(value));
            case "class_credit" -> classCredit(src, value);
            case "course_list_rule" -> new CourseListRule(text(value, "label"),
                    value.hasNonNull("course_list") ? courseList(src, value.get("course_list")) : null,
                    restrictions(value));
            case "conditional" -> new Conditional(text(value, "condition_str"),
                    readRules(src, value.get("if_true")),
                    value.has("if_false") ? readRules(src, value.get("if_false")) : null);
            case "copy_rules" -> new CopyRules(text(value, "label"), text(value, "institution"),
                    text(value, "requirement_id"));
            case "group_requirement" -> groupRequirement(src, value);
            case "subset" -> subset(src, value);
            case "remark" -> new Remark(text(value, "remark"));
            case "proxy_advice" -> new ProxyAdvice(value);
            case "rule_complete" -> new RuleComplete(value.path("is_complete").asBoolean(false));
            case "noncourse" -> new NonCourse(text(value, "label"));
            default -> new Unrecognized(key, value);
        };
    }

    private ClassCredit classCredit(Source src, JsonNode value) {
        return new ClassCredit(text(value, "label"),
                integer(value, "min_classes"), integer(value, "max_classes"),
                decimal(value, "min_credits"), decimal(value, "max_credits"),
                text(value, "conjunction"),
                integer(value, "allow_classes"), decimal(value, "allow_credits"),
                value.hasNonNull("course_list") ? courseList(src, value.get("course_list")) : null,
                restrictions(value));
    }

    private GroupRequirement groupRequirement(Source src, JsonNode value) {
        List<List<BodyRule>> groups = new ArrayList<>();
        JsonNode groupList = value.path("group_list");
        if (groupList.isArray()) {
            groupList.forEach(group -> groups.add(readRules(src, group)));
        } else if (!groupList.isMissingNode() && !groupList.isNull()) {
            throw src.error(value, "group_list is not a list");
        }
        return new GroupRequirement(text(value, "label"),
                Optional.ofNullable(integer(value, "number")).orElse(groups.size()),
                groups, restrictions(value));
    }

    private Subset subset(Source src, JsonNode value) {
        List<BodyRule> rules = new ArrayList<>();
        JsonNode requirements = value.path("requirements");
        if (requirements.isArray()) {
            requirements.forEach(item -> rules.add(readSubsetRule(src, item)));
        }
        String remark = value.hasNonNull("remark")
                ? (value.get("remark").isTextual() ? value.get("remark").asText() : value.get("remark").toString())
                : null;
        return new Subset(text(value, "label"), rules, remark, value.get("proxy_advice"), restrictions(value));
    }

    private BodyRule readSubsetRule(Source src, JsonNode item) {
        if (!item.isObject() || item.size() != 1) {
            throw src.error(item, "Subset item is not a single-key record");
        }
        String key = item.fieldNames().next();
        JsonNode value = item.get(key);
        if (SUBSET_QUALIFIERS.contains(key)) return new SubsetQualifier(key, value);
        if ("class_credit".equals(key) && value.isArray()) {
            List<BodyRule> credits = new ArrayList<>();
            value.forEach(v -> credits.add(classCredit(src, v)));
            return new RuleList(credits);
        }
        return readRule(src, item);
    }

    // Course lists and scalars -----------------------------------------------------------------

    private CourseList courseList(Source src, JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        List<List<CourseTriple>> areas = new ArrayList<>();
        JsonNode scribed = node.path("scribed_courses");
        if (scribed.isArray()) {
            for (JsonNode area : scribed) {
                if (isTriple(area)) areas.add(List.of(triple(src, area)));
                else areas.add(triples(src, area));
            }
        }
        return new CourseList(areas, triples(src, node.get("except_courses")),
                triples(src, node.get("include_courses")), text(node, "label"));
    }

    private List<CourseTriple> triples(Source src, JsonNode node) {
        if (node == null || !node.isArray()) return List.of();
        List<CourseTriple> out = new ArrayList<>();
        node.forEach(t -> out.add(triple(src, t)));
        return out;
    }

    private boolean isTriple(JsonNode node) {
        return node.isObject() || (node.isArray() && node.size() > 0 && !node.get(0).isContainerNode());
    }

    private CourseTriple triple(Source src, JsonNode node) {
        if (node.isObject()) {
            return new CourseTriple(text(node, "discipline"), text(node, "catalog_number"), text(node, "with_clause"));
        }
        if (!node.isArray() || node.size() < 2) throw src.error(node, "Malformed course entry");
        JsonNode with = node.size() > 2 ? node.get(2) : null;
        return new CourseTriple(node.get(0).asText(), node.get(1).asText(),
                with == null || with.isNull() ? null : with.asText());
    }

    private Restrictions restrictions(JsonNode value) {
        JsonNode maxTransfer = value.get("maxtransfer");
        String minGrade = null;
        Double gradePoint = decimal(value.path("mingrade"), "number");
        if (gradePoint != null) minGrade = LetterGrades.letterGrade(gradePoint);
        if (maxTransfer == null && minGrade == null) return Restrictions.NONE;
        return new Restrictions(maxTransfer, minGrade);
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node == null ? null : node.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }

    private static Integer integer(JsonNode node, String field) {
        Double d = decimal(node, field);
        return d == null ? null : (int) Math.round(d);
    }

    private static Double decimal(JsonNode node, String field) {
        JsonNode v = node == null ? null : node.get(field);
        if (v == null || v.isNull()) return null;
        if (v.isNumber()) return v.asDouble();
        String s = v.asText().trim();
        if (s.isEmpty()) return null;
        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }

    private record Source(String institution, String requirementId) {
        StructuralException error(JsonNode node, String message) {
            String shown = node.toString();
            if (shown.length() > 200) shown = shown.substring(0, 200) + "...";
            return new StructuralException(institution, requirementId, shown, message);
        }
    }
}
