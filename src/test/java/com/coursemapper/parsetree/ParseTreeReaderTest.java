package com.coursemapper.parsetree;

import com.coursemapper.exception.StructuralException;
import com.coursemapper.parsetree.ParseTreeModels.*;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ParseTreeReaderTest {
    private final ParseTreeReader reader = new ParseTreeReader(new ObjectMapper());

    private ParseTree read(String json) {
        return reader.read("QNS01", "RA000001", reader.toJson("QNS01", "RA000001", json));
    }

    @Test
    void readsBodyRulesByKind() {
        ParseTree tree = read("""
                {"header_list": [],
                 "body_list": [
                   {"remark": "Take these"},
                   {"class_credit": {"label": "Core", "min_classes": "2", "max_classes": 2,
                                     "mingrade": {"number": "2.0"},
                                     "course_list": {"scribed_courses": [["BIO", "101", null], ["BIO", "102", "grade >= c"]],
                                                     "except_courses": [], "include_courses": []}}},
                   {"conditional": {"condition_str": "conc = FIN", "if_true": [{"noncourse": {"label": "x"}}]}},
                   {"frobnicate": {"a": 1}}
                 ]}
                """);

        assertNull(tree.error());
        assertEquals(4, tree.body().size());
        assertTrue(tree.body().get(0) instanceof Remark);

        var cc = (ClassCredit) tree.body().get(1);
        assertEquals(2, cc.minClasses());
        assertEquals("C", cc.restrictions().minGrade());
        assertEquals(2, cc.courseList().scribedCount());
        assertEquals("grade >= c", cc.courseList().scribedAreas().get(1).get(0).withClause());

        var conditional = (Conditional) tree.body().get(2);
        assertNull(conditional.ifFalse());
        assertEquals(1, conditional.ifTrue().size());

        var unknown = (Unrecognized) tree.body().get(3);
        assertEquals("frobnicate", unknown.kind());
    }

    @Test
    void multiKeyBodyItemIsStructural() {
        var e = assertThrows(StructuralException.class,
                () -> read("{\"body_list\": [{\"remark\": \"a\", \"block\": {}}]}"));
        assertEquals("RA000001", e.getRequirementId());
    }

    @Test
    void multiKeyHeaderItemIsStructural() {
        assertThrows(StructuralException.class,
                () -> read("{\"header_list\": [{\"header_mingpa\": {}, \"remark\": \"x\"}], \"body_list\": []}"));
    }

    @Test
    void invalidJsonIsStructural() {
        assertThrows(StructuralException.class, () -> reader.toJson("QNS01", "RA000001", "{not json"));
    }

    @Test
    void errorTreesAndMissingBodiesAreDistinguished() {
        ParseTree failed = read("{\"error\": \"Syntax error at line 3\"}");
        assertTrue(failed.hasError());
        assertEquals("Syntax error at line 3", failed.error());

        ParseTree noBody = read("{\"header_list\": []}");
        assertFalse(noBody.hasError());
        assertNull(noBody.body());

        ParseTree emptyBody = read("{\"header_list\": [], \"body_list\": []}");
        assertTrue(emptyBody.body().isEmpty());
    }

    @Test
    void classifiesHeaderItems() {
        ParseTree tree = read("""
                {"header_list": [
                   {"header_maxterm": {"label": "x"}},
                   {"header_minperdisc": {"label": "Per disc", "minperdisc": {"number": 2}}},
                   {"header_widget": {"label": "?"}},
                   {"conditional": {"condition_str": "X", "if_true": {"remark": "r"}, "if_false": []}}
                 ],
                 "body_list": []}
                """);

        assertTrue(tree.header().get(0) instanceof IgnoredHeader);
        assertEquals("header_minperdisc", ((HeaderQualifier) tree.header().get(1)).kind());
        assertTrue(tree.header().get(2) instanceof UnrecognizedHeader);
        var conditional = (HeaderConditional) tree.header().get(3);
        assertEquals(1, conditional.ifTrue().size());
        assertTrue(conditional.ifFalse().isEmpty());
    }
}
