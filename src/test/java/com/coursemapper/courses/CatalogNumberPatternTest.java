package com.coursemapper.courses;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CatalogNumberPatternTest {

    @Test
    void wildcardAloneMatchesEverything() {
        CatalogNumberPattern any = CatalogNumberPattern.of("@");
        assertTrue(any.isWildcard());
        assertTrue(any.test("10100"));
        assertTrue(any.test("W 200"));
    }

    @Test
    void wildcardInsideTokenMatchesAnyRun() {
        CatalogNumberPattern pattern = CatalogNumberPattern.of("1@");
        assertTrue(pattern.test("101"));
        assertTrue(pattern.test("1"));
        assertFalse(pattern.test("201"));
        assertTrue(CatalogNumberPattern.of("b@").test("BIO"));
    }

    @Test
    void rangesUseTheLeadingNumberInclusively() {
        CatalogNumberPattern range = CatalogNumberPattern.of("100:199");
        assertTrue(range.test("100"));
        assertTrue(range.test("150W"));
        assertTrue(range.test("199"));
        assertFalse(range.test("200"));
        assertFalse(range.test("ABC"));

        assertTrue(CatalogNumberPattern.of(":150").test("20"));
        assertFalse(CatalogNumberPattern.of("300:").test("299.5"));
    }

    @Test
    void plainNumbersMatchExactlyIgnoringCase() {
        assertTrue(CatalogNumberPattern.of("101h").test("101H"));
        assertFalse(CatalogNumberPattern.of("101").test("1010"));
    }
}
