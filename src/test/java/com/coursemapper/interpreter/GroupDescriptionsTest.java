package com.coursemapper.interpreter;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GroupDescriptionsTest {

    @Test
    void describesHowManyGroupsAreRequired() {
        assertEquals("The following one group", GroupDescriptions.describe(1, 1));
        assertEquals("Both of the following two groups", GroupDescriptions.describe(2, 2));
        assertEquals("All of the following three groups", GroupDescriptions.describe(3, 3));
        assertEquals("Either of the following two groups", GroupDescriptions.describe(2, 1));
        assertEquals("Any two of the following four groups", GroupDescriptions.describe(4, 2));
        assertEquals("Any one of the following 20 groups", GroupDescriptions.describe(20, 1));
    }

    @Test
    void numbersGroupsInWords() {
        assertEquals("First of one group", GroupDescriptions.ordinal(1, 1));
        assertEquals("Second of three groups", GroupDescriptions.ordinal(2, 3));
        assertEquals("Group number 14 of 15 groups", GroupDescriptions.ordinal(14, 15));
    }

    @Test
    void genericLabelsAreReplaced() {
        assertTrue(GroupDescriptions.isGeneric("Select 1 of the following 2 groups:"));
        assertTrue(GroupDescriptions.isGeneric(null));
        assertFalse(GroupDescriptions.isGeneric("Choose a writing sequence"));

        assertEquals("Either of the following two groups",
                GroupDescriptions.label("Select 1 of the following 2 groups:", 2, 1));
        assertEquals("Choose a writing sequence", GroupDescriptions.label("Choose a writing sequence", 2, 1));
    }
}
