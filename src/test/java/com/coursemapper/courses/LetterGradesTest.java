package com.coursemapper.courses;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LetterGradesTest {
    private static final List<String> ORDER = List.of("Any", "D", "D+", "C-", "C", "C+", "B-", "B", "B+", "A-", "A", "A+");

    @Test
    void mapsScaleBoundaries() {
        assertEquals("Any", LetterGrades.letterGrade(0.0));
        assertEquals("Any", LetterGrades.letterGrade(0.7));
        assertEquals("D", LetterGrades.letterGrade(1.0));
        assertEquals("D+", LetterGrades.letterGrade(1.3));
        assertEquals("C-", LetterGrades.letterGrade(1.7));
        assertEquals("C", LetterGrades.letterGrade(2.0));
        assertEquals("C+", LetterGrades.letterGrade(2.3));
        assertEquals("B-", LetterGrades.letterGrade(2.7));
        assertEquals("B", LetterGrades.letterGrade(3.0));
        assertEquals("B+", LetterGrades.letterGrade(3.3));
        assertEquals("A-", LetterGrades.letterGrade(3.7));
        assertEquals("A", LetterGrades.letterGrade(4.0));
        assertEquals("A+", LetterGrades.letterGrade(4.3));
        assertEquals("A+", LetterGrades.letterGrade(5.0));
    }

    @Test
    void isNonDecreasingOverGradePoints() {
        int previous = 0;
        for (int tenths = 0; tenths <= 60; tenths++) {
            String grade = LetterGrades.letterGrade(tenths / 10.0);
            int rank = ORDER.indexOf(grade);
            assertTrue(rank >= 0, "unexpected grade " + grade);
            assertTrue(rank >= previous, grade + " at " + tenths / 10.0 + " is lower than " + ORDER.get(previous));
            previous = rank;
        }
    }
}
