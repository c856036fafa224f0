package com.coursemapper.courses;

/**
 * Converts a passing grade point to a letter grade.
 *
 * <pre>
 *   4.3 A+   4.0 A   3.7 A-
 *   3.3 B+   3.0 B   2.7 B-
 *   2.3 C+   2.0 C   1.7 C-
 *   1.3 D+   1.0 D   below 1.0 Any
 * </pre>
 */
public final class LetterGrades {
    private static final String[] LETTERS = {"D", "C", "B", "A"};
    private static final String[] SUFFIXES = {"-", "", "+"};

    private LetterGrades() {}

    public static String letterGrade(double gradePoint) {
        if (Double.isNaN(gradePoint) || gradePoint < 1.0) return "Any";
        // work in whole tenths so 4.3 and friends don't fall just short of their boundary
        long tenths = (long) Math.floor(gradePoint * 10 + 1e-9);
        if (tenths >= 43) return "A+";
        long offset = tenths - 7;
        int letter = (int) Math.min(offset / 10, 3);
        int suffix = (int) Math.min((offset % 10) / 3, 2);
        return LETTERS[letter] + SUFFIXES[suffix];
    }
}
