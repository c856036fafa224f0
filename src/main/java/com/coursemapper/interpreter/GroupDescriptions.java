package com.coursemapper.interpreter;

import java.util.*;

/** English wording for group requirements, used when the scribed label says nothing more. */
public final class GroupDescriptions {
    private static final List<String> NUMBER_NAMES = List.of("none", "one", "two", "three", "four", "five", "six",
            "seven", "eight", "nine", "ten", "eleven", "twelve");
    private static final List<String> NUMBER_ORDINALS = List.of("zeroth", "first", "second", "third", "fourth",
            "fifth", "sixth", "seventh", "eighth", "ninth", "tenth", "eleventh", "twelfth");
    private static final Set<String> IGNORE_WORDS;

    static {
        Set<String> words = new HashSet<>(NUMBER_NAMES);
        words.addAll(List.of("and", "area", "areas", "choose", "following", "from", "group", "groups", "module",
                "modules", "of", "option", "options", "or", "select", "selected", "selct", "slect", "sequence",
                "sequences", "set", "study", "the"));
        IGNORE_WORDS = Set.copyOf(words);
    }

    private GroupDescriptions() {
    }

    public static String describe(int numGroups, int numRequired) {
        String prefix;
        if (numRequired == numGroups) {
            prefix = numRequired == 1 ? "The" : numRequired == 2 ? "Both of the" : "All of the";
        } else if (numRequired == 1 && numGroups == 2) {
            prefix = "Either of the";
        } else {
            prefix = "Any " + name(numRequired) + " of the";
        }
        return prefix + " following " + name(numGroups) + " group" + (numGroups == 1 ? "" : "s");
    }

    /** "Second of three groups" for the 1-based group number. */
    public static String ordinal(int groupNumber, int numGroups) {
        String of = " of " + name(numGroups) + " group" + (numGroups == 1 ? "" : "s");
        if (groupNumber < NUMBER_ORDINALS.size()) {
            String ordinal = NUMBER_ORDINALS.get(groupNumber);
            return Character.toUpperCase(ordinal.charAt(0)) + ordinal.substring(1) + of;
        }
        return String.format(Locale.ROOT, "Group number %,d", groupNumber) + of;
    }

    /** True when the label holds only numbers, punctuation and filler words. */
    public static boolean isGeneric(String label) {
        if (label == null || label.isBlank()) return true;
        String stripped = label.replaceAll("[\\d\\p{Punct}]+", " ").toLowerCase(Locale.ROOT);
        return Arrays.stream(stripped.split("\\s+"))
                .filter(w -> !w.isEmpty())
                .allMatch(IGNORE_WORDS::contains);
    }

    public static String label(String scribed, int numGroups, int numRequired) {
        return isGeneric(scribed) ? describe(numGroups, numRequired) : scribed;
    }

    private static String name(int n) {
        return n >= 0 && n < NUMBER_NAMES.size() ? NUMBER_NAMES.get(n) : String.format(Locale.ROOT, "%,d", n);
    }
}
