package com.coursemapper.interpreter;

import com.coursemapper.context.ContextFrame.ConditionFrame;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort summary of the conditions enclosing a requirement. Only expressions about majors,
 * minors and concentrations are kept, rewritten as e.g. {@code CON == FIN || CON == ACC}; an else
 * leg is negated with De Morgan's laws. Anything else contributes nothing.
 */
public final class ConditionExpressions {
    private static final Pattern PROGRAM_TERM = Pattern.compile("\\b(major|minor|conc)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern TOKEN = Pattern.compile("<>|=|\\(|\\)|[^\\s=<>()]+");
    private static final Pattern CONCENTRATION = Pattern.compile("CON == ([^\\s()]+)");

    private ConditionExpressions() {
    }

    public static String summarize(List<ConditionFrame> conditions) {
        List<String> parts = new ArrayList<>();
        for (ConditionFrame frame : conditions) {
            String rewritten = rewrite(frame.condition(), frame.tag().negated());
            if (!rewritten.isEmpty()) parts.add(rewritten);
        }
        return String.join(" && ", parts);
    }

    /** Concentration codes the summary requires to be equal, in order of appearance. */
    public static List<String> eligibleConcentrations(String summary) {
        Set<String> codes = new LinkedHashSet<>();
        Matcher m = CONCENTRATION.matcher(summary);
        while (m.find()) codes.add(m.group(1));
        return List.copyOf(codes);
    }

    static String rewrite(String expression, boolean deMorgan) {
        if (expression == null || !PROGRAM_TERM.matcher(expression).find()) return "";
        StringBuilder sentence = new StringBuilder();
        Matcher m = TOKEN.matcher(expression.trim());
        while (m.find()) {
            String token = m.group().toUpperCase(Locale.ROOT);
            switch (token) {
                case "MAJOR" -> sentence.append("MAJ");
                case "MINOR" -> sentence.append("MIN");
                case "CONC" -> sentence.append("CON");
                case "AND" -> sentence.append(deMorgan ? " || " : " && ");
                case "OR" -> sentence.append(deMorgan ? " && " : " || ");
                case "=" -> sentence.append(deMorgan ? " != " : " == ");
                case "<>" -> sentence.append(deMorgan ? " == " : " != ");
                // negation inside a program condition has no summary form
                case "NOT" -> {
                    return "";
                }
                default -> sentence.append(token);
            }
        }
        return sentence.toString().trim();
    }
}
