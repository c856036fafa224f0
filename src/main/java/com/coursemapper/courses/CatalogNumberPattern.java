package com.coursemapper.courses;

import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Matcher for a scribed discipline or catalog number. {@code @} alone matches anything and inside a
 * token matches any run of characters. {@code lo:hi} matches catalog numbers whose leading number
 * lies in the inclusive range; either bound may be left out.
 */
public final class CatalogNumberPattern implements Predicate<String> {
    public static final String WILDCARD = "@";
    private static final Pattern LEADING_NUMBER = Pattern.compile("^\\s*(\\d+(?:\\.\\d+)?)");

    private final Predicate<String> matcher;
    private final String scribed;

    private CatalogNumberPattern(String scribed, Predicate<String> matcher) {
        this.scribed = scribed;
        this.matcher = matcher;
    }

    public static CatalogNumberPattern of(String scribed) {
        String s = scribed == null ? "" : scribed.trim();
        if (s.isEmpty() || s.equals(WILDCARD)) {
            return new CatalogNumberPattern(s, value -> true);
        }
        if (s.contains(":")) {
            String[] bounds = s.split(":", -1);
            Double lo = leadingNumber(bounds[0]);
            Double hi = leadingNumber(bounds[1]);
            return new CatalogNumberPattern(s, value -> {
                Double n = leadingNumber(value);
                return n != null && (lo == null || n >= lo) && (hi == null || n <= hi);
            });
        }
        if (s.contains(WILDCARD)) {
            StringBuilder regex = new StringBuilder();
            for (String part : s.split(WILDCARD, -1)) {
                if (regex.length() > 0) regex.append(".*");
                regex.append(Pattern.quote(part));
            }
            Pattern compiled = Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE);
            return new CatalogNumberPattern(s, value -> value != null && compiled.matcher(value.trim()).matches());
        }
        String exact = s.toUpperCase(Locale.ROOT);
        return new CatalogNumberPattern(s, value -> value != null && value.trim().toUpperCase(Locale.ROOT).equals(exact));
    }

    public boolean isWildcard() {
        return scribed.isEmpty() || scribed.equals(WILDCARD);
    }

    @Override
    public boolean test(String value) {
        return matcher.test(value);
    }

    static Double leadingNumber(String value) {
        if (value == null) return null;
        Matcher m = LEADING_NUMBER.matcher(value);
        return m.find() ? Double.valueOf(m.group(1)) : null;
    }

    @Override
    public String toString() {
        return scribed;
    }
}
