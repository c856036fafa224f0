package com.coursemapper.header;

/** The program-level qualifier lists. Column lists get their own output column; the rest go into "other". */
public enum QualifierList {
    TOTAL_CREDITS("total_credits_list", true),
    MAX_TRANSFER("maxtransfer_list", true),
    MIN_RESIDENCY("minres_list", true),
    MIN_GRADE("mingrade_list", true),
    MIN_GPA("mingpa_list", true),
    MAX_CLASS("maxclass_list", false),
    MAX_CREDIT("maxcredit_list", false),
    MAX_PASS_FAIL("maxpassfail_list", false),
    MAX_PER_DISC("maxperdisc_list", false),
    MIN_CLASS("minclass_list", false),
    MIN_CREDIT("mincredit_list", false),
    MIN_PER_DISC("minperdisc_list", false),
    PROXY_ADVICE("proxyadvice_list", false),
    CONDITIONAL("conditional_dict", false);

    private final String key;
    private final boolean column;

    QualifierList(String key, boolean column) {
        this.key = key;
        this.column = column;
    }

    public String key() {
        return key;
    }

    public boolean isColumn() {
        return column;
    }

    public static QualifierList forHeaderKind(String kind) {
        return switch (kind) {
            case "header_maxclass" -> MAX_CLASS;
            case "header_maxcredit" -> MAX_CREDIT;
            case "header_maxpassfail" -> MAX_PASS_FAIL;
            case "header_maxperdisc" -> MAX_PER_DISC;
            case "header_minclass" -> MIN_CLASS;
            case "header_mincredit" -> MIN_CREDIT;
            case "header_minperdisc" -> MIN_PER_DISC;
            default -> throw new IllegalArgumentException("No qualifier list for " + kind);
        };
    }
}
