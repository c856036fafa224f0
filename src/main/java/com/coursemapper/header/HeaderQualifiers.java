package com.coursemapper.header;

import java.util.*;

/**
 * Program-level qualifiers of one block. Each list holds entries in scribed order, interleaved
 * with the open and close tags of the header conditionals they came from.
 */
public class HeaderQualifiers {
    private final Map<QualifierList, List<Object>> lists = new EnumMap<>(QualifierList.class);
    private final List<String> remarks = new ArrayList<>();
    private Map<String, Object> planInfo;

    public HeaderQualifiers() {
        for (QualifierList list : QualifierList.values()) lists.put(list, new ArrayList<>());
    }

    public List<Object> list(QualifierList list) {
        return Collections.unmodifiableList(lists.get(list));
    }

    void append(QualifierList list, Object entry) {
        lists.get(list).add(entry);
    }

    void addRemark(String remark) {
        if (remark != null && !remark.isBlank()) remarks.add(remark.trim());
    }

    public void setPlanInfo(Map<String, Object> planInfo) {
        this.planInfo = planInfo;
    }

    /** The non-column lists keyed by name, plus the header remark and plan info when present. */
    public Map<String, Object> other() {
        Map<String, Object> out = new LinkedHashMap<>();
        for (QualifierList list : QualifierList.values()) {
            if (!list.isColumn()) out.put(list.key(), lists.get(list));
        }
        if (!remarks.isEmpty()) out.put("remark", String.join(" ", remarks));
        if (planInfo != null) out.put("plan_info", planInfo);
        return out;
    }
}
