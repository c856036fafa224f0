package com.coursemapper.report;

public enum ReportChannel {
    HANDLED("handled"),
    IGNORED("ignored"),
    TODO("todo"),
    FAIL("fail"),
    ANOMALY("anomaly"),
    SUBPLANS("subplans"),
    NO_COURSES("no-courses"),
    BLOCKS("blocks"),
    LABELS("labels");

    private final String channelName;

    ReportChannel(String channelName) {
        this.channelName = channelName;
    }

    public String channelName() {
        return channelName;
    }

    public String loggerName() {
        return "course-mapper." + channelName;
    }
}
