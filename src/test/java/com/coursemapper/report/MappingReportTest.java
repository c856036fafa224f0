package com.coursemapper.report;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MappingReportTest {

    @Test
    void countsEveryEventButRetainsOnlyTheFirstOnes() {
        MappingReport report = new MappingReport(2);

        report.record(ReportChannel.FAIL, "QNS01", "RA000001", "Missing body");
        report.record(ReportChannel.HANDLED, "QNS01", "RA000001", "Empty body");
        report.record(ReportChannel.FAIL, "QNS01", "RA000002", "Missing body");

        assertEquals(2, report.events().size());
        assertEquals(2, report.count(ReportChannel.FAIL));
        assertEquals(1, report.dropped());
        assertEquals(Map.of("fail", 2L, "handled", 1L), report.tally());
        assertFalse(report.contains(ReportChannel.FAIL, "RA000002"));
    }

    @Test
    void zeroRetainedKeepsOnlyTallies() {
        MappingReport report = new MappingReport(0);

        report.record(ReportChannel.SUBPLANS, "QNS01", "RA000001", "Subplan FIN not referenced; 25 enrolled");

        assertTrue(report.events().isEmpty());
        assertEquals(1, report.count(ReportChannel.SUBPLANS));
    }
}
