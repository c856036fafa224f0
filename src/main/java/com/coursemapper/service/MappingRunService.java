package com.coursemapper.service;

import com.coursemapper.config.CourseMapperProperties;
import com.coursemapper.domain.DomainModels.ActivePlan;
import com.coursemapper.interpreter.MappingRun;
import com.coursemapper.interpreter.ParseTreeCache;
import com.coursemapper.interpreter.RequirementInterpreter;
import com.coursemapper.parsetree.ParseTreeReader;
import com.coursemapper.report.MappingReport;
import com.coursemapper.repository.ActivePlanJdbcRepository;
import com.coursemapper.repository.QuarantineJdbcRepository;
import com.coursemapper.store.BlockParser;
import com.coursemapper.store.MappingOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

/**
 * Runs the mapper over every active plan. Output rows are written as they are produced, so a run
 * aborted by a structural error leaves the rows written up to that point. Runs share one set of
 * output tables and are executed one at a time.
 */
@Service
public class MappingRunService {
    private static final Logger log = LoggerFactory.getLogger(MappingRunService.class);

    private final ActivePlanJdbcRepository planRepository;
    private final QuarantineJdbcRepository quarantineRepository;
    private final RequirementInterpreter interpreter;
    private final MappingOutput output;
    private final ParseTreeReader reader;
    private final BlockParser parser;
    private final CourseMapperProperties properties;
    private final Clock clock;

    public MappingRunService(ActivePlanJdbcRepository planRepository,
                             QuarantineJdbcRepository quarantineRepository,
                             RequirementInterpreter interpreter,
                             MappingOutput output,
                             ParseTreeReader reader,
                             BlockParser parser,
                             CourseMapperProperties properties) {
        this.planRepository = planRepository;
        this.quarantineRepository = quarantineRepository;
        this.interpreter = interpreter;
        this.output = output;
        this.reader = reader;
        this.parser = parser;
        this.properties = properties;
        this.clock = Clock.systemDefaultZone();
    }

    public synchronized RunSummary run(Collection<String> institutions) {
        long start = System.currentTimeMillis();
        List<ActivePlan> plans = planRepository.findActivePlans(institutions == null ? List.of() : institutions);
        log.info("Mapping {} active plans{}", plans.size(),
                institutions == null || institutions.isEmpty() ? "" : " for " + institutions);

        output.reset();
        MappingReport report = new MappingReport(properties.reportRetainedEvents());
        MappingRun run = new MappingRun(LocalDate.now(clock).toString(), quarantineRepository.snapshot(),
                new ParseTreeCache(reader, parser), report);
        for (ActivePlan plan : plans) {
            interpreter.processPlan(plan, run);
        }

        RunSummary summary = new RunSummary(plans.size(), run.blocksByType(), run.requirementCount(),
                run.courseMappingCount(), report.tally(), run.dispatchCounts(), System.currentTimeMillis() - start);
        log.info("Mapped {} blocks {} into {} requirements and {} course mappings in {} ms",
                summary.blocks(), summary.blocksByType(), summary.requirements(), summary.courseMappings(),
                summary.elapsedMillis());
        log.info("Report channels: {}", summary.reportTally());
        if (report.dropped() > 0) {
            log.info("{} report events were logged but not retained", report.dropped());
        }
        return summary;
    }
}
