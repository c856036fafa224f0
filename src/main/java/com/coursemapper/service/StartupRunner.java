package com.coursemapper.service;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Performs a full run once the application is up, when {@code course-mapper.run-on-startup} is set. */
@Component
@ConditionalOnProperty(prefix = "course-mapper", name = "run-on-startup", havingValue = "true")
public class StartupRunner implements ApplicationRunner {
    private final MappingRunService runService;

    public StartupRunner(MappingRunService runService) {
        this.runService = runService;
    }

    @Override
    public void run(ApplicationArguments args) {
        runService.run(args.getNonOptionArgs());
    }
}
