package com.coursemapper.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;
import java.util.Locale;

/** Switches for a mapping run, bound from {@code course-mapper.*}. */
@ConfigurationProperties(prefix = "course-mapper")
public record CourseMapperProperties(@DefaultValue("true") boolean conciseConditionals,
                                     @DefaultValue("true") boolean remarks,
                                     @DefaultValue("true") boolean proxyAdvice,
                                     @DefaultValue("64") int maxDepth,
                                     @DefaultValue("MHC") List<String> ignoredBlockValuePrefixes,
                                     @DefaultValue("false") boolean runOnStartup,
                                     @DefaultValue("1000") int reportRetainedEvents) {

    public static CourseMapperProperties defaults() {
        return new CourseMapperProperties(true, true, true, 64, List.of("MHC"), false, 1000);
    }

    public boolean isIgnoredBlockValue(String blockValue) {
        if (blockValue == null) return false;
        String upper = blockValue.toUpperCase(Locale.ROOT);
        return ignoredBlockValuePrefixes.stream()
                .anyMatch(p -> !p.isBlank() && upper.startsWith(p.toUpperCase(Locale.ROOT)));
    }

    public CourseMapperProperties withConciseConditionals(boolean concise) {
        return new CourseMapperProperties(concise, remarks, proxyAdvice, maxDepth, ignoredBlockValuePrefixes, runOnStartup, reportRetainedEvents);
    }

    public CourseMapperProperties withMaxDepth(int depth) {
        return new CourseMapperProperties(conciseConditionals, remarks, proxyAdvice, depth, ignoredBlockValuePrefixes, runOnStartup, reportRetainedEvents);
    }

    public CourseMapperProperties withRemarks(boolean enabled) {
        return new CourseMapperProperties(conciseConditionals, enabled, proxyAdvice, maxDepth, ignoredBlockValuePrefixes, runOnStartup, reportRetainedEvents);
    }
}
