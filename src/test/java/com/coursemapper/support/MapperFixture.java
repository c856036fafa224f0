package com.coursemapper.support;

import com.coursemapper.config.CourseMapperProperties;
import com.coursemapper.context.ContextSerializer;
import com.coursemapper.courses.CourseListNormalizer;
import com.coursemapper.domain.DomainModels.*;
import com.coursemapper.header.HeaderExtractor;
import com.coursemapper.interpreter.*;
import com.coursemapper.parsetree.ParseTreeReader;
import com.coursemapper.report.MappingReport;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Set;

/** Wires the interpreter by hand against an {@link InMemoryCurriculum}. */
public class MapperFixture {
    public final ObjectMapper objectMapper = new ObjectMapper();
    public final InMemoryCurriculum curriculum = new InMemoryCurriculum();
    public final CourseMapperProperties properties;
    public final ParseTreeReader reader = new ParseTreeReader(objectMapper);
    public final CourseListNormalizer normalizer = new CourseListNormalizer(curriculum);
    public final HeaderExtractor headerExtractor;
    public final RequirementInterpreter interpreter;

    public MapperFixture() {
        this(CourseMapperProperties.defaults());
    }

    public MapperFixture(CourseMapperProperties properties) {
        this.properties = properties;
        this.headerExtractor = new HeaderExtractor(normalizer, properties);
        ContextSerializer serializer = new ContextSerializer(objectMapper);
        RequirementEmitter emitter = new RequirementEmitter(normalizer, serializer, curriculum);
        this.interpreter = new RequirementInterpreter(headerExtractor, new ReferenceResolver(curriculum), emitter,
                serializer, curriculum, properties);
    }

    public MappingRun newRun(Set<BlockId> quarantine) {
        return new MappingRun("2026-10-18", quarantine, new ParseTreeCache(reader, curriculum), new MappingReport());
    }

    public MappingRun newRun() {
        return newRun(Set.of());
    }

    public static PlanDescriptor plan(String name, String type, SubplanDescriptor... subplans) {
        return new PlanDescriptor(name, type, name + " description", "2020-09-01", "26.0101", 4, 100, List.of(subplans));
    }

    public static SubplanDescriptor subplan(String name, RequirementBlock block) {
        return new SubplanDescriptor(name, "CON", name + " description", "2020-09-01", "26.0101", 4, 25, block);
    }

    /** Body JSON for a parse tree with an empty header. */
    public static String tree(String bodyList) {
        return "{\"header_list\": [], \"body_list\": " + bodyList + "}";
    }

    /** A class_credit rule over the given scribed course triples, e.g. {@code ["BIO", "1@", null]}. */
    public static String classCredit(String label, String scribed, String except) {
        return """
                {"class_credit": {"label": "%s", "min_classes": 3, "max_classes": 3,
                  "course_list": {"scribed_courses": [[%s]], "except_courses": [%s], "include_courses": []}}}
                """.formatted(label, scribed, except);
    }
}
