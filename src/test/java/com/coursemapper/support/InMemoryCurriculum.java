package com.coursemapper.support;

import com.coursemapper.courses.CatalogNumberPattern;
import com.coursemapper.domain.DomainModels.*;
import com.coursemapper.store.BlockParser;
import com.coursemapper.store.BlockStore;
import com.coursemapper.store.CatalogLookup;
import com.coursemapper.store.MappingOutput;

import java.util.*;

/** Blocks, catalog and output sink held in memory, for interpreter tests without a database. */
public class InMemoryCurriculum implements BlockStore, CatalogLookup, MappingOutput, BlockParser {
    private final Map<BlockId, RequirementBlock> blocks = new LinkedHashMap<>();
    private final Set<BlockId> inactive = new HashSet<>();
    private final Map<String, List<CatalogCourse>> courses = new HashMap<>();
    private int nextCourseId = 1;

    public final List<ProgramRow> programs = new ArrayList<>();
    public final List<RequirementRow> requirements = new ArrayList<>();
    public final List<CourseMappingRow> mappings = new ArrayList<>();

    public RequirementBlock block(String institution, String requirementId, String blockType, String blockValue,
                                  String title, String parseTreeJson) {
        return block(institution, requirementId, blockType, blockValue, title, null, parseTreeJson);
    }

    public RequirementBlock block(String institution, String requirementId, String blockType, String blockValue,
                                  String title, String discriminator, String parseTreeJson) {
        RequirementBlock block = new RequirementBlock(institution, requirementId, blockType, blockValue, title,
                "2020-09-01", "99999999", discriminator, parseTreeJson);
        blocks.put(block.id(), block);
        return block;
    }

    public void deactivate(RequirementBlock block) {
        inactive.add(block.id());
    }

    public CatalogCourse course(String institution, String discipline, String catalogNumber, String title, String credits) {
        CatalogCourse course = new CatalogCourse(nextCourseId++, 1, title, credits, "UGRD", discipline, catalogNumber);
        courses.computeIfAbsent(institution, i -> new ArrayList<>()).add(course);
        return course;
    }

    public List<CourseMappingRow> mappingsFor(int requirementKey) {
        return mappings.stream().filter(m -> m.requirementKey() == requirementKey).toList();
    }


    @Override
    public List<RequirementBlock> findActive(String institution, String blockType, String blockValue) {
        return blocks.values().stream()
                .filter(b -> !inactive.contains(b.id()))
                .filter(b -> b.institution().equals(institution) && b.blockType().equals(blockType)
                        && b.blockValue().equals(blockValue))
                .toList();
    }

    @Override
    public Optional<RequirementBlock> findCurrent(String institution, String requirementId) {
        return Optional.ofNullable(blocks.get(new BlockId(institution, requirementId))).filter(b -> b.periodStop().startsWith("9"));
    }

    @Override
    public List<CatalogCourse> expand(String institution, String disciplinePattern, String catalogNumberPattern) {
        CatalogNumberPattern discipline = CatalogNumberPattern.of(disciplinePattern);
        CatalogNumberPattern number = CatalogNumberPattern.of(catalogNumberPattern);
        return courses.getOrDefault(institution, List.of()).stream()
                .filter(c -> discipline.test(c.discipline()) && number.test(c.catalogNumber()))
                .toList();
    }

    @Override
    public String parse(RequirementBlock block) {
        return "{\"error\": \"not parsed\"}";
    }

    @Override
    public void reset() {
        programs.clear();
        requirements.clear();
        mappings.clear();
    }

    @Override
    public void writeProgram(ProgramRow row) {
        programs.add(row);
    }

    @Override
    public void writeRequirement(RequirementRow row) {
        requirements.add(row);
    }

    @Override
    public void writeCourseMapping(CourseMappingRow row) {
        mappings.add(row);
    }
}
