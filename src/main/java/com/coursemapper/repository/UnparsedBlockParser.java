package com.coursemapper.repository;

import com.coursemapper.domain.DomainModels.RequirementBlock;
import com.coursemapper.store.BlockParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

/** Stands in for the requirement grammar parser: a block without a stored tree cannot be mapped. */
@Component
public class UnparsedBlockParser implements BlockParser {
    private final ObjectMapper objectMapper;

    public UnparsedBlockParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String parse(RequirementBlock block) {
        ObjectNode result = objectMapper.createObjectNode();
        result.put("error", "No parse tree stored for " + block.institution() + " " + block.requirementId()
                + " (" + block.catalogYears() + ")");
        return result.toString();
    }
}
