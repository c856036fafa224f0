package com.coursemapper.interpreter;

import com.coursemapper.domain.DomainModels.BlockId;
import com.coursemapper.domain.DomainModels.RequirementBlock;
import com.coursemapper.parsetree.ParseTreeModels.ParseTree;
import com.coursemapper.parsetree.ParseTreeReader;
import com.coursemapper.report.MappingReport;
import com.coursemapper.report.ReportChannel;
import com.coursemapper.store.BlockParser;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.HashMap;
import java.util.Map;

/** Parse trees by block identity, read once per run. Blocks stored without a tree are parsed on demand. */
public class ParseTreeCache {
    private final ParseTreeReader reader;
    private final BlockParser parser;
    private final Map<BlockId, ParseTree> trees = new HashMap<>();

    public ParseTreeCache(ParseTreeReader reader, BlockParser parser) {
        this.reader = reader;
        this.parser = parser;
    }

    public ParseTree get(RequirementBlock block, MappingReport report) {
        ParseTree cached = trees.get(block.id());
        if (cached != null) return cached;

        String json = block.parseTreeJson();
        JsonNode root = reader.toJson(block.institution(), block.requirementId(), json);
        if (root.isEmpty()) {
            report.record(ReportChannel.HANDLED, block.institution(), block.requirementId(), "Reference to un-parsed block");
            root = reader.toJson(block.institution(), block.requirementId(), parser.parse(block));
        }
        ParseTree tree = root.isEmpty()
                ? ParseTree.failed("Empty parse tree")
                : reader.read(block.institution(), block.requirementId(), root);
        trees.put(block.id(), tree);
        return tree;
    }
}
