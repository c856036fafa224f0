package com.coursemapper.store;

import com.coursemapper.domain.DomainModels.RequirementBlock;

/**
 * Grammar parser for requirement text. Returns the parse tree as JSON: either an object with
 * {@code header_list} and {@code body_list}, or one with an {@code error} string.
 */
public interface BlockParser {

    String parse(RequirementBlock block);
}
