package com.coursemapper.store;

import com.coursemapper.domain.DomainModels.RequirementBlock;

import java.util.List;
import java.util.Optional;

/** Read access to stored requirement blocks. */
public interface BlockStore {

    /** Active blocks with this type and value, in a stable order. */
    List<RequirementBlock> findActive(String institution, String blockType, String blockValue);

    /** The still-valid version of a block, used when another block copies its rules. */
    Optional<RequirementBlock> findCurrent(String institution, String requirementId);
}
