package org.broadinstitute.treealign.tools.treealign;

import java.util.List;

/**
 * Builds the consensus inputs used to discriminate between the clean children of a clade.
 */
@FunctionalInterface
public interface ProfileBuilder {

    /**
     * @param childLeafSets leaf (cell) names under each clean child, in roster order.
     * @param eligibleCells cells still under consideration at this clade.
     * @return never {@code null}; tables must be row-aligned across tracks and clade-columns must follow the roster order.
     */
    CloneAssignmentInputs build(List<List<String>> childLeafSets, List<String> eligibleCells);
}
