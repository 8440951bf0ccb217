package org.broadinstitute.treealign.testutils;

import org.broadinstitute.treealign.tools.treealign.CellMatrix;
import org.broadinstitute.treealign.tools.treealign.CloneAssignmentInputs;
import org.broadinstitute.treealign.tools.treealign.ProfileBuilder;
import org.broadinstitute.treealign.utils.tree.Clade;
import org.broadinstitute.treealign.utils.tree.LineageTree;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Deterministic {@link ProfileBuilder}: builds {@code geneCount} genes and {@code snpCount} SNPs for every visit, with
 * consensus columns named after the clean children.  A count of zero yields an empty total-copy-number track or no
 * allele-specific track at all.
 */
public final class ConsensusProfileBuilder implements ProfileBuilder {

    private final LineageTree tree;
    private final int geneCount;
    private final int snpCount;
    private final List<List<String>> rosters = new ArrayList<>();
    private final List<List<String>> eligibleCells = new ArrayList<>();

    public ConsensusProfileBuilder(final LineageTree tree, final int geneCount, final int snpCount) {
        this.tree = tree;
        this.geneCount = geneCount;
        this.snpCount = snpCount;
    }

    @Override
    public CloneAssignmentInputs build(final List<List<String>> childLeafSets, final List<String> cells) {
        final List<String> roster = childLeafSets.stream().map(this::cladeNameOf).collect(Collectors.toList());
        rosters.add(roster);
        eligibleCells.add(new ArrayList<>(cells));

        final List<String> genes = LineageTreeTestUtils.names("gene", geneCount);
        final List<String> snps = LineageTreeTestUtils.names("snp", snpCount);
        final CellMatrix expression = filled(genes, cells, 3.);
        final CellMatrix consensus = filled(genes, roster, 2.);
        if (snpCount == 0) {
            return new CloneAssignmentInputs(expression, consensus, null, null, null);
        }
        return new CloneAssignmentInputs(expression, consensus, filled(snps, roster, 1.), filled(snps, cells, 4.), filled(snps, cells, 8.));
    }

    /**
     * @return the clean-child rosters of every visit that reached input construction, in visit order.
     */
    public List<List<String>> getRosters() {
        return rosters;
    }

    public List<List<String>> getEligibleCells() {
        return eligibleCells;
    }

    private String cladeNameOf(final List<String> leafNames) {
        return tree.getClades().stream()
                .filter(c -> c.getTerminalNames().equals(leafNames))
                .map(Clade::getName)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("no clade has leaves " + leafNames));
    }

    private static CellMatrix filled(final List<String> rows, final List<String> columns, final double value) {
        if (rows.isEmpty() || columns.isEmpty()) {
            return CellMatrix.empty(rows, columns);
        }
        final double[][] values = new double[rows.size()][columns.size()];
        for (final double[] row : values) {
            Arrays.fill(row, value);
        }
        return new CellMatrix(rows, columns, values);
    }
}
