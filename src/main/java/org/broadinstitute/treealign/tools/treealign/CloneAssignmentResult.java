package org.broadinstitute.treealign.tools.treealign;

import org.broadinstitute.treealign.utils.Utils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Consensus outcome of a {@link CloneAssigner} run at one clade.
 */
public final class CloneAssignmentResult {

    private final double noneFrequency;
    private final Map<String, Integer> cloneAssignments;
    private final CellMatrix assignmentTable;
    private final double[] meanGeneTypeScores;
    private final double[] meanAlleleAssignProbabilities;

    /**
     * @param noneFrequency fraction of outcomes without a confident assignment, in [0, 1].
     * @param cloneAssignments index into the clean-child roster for each confidently assigned cell; cells without
     *                         a confident assignment are simply absent.
     * @param assignmentTable per-run assignments (cells x runs), may be {@code null}.
     * @param meanGeneTypeScores mean gene-type score per row of the consensus copy-number table, {@code null} if
     *                           the total-copy-number track was not used.
     * @param meanAlleleAssignProbabilities mean allele-assignment probability per row of the haplotype copy-number
     *                                      table, {@code null} if the allele-specific track was not used.
     */
    public CloneAssignmentResult(final double noneFrequency,
                                 final Map<String, Integer> cloneAssignments,
                                 final CellMatrix assignmentTable,
                                 final double[] meanGeneTypeScores,
                                 final double[] meanAlleleAssignProbabilities) {
        Utils.nonNull(cloneAssignments, "clone assignments cannot be null");
        Utils.containsNoNull(cloneAssignments.values(), "clone assignments cannot contain null indices; leave the cell out instead");
        this.noneFrequency = noneFrequency;
        this.cloneAssignments = Collections.unmodifiableMap(new LinkedHashMap<>(cloneAssignments));
        this.assignmentTable = assignmentTable;
        this.meanGeneTypeScores = meanGeneTypeScores == null ? null : meanGeneTypeScores.clone();
        this.meanAlleleAssignProbabilities = meanAlleleAssignProbabilities == null ? null : meanAlleleAssignProbabilities.clone();
    }

    public double getNoneFrequency() {
        return noneFrequency;
    }

    /**
     * Fraction of outcomes with a confident assignment, {@code 1 - noneFrequency}.
     */
    public double getAssignedFrequency() {
        return 1 - noneFrequency;
    }

    public Map<String, Integer> getCloneAssignments() {
        return cloneAssignments;
    }

    public OptionalInt getCloneIndex(final String cell) {
        final Integer index = cloneAssignments.get(cell);
        return index == null ? OptionalInt.empty() : OptionalInt.of(index);
    }

    public CellMatrix getAssignmentTable() {
        return assignmentTable;
    }

    public double[] getMeanGeneTypeScores() {
        return meanGeneTypeScores == null ? null : meanGeneTypeScores.clone();
    }

    public double[] getMeanAlleleAssignProbabilities() {
        return meanAlleleAssignProbabilities == null ? null : meanAlleleAssignProbabilities.clone();
    }
}
