package org.broadinstitute.treealign.tools.treealign;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The tables built by a {@link ProfileBuilder} for one clade visit.
 *
 * <p>
 *     The total-copy-number track consists of the expression counts (genes x cells) and the consensus copy number
 *     of each clean child (genes x clades).  The allele-specific track consists of the haplotype-specific copy number
 *     of each clean child (SNPs x clades), the SNV allele counts (SNPs x cells) and the SNV total counts
 *     (SNPs x cells).  Any table may be {@code null}.
 * </p>
 */
public final class CloneAssignmentInputs {

    private final CellMatrix expression;
    private final CellMatrix consensusCopyNumber;
    private final CellMatrix haplotypeCopyNumber;
    private final CellMatrix snvAllele;
    private final CellMatrix snv;

    public CloneAssignmentInputs(final CellMatrix expression,
                                 final CellMatrix consensusCopyNumber,
                                 final CellMatrix haplotypeCopyNumber,
                                 final CellMatrix snvAllele,
                                 final CellMatrix snv) {
        this.expression = expression;
        this.consensusCopyNumber = consensusCopyNumber;
        this.haplotypeCopyNumber = haplotypeCopyNumber;
        this.snvAllele = snvAllele;
        this.snv = snv;
    }

    public CellMatrix getExpression() {
        return expression;
    }

    public CellMatrix getConsensusCopyNumber() {
        return consensusCopyNumber;
    }

    public CellMatrix getHaplotypeCopyNumber() {
        return haplotypeCopyNumber;
    }

    public CellMatrix getSnvAllele() {
        return snvAllele;
    }

    public CellMatrix getSnv() {
        return snv;
    }

    /**
     * Restricts the per-cell tables (expression, SNV allele and SNV) to the cells they all share.
     *
     * <p>
     *     Only tables that carry signal take part; the order of the first of them (expression first) is kept.
     * </p>
     */
    public CloneAssignmentInputs withConsistentCells() {
        final List<CellMatrix> perCellTables = Stream.of(expression, snvAllele, snv)
                .filter(CloneAssignmentInputGate::isValid)
                .collect(Collectors.toList());
        if (perCellTables.size() < 2) {
            return this;
        }
        final Set<String> sharedCells = new LinkedHashSet<>(perCellTables.get(0).columnNames());
        perCellTables.subList(1, perCellTables.size()).forEach(t -> sharedCells.retainAll(t.columnNames()));
        final List<String> cells = new ArrayList<>(sharedCells);
        return new CloneAssignmentInputs(
                CloneAssignmentInputGate.isValid(expression) ? expression.subsetColumns(cells) : expression,
                consensusCopyNumber,
                haplotypeCopyNumber,
                CloneAssignmentInputGate.isValid(snvAllele) ? snvAllele.subsetColumns(cells) : snvAllele,
                CloneAssignmentInputGate.isValid(snv) ? snv.subsetColumns(cells) : snv);
    }

    /**
     * Drops the tables of every track that the classification found unusable.
     */
    public CloneAssignmentInputs maskedBy(final CloneAssignmentInputGate.Classification classification) {
        final boolean totalCopyNumber = classification.hasTotalCopyNumber();
        final boolean alleleSpecific = classification.hasAlleleSpecific();
        return new CloneAssignmentInputs(
                totalCopyNumber ? expression : null,
                totalCopyNumber ? consensusCopyNumber : null,
                alleleSpecific ? haplotypeCopyNumber : null,
                alleleSpecific ? snvAllele : null,
                alleleSpecific ? snv : null);
    }
}
