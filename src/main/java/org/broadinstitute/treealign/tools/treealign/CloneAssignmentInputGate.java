package org.broadinstitute.treealign.tools.treealign;

import org.broadinstitute.treealign.utils.Utils;

/**
 * Decides which data tracks of a {@link CloneAssignmentInputs} carry enough data to be used for inference.
 */
public final class CloneAssignmentInputGate {

    private CloneAssignmentInputGate() {}

    /**
     * A table is valid iff it is present and has at least one row and one column.
     */
    public static boolean isValid(final CellMatrix table) {
        return table != null && table.numRows() > 0 && table.numColumns() > 0;
    }

    public static boolean allValid(final CellMatrix... tables) {
        for (final CellMatrix table : tables) {
            if (!isValid(table)) {
                return false;
            }
        }
        return true;
    }

    public static Classification classify(final CloneAssignmentInputs inputs) {
        Utils.nonNull(inputs);
        final boolean totalCopyNumber = allValid(inputs.getExpression(), inputs.getConsensusCopyNumber());
        final boolean alleleSpecific = allValid(inputs.getHaplotypeCopyNumber(), inputs.getSnvAllele(), inputs.getSnv());
        return new Classification(
                totalCopyNumber,
                alleleSpecific,
                totalCopyNumber ? inputs.getConsensusCopyNumber().numRows() : 0,
                alleleSpecific ? inputs.getHaplotypeCopyNumber().numRows() : 0,
                totalCopyNumber ? inputs.getExpression().numColumns() : 0,
                alleleSpecific ? inputs.getSnvAllele().numColumns() : 0);
    }

    /**
     * Usability of both tracks and the amount of discriminating signal each offers.  Counts are zero for unusable tracks.
     */
    public static final class Classification {
        private final boolean totalCopyNumber;
        private final boolean alleleSpecific;
        private final int geneCount;
        private final int snpCount;
        private final int expressionCellCount;
        private final int snvAlleleCellCount;

        Classification(final boolean totalCopyNumber, final boolean alleleSpecific,
                       final int geneCount, final int snpCount,
                       final int expressionCellCount, final int snvAlleleCellCount) {
            this.totalCopyNumber = totalCopyNumber;
            this.alleleSpecific = alleleSpecific;
            this.geneCount = geneCount;
            this.snpCount = snpCount;
            this.expressionCellCount = expressionCellCount;
            this.snvAlleleCellCount = snvAlleleCellCount;
        }

        public boolean hasTotalCopyNumber() {
            return totalCopyNumber;
        }

        public boolean hasAlleleSpecific() {
            return alleleSpecific;
        }

        public boolean hasUsableInput() {
            return totalCopyNumber || alleleSpecific;
        }

        public int getGeneCount() {
            return geneCount;
        }

        public int getSnpCount() {
            return snpCount;
        }

        public int getExpressionCellCount() {
            return expressionCellCount;
        }

        public int getSnvAlleleCellCount() {
            return snvAlleleCellCount;
        }

        @Override
        public String toString() {
            return String.format("Classification{totalCopyNumber=%b, alleleSpecific=%b, genes=%d, snps=%d}",
                    totalCopyNumber, alleleSpecific, geneCount, snpCount);
        }
    }
}
