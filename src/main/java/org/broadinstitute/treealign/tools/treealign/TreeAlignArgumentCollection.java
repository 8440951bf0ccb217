package org.broadinstitute.treealign.tools.treealign;

import org.broadinstitute.barclay.argparser.Advanced;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.treealign.utils.param.ParamUtils;

import java.io.Serializable;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Thresholds that decide how far down the lineage tree cells are assigned.
 */
public final class TreeAlignArgumentCollection implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final String MIN_CELL_COUNT_EXPR_LONG_NAME = "min-cell-count-expr";
    public static final String MIN_CELL_COUNT_CNV_LONG_NAME = "min-cell-count-cnv";
    public static final String MIN_GENE_DIFF_LONG_NAME = "min-gene-diff";
    public static final String MIN_SNP_DIFF_LONG_NAME = "min-snp-diff";
    public static final String LEVEL_CUTOFF_LONG_NAME = "level-cutoff";
    public static final String MIN_PROCEED_FREQ_LONG_NAME = "min-proceed-freq";
    public static final String MIN_RECORD_FREQ_LONG_NAME = "min-record-freq";
    public static final String REPEAT_LONG_NAME = "repeat";
    public static final String INFER_GENE_TYPE_SCORE_LONG_NAME = "infer-gene-type-score";
    public static final String INFER_ALLELE_ASSIGNMENT_LONG_NAME = "infer-allele-assignment";
    public static final String RECORD_INPUT_OUTPUT_LONG_NAME = "record-input-output";
    public static final String TRACED_ROW_LONG_NAME = "traced-row";

    public static final int DEFAULT_MIN_CELL_COUNT_EXPR = 20;
    public static final int DEFAULT_MIN_CELL_COUNT_CNV = 20;
    public static final int DEFAULT_MIN_GENE_DIFF = 100;
    public static final int DEFAULT_MIN_SNP_DIFF = 100;
    public static final int DEFAULT_LEVEL_CUTOFF = 10;
    public static final double DEFAULT_MIN_PROCEED_FREQ = 0.7;
    public static final double DEFAULT_MIN_RECORD_FREQ = 0.7;
    public static final int DEFAULT_REPEAT = 10;

    @Argument(
            fullName = MIN_CELL_COUNT_EXPR_LONG_NAME,
            doc = "Minimum number of profiled cells at a clade to keep assigning them to its subtrees.",
            optional = true,
            minValue = 0
    )
    public int minCellCountExpr = DEFAULT_MIN_CELL_COUNT_EXPR;

    @Argument(
            fullName = MIN_CELL_COUNT_CNV_LONG_NAME,
            doc = "Minimum number of leaves under a clade for it to be visited or considered as a child.",
            optional = true,
            minValue = 0
    )
    public int minCellCountCnv = DEFAULT_MIN_CELL_COUNT_CNV;

    @Argument(
            fullName = MIN_GENE_DIFF_LONG_NAME,
            doc = "Minimum number of genes that differ between child clades for the total-copy-number track to discriminate.",
            optional = true,
            minValue = 0
    )
    public int minGeneDiff = DEFAULT_MIN_GENE_DIFF;

    @Argument(
            fullName = MIN_SNP_DIFF_LONG_NAME,
            doc = "Minimum number of SNPs that differ between child clades for the allele-specific track to discriminate.",
            optional = true,
            minValue = 0
    )
    public int minSnpDiff = DEFAULT_MIN_SNP_DIFF;

    @Argument(
            fullName = LEVEL_CUTOFF_LONG_NAME,
            doc = "Deepest level (the root is level 0) at which clades are still visited.",
            optional = true,
            minValue = 0
    )
    public int levelCutoff = DEFAULT_LEVEL_CUTOFF;

    @Argument(
            fullName = MIN_PROCEED_FREQ_LONG_NAME,
            doc = "Minimum frequency of confidently assigned cells to descend into the child clades.",
            optional = true,
            minValue = 0.0,
            maxValue = 1.0
    )
    public double minProceedFreq = DEFAULT_MIN_PROCEED_FREQ;

    @Argument(
            fullName = MIN_RECORD_FREQ_LONG_NAME,
            doc = "Minimum frequency of confidently assigned cells to record the assignments at a clade.",
            optional = true,
            minValue = 0.0,
            maxValue = 1.0
    )
    public double minRecordFreq = DEFAULT_MIN_RECORD_FREQ;

    @Argument(
            fullName = REPEAT_LONG_NAME,
            doc = "Number of times the clone assigner repeats its inference to build a consensus.",
            optional = true,
            minValue = 1
    )
    public int repeat = DEFAULT_REPEAT;

    @Argument(
            fullName = INFER_GENE_TYPE_SCORE_LONG_NAME,
            doc = "Whether to record gene-type scores from the total-copy-number track.",
            optional = true
    )
    public boolean inferGeneTypeScore = true;

    @Argument(
            fullName = INFER_ALLELE_ASSIGNMENT_LONG_NAME,
            doc = "Whether to record allele-assignment probabilities from the allele-specific track.",
            optional = true
    )
    public boolean inferAlleleAssignment = true;

    @Advanced
    @Argument(
            fullName = RECORD_INPUT_OUTPUT_LONG_NAME,
            doc = "Keep the inputs and outputs of the clone assigner for every clade where it runs.",
            optional = true
    )
    public boolean recordInputOutput = false;

    @Advanced
    @Argument(
            fullName = TRACED_ROW_LONG_NAME,
            doc = "Gene or SNP whose recorded scores are logged each time they grow.  May be specified more than once.",
            optional = true
    )
    public Set<String> tracedRows = new LinkedHashSet<>();

    /**
     * @throws IllegalArgumentException if any threshold is out of range.
     */
    public void validate() {
        ParamUtils.isPositiveOrZero(minCellCountExpr, MIN_CELL_COUNT_EXPR_LONG_NAME + " must be non-negative.");
        ParamUtils.isPositiveOrZero(minCellCountCnv, MIN_CELL_COUNT_CNV_LONG_NAME + " must be non-negative.");
        ParamUtils.isPositiveOrZero(minGeneDiff, MIN_GENE_DIFF_LONG_NAME + " must be non-negative.");
        ParamUtils.isPositiveOrZero(minSnpDiff, MIN_SNP_DIFF_LONG_NAME + " must be non-negative.");
        ParamUtils.isPositiveOrZero(levelCutoff, LEVEL_CUTOFF_LONG_NAME + " must be non-negative.");
        ParamUtils.inRange(minProceedFreq, 0., 1., MIN_PROCEED_FREQ_LONG_NAME + " must be in [0, 1].");
        ParamUtils.inRange(minRecordFreq, 0., 1., MIN_RECORD_FREQ_LONG_NAME + " must be in [0, 1].");
        ParamUtils.isPositive(repeat, REPEAT_LONG_NAME + " must be positive.");
    }
}
