package org.broadinstitute.treealign.tools.treealign;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.treealign.exceptions.TreeAlignException;
import org.broadinstitute.treealign.tools.treealign.CladeDiagnostic.StopReason;
import org.broadinstitute.treealign.utils.Utils;
import org.broadinstitute.treealign.utils.tree.Clade;
import org.broadinstitute.treealign.utils.tree.LineageTree;
import org.broadinstitute.treealign.utils.tree.TreeIndex;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Assigns profiled cells to the clades of a lineage tree, descending one level at a time while the data allow it.
 *
 * <p>
 *     Every cell starts at the root.  At each visited clade the engine either stops (too deep, too few cells or
 *     leaves, too little signal, or too little confidence), passes all cells to the only child large enough to be
 *     considered, or asks the {@link CloneAssigner} to split the cells among the children and descends into each
 *     of them with its share.  Clades where the traversal stops form the frontier reported by
 *     {@link CloneAssignmentState#getPrunedClades()}.
 * </p>
 *
 * <p>
 *     Stops are never errors; they are reported as {@link CladeDiagnostic}s.  Exceptions thrown by the clone assigner
 *     propagate and abort the traversal.
 * </p>
 */
public final class TreeAlignEngine {
    private static final Logger logger = LogManager.getLogger(TreeAlignEngine.class);

    /**
     * Reported with {@link StopReason#NO_USABLE_INPUT}: the number of usable data tracks, of which at least one is needed.
     */
    public static final String USABLE_TRACK_COUNT = "usable-track-count";

    private final LineageTree tree;
    private final ProfileBuilder profileBuilder;
    private final CloneAssigner cloneAssigner;
    private final TreeAlignArgumentCollection arguments;
    private final Set<String> tracedRows;

    /**
     * @param tree the lineage tree; it is normalized in place by {@link TreeIndex#normalize(LineageTree)}.
     * @param profileBuilder builds the consensus inputs for each clade.
     * @param cloneAssigner splits cells among child clades.
     * @param arguments thresholds; validated here.
     */
    public TreeAlignEngine(final LineageTree tree,
                           final ProfileBuilder profileBuilder,
                           final CloneAssigner cloneAssigner,
                           final TreeAlignArgumentCollection arguments) {
        Utils.nonNull(tree, "the tree cannot be null");
        this.profileBuilder = Utils.nonNull(profileBuilder, "the profile builder cannot be null");
        this.cloneAssigner = Utils.nonNull(cloneAssigner, "the clone assigner cannot be null");
        this.arguments = Utils.nonNull(arguments, "the arguments cannot be null");
        arguments.validate();
        this.tracedRows = arguments.tracedRows == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(arguments.tracedRows));
        this.tree = TreeIndex.normalize(tree);
    }

    public LineageTree getTree() {
        return tree;
    }

    /**
     * Runs a full traversal from the root.
     *
     * @param cells the profiled cells; each ends up assigned to exactly one clade.
     * @return a fresh state holding the outcome of this traversal.
     */
    public CloneAssignmentState assignCellsToTree(final List<String> cells) {
        Utils.containsNoNull(cells, "cells cannot be null or contain nulls");
        Utils.checkForDuplicatesAndReturnSet(cells, "cells contain duplicates.");
        final CloneAssignmentState state = new CloneAssignmentState();
        final Clade root = tree.getRoot();
        state.initialize(cells, root.getName());
        logger.info(String.format("Assigning %d cells to a tree with %d leaves.", cells.size(), root.countTerminals()));
        assignCellsToClade(state, root, new ArrayList<>(cells), 0);
        logger.info(String.format("Traversal finished with %d pruned clades.", state.getPrunedClades().size()));
        return state;
    }

    private void assignCellsToClade(final CloneAssignmentState state, final Clade clade, final List<String> cells, final int level) {
        final String cladeName = clade.getName();
        logger.debug(String.format("Visiting %s at level %d with %d cells.", cladeName, level, cells.size()));

        if (level > arguments.levelCutoff) {
            state.prune(cladeName);
            stop(state, cladeName, level, StopReason.LEVEL_LIMIT_EXCEEDED,
                    TreeAlignArgumentCollection.LEVEL_CUTOFF_LONG_NAME, level, arguments.levelCutoff);
            return;
        }

        final int leafCount = clade.countTerminals();
        if (cells.size() < arguments.minCellCountExpr || leafCount < arguments.minCellCountCnv) {
            state.prune(cladeName);
            if (cells.size() < arguments.minCellCountExpr) {
                stop(state, cladeName, level, StopReason.TOO_FEW_ELIGIBLE_CELLS,
                        TreeAlignArgumentCollection.MIN_CELL_COUNT_EXPR_LONG_NAME, cells.size(), arguments.minCellCountExpr);
            }
            if (leafCount < arguments.minCellCountCnv) {
                stop(state, cladeName, level, StopReason.TOO_FEW_LEAVES,
                        TreeAlignArgumentCollection.MIN_CELL_COUNT_CNV_LONG_NAME, leafCount, arguments.minCellCountCnv);
            }
            return;
        }

        final List<Clade> cleanChildren = new ArrayList<>();
        final List<List<String>> childLeafSets = new ArrayList<>();
        int largestChildLeafCount = 0;
        for (final Clade child : clade.getChildren()) {
            final List<String> childLeaves = child.getTerminalNames();
            largestChildLeafCount = Math.max(largestChildLeafCount, childLeaves.size());
            if (childLeaves.size() < arguments.minCellCountCnv) {
                state.prune(child.getName());
                stop(state, child.getName(), level + 1, StopReason.CHILD_TOO_FEW_LEAVES,
                        TreeAlignArgumentCollection.MIN_CELL_COUNT_CNV_LONG_NAME, childLeaves.size(), arguments.minCellCountCnv);
            } else {
                cleanChildren.add(child);
                childLeafSets.add(childLeaves);
            }
        }

        if (cleanChildren.isEmpty()) {
            stop(state, cladeName, level, StopReason.NO_CLEAN_CHILD,
                    TreeAlignArgumentCollection.MIN_CELL_COUNT_CNV_LONG_NAME, largestChildLeafCount, arguments.minCellCountCnv);
            return;
        }

        if (cleanChildren.size() == 1) {
            final Clade onlyChild = cleanChildren.get(0);
            logger.info(String.format("At %s there is only one clean child clade, %s; all %d cells move to it.",
                    cladeName, onlyChild.getName(), cells.size()));
            state.commitAll(cells, onlyChild.getName());
            assignCellsToClade(state, onlyChild, cells, level + 1);
            return;
        }

        cleanChildren.forEach(c -> logger.info(String.format("At %s, one of the child clades is %s with %d leaves.",
                cladeName, c.getName(), c.countTerminals())));

        final CloneAssignmentInputs builtInputs = profileBuilder.build(
                Collections.unmodifiableList(childLeafSets), Collections.unmodifiableList(cells));
        if (builtInputs == null) {
            throw new TreeAlignException(String.format("The profile builder returned no inputs at clade \"%s\".", cladeName));
        }
        final CloneAssignmentInputs consistentInputs = builtInputs.withConsistentCells();
        final CloneAssignmentInputGate.Classification classification = CloneAssignmentInputGate.classify(consistentInputs);

        if (!classification.hasUsableInput()) {
            pruneAll(state, cleanChildren);
            stop(state, cladeName, level, StopReason.NO_USABLE_INPUT, USABLE_TRACK_COUNT, 0, 1);
            return;
        }

        if (classification.getGeneCount() < arguments.minGeneDiff && classification.getSnpCount() < arguments.minSnpDiff) {
            pruneAll(state, cleanChildren);
            stop(state, cladeName, level, StopReason.TOO_FEW_DISCRIMINATING_FEATURES,
                    TreeAlignArgumentCollection.MIN_GENE_DIFF_LONG_NAME, classification.getGeneCount(), arguments.minGeneDiff);
            stop(state, cladeName, level, StopReason.TOO_FEW_DISCRIMINATING_FEATURES,
                    TreeAlignArgumentCollection.MIN_SNP_DIFF_LONG_NAME, classification.getSnpCount(), arguments.minSnpDiff);
            return;
        }

        final CloneAssignmentInputs inputs = consistentInputs.maskedBy(classification);
        logTrackSizes(cladeName, classification);

        CladeRecord record = null;
        if (arguments.recordInputOutput) {
            record = new CladeRecord(cladeName,
                    cleanChildren.stream().map(Clade::getName).collect(Collectors.toList()), inputs);
            state.addCladeRecord(record);
        }

        //failures of the assigner are fatal and propagate
        final CloneAssignmentResult result = cloneAssigner.run(inputs, arguments.repeat);
        validateResult(cladeName, result, cells, cleanChildren.size());
        if (record != null) {
            record.setResult(result);
        }

        final double assignedFrequency = result.getAssignedFrequency();
        final boolean recorded = assignedFrequency >= arguments.minRecordFreq;
        if (recorded) {
            state.commit(cells, result.getCloneAssignments(), cleanChildren);
            recordScores(state, cladeName, classification, inputs, result);
        } else {
            stop(state, cladeName, level, StopReason.RECORD_FREQUENCY_NOT_REACHED,
                    TreeAlignArgumentCollection.MIN_RECORD_FREQ_LONG_NAME, assignedFrequency, arguments.minRecordFreq);
        }

        if (recorded && assignedFrequency >= arguments.minProceedFreq) {
            logger.info(String.format("Clone assignment proceeds below %s with assigned frequency %s.", cladeName, assignedFrequency));
            for (int i = 0; i < cleanChildren.size(); i++) {
                final int cloneIndex = i;
                final List<String> childCells = cells.stream()
                        .filter(cell -> result.getCloneIndex(cell).orElse(-1) == cloneIndex)
                        .collect(Collectors.toList());
                assignCellsToClade(state, cleanChildren.get(i), childCells, level + 1);
            }
        } else {
            if (recorded) {
                stop(state, cladeName, level, StopReason.PROCEED_FREQUENCY_NOT_REACHED,
                        TreeAlignArgumentCollection.MIN_PROCEED_FREQ_LONG_NAME, assignedFrequency, arguments.minProceedFreq);
            }
            pruneAll(state, cleanChildren);
        }
    }

    private void recordScores(final CloneAssignmentState state,
                              final String cladeName,
                              final CloneAssignmentInputGate.Classification classification,
                              final CloneAssignmentInputs inputs,
                              final CloneAssignmentResult result) {
        if (classification.hasTotalCopyNumber() && arguments.inferGeneTypeScore) {
            final double[] scores = result.getMeanGeneTypeScores();
            if (scores == null) {
                logger.debug(String.format("No gene-type scores returned at %s.", cladeName));
            } else {
                final List<String> genes = inputs.getConsensusCopyNumber().rowNames();
                checkScoreLength(cladeName, "gene-type scores", scores, genes);
                state.accumulateGeneTypeScores(genes, scores);
                logTracedRows(genes, state.getGeneTypeScores());
            }
        }
        if (classification.hasAlleleSpecific() && arguments.inferAlleleAssignment) {
            final double[] probabilities = result.getMeanAlleleAssignProbabilities();
            if (probabilities == null) {
                logger.debug(String.format("No allele-assignment probabilities returned at %s.", cladeName));
            } else {
                final List<String> snps = inputs.getHaplotypeCopyNumber().rowNames();
                checkScoreLength(cladeName, "allele-assignment probabilities", probabilities, snps);
                state.accumulateAlleleAssignProbabilities(snps, probabilities);
                logTracedRows(snps, state.getAlleleAssignProbabilities());
            }
        }
    }

    private static void validateResult(final String cladeName, final CloneAssignmentResult result,
                                       final List<String> cells, final int rosterSize) {
        if (result == null) {
            throw new TreeAlignException.MalformedAssignerResult(cladeName, "no result.");
        }
        final double noneFrequency = result.getNoneFrequency();
        if (!(noneFrequency >= 0. && noneFrequency <= 1.)) {
            throw new TreeAlignException.MalformedAssignerResult(cladeName, "none frequency " + noneFrequency + " is not in [0, 1].");
        }
        for (final String cell : cells) {
            final OptionalInt index = result.getCloneIndex(cell);
            if (index.isPresent() && (index.getAsInt() < 0 || index.getAsInt() >= rosterSize)) {
                throw new TreeAlignException.MalformedAssignerResult(cladeName,
                        String.format("cell %s is assigned to clone %d but there are %d clean child clades.", cell, index.getAsInt(), rosterSize));
            }
        }
    }

    private static void checkScoreLength(final String cladeName, final String what, final double[] values, final List<String> rows) {
        if (values.length != rows.size()) {
            throw new TreeAlignException.MalformedAssignerResult(cladeName,
                    String.format("%d %s for %d rows.", values.length, what, rows.size()));
        }
    }

    private void logTracedRows(final List<String> rows, final Map<String, List<Double>> scores) {
        if (tracedRows.isEmpty()) {
            return;
        }
        rows.stream().filter(tracedRows::contains)
                .forEach(row -> logger.info(String.format("%s: %s", row, scores.get(row))));
    }

    private static void logTrackSizes(final String cladeName, final CloneAssignmentInputGate.Classification classification) {
        logger.info("Running clone assignment for clade " + cladeName);
        if (classification.hasTotalCopyNumber()) {
            logger.info(String.format("Copy-number gene count: %d, expression cell count: %d",
                    classification.getGeneCount(), classification.getExpressionCellCount()));
        }
        if (classification.hasAlleleSpecific()) {
            logger.info(String.format("Haplotype-specific SNP count: %d, SNV allele cell count: %d",
                    classification.getSnpCount(), classification.getSnvAlleleCellCount()));
        }
    }

    private static void pruneAll(final CloneAssignmentState state, final List<Clade> clades) {
        clades.forEach(c -> state.prune(c.getName()));
    }

    private static void stop(final CloneAssignmentState state, final String cladeName, final int level,
                             final StopReason reason, final String threshold, final double actual, final double required) {
        final CladeDiagnostic diagnostic = new CladeDiagnostic(cladeName, level, reason, threshold, actual, required);
        state.addDiagnostic(diagnostic);
        logger.info(diagnostic.toString());
    }
}
