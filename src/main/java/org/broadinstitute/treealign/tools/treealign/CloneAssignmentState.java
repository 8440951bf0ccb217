package org.broadinstitute.treealign.tools.treealign;

import org.broadinstitute.treealign.utils.Utils;
import org.broadinstitute.treealign.utils.tree.Clade;

import java.util.*;

/**
 * Outcome of one traversal of a lineage tree: the clade each cell is assigned to, the clades where the traversal
 * stopped, and the per-row scores recorded along the way.
 *
 * <p>
 *     Assignments only move down the tree and the pruned set only grows.  Score lists are appended in visit order.
 *     This class is not thread-safe; a single traversal mutates it from one thread.
 * </p>
 */
public final class CloneAssignmentState {

    private final Map<String, String> cloneAssignments = new LinkedHashMap<>();
    private final Set<String> prunedClades = new LinkedHashSet<>();
    private final Map<String, List<Double>> geneTypeScores = new LinkedHashMap<>();
    private final Map<String, List<Double>> alleleAssignProbabilities = new LinkedHashMap<>();
    private final Map<String, CladeRecord> cladeRecords = new LinkedHashMap<>();
    private final List<CladeDiagnostic> diagnostics = new ArrayList<>();

    /**
     * Assigns every cell to the root so that each one has an assignment even if the traversal stops immediately.
     */
    public void initialize(final List<String> cells, final String rootName) {
        Utils.containsNoNull(cells, "cells cannot be null or contain nulls");
        Utils.nonNull(rootName, "the root must be named");
        cells.forEach(cell -> cloneAssignments.put(cell, rootName));
    }

    /**
     * Assigns every cell to the same clade.
     */
    public void commitAll(final List<String> cells, final String cladeName) {
        Utils.nonNull(cladeName);
        cells.forEach(cell -> cloneAssignments.put(cell, cladeName));
    }

    /**
     * Assigns each cell with an index to the clade at that index in {@code roster}; cells without an index keep
     * their current assignment.
     *
     * @param cells the cells to consider.
     * @param cloneIndices roster index per cell, absent for cells without a confident assignment.
     * @param roster the clean children of the visited clade.
     */
    public void commit(final List<String> cells, final Map<String, Integer> cloneIndices, final List<Clade> roster) {
        Utils.nonNull(cloneIndices);
        Utils.nonNull(roster);
        for (final String cell : cells) {
            final Integer index = cloneIndices.get(cell);
            if (index != null) {
                cloneAssignments.put(cell, roster.get(Utils.validIndex(index, roster.size())).getName());
            }
        }
    }

    public void accumulateGeneTypeScores(final List<String> rowIds, final double[] values) {
        accumulate(geneTypeScores, rowIds, values);
    }

    public void accumulateAlleleAssignProbabilities(final List<String> rowIds, final double[] values) {
        accumulate(alleleAssignProbabilities, rowIds, values);
    }

    private static void accumulate(final Map<String, List<Double>> scores, final List<String> rowIds, final double[] values) {
        Utils.nonNull(rowIds);
        Utils.nonNull(values);
        Utils.validateArg(rowIds.size() == values.length,
                () -> String.format("%d row ids but %d values", rowIds.size(), values.length));
        for (int i = 0; i < values.length; i++) {
            scores.computeIfAbsent(rowIds.get(i), k -> new ArrayList<>()).add(values[i]);
        }
    }

    /**
     * Adds a clade to the frontier; adding it again has no effect.
     */
    public void prune(final String cladeName) {
        prunedClades.add(Utils.nonNull(cladeName));
    }

    void addDiagnostic(final CladeDiagnostic diagnostic) {
        diagnostics.add(Utils.nonNull(diagnostic));
    }

    void addCladeRecord(final CladeRecord record) {
        cladeRecords.put(record.getCladeName(), record);
    }

    /**
     * @return cell name to clade name, in the order cells were first seen.
     */
    public Map<String, String> getCloneAssignments() {
        return Collections.unmodifiableMap(cloneAssignments);
    }

    public String getCloneAssignment(final String cell) {
        return cloneAssignments.get(cell);
    }

    /**
     * @return the frontier, in the order clades were pruned.
     */
    public Set<String> getPrunedClades() {
        return Collections.unmodifiableSet(prunedClades);
    }

    public Map<String, List<Double>> getGeneTypeScores() {
        return unmodifiable(geneTypeScores);
    }

    public Map<String, List<Double>> getAlleleAssignProbabilities() {
        return unmodifiable(alleleAssignProbabilities);
    }

    /**
     * @return per-clade inputs and outputs; empty unless input/output recording is enabled.
     */
    public Map<String, CladeRecord> getCladeRecords() {
        return Collections.unmodifiableMap(cladeRecords);
    }

    public List<CladeDiagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    private static Map<String, List<Double>> unmodifiable(final Map<String, List<Double>> scores) {
        final Map<String, List<Double>> result = new LinkedHashMap<>(scores.size());
        scores.forEach((k, v) -> result.put(k, Collections.unmodifiableList(v)));
        return Collections.unmodifiableMap(result);
    }
}
