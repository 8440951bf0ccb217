package org.broadinstitute.treealign.testutils;

import org.broadinstitute.treealign.tools.treealign.CellMatrix;
import org.broadinstitute.treealign.tools.treealign.CloneAssigner;
import org.broadinstitute.treealign.tools.treealign.CloneAssignmentInputs;
import org.broadinstitute.treealign.tools.treealign.CloneAssignmentResult;

import java.util.*;
import java.util.function.Function;

/**
 * Deterministic {@link CloneAssigner} that answers from scripts keyed by the clean-child roster (the consensus column
 * names).  Unscripted rosters get a none frequency of 1, i.e. no confident assignment.  A script naming a clade outside
 * the roster yields an out-of-range index.
 *
 * <p>Scores returned for every row equal the 1-based ordinal of the call, so tests can check the order in which
 * clades were recorded.</p>
 */
public final class ScriptedCloneAssigner implements CloneAssigner {

    private final Map<List<String>, Script> scripts = new HashMap<>();
    private final List<List<String>> calledRosters = new ArrayList<>();
    private final List<CloneAssignmentInputs> calledInputs = new ArrayList<>();
    private final List<Integer> calledRepeats = new ArrayList<>();

    /**
     * @param roster clean child clade names, in roster order.
     * @param noneFrequency the none frequency to report.
     * @param cellToClade clade name for each cell, or {@code null} for a cell without a confident assignment.
     */
    public ScriptedCloneAssigner when(final List<String> roster, final double noneFrequency, final Function<String, String> cellToClade) {
        scripts.put(new ArrayList<>(roster), new Script(noneFrequency, cellToClade));
        return this;
    }

    @Override
    public CloneAssignmentResult run(final CloneAssignmentInputs inputs, final int repeat) {
        final List<String> roster = inputs.getConsensusCopyNumber() != null
                ? inputs.getConsensusCopyNumber().columnNames()
                : inputs.getHaplotypeCopyNumber().columnNames();
        final List<String> cells = inputs.getExpression() != null
                ? inputs.getExpression().columnNames()
                : inputs.getSnvAllele().columnNames();
        calledRosters.add(roster);
        calledInputs.add(inputs);
        calledRepeats.add(repeat);
        final double ordinal = calledRosters.size();

        final Script script = scripts.getOrDefault(roster, new Script(1., cell -> null));
        final Map<String, Integer> assignments = new LinkedHashMap<>();
        for (final String cell : cells) {
            final String clade = script.cellToClade.apply(cell);
            if (clade != null) {
                final int index = roster.indexOf(clade);
                assignments.put(cell, index >= 0 ? index : Integer.MAX_VALUE);
            }
        }
        return new CloneAssignmentResult(script.noneFrequency, assignments, null,
                scores(inputs.getConsensusCopyNumber(), ordinal),
                scores(inputs.getHaplotypeCopyNumber(), ordinal));
    }

    public List<List<String>> getCalledRosters() {
        return calledRosters;
    }

    public List<CloneAssignmentInputs> getCalledInputs() {
        return calledInputs;
    }

    public List<Integer> getCalledRepeats() {
        return calledRepeats;
    }

    private static double[] scores(final CellMatrix table, final double value) {
        if (table == null) {
            return null;
        }
        final double[] result = new double[table.numRows()];
        Arrays.fill(result, value);
        return result;
    }

    private static final class Script {
        private final double noneFrequency;
        private final Function<String, String> cellToClade;

        Script(final double noneFrequency, final Function<String, String> cellToClade) {
            this.noneFrequency = noneFrequency;
            this.cellToClade = cellToClade;
        }
    }
}
