package org.broadinstitute.treealign.tools.treealign;

import org.broadinstitute.treealign.testutils.BaseTest;
import org.broadinstitute.treealign.utils.tree.Clade;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.*;

public final class CloneAssignmentStateUnitTest extends BaseTest {

    private static final List<String> CELLS = Arrays.asList("c1", "c2", "c3");

    @Test
    public void testInitializeAssignsEveryCellToRoot() {
        final CloneAssignmentState state = new CloneAssignmentState();
        state.initialize(CELLS, "root");
        Assert.assertEquals(state.getCloneAssignments().keySet(), new LinkedHashSet<>(CELLS));
        CELLS.forEach(c -> Assert.assertEquals(state.getCloneAssignment(c), "root"));
    }

    @Test
    public void testCommitLeavesCellsWithoutIndexUnchanged() {
        final CloneAssignmentState state = new CloneAssignmentState();
        state.initialize(CELLS, "root");
        final List<Clade> roster = Arrays.asList(Clade.leaf("A"), Clade.leaf("B"));
        final Map<String, Integer> indices = new HashMap<>();
        indices.put("c1", 1);
        indices.put("c3", 0);

        state.commit(CELLS, indices, roster);

        Assert.assertEquals(state.getCloneAssignment("c1"), "B");
        Assert.assertEquals(state.getCloneAssignment("c2"), "root");
        Assert.assertEquals(state.getCloneAssignment("c3"), "A");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testCommitRejectsIndexOutsideRoster() {
        final CloneAssignmentState state = new CloneAssignmentState();
        state.commit(CELLS, Collections.singletonMap("c1", 2), Arrays.asList(Clade.leaf("A"), Clade.leaf("B")));
    }

    @Test
    public void testCommitAll() {
        final CloneAssignmentState state = new CloneAssignmentState();
        state.initialize(CELLS, "root");
        state.commitAll(Arrays.asList("c1", "c2"), "only");
        Assert.assertEquals(state.getCloneAssignment("c1"), "only");
        Assert.assertEquals(state.getCloneAssignment("c2"), "only");
        Assert.assertEquals(state.getCloneAssignment("c3"), "root");
    }

    @Test
    public void testAccumulateAppendsInVisitOrder() {
        final CloneAssignmentState state = new CloneAssignmentState();
        state.accumulateGeneTypeScores(Arrays.asList("MYC", "TP53"), new double[]{0.9, 0.1});
        state.accumulateGeneTypeScores(Arrays.asList("TP53", "MECOM"), new double[]{0.4, 0.5});

        final Map<String, List<Double>> scores = state.getGeneTypeScores();
        Assert.assertEquals(new ArrayList<>(scores.keySet()), Arrays.asList("MYC", "TP53", "MECOM"));
        Assert.assertEquals(scores.get("MYC"), Collections.singletonList(0.9));
        Assert.assertEquals(scores.get("TP53"), Arrays.asList(0.1, 0.4));
        Assert.assertEquals(scores.get("MECOM"), Collections.singletonList(0.5));
        Assert.assertTrue(state.getAlleleAssignProbabilities().isEmpty());
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testAccumulateRejectsLengthMismatch() {
        new CloneAssignmentState().accumulateAlleleAssignProbabilities(Arrays.asList("snp_0", "snp_1"), new double[]{0.5});
    }

    @Test
    public void testPruneIsIdempotent() {
        final CloneAssignmentState state = new CloneAssignmentState();
        state.prune("A");
        state.prune("B");
        state.prune("A");
        Assert.assertEquals(new ArrayList<>(state.getPrunedClades()), Arrays.asList("A", "B"));
    }

    @Test(expectedExceptions = UnsupportedOperationException.class)
    public void testViewsAreUnmodifiable() {
        final CloneAssignmentState state = new CloneAssignmentState();
        state.initialize(CELLS, "root");
        state.getCloneAssignments().put("c4", "root");
    }
}
