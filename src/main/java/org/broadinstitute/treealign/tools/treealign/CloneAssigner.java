package org.broadinstitute.treealign.tools.treealign;

/**
 * Statistical assignment of cells to one of the clean children of a clade.
 *
 * <p>
 *     Implementations repeat their inference {@code repeat} times and report the consensus.  Tables of a track that
 *     is not usable are {@code null}.  Any exception thrown here aborts the whole traversal.
 * </p>
 */
@FunctionalInterface
public interface CloneAssigner {

    CloneAssignmentResult run(CloneAssignmentInputs inputs, int repeat);
}
