package org.broadinstitute.treealign.utils.tree;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.treealign.exceptions.UserException;
import org.broadinstitute.treealign.utils.Utils;

import java.util.Comparator;
import java.util.HashSet;
import java.util.Set;

/**
 * Prepares a {@link LineageTree} for a reproducible traversal.
 *
 * <p>
 *     Children of every clade are reordered by ascending number of descendant leaves (a stable sort, so clades
 *     with the same number of leaves keep their original relative order), then every unnamed internal clade
 *     is named {@code node_<k>}, where {@code k} counts unnamed internal clades in depth-first pre-order of the
 *     reordered tree.  Leaves are never renamed.
 * </p>
 */
public final class TreeIndex {
    private static final Logger logger = LogManager.getLogger(TreeIndex.class);

    public static final String INTERNAL_NODE_NAME_PREFIX = "node_";

    private TreeIndex() {}

    /**
     * Reorders and names the clades of {@code tree} in place.  Normalizing an already normalized tree changes nothing.
     *
     * @param tree the tree to normalize.
     * @return the same tree, for chaining.
     * @throws UserException.MalformedTree if a leaf has no name or two clades share a name.
     */
    public static LineageTree normalize(final LineageTree tree) {
        Utils.nonNull(tree, "the tree cannot be null");
        ladderize(tree.getRoot());
        final int named = nameInternalClades(tree.getRoot(), 0);
        if (named > 0) {
            logger.debug(String.format("Named %d unnamed internal clades.", named));
        }
        validateNames(tree);
        return tree;
    }

    private static void ladderize(final Clade clade) {
        if (clade.isTerminal()) {
            return;
        }
        clade.sortChildren(Comparator.comparingInt(Clade::countTerminals));
        for (final Clade child : clade.getChildren()) {
            ladderize(child);
        }
    }

    //returns the counter after this subtree
    private static int nameInternalClades(final Clade clade, final int counter) {
        if (clade.isTerminal()) {
            if (clade.getName() == null || clade.getName().isEmpty()) {
                throw new UserException.MalformedTree("every leaf must be named after a cell.");
            }
            return counter;
        }
        int next = counter;
        if (clade.getName() == null || clade.getName().isEmpty()) {
            clade.setName(INTERNAL_NODE_NAME_PREFIX + next);
            next++;
        }
        for (final Clade child : clade.getChildren()) {
            next = nameInternalClades(child, next);
        }
        return next;
    }

    private static void validateNames(final LineageTree tree) {
        final Set<String> names = new HashSet<>();
        for (final Clade clade : tree.getClades()) {
            if (!names.add(clade.getName())) {
                throw new UserException.MalformedTree(String.format("clade name \"%s\" appears more than once.", clade.getName()));
            }
        }
    }
}
