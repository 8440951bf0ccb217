package org.broadinstitute.treealign.utils.tree;

import org.broadinstitute.treealign.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A rooted, ordered lineage (clonal) tree of {@link Clade}s whose leaves are single cells.
 */
public final class LineageTree {

    private final Clade root;

    public LineageTree(final Clade root) {
        this.root = Utils.nonNull(root, "the root clade cannot be null");
    }

    public Clade getRoot() {
        return root;
    }

    /**
     * @return every clade of the tree in depth-first pre-order.
     */
    public List<Clade> getClades() {
        final List<Clade> result = new ArrayList<>();
        collectPreOrder(root, result);
        return result;
    }

    public List<String> getLeafNames() {
        return root.getTerminalNames();
    }

    public Optional<Clade> findClade(final String name) {
        Utils.nonNull(name);
        return getClades().stream().filter(c -> name.equals(c.getName())).findFirst();
    }

    /**
     * Returns the clades on the path from the root down to the clade with the given name, both included.
     *
     * @param name clade name.
     * @return never {@code null}, empty if no clade has that name.
     */
    public List<Clade> getPathFromRoot(final String name) {
        Utils.nonNull(name);
        final List<Clade> path = new ArrayList<>();
        return findPath(root, name, path) ? Collections.unmodifiableList(path) : Collections.emptyList();
    }

    private static boolean findPath(final Clade clade, final String name, final List<Clade> path) {
        path.add(clade);
        if (name.equals(clade.getName())) {
            return true;
        }
        for (final Clade child : clade.getChildren()) {
            if (findPath(child, name, path)) {
                return true;
            }
        }
        path.remove(path.size() - 1);
        return false;
    }

    private static void collectPreOrder(final Clade clade, final List<Clade> result) {
        result.add(clade);
        for (final Clade child : clade.getChildren()) {
            collectPreOrder(child, result);
        }
    }
}
