package org.broadinstitute.treealign.utils.tree;

import org.broadinstitute.treealign.utils.Utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A node of a {@link LineageTree}: a clone or ancestral group of cells.
 *
 * <p>
 *     Leaves are named after the cell they represent.  Internal nodes may be created without a name;
 *     {@link TreeIndex#normalize(LineageTree)} gives every one of them a stable name before traversal.
 * </p>
 */
public final class Clade {

    private String name;
    private final Double branchLength;
    private final List<Clade> children;

    /**
     * Creates a clade.
     *
     * @param name the clade name, {@code null} for unnamed internal nodes.
     * @param branchLength length of the branch leading to this clade, {@code null} if unknown.
     * @param children the ordered children, empty for leaves.
     */
    public Clade(final String name, final Double branchLength, final List<Clade> children) {
        Utils.containsNoNull(children, "the children of a clade cannot be null");
        this.name = name;
        this.branchLength = branchLength;
        this.children = new ArrayList<>(children);
    }

    public Clade(final String name, final List<Clade> children) {
        this(name, null, children);
    }

    /**
     * Creates an internal node without a name.
     */
    public static Clade unnamed(final Clade... children) {
        return new Clade(null, Arrays.asList(children));
    }

    public static Clade internal(final String name, final Clade... children) {
        return new Clade(Utils.nonEmpty(name, "clade name"), Arrays.asList(children));
    }

    public static Clade leaf(final String cellName) {
        return new Clade(Utils.nonEmpty(cellName, "leaf name"), Collections.emptyList());
    }

    public String getName() {
        return name;
    }

    void setName(final String name) {
        this.name = name;
    }

    public Double getBranchLength() {
        return branchLength;
    }

    /**
     * @return an unmodifiable view of the children in their current order.
     */
    public List<Clade> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Stable sort of the direct children.
     */
    void sortChildren(final Comparator<Clade> comparator) {
        children.sort(comparator);
    }

    public boolean isTerminal() {
        return children.isEmpty();
    }

    /**
     * @return the leaves under this clade (itself if it is a leaf), in depth-first order.
     */
    public List<Clade> getTerminals() {
        final List<Clade> result = new ArrayList<>();
        collectTerminals(this, result);
        return result;
    }

    public List<String> getTerminalNames() {
        return getTerminals().stream().map(Clade::getName).collect(Collectors.toList());
    }

    public int countTerminals() {
        if (isTerminal()) {
            return 1;
        }
        int count = 0;
        for (final Clade child : children) {
            count += child.countTerminals();
        }
        return count;
    }

    private static void collectTerminals(final Clade clade, final List<Clade> result) {
        if (clade.isTerminal()) {
            result.add(clade);
            return;
        }
        for (final Clade child : clade.children) {
            collectTerminals(child, result);
        }
    }

    @Override
    public String toString() {
        return name == null ? "<unnamed clade>" : name;
    }
}
