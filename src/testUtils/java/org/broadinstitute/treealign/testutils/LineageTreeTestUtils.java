package org.broadinstitute.treealign.testutils;

import org.broadinstitute.treealign.utils.tree.Clade;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Builders for small lineage trees and cell lists used across tests.
 */
public final class LineageTreeTestUtils {

    private LineageTreeTestUtils() {}

    /**
     * @return {@code prefix_0 ... prefix_(n-1)}
     */
    public static List<String> names(final String prefix, final int n) {
        return IntStream.range(0, n).mapToObj(i -> prefix + "_" + i).collect(Collectors.toList());
    }

    public static List<Clade> leaves(final String prefix, final int n) {
        return names(prefix, n).stream().map(Clade::leaf).collect(Collectors.toList());
    }

    /**
     * A named clade whose children are {@code n} leaves named {@code <name>_cell_<i>}.
     */
    public static Clade cladeWithLeaves(final String name, final int n) {
        return new Clade(name, leaves(name + "_cell", n));
    }

    public static Clade clade(final String name, final Clade... children) {
        return Clade.internal(name, children);
    }

    public static List<String> concat(final List<String> first, final List<String> second) {
        final List<String> result = new ArrayList<>(first);
        result.addAll(second);
        return result;
    }
}
