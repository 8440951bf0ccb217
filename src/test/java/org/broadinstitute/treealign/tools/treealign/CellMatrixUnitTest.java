package org.broadinstitute.treealign.tools.treealign;

import org.broadinstitute.treealign.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;

public final class CellMatrixUnitTest extends BaseTest {

    private static CellMatrix twoByThree() {
        return new CellMatrix(Arrays.asList("g1", "g2"), Arrays.asList("c1", "c2", "c3"),
                new double[][]{{1, 2, 3}, {4, 5, 6}});
    }

    @Test
    public void testDimensionsAndValues() {
        final CellMatrix matrix = twoByThree();
        Assert.assertEquals(matrix.numRows(), 2);
        Assert.assertEquals(matrix.numColumns(), 3);
        Assert.assertFalse(matrix.isEmpty());
        Assert.assertEquals(matrix.get(1, 2), 6.);
        Assert.assertEquals(matrix.getRow(0), new double[]{1, 2, 3});
        Assert.assertEquals(matrix.getColumn("c2"), new double[]{2, 5});
    }

    @Test
    public void testValuesAreCopied() {
        final double[][] values = {{1, 2}};
        final CellMatrix matrix = new CellMatrix(Collections.singletonList("g"), Arrays.asList("a", "b"), values);
        values[0][0] = 100;
        Assert.assertEquals(matrix.get(0, 0), 1.);
    }

    @Test
    public void testEmptyMatrix() {
        final CellMatrix noRows = CellMatrix.empty(Collections.emptyList(), Arrays.asList("c1", "c2"));
        Assert.assertTrue(noRows.isEmpty());
        Assert.assertEquals(noRows.numRows(), 0);
        Assert.assertEquals(noRows.numColumns(), 2);

        final CellMatrix noColumns = CellMatrix.empty(Arrays.asList("g1"), Collections.emptyList());
        Assert.assertTrue(noColumns.isEmpty());
        Assert.assertEquals(noColumns.getRow(0).length, 0);
    }

    @Test
    public void testSubsetColumnsFollowsRequestedOrder() {
        final CellMatrix subset = twoByThree().subsetColumns(Arrays.asList("c3", "absent", "c1"));
        Assert.assertEquals(subset.columnNames(), Arrays.asList("c3", "c1"));
        Assert.assertEquals(subset.rowNames(), Arrays.asList("g1", "g2"));
        Assert.assertEquals(subset.getRow(1), new double[]{6, 4});
    }

    @Test
    public void testSubsetToNoColumns() {
        final CellMatrix subset = twoByThree().subsetColumns(Collections.singletonList("absent"));
        Assert.assertTrue(subset.isEmpty());
        Assert.assertEquals(subset.numRows(), 2);
        Assert.assertEquals(subset.numColumns(), 0);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testDuplicateColumnsRejected() {
        new CellMatrix(Collections.singletonList("g"), Arrays.asList("a", "a"), new double[][]{{1, 2}});
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testDimensionMismatchRejected() {
        new CellMatrix(Arrays.asList("g1", "g2"), Arrays.asList("a", "b"), new double[][]{{1, 2}});
    }
}
