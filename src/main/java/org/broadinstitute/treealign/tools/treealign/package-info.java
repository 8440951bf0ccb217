/**
 * Tree-based clone assignment: walks a lineage tree from the root and refines the clade each profiled cell is
 * assigned to, one level at a time, for as long as the copy-number and allele-specific data support a split.
 *
 * <p>The statistical assignment itself ({@link org.broadinstitute.treealign.tools.treealign.CloneAssigner}) and the
 * construction of consensus inputs ({@link org.broadinstitute.treealign.tools.treealign.ProfileBuilder}) are supplied
 * by the caller.</p>
 */
package org.broadinstitute.treealign.tools.treealign;
