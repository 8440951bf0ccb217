package org.broadinstitute.treealign.tools.treealign;

import org.broadinstitute.treealign.utils.Utils;

import java.util.Collections;
import java.util.List;

/**
 * Inputs and outputs of the clone assigner at one clade, kept only when input/output recording is enabled.
 */
public final class CladeRecord {

    private final String cladeName;
    private final List<String> roster;
    private final CloneAssignmentInputs inputs;
    private CloneAssignmentResult result;

    CladeRecord(final String cladeName, final List<String> roster, final CloneAssignmentInputs inputs) {
        this.cladeName = Utils.nonNull(cladeName);
        this.roster = Collections.unmodifiableList(roster);
        this.inputs = Utils.nonNull(inputs);
    }

    void setResult(final CloneAssignmentResult result) {
        this.result = result;
    }

    public String getCladeName() {
        return cladeName;
    }

    /**
     * @return names of the clean children, in the order the assigner indices refer to.
     */
    public List<String> getRoster() {
        return roster;
    }

    public CloneAssignmentInputs getInputs() {
        return inputs;
    }

    /**
     * @return {@code null} until the assigner has returned.
     */
    public CloneAssignmentResult getResult() {
        return result;
    }
}
