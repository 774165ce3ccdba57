package org.coregstack.pipeline;

import java.util.List;

import org.coregstack.stack.AcquisitionDate;
import org.coregstack.stack.DatePair;
import org.coregstack.tree.CoregistrationForest;

/**
 * What a stack run works on: the reference, its coregistration forest and the interferogram pairs.
 *
 * @param stackId         stack identifier
 * @param forest          coregistration forest rooted at the stack reference
 * @param interferograms  interferogram network over the reachable dates
 */
public record StackDefinition(String stackId, CoregistrationForest forest, List<DatePair> interferograms) {

    public StackDefinition {
        interferograms = List.copyOf(interferograms);
    }

    public AcquisitionDate reference() {
        return forest.reference();
    }
}
