package com.nodegraph.codegen.io;

import java.util.List;

import com.nodegraph.codegen.model.GraphLink;

/**
 * Outcome of loading a {@link GraphDocument}. Entities that could not be
 * restored are listed with a reason; they never abort the rest of the load.
 *
 * @param nodesLoaded       number of nodes restored
 * @param linksLoaded       number of links kept after validation
 * @param skippedNodes      one message per node that was skipped
 * @param skippedLinks      one message per connection that was skipped
 * @param removedByValidation links restored but then dropped by the repair pass
 */
public record LoadReport(int nodesLoaded, int linksLoaded, List<String> skippedNodes, List<String> skippedLinks,
        List<GraphLink> removedByValidation) {

    public boolean isClean() {
        return skippedNodes.isEmpty() && skippedLinks.isEmpty() && removedByValidation.isEmpty();
    }
}
