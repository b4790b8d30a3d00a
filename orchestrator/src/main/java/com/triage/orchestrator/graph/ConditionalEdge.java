package com.triage.orchestrator.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A runtime choice of next node: the router's outcome label is looked up in
 * {@code destinations}, whose values are node names or {@link GraphDefinition#END}.
 */
public record ConditionalEdge(String from,
                              Set<String> outcomes,
                              Router router,
                              Map<String, String> destinations) {

    public ConditionalEdge {
        outcomes     = Collections.unmodifiableSet(new LinkedHashSet<>(outcomes));
        destinations = Collections.unmodifiableMap(new LinkedHashMap<>(destinations));
    }
}
