package com.triage.orchestrator.search;

import java.util.List;

/**
 * Web search capability used by the research node.
 */
public interface SearchClient {

    /** Sites that tend to hold answers to operational and programming errors. */
    List<String> TECHNICAL_DOMAINS = List.of(
            "stackoverflow.com",
            "github.com",
            "docs.python.org",
            "docs.docker.com",
            "kubernetes.io",
            "aws.amazon.com/documentation",
            "cloud.google.com/docs",
            "learn.microsoft.com",
            "developer.mozilla.org");

    /**
     * @param depth          "basic" or "advanced"
     * @param includeDomains restrict results to these domains; empty for no restriction
     * @throws SearchException if the provider call fails
     */
    List<SearchHit> search(String query, String depth, int maxResults, List<String> includeDomains);

    /** Deep search restricted to {@link #TECHNICAL_DOMAINS}. */
    default List<SearchHit> searchTechnical(String query, int maxResults) {
        return search(query, "advanced", maxResults, TECHNICAL_DOMAINS);
    }
}
