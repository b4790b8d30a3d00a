package com.triage.orchestrator.search;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** One web search result. {@code score} is the provider's relevance score. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SearchHit(String title, String url, String content, double score) {}
