package com.triage.orchestrator.search;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP client for the Tavily search API.
 *
 * Tavily returns pre-cleaned page extracts with a relevance score, which can go
 * into a prompt without further scraping.
 */
@Component
public class TavilySearchClient implements SearchClient {

    private static final Logger log = LoggerFactory.getLogger(TavilySearchClient.class);

    private static final String API_URL = "https://api.tavily.com/search";

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SearchResponse(List<SearchHit> results) {}

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiKey;

    public TavilySearchClient(@Value("${tavily.api-key}") String apiKey,
                              ObjectMapper objectMapper) {
        this.apiKey = apiKey;
        this.json   = objectMapper;
        this.http   = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public List<SearchHit> search(String query, String depth, int maxResults, List<String> includeDomains) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new SearchException("Tavily API key not configured (tavily.api-key)");
        }
        log.info("Searching '{}' (depth={}, max={})", query, depth, maxResults);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("api_key",      apiKey);
        body.put("query",        query);
        body.put("search_depth", depth);
        body.put("max_results",  maxResults);
        if (includeDomains != null && !includeDomains.isEmpty()) {
            body.put("include_domains", includeDomains);
        }

        String respBody = post(toJson(body), "search '" + query + "'");
        try {
            SearchResponse parsed = json.readValue(respBody, SearchResponse.class);
            return parsed.results() == null ? List.of() : parsed.results();
        } catch (JsonProcessingException e) {
            throw new SearchException("Failed to parse Tavily response", e);
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String post(String jsonBody, String opName) {
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(API_URL))
                    .timeout(Duration.ofSeconds(60))
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new SearchException(opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body());
            }
            return resp.body();
        } catch (SearchException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SearchException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new SearchException(opName + " failed", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new SearchException("JSON serialization failed", e);
        }
    }
}
