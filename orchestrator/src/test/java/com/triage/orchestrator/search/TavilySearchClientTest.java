package com.triage.orchestrator.search;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TavilySearchClientTest {

    private final ObjectMapper json = new ObjectMapper();

    @Test
    void search_withoutApiKey_failsBeforeAnyRequest() {
        TavilySearchClient client = new TavilySearchClient("", json);

        assertThatThrownBy(() -> client.searchTechnical("postgres connection refused", 5))
                .isInstanceOf(SearchException.class)
                .hasMessageContaining("tavily.api-key");
    }

    @Test
    void searchResponse_ignoresUnknownFields() throws Exception {
        TavilySearchClient.SearchResponse resp = json.readValue("""
                {"query":"q","response_time":0.4,"results":[
                  {"title":"Docs","url":"https://postgresql.org","content":"Check listen_addresses","score":0.92,"raw_content":null}]}
                """, TavilySearchClient.SearchResponse.class);

        assertThat(resp.results()).containsExactly(
                new SearchHit("Docs", "https://postgresql.org", "Check listen_addresses", 0.92));
    }
}
