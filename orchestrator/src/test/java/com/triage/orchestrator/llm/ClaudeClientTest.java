package com.triage.orchestrator.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Offline checks of the Messages API wire format and error classification.
 */
class ClaudeClientTest {

    private final ObjectMapper json = new ObjectMapper();

    @Test
    void messagesResponse_concatenatesTextBlocksOnly() throws Exception {
        ClaudeClient.MessagesResponse resp = json.readValue("""
                {"id":"msg_1","content":[
                  {"type":"text","text":"Hello "},
                  {"type":"tool_use","id":"t1"},
                  {"type":"text","text":"world"}],
                 "stop_reason":"end_turn"}
                """, ClaudeClient.MessagesResponse.class);

        assertThat(resp.text()).isEqualTo("Hello world");
    }

    @Test
    void messagesResponse_noContent_throws() {
        assertThatThrownBy(() -> new ClaudeClient.MessagesResponse(null).text())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void languageModelException_onlyOverloadIsRetryable() {
        assertThat(new LanguageModelException(429, "rate limited").isRetryable()).isTrue();
        assertThat(new LanguageModelException(529, "overloaded").isRetryable()).isTrue();
        assertThat(new LanguageModelException(400, "bad request").isRetryable()).isFalse();
        assertThat(new LanguageModelException("no response", new RuntimeException()).statusCode()).isEqualTo(-1);
    }
}
