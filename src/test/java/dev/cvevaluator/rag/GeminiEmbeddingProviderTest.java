package dev.cvevaluator.rag;

import dev.cvevaluator.config.AiProperties;
import dev.cvevaluator.config.RetrievalProperties;
import dev.cvevaluator.exception.ProviderResponseException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class GeminiEmbeddingProviderTest {

    private MockWebServer mockWebServer;
    private GeminiEmbeddingProvider provider;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();

        AiProperties aiProperties = new AiProperties();
        aiProperties.setApiKey("embed-key");
        aiProperties.setBaseUrl(mockWebServer.url("/").toString());
        RetrievalProperties retrievalProperties = new RetrievalProperties();
        retrievalProperties.getEmbedding().setModel("text-embedding-004");
        provider = new GeminiEmbeddingProvider(aiProperties, retrievalProperties);
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    @Test
    @DisplayName("Should return the embedding values")
    void shouldEmbedText() throws Exception {
        mockWebServer.enqueue(new MockResponse()
                .setBody("{\"embedding\": {\"values\": [0.1, -0.2, 0.3]}}")
                .setHeader("Content-Type", "application/json"));

        StepVerifier.create(provider.embed("Java backend engineer"))
                .assertNext(vector -> assertThat(vector).containsExactly(0.1, -0.2, 0.3))
                .verifyComplete();

        RecordedRequest request = mockWebServer.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1beta/models/text-embedding-004:embedContent?key=embed-key");
        assertThat(request.getBody().readUtf8())
                .contains("\"model\":\"models/text-embedding-004\"")
                .contains("Java backend engineer");
    }

    @Test
    @DisplayName("Should reject a response without values")
    void shouldRejectMissingValues() {
        mockWebServer.enqueue(new MockResponse()
                .setBody("{\"embedding\": {}}")
                .setHeader("Content-Type", "application/json"));

        StepVerifier.create(provider.embed("text"))
                .expectError(ProviderResponseException.class)
                .verify();
    }
}
