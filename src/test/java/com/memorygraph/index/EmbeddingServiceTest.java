package com.memorygraph.index;

import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import com.memorygraph.shared.StorageUnavailableException;
import com.memorygraph.shared.config.EmbeddingConfig;
import org.junit.jupiter.api.Test;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;

@WireMockTest
class EmbeddingServiceTest {

    private static EmbeddingService service(WireMockRuntimeInfo wiremock, int dimensions) {
        return new EmbeddingService(
                new EmbeddingConfig(wiremock.getHttpBaseUrl() + "/v1/", "secret", "nomic-embed-text"), dimensions);
    }

    @Test
    void parsesEmbeddingResponse(WireMockRuntimeInfo wiremock) {
        stubFor(post(urlEqualTo("/v1/embeddings"))
                .withHeader("Authorization", equalTo("Bearer secret"))
                .withRequestBody(matchingJsonPath("$.model", equalTo("nomic-embed-text")))
                .withRequestBody(matchingJsonPath("$.input", equalTo("billing latency")))
                .willReturn(okJson("""
                        {"data": [{"embedding": [0.25, -0.5, 0.75]}]}
                        """)));

        var key = service(wiremock, 3).keyFor("billing latency");
        assertArrayEquals(new float[]{0.25f, -0.5f, 0.75f}, key);
    }

    @Test
    void dimensionMismatchIsRejected(WireMockRuntimeInfo wiremock) {
        stubFor(post(urlEqualTo("/v1/embeddings"))
                .willReturn(okJson("""
                        {"data": [{"embedding": [0.1, 0.2]}]}
                        """)));

        assertThrows(StorageUnavailableException.class, () -> service(wiremock, 3).keyFor("x"));
    }

    @Test
    void serverErrorBecomesStorageUnavailable(WireMockRuntimeInfo wiremock) {
        stubFor(post(urlEqualTo("/v1/embeddings")).willReturn(serverError()));

        var ex = assertThrows(StorageUnavailableException.class, () -> service(wiremock, 3).keyFor("x"));
        assertTrue(ex.getMessage().contains("500"));
    }

    @Test
    void malformedBodyBecomesStorageUnavailable(WireMockRuntimeInfo wiremock) {
        stubFor(post(urlEqualTo("/v1/embeddings")).willReturn(ok("not json")));

        assertThrows(StorageUnavailableException.class, () -> service(wiremock, 3).keyFor("x"));
    }
}
