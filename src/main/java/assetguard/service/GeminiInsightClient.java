package assetguard.service;

import assetguard.exception.ExternalServiceException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Calls the Gemini {@code generateContent} REST endpoint.
 */
public class GeminiInsightClient implements InsightClient {

    private static final Logger logger = LoggerFactory.getLogger(GeminiInsightClient.class);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(60);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI endpoint;

    public GeminiInsightClient(String endpoint, ObjectMapper objectMapper) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), endpoint, objectMapper);
    }

    GeminiInsightClient(HttpClient httpClient, String endpoint, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.endpoint = URI.create(endpoint);
    }

    @Override
    public String generateContent(String apiKey, String prompt) throws ExternalServiceException {
        try {
            HttpRequest request = HttpRequest.newBuilder(endpoint)
                    .timeout(REQUEST_TIMEOUT)
                    .header("Content-Type", "application/json")
                    .header("x-goog-api-key", apiKey)
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody(prompt), StandardCharsets.UTF_8))
                    .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (response.statusCode() != 200) {
                throw new ExternalServiceException("Gemini request failed with HTTP " + response.statusCode());
            }
            return extractText(response.body());
        } catch (IOException e) {
            throw new ExternalServiceException("Gemini request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalServiceException("Gemini request was interrupted", e);
        }
    }

    String requestBody(String prompt) throws IOException {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode contents = root.putArray("contents");
        contents.addObject().putArray("parts").addObject().put("text", prompt);
        return objectMapper.writeValueAsString(root);
    }

    /**
     * Joins the text parts of the first candidate. Returns an empty string when there is none.
     */
    String extractText(String responseBody) throws IOException {
        JsonNode parts = objectMapper.readTree(responseBody).path("candidates").path(0).path("content").path("parts");
        StringBuilder text = new StringBuilder();
        for (JsonNode part : parts) {
            text.append(part.path("text").asText(""));
        }
        if (text.length() == 0) {
            logger.warn("Gemini response had no text parts");
        }
        return text.toString();
    }
}
