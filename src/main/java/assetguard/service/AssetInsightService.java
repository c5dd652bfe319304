package assetguard.service;

import assetguard.data.AssetStatus;
import assetguard.data.Transaction;
import assetguard.store.EntityStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Asks the insight backend for a short written analysis of the inventory. The returned future
 * always completes normally: every failure is turned into a fixed message.
 */
public class AssetInsightService {

    private static final Logger logger = LoggerFactory.getLogger(AssetInsightService.class);

    public static final String MISSING_KEY_MESSAGE = "API Key not found. Please configure the environment variable.";
    public static final String FAILURE_MESSAGE = "Error analyzing data. Please try again later.";
    public static final String EMPTY_RESPONSE_MESSAGE = "Unable to generate analysis at this time.";
    static final int RECENT_TRANSACTION_LIMIT = 10;

    private final EntityStore store;
    private final InsightClient client;
    private final String apiKey;
    private final ObjectMapper objectMapper;
    private final Executor executor;
    private final Clock clock;

    /**
     * @param apiKey the backend credential, or null when none is configured
     */
    public AssetInsightService(EntityStore store, InsightClient client, String apiKey, ObjectMapper objectMapper, Executor executor, Clock clock) {
        this.store = store;
        this.client = client;
        this.apiKey = apiKey;
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.clock = clock;
    }

    public CompletableFuture<String> analyzeAssetHealth() {
        if (apiKey == null || apiKey.isBlank()) {
            logger.warn("Insight analysis requested but no API key is configured");
            return CompletableFuture.completedFuture(MISSING_KEY_MESSAGE);
        }
        return CompletableFuture.supplyAsync(() -> {
            try {
                String prompt = buildPrompt(buildSnapshot());
                String response = client.generateContent(apiKey, prompt);
                if (response == null || response.isBlank()) {
                    return EMPTY_RESPONSE_MESSAGE;
                }
                return response.trim();
            } catch (Exception e) {
                logger.error("Insight analysis failed", e);
                return FAILURE_MESSAGE;
            }
        }, executor);
    }

    public InsightSnapshot buildSnapshot() throws SQLException {
        Map<AssetStatus, Integer> counts = store.countAssetsByStatus();
        Map<String, Integer> statusCounts = new LinkedHashMap<>();
        int total = 0;
        for (Map.Entry<AssetStatus, Integer> entry : counts.entrySet()) {
            statusCounts.put(entry.getKey().getLabel(), entry.getValue());
            total += entry.getValue();
        }

        List<InsightSnapshot.RecentTransaction> recent = new ArrayList<>();
        for (Transaction tx : store.recentTransactions(RECENT_TRANSACTION_LIMIT)) {
            String date = Instant.ofEpochMilli(tx.getTimestamp()).atZone(clock.getZone()).toLocalDate().toString();
            recent.add(new InsightSnapshot.RecentTransaction(tx.getType().getLabel(), tx.getAssetName(), date, tx.getNotes()));
        }
        return new InsightSnapshot(total, statusCounts, recent);
    }

    String buildPrompt(InsightSnapshot snapshot) throws JsonProcessingException {
        String data = objectMapper.writeValueAsString(snapshot);
        return """
                Act as an intelligent facility manager. Analyze the following JSON of asset and transaction data.
                Give a concise summary (at most 3 paragraphs) covering:
                1. Current asset utilization.
                2. Any maintenance concerns based on the logs or statuses.
                3. Recommendations for optimizing asset allocation.

                Data:
                """ + data;
    }
}
