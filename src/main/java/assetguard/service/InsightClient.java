package assetguard.service;

import assetguard.exception.ExternalServiceException;

/**
 * A text-generation backend used to summarise the inventory.
 */
public interface InsightClient {

    /**
     * @return the generated text, possibly blank
     * @throws ExternalServiceException if the backend could not be reached or refused the request
     */
    String generateContent(String apiKey, String prompt) throws ExternalServiceException;
}
