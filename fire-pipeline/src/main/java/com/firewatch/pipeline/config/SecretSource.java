package com.firewatch.pipeline.config;

import java.util.Optional;

/**
 * Read-only key-value access to credentials.
 */
public interface SecretSource {

    String FIRMS_MAP_KEY = "firewatch.secrets.firms-map-key";
    String BIGDATACLOUD_API_KEY = "firewatch.secrets.bigdatacloud-api-key";

    /**
     * @return the secret, or empty when it is absent or blank
     */
    Optional<String> get(String key);
}
