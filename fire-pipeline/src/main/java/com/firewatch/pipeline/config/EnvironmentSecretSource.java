package com.firewatch.pipeline.config;

import lombok.RequiredArgsConstructor;
import org.springframework.core.env.Environment;

import java.util.Optional;

/**
 * Resolves secrets from the Spring environment: env vars, system properties, application.yml.
 */
@RequiredArgsConstructor
public class EnvironmentSecretSource implements SecretSource {

    private final Environment environment;

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(environment.getProperty(key))
                .map(String::trim)
                .filter(v -> !v.isEmpty());
    }
}
