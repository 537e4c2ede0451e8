package com.nevis.codeindex.service;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class TaskCredentialStore {

    private final Map<UUID, String> tokens = new ConcurrentHashMap<>();

    public void put(UUID taskId, String accessToken) {
        if (accessToken != null && !accessToken.isBlank()) {
            tokens.put(taskId, accessToken);
        }
    }

    public Optional<String> get(UUID taskId) {
        return Optional.ofNullable(tokens.get(taskId));
    }

    public void remove(UUID taskId) {
        tokens.remove(taskId);
    }
}
