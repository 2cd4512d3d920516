package com.draftreview.infrastructure.ai.cache;

import com.draftreview.infrastructure.ai.config.CacheSettings;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Caches parsed backend payloads as JSON. Entries expire after the configured TTL and the cache
 * is bounded by the summed payload size.
 */
@Slf4j
public class ResponseCache {

    private final Cache<String, String> cache;
    private final ObjectMapper objectMapper;

    public ResponseCache(CacheSettings settings, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(settings.ttl())
                .maximumWeight(settings.maxSizeBytes())
                .<String, String>weigher((key, json) -> key.length() + json.length())
                .build();
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        String json = cache.getIfPresent(key);
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            log.warn("[ResponseCache] Dropping unreadable entry {}: {}", key, e.getOriginalMessage());
            cache.invalidate(key);
            return Optional.empty();
        }
    }

    public void put(String key, Object value) {
        try {
            cache.put(key, objectMapper.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            log.warn("[ResponseCache] Not caching {}: {}", value.getClass().getSimpleName(), e.getOriginalMessage());
        }
    }

    public void clear() {
        cache.invalidateAll();
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
