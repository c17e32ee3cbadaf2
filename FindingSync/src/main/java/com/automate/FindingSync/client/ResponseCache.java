package com.automate.FindingSync.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;

/**
 * Bounded, time-limited cache of upstream GET responses.
 * Cached nodes are shared between callers and must be treated as read-only.
 */
public class ResponseCache {

    private final Cache<String, JsonNode> cache;
    private final ObjectMapper objectMapper;

    public ResponseCache(int maxSize, Duration ttl, ObjectMapper objectMapper) {
        this(maxSize, ttl, objectMapper, Ticker.systemTicker());
    }

    public ResponseCache(int maxSize, Duration ttl, ObjectMapper objectMapper, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .build();
        this.objectMapper = objectMapper;
    }

    /** Key = base URL + endpoint + params serialized in key order, so parameter order never matters. */
    public String key(String baseUrl, String endpoint, Map<String, String> params) {
        try {
            return baseUrl + endpoint + objectMapper.writeValueAsString(new TreeMap<>(params));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot build cache key for " + endpoint, e);
        }
    }

    public JsonNode get(String key) {
        return cache.getIfPresent(key);
    }

    public void put(String key, JsonNode value) {
        cache.put(key, value);
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
