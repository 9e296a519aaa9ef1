package com.example.formlayout.store;

import com.example.formlayout.config.LayoutProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One Redis hash per app, key {@code <prefix>layout:<appId>}:
 *  - layout  : the layout array as JSON text
 *  - revision: increases by one on every write, first write is 1
 *
 * Check and write are two round trips; concurrent writers to one app have to be serialized
 * by the caller through the revision they quote.
 */
@Slf4j
@Component
public class RedisFormLayoutStore implements FormLayoutStore {

    private static final String LAYOUT_KEY = "layout:";
    static final String FIELD_LAYOUT = "layout";
    static final String FIELD_REVISION = "revision";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final LayoutProperties props;

    public RedisFormLayoutStore(StringRedisTemplate redisTemplate,
                                ObjectMapper objectMapper,
                                LayoutProperties props) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.props = props;
    }

    String redisKeyForLayout(String appId) {
        return props.getRedisKeyPrefix() + LAYOUT_KEY + appId;
    }

    @Override
    public FormLayoutSnapshot fetch(String appId) {
        HashOperations<String, Object, Object> ops = redisTemplate.opsForHash();
        Map<Object, Object> map = ops.entries(redisKeyForLayout(appId));
        if (map == null || map.isEmpty() || map.get(FIELD_LAYOUT) == null) {
            throw new FormLayoutNotFoundException(appId);
        }
        String text = String.valueOf(map.get(FIELD_LAYOUT));
        try {
            JsonNode layout = objectMapper.readTree(text);
            return new FormLayoutSnapshot(layout, parseRevision(map.get(FIELD_REVISION)));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored layout of app " + appId + " is not valid JSON", e);
        }
    }

    @Override
    public long persist(String appId, JsonNode layout, long revision) {
        String key = redisKeyForLayout(appId);
        HashOperations<String, Object, Object> ops = redisTemplate.opsForHash();
        long current = parseRevision(ops.get(key, FIELD_REVISION));
        if (revision != LATEST_REVISION && revision != current) {
            throw new StaleRevisionException(appId, revision, current);
        }
        long next = current + 1;

        Map<String, String> hash = new LinkedHashMap<>();
        try {
            hash.put(FIELD_LAYOUT, objectMapper.writeValueAsString(layout));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Layout of app " + appId + " cannot be serialized", e);
        }
        hash.put(FIELD_REVISION, String.valueOf(next));
        ops.putAll(key, hash);

        log.info("Persisted layout for app {}: revision {} -> {}", appId, current, next);
        return next;
    }

    private static long parseRevision(Object raw) {
        if (raw == null) {
            return 0L;
        }
        try {
            return Long.parseLong(String.valueOf(raw).trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Stored layout revision is not a number: " + raw, e);
        }
    }
}
