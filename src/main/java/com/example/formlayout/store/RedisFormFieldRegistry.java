package com.example.formlayout.store;

import com.example.formlayout.config.LayoutProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Reads field codes from the Redis set {@code <prefix>fields:<appId>}.
 */
@Component
@RequiredArgsConstructor
public class RedisFormFieldRegistry implements FormFieldRegistry {

    private static final String FIELDS_KEY = "fields:";

    private final StringRedisTemplate redisTemplate;
    private final LayoutProperties props;

    @Override
    public Set<String> fieldCodes(String appId) {
        Set<String> members = redisTemplate.opsForSet().members(redisKeyForFields(appId));
        return members == null ? Set.of() : members;
    }

    String redisKeyForFields(String appId) {
        return props.getRedisKeyPrefix() + FIELDS_KEY + appId;
    }
}
