package com.example.formlayout.store;

import com.example.formlayout.config.LayoutProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class RedisFormLayoutStoreTest {

    private static final String KEY = "test:layout:42";

    private final ObjectMapper mapper = new ObjectMapper();
    private StringRedisTemplate redisTemplate;
    private HashOperations<String, Object, Object> hashOps;
    private RedisFormLayoutStore store;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        hashOps = mock(HashOperations.class);
        when(redisTemplate.<Object, Object>opsForHash()).thenReturn(hashOps);

        LayoutProperties props = new LayoutProperties();
        props.setRedisKeyPrefix("test:");
        store = new RedisFormLayoutStore(redisTemplate, mapper, props);
    }

    @Test
    void keyUsesConfiguredPrefix() {
        assertEquals(KEY, store.redisKeyForLayout("42"));
    }

    @Test
    void fetchReadsLayoutAndRevision() {
        when(hashOps.entries(KEY)).thenReturn(Map.of(
                RedisFormLayoutStore.FIELD_LAYOUT, "[{\"type\":\"ROW\",\"fields\":[]}]",
                RedisFormLayoutStore.FIELD_REVISION, "7"));

        FormLayoutSnapshot snapshot = store.fetch("42");

        assertEquals(7L, snapshot.revision());
        assertEquals("ROW", snapshot.layout().get(0).get("type").asText());
    }

    @Test
    void fetchUnknownAppFails() {
        when(hashOps.entries(KEY)).thenReturn(Map.of());

        assertThrows(FormLayoutNotFoundException.class, () -> store.fetch("42"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void firstWriteIsRevisionOne() throws Exception {
        when(hashOps.get(KEY, RedisFormLayoutStore.FIELD_REVISION)).thenReturn(null);
        JsonNode layout = mapper.readTree("[]");

        long revision = store.persist("42", layout, FormLayoutStore.LATEST_REVISION);

        assertEquals(1L, revision);
        ArgumentCaptor<Map<String, String>> captor = ArgumentCaptor.forClass(Map.class);
        verify(hashOps).putAll(eq(KEY), captor.capture());
        assertEquals("[]", captor.getValue().get(RedisFormLayoutStore.FIELD_LAYOUT));
        assertEquals("1", captor.getValue().get(RedisFormLayoutStore.FIELD_REVISION));
    }

    @Test
    void matchingRevisionIsAccepted() throws Exception {
        when(hashOps.get(KEY, RedisFormLayoutStore.FIELD_REVISION)).thenReturn("3");

        assertEquals(4L, store.persist("42", mapper.readTree("[]"), 3));
    }

    @Test
    void staleRevisionIsRejectedWithoutWriting() throws Exception {
        when(hashOps.get(KEY, RedisFormLayoutStore.FIELD_REVISION)).thenReturn("5");

        StaleRevisionException e = assertThrows(StaleRevisionException.class,
                () -> store.persist("42", mapper.readTree("[]"), 4));
        assertEquals(5L, e.getCurrentRevision());
        verify(hashOps, never()).putAll(anyString(), anyMap());
    }

    @Test
    void corruptRevisionIsReported() {
        when(hashOps.get(any(), any())).thenReturn("abc");

        assertThrows(IllegalStateException.class,
                () -> store.persist("42", mapper.createArrayNode(), FormLayoutStore.LATEST_REVISION));
    }
}
