package com.hookrelay.common.store;

import com.hookrelay.common.exception.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * {@link AtomicStore} backed by Redis. Compare-and-act operations run as Lua scripts,
 * so the check and the mutation happen in one server-side step.
 */
@Slf4j
public class RedisAtomicStore implements AtomicStore {

    private final StringRedisTemplate redisTemplate;
    private final Map<AtomicScript, DefaultRedisScript<Long>> scripts = new EnumMap<>(AtomicScript.class);

    public RedisAtomicStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
        for (AtomicScript script : AtomicScript.values()) {
            scripts.put(script, new DefaultRedisScript<>(script.getLua(), Long.class));
        }
    }

    @Override
    public String get(String key) {
        return call("GET", key, () -> redisTemplate.opsForValue().get(key));
    }

    @Override
    public void set(String key, String value, long ttlSeconds) {
        AtomicStore.requireTtl(ttlSeconds);
        call("SET", key, () -> {
            redisTemplate.opsForValue().set(key, value, Duration.ofSeconds(ttlSeconds));
            return null;
        });
    }

    @Override
    public boolean setIfNotExists(String key, String value, long ttlSeconds) {
        AtomicStore.requireTtl(ttlSeconds);
        Boolean created = call("SETNX", key,
                () -> redisTemplate.opsForValue().setIfAbsent(key, value, Duration.ofSeconds(ttlSeconds)));
        return Boolean.TRUE.equals(created);
    }

    @Override
    public long executeScript(AtomicScript script, List<String> keys, String... args) {
        Long result = call(script.name(), keys.isEmpty() ? "" : keys.get(0),
                () -> redisTemplate.execute(scripts.get(script), keys, (Object[]) args));
        return result != null ? result : 0L;
    }

    @Override
    public boolean delete(String key) {
        return Boolean.TRUE.equals(call("DEL", key, () -> redisTemplate.delete(key)));
    }

    @Override
    public boolean exists(String key) {
        return Boolean.TRUE.equals(call("EXISTS", key, () -> redisTemplate.hasKey(key)));
    }

    private <T> T call(String operation, String key, Supplier<T> command) {
        try {
            return command.get();
        } catch (DataAccessException e) {
            log.debug("Redis {} failed for key={}: {}", operation, key, e.getMessage());
            throw new StoreUnavailableException(
                    String.format("Redis %s failed for key %s", operation, key), e);
        }
    }
}
