package com.example.sessionservice.kv;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
public class RedisKvClient implements KvClient {

    private final StringRedisTemplate redis;

    @Autowired
    public RedisKvClient(StringRedisTemplate redis) {
        this.redis = redis;
    }

    @Override
    public Optional<String> get(String key) {
        return call("GET " + key, () -> Optional.ofNullable(redis.opsForValue().get(key)));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        call("SET " + key, () -> {
            if (ttl == null || ttl.isZero() || ttl.isNegative()) {
                redis.opsForValue().set(key, value);
            } else {
                redis.opsForValue().set(key, value, ttl);
            }
            return null;
        });
    }

    @Override
    public long del(String key) {
        return call("DEL " + key, () -> Boolean.TRUE.equals(redis.delete(key)) ? 1L : 0L);
    }

    @Override
    public void sadd(String key, String member) {
        call("SADD " + key, () -> redis.opsForSet().add(key, member));
    }

    @Override
    public void srem(String key, String member) {
        call("SREM " + key, () -> redis.opsForSet().remove(key, member));
    }

    @Override
    public Set<String> smembers(String key) {
        return call("SMEMBERS " + key, () -> {
            Set<String> members = redis.opsForSet().members(key);
            return members == null ? Set.of() : members;
        });
    }

    @Override
    public long scard(String key) {
        return call("SCARD " + key, () -> {
            Long size = redis.opsForSet().size(key);
            return size == null ? 0L : size;
        });
    }

    @Override
    public void expire(String key, Duration ttl) {
        call("EXPIRE " + key, () -> redis.expire(key, ttl));
    }

    private <T> T call(String command, Supplier<T> op) {
        try {
            return op.get();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Redis command failed: " + command, e);
        }
    }
}
