package com.example.sessionservice.kv;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Minimal key-value contract the session layer needs. Implementations throw
 * {@link StoreUnavailableException} when the backing store cannot be reached.
 */
public interface KvClient {
    Optional<String> get(String key);
    void set(String key, String value, Duration ttl);
    long del(String key);
    void sadd(String key, String member);
    void srem(String key, String member);
    Set<String> smembers(String key);
    long scard(String key);
    void expire(String key, Duration ttl);
}
