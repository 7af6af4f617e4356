package ippnotify.auth;

import java.util.concurrent.TimeUnit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import ippnotify.common.configuration.SecurityProperties;

/**
 * Verified user names keyed by the credential that proved them, so that each client is checked against the user store once per
 * expiration period.
 */
public class AuthCache {

    private final Cache<String,String> cache;

    public AuthCache(SecurityProperties securityProperties) {
        this.cache = Caffeine.newBuilder().expireAfterWrite(securityProperties.getCacheExpirationMinutes(), TimeUnit.MINUTES).build();
    }

    public String get(String key) {
        return cache.getIfPresent(key);
    }

    public void put(String key, String username) {
        cache.put(key, username);
    }
}
