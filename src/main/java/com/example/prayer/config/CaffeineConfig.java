package com.example.prayer.config;

import com.example.prayer.model.Coordinates;
import com.example.prayer.model.PrayerId;
import com.example.prayer.model.Streak;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

@Configuration
@RequiredArgsConstructor
public class CaffeineConfig {

    private final AppProperties appProperties;

    /**
     * Backing map for the in-memory key-value store. It holds settings and completion history,
     * so it is unbounded and never evicts; prayer-time entries carry their own expiry.
     */
    @Bean
    @Profile("!redis")
    public Cache<String, byte[]> keyValueCache() {
        return Caffeine.newBuilder()
                .recordStats()
                .build();
    }

    @Bean
    public Cache<String, Coordinates> locationCache() {
        return Caffeine.newBuilder()
                .maximumSize(1)
                .expireAfterWrite(appProperties.getCache().getLocation().getExpireAfterWrite())
                .recordStats()
                .build();
    }

    @Bean
    public Cache<PrayerId, Streak> streakCache() {
        return Caffeine.newBuilder()
                .maximumSize(appProperties.getCache().getStreaks().getMaximumSize())
                .expireAfterWrite(appProperties.getCache().getStreaks().getExpireAfterWrite())
                .recordStats()
                .build();
    }
}
