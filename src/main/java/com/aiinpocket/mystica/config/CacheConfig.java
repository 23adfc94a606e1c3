package com.aiinpocket.mystica.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * 快取配置。
 * 使用 Caffeine 本地快取，存放幾乎不變動的遊戲資料（稀有度掉率、風格名稱），TTL 10 分鐘。
 * 戰鬥 session 不進快取，一律讀寫資料庫以確保多 Pod 間的一致性。
 */
@Configuration
@EnableCaching
public class CacheConfig {

    public static final String RARITY_DEFINITIONS = "rarityDefinitions";
    public static final String STYLE_NAMES = "styleNames";

    @Bean
    public CacheManager cacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager(RARITY_DEFINITIONS, STYLE_NAMES);
        manager.setCaffeine(Caffeine.newBuilder()
                .expireAfterWrite(10, TimeUnit.MINUTES)
                .maximumSize(500));
        return manager;
    }
}
