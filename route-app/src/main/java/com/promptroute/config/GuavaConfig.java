package com.promptroute.config;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.promptroute.domain.budget.model.entity.LedgerEntryEntity;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Guava 缓存配置类。
 * <p>
 * ledgerStateCache 保存各组织当前周期最近一次已知的账本条目，
 * 写入后按 route.ledger.cache-ttl-ms 过期（默认 3 秒），commit 时主动驱逐。
 * </p>
 *
 * @author promptroute
 * @since 2026-10-01
 */
@Configuration
public class GuavaConfig {

    @Bean(name = "ledgerStateCache")
    public Cache<String, LedgerEntryEntity> ledgerStateCache(
            @Value("${route.ledger.cache-ttl-ms:3000}") long ttlMs,
            @Value("${route.ledger.cache-max-size:10000}") long maxSize) {
        return CacheBuilder.newBuilder()
                .expireAfterWrite(Math.max(ttlMs, 0L), TimeUnit.MILLISECONDS)
                .maximumSize(Math.max(maxSize, 1L))
                .build();
    }

}
