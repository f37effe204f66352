package com.fountain.pool.config;

import com.fountain.pool.integration.AssetTransferService;
import com.fountain.pool.integration.CallerIdentityProvider;
import com.fountain.pool.integration.InMemoryAssetCustody;
import com.fountain.pool.integration.SecurityContextCallerIdentityProvider;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Default collaborators for the pool service. Each one backs off when the
 * application provides its own bean.
 */
@Configuration
@Slf4j
public class FountainConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(AssetTransferService.class)
    public InMemoryAssetCustody assetTransferService() {
        log.info("No AssetTransferService provided, using in-memory custody");
        return new InMemoryAssetCustody();
    }

    @Bean
    @ConditionalOnMissingBean
    public CallerIdentityProvider callerIdentityProvider() {
        return new SecurityContextCallerIdentityProvider();
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
