package com.tempmail.config;

import com.tempmail.storage.BlobStore;
import com.tempmail.storage.LocalBlobStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Paths;

/**
 * Immutable runtime settings and storage beans, built once at start from {@link ServerProperties}
 */
@Slf4j
@Configuration
public class TempMailConfig {

    @Bean
    public RetentionPolicy retentionPolicy(ServerProperties properties) {
        RetentionPolicy policy = new RetentionPolicy(properties.getRetention().getMinutes());
        log.info("Mailbox retention: {} minutes", policy.minutes());
        return policy;
    }

    @Bean
    public ForwardRules forwardRules(ServerProperties properties) {
        ForwardRules rules = ForwardRules.from(properties);
        log.info("Forward rules loaded: {} (domains={})", rules.rules().size(), properties.getDomainList());
        return rules;
    }

    @Bean
    public BlobStore blobStore(ServerProperties properties) {
        return new LocalBlobStore(Paths.get(properties.getStorage().getBasePath()));
    }

    // Shared Reactor scheduler, not owned by the context
    @Bean(destroyMethod = "")
    public Scheduler backgroundScheduler() {
        return Schedulers.boundedElastic();
    }
}
