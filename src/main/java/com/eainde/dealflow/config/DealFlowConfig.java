package com.eainde.dealflow.config;

import com.eainde.dealflow.collaborator.ClasspathRosterProvider;
import com.eainde.dealflow.collaborator.CommunicationSource;
import com.eainde.dealflow.collaborator.DealStore;
import com.eainde.dealflow.collaborator.InMemoryCommunicationSource;
import com.eainde.dealflow.collaborator.InMemoryDealStore;
import com.eainde.dealflow.collaborator.RetrievalService;
import com.eainde.dealflow.collaborator.RosterProvider;
import com.eainde.dealflow.thread.MdcAwareExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Run and progress delivery pools and the default collaborators. Each collaborator bean backs
 * off when the application provides its own implementation.
 */
@Slf4j
@Configuration
public class DealFlowConfig {

    @Bean(name = "runExecutor", destroyMethod = "shutdown")
    public MdcAwareExecutor runExecutor(
            @Value("${dealflow.runs.executor.core-size:4}") int coreSize,
            @Value("${dealflow.runs.executor.max-size:64}") int maxSize) {
        return new MdcAwareExecutor("deal-run-", coreSize, maxSize);
    }

    @Bean(name = "progressExecutor", destroyMethod = "shutdown")
    public MdcAwareExecutor progressExecutor(
            @Value("${dealflow.progress.delivery-threads:256}") int maxSize) {
        return new MdcAwareExecutor("deal-progress-", 0, maxSize);
    }

    @Bean
    @ConditionalOnMissingBean(DealStore.class)
    public InMemoryDealStore dealStore() {
        log.info("No DealStore provided, using the in-memory store");
        return new InMemoryDealStore();
    }

    @Bean
    @ConditionalOnMissingBean(RosterProvider.class)
    public RosterProvider rosterProvider(
            ObjectMapper objectMapper,
            @Value("${dealflow.fixtures.roster:data/roster.json}") String rosterPath,
            @Value("${dealflow.fixtures.profile:data/organization-profile.json}") String profilePath) {
        return new ClasspathRosterProvider(objectMapper, rosterPath, profilePath);
    }

    @Bean
    @ConditionalOnMissingBean(RetrievalService.class)
    public RetrievalService retrievalService() {
        log.info("No RetrievalService provided, proposals are drafted without retrieved context");
        return (contextText, requirementTexts, limit) -> List.of();
    }

    @Bean
    @ConditionalOnMissingBean(CommunicationSource.class)
    public InMemoryCommunicationSource communicationSource() {
        return new InMemoryCommunicationSource();
    }
}
