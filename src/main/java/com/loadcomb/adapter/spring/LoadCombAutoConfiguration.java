package com.loadcomb.adapter.spring;

import com.loadcomb.combination.CombinationInstantiator;
import com.loadcomb.combination.Pruner;
import com.loadcomb.config.ConfigLoader;
import com.loadcomb.config.LoadFactorsConfig;
import com.loadcomb.config.LoadGroupsConfig;
import com.loadcomb.core.LoadCombinationGenerator;
import com.loadcomb.expansion.BranchExpander;
import com.loadcomb.export.CombinationSerializer;
import com.loadcomb.export.ReportWriter;
import com.loadcomb.hierarchy.HierarchyBuilder;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ForkJoinPool;

/**
 * Spring Boot auto-configuration for load combination generation.
 */
@Configuration
@ConditionalOnProperty(prefix = "loadcomb", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(LoadCombProperties.class)
public class LoadCombAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(LoadCombAutoConfiguration.class);

    private ForkJoinPool expansionPool;

    @Bean
    @ConditionalOnMissingBean
    public LoadGroupsConfig loadGroupsConfig(LoadCombProperties properties) {
        return ConfigLoader.loadGroups(properties.getGroupsPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public LoadFactorsConfig loadFactorsConfig(LoadCombProperties properties) {
        return ConfigLoader.loadFactors(properties.getFactorsPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public BranchExpander branchExpander(LoadCombProperties properties) {
        if (!properties.isParallelExpansion()) {
            return new BranchExpander();
        }
        int parallelism = properties.getParallelism() > 0
                ? properties.getParallelism()
                : Runtime.getRuntime().availableProcessors();
        log.info("Creating expansion pool with parallelism {}", parallelism);
        this.expansionPool = new ForkJoinPool(parallelism);
        return new BranchExpander(expansionPool);
    }

    @Bean
    @ConditionalOnMissingBean
    public LoadCombinationGenerator loadCombinationGenerator(LoadCombProperties properties,
                                                             BranchExpander branchExpander) {
        log.info("Creating LoadCombinationGenerator: prune={}, pruning={}, maxCombinations={}, parallel={}",
                properties.isPrune(), properties.getPruningMode(), properties.getMaxCombinations(),
                branchExpander.isParallel());
        return new LoadCombinationGenerator(
                new HierarchyBuilder(),
                new CombinationInstantiator(),
                new Pruner(properties.getPruningMode()),
                branchExpander,
                new CombinationSerializer(),
                properties.getMaxCombinations(),
                properties.isPrune());
    }

    @Bean
    @ConditionalOnMissingBean
    public ReportWriter reportWriter(LoadCombProperties properties) {
        return properties.getReportFormat().createWriter();
    }

    @PreDestroy
    public void shutdown() {
        if (expansionPool != null && !expansionPool.isShutdown()) {
            log.info("Shutting down expansion pool");
            expansionPool.shutdown();
        }
    }
}
