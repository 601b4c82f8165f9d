package com.delta.harvester.service;

import com.delta.harvester.config.HarvesterProperties;
import com.delta.harvester.crawl.model.HarvestRunSummary;
import com.delta.harvester.crawl.model.SessionStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class HarvestCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(HarvestCliRunner.class);

    private final HarvesterProperties properties;
    private final HarvestOrchestratorService harvestOrchestratorService;
    private final ConfigurableApplicationContext applicationContext;

    public HarvestCliRunner(
        HarvesterProperties properties,
        HarvestOrchestratorService harvestOrchestratorService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.harvestOrchestratorService = harvestOrchestratorService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        HarvestRunSummary summary = harvestOrchestratorService.run();
        SessionStats stats = summary.stats();
        log.info(
            "Harvest run {} completed: convergence={}, links={}, records={}, output={}",
            summary.runId(),
            summary.convergence(),
            summary.discoveredLinks(),
            summary.recordCount(),
            summary.outputDirectory()
        );
        log.info(
            "Session stats: processed={}, captured={}, enriched={}, errors={}, skipped={}, duplicates={}, duration={}",
            stats.getTotalProcessed(),
            stats.getSuccessfulCaptures(),
            stats.getSuccessfulEnrichments(),
            stats.getErrors(),
            stats.getSkipped(),
            stats.getDuplicates(),
            stats.getDuration()
        );

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}
