package com.delta.opportunities.pipeline.cli;

import com.delta.opportunities.config.PipelineProperties;
import com.delta.opportunities.pipeline.model.DiscoverySummary;
import com.delta.opportunities.pipeline.orchestrator.WorkflowOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Daily batch entry point: discovers every opportunity in a CSV export for one user.
 */
@Component
@Order(10)
public class PipelineCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(PipelineCliRunner.class);

    private final PipelineProperties properties;
    private final WorkflowOrchestrator orchestrator;
    private final ConfigurableApplicationContext applicationContext;
    private final OpportunityCsvReader csvReader = new OpportunityCsvReader();

    public PipelineCliRunner(
        PipelineProperties properties,
        WorkflowOrchestrator orchestrator,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.orchestrator = orchestrator;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        if (!properties.getCli().isRun()) {
            return;
        }
        Path file = resolvePath(properties.getCli().getFile());
        OpportunityCsvReader.ReadResult read;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            read = csvReader.read(reader);
        }
        for (String error : read.errors()) {
            log.warn("Skipped {}", error);
        }

        DiscoverySummary summary = orchestrator.discoverBatch(properties.getCli().getUserId(), read.opportunities());
        log.info(
            "CLI discovery from {}: received={} created={} merged={} rejected={} applications={} unreadableRows={}",
            file,
            summary.received(),
            summary.opportunitiesCreated(),
            summary.opportunitiesMerged(),
            summary.rejected(),
            summary.applicationsCreated(),
            read.errors().size()
        );
        for (String sample : summary.errorSamples()) {
            log.info("Rejected: {}", sample);
        }

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }

    private Path resolvePath(String configuredPath) {
        Path path = Paths.get(configuredPath);
        if (path.isAbsolute()) {
            return path.normalize();
        }
        return Paths.get("").toAbsolutePath().resolve(path).normalize();
    }
}
