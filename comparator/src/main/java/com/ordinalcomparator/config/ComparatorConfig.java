package com.ordinalcomparator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ordinalcomparator.reconcile.config.CheckpointProperties;
import com.ordinalcomparator.reconcile.config.ComparatorRunProperties;
import com.ordinalcomparator.reconcile.config.EndpointHttpProperties;
import com.ordinalcomparator.reconcile.config.EngineProperties;
import com.ordinalcomparator.reconcile.config.ReportProperties;
import com.ordinalcomparator.reconcile.config.RetryProperties;
import com.ordinalcomparator.reconcile.engine.ReportSink;
import com.ordinalcomparator.reconcile.report.CompositeReportSink;
import com.ordinalcomparator.reconcile.report.JsonLinesReportSink;
import com.ordinalcomparator.reconcile.report.LoggingReportSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Registers the comparator's typed properties and the report sinks.
 */
@Configuration
@Slf4j
@EnableConfigurationProperties({ ComparatorRunProperties.class, RetryProperties.class, EndpointHttpProperties.class,
        EngineProperties.class, CheckpointProperties.class, ReportProperties.class })
public class ComparatorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Log sink always; JSON Lines sink when comparator.report.file is set. */
    @Bean
    public ReportSink reportSink(ReportProperties reportProperties, ObjectMapper objectMapper) {
        List<ReportSink> sinks = new ArrayList<>();
        sinks.add(new LoggingReportSink());
        if (StringUtils.hasText(reportProperties.getFile())) {
            Path file = Path.of(reportProperties.getFile());
            log.info("Writing JSON Lines report to {}", file.toAbsolutePath());
            sinks.add(new JsonLinesReportSink(file, objectMapper));
        }
        return new CompositeReportSink(sinks);
    }
}
