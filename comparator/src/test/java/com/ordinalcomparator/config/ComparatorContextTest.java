package com.ordinalcomparator.config;

import com.ordinalcomparator.cli.ComparatorRunner;
import com.ordinalcomparator.domain.ChainId;
import com.ordinalcomparator.domain.ProtocolId;
import com.ordinalcomparator.domain.RunConfig;
import com.ordinalcomparator.reconcile.checkpoint.CheckpointStore;
import com.ordinalcomparator.reconcile.checkpoint.FileCheckpointStore;
import com.ordinalcomparator.reconcile.compare.ComparatorRegistry;
import com.ordinalcomparator.reconcile.config.ComparatorRunProperties;
import com.ordinalcomparator.reconcile.config.EngineProperties;
import com.ordinalcomparator.reconcile.engine.ReconciliationEngine;
import com.ordinalcomparator.reconcile.engine.ReportSink;
import com.ordinalcomparator.reconcile.report.CompositeReportSink;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "comparator.runner.enabled=false",
        "comparator.primary-endpoint=http://primary.example:3000/",
        "comparator.secondary-endpoint=http://secondary.example:3000",
        "comparator.chain=FRACTAL",
        "comparator.protocol=BRC20",
        "comparator.threads=8",
        "comparator.checkpoint.directory=target/context-test-checkpoints"
})
class ComparatorContextTest {

    @Autowired
    ApplicationContext context;

    @Autowired
    ComparatorRunProperties runProperties;

    @Autowired
    EngineProperties engineProperties;

    @Autowired
    CheckpointStore checkpointStore;

    @Autowired
    ReportSink reportSink;

    @Autowired
    ComparatorRegistry comparatorRegistry;

    @Autowired
    @Qualifier(SchedulerConfig.SCHEDULER_POOL)
    ThreadPoolTaskScheduler schedulerPool;

    @Test
    @DisplayName("properties bind into a run config with trailing slashes trimmed")
    void propertiesBind() {
        RunConfig config = runProperties.toRunConfig();

        assertThat(config.chain()).isEqualTo(ChainId.FRACTAL);
        assertThat(config.protocol()).isEqualTo(ProtocolId.BRC20);
        assertThat(config.primaryEndpoint()).isEqualTo("http://primary.example:3000");
        assertThat(config.secondaryEndpoint()).isEqualTo("http://secondary.example:3000");
        assertThat(config.startHeight()).isNull();
        assertThat(config.endHeight()).isNull();
        assertThat(config.threadCount()).isEqualTo(8);
        assertThat(engineProperties.isTolerateGaps()).isFalse();
    }

    @Test
    @DisplayName("file checkpoint store and composite report sink are wired by default")
    void defaultWiring() {
        assertThat(checkpointStore).isInstanceOf(FileCheckpointStore.class);
        assertThat(reportSink).isInstanceOf(CompositeReportSink.class);
        assertThat(context.getBean(ReconciliationEngine.class)).isNotNull();
        assertThat(comparatorRegistry.forProtocol(ProtocolId.BRC20).protocol()).isEqualTo(ProtocolId.BRC20);
        assertThat(comparatorRegistry.forProtocol(ProtocolId.ORDINAL).protocol()).isEqualTo(ProtocolId.ORDINAL);
        assertThat(schedulerPool.getScheduledThreadPoolExecutor().getCorePoolSize()).isEqualTo(1);
    }

    @Test
    void runnerIsNotRegisteredWhenDisabled() {
        assertThat(context.getBeanNamesForType(ComparatorRunner.class)).isEmpty();
    }
}
