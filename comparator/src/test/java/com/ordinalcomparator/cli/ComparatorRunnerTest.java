package com.ordinalcomparator.cli;

import com.ordinalcomparator.domain.ChainId;
import com.ordinalcomparator.domain.DivergenceKind;
import com.ordinalcomparator.domain.HeightRange;
import com.ordinalcomparator.domain.ProtocolId;
import com.ordinalcomparator.domain.RunConfig;
import com.ordinalcomparator.reconcile.config.ComparatorRunProperties;
import com.ordinalcomparator.reconcile.config.EngineProperties;
import com.ordinalcomparator.reconcile.engine.EngineState;
import com.ordinalcomparator.reconcile.engine.ReconciliationEngine;
import com.ordinalcomparator.reconcile.engine.RunSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ComparatorRunnerTest {

    @Mock
    ReconciliationEngine engine;

    private ComparatorRunProperties runProperties;
    private ComparatorRunner runner;

    @BeforeEach
    void setUp() {
        runProperties = new ComparatorRunProperties();
        runProperties.setPrimaryEndpoint("http://a:3000/");
        runProperties.setSecondaryEndpoint("http://b:3000");
        runProperties.setChain(ChainId.BITCOIN);
        runProperties.setProtocol(ProtocolId.ORDINAL);
        runProperties.setStartBlock(100L);
        runProperties.setEndBlock(110L);
        runProperties.setThreads(4);
        EngineProperties engineProperties = new EngineProperties();
        engineProperties.setShutdownGracePeriodMs(10);
        runner = new ComparatorRunner(engine, runProperties, engineProperties);
    }

    private static RunSummary summary(EngineState state) {
        return new RunSummary(state, new HeightRange(100, 110), 11, 0, 110L,
                Map.of(), new TreeMap<>(), List.of(), null, Duration.ofSeconds(2));
    }

    @Test
    void exitCodes() {
        assertThat(ComparatorRunner.exitCodeFor(EngineState.COMPLETED)).isZero();
        assertThat(ComparatorRunner.exitCodeFor(EngineState.FAILED)).isEqualTo(1);
        assertThat(ComparatorRunner.exitCodeFor(EngineState.CANCELLED)).isEqualTo(130);
    }

    @Test
    void runPassesPropertiesToEngineAndKeepsExitCode() {
        when(engine.run(any())).thenReturn(summary(EngineState.CANCELLED));

        runner.run(new DefaultApplicationArguments());

        ArgumentCaptor<RunConfig> captor = ArgumentCaptor.forClass(RunConfig.class);
        verify(engine).run(captor.capture());
        RunConfig config = captor.getValue();
        assertThat(config.primaryEndpoint()).isEqualTo("http://a:3000");
        assertThat(config.startHeight()).isEqualTo(100L);
        assertThat(config.endHeight()).isEqualTo(110L);
        assertThat(config.threadCount()).isEqualTo(4);
        assertThat(runner.getExitCode()).isEqualTo(130);
    }

    @Test
    void completedRunExitsZeroEvenWithDivergences() {
        RunSummary divergent = new RunSummary(EngineState.COMPLETED, new HeightRange(100, 110), 11, 1, 110L,
                Map.of(DivergenceKind.FIELD_MISMATCH, 1L), new TreeMap<>(Map.of(0L, 1L)),
                List.of(), null, Duration.ofSeconds(2));
        when(engine.run(any())).thenReturn(divergent);

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    void shutdownAfterRunDoesNotCancel() {
        when(engine.run(any())).thenReturn(summary(EngineState.COMPLETED));
        runner.run(new DefaultApplicationArguments());

        runner.onShutdown();

        verify(engine, never()).cancel();
    }
}
