package com.phillippitts.presetgraph.service.runner;

import com.phillippitts.presetgraph.service.execution.CancellationToken;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineRunRegistryTest {

    private final PipelineRunRegistry registry = new PipelineRunRegistry();

    @Test
    void cancelsRunById() {
        RunHandle handle = new RunHandle("r1", "p", new CancellationToken());
        registry.register(handle);

        assertThat(registry.cancel("r1")).isTrue();
        assertThat(handle.isCancelled()).isTrue();
        // second cancel is a no-op
        assertThat(registry.cancel("r1")).isFalse();
        assertThat(registry.cancel("unknown")).isFalse();
    }

    @Test
    void cancelAllCountsNewlyCancelledRuns() {
        RunHandle first = new RunHandle("r1", "p", new CancellationToken());
        RunHandle second = new RunHandle("r2", "p", new CancellationToken());
        registry.register(first);
        registry.register(second);
        first.cancel();

        assertThat(registry.cancelAll()).isEqualTo(1);
        assertThat(second.isCancelled()).isTrue();
    }

    @Test
    void deregisterRemovesRun() {
        registry.register(new RunHandle("r1", "p", new CancellationToken()));
        assertThat(registry.activeCount()).isEqualTo(1);
        assertThat(registry.find("r1")).isPresent();

        registry.deregister("r1");

        assertThat(registry.activeCount()).isZero();
    }

    @Test
    void rejectsDuplicateRunId() {
        registry.register(new RunHandle("r1", "p", new CancellationToken()));

        assertThatThrownBy(() -> registry.register(new RunHandle("r1", "p", new CancellationToken())))
                .isInstanceOf(IllegalStateException.class);
    }
}
