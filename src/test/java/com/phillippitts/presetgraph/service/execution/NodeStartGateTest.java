package com.phillippitts.presetgraph.service.execution;

import org.junit.jupiter.api.Test;

import java.util.concurrent.Semaphore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeStartGateTest {

    @Test
    void admitsUpToLimit() {
        NodeStartGate gate = new NodeStartGate(2, 0);

        assertThat(gate.enter()).isTrue();
        assertThat(gate.enter()).isTrue();
        assertThat(gate.enter()).isFalse();

        gate.exit();
        assertThat(gate.availablePermits()).isEqualTo(1);
        assertThat(gate.enter()).isTrue();
    }

    @Test
    void timesOutWhenFull() {
        NodeStartGate gate = new NodeStartGate(new Semaphore(1), 20);
        gate.enter();

        long start = System.nanoTime();
        boolean entered = gate.enter();

        assertThat(entered).isFalse();
        assertThat(System.nanoTime() - start).isGreaterThanOrEqualTo(15_000_000L);
    }

    @Test
    void interruptedWaitReturnsFalseAndKeepsFlag() {
        NodeStartGate gate = new NodeStartGate(1, 1000);
        gate.enter();

        Thread.currentThread().interrupt();
        try {
            assertThat(gate.enter()).isFalse();
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void rejectsNonPositiveLimit() {
        assertThatThrownBy(() -> new NodeStartGate(0, 100)).isInstanceOf(IllegalArgumentException.class);
    }
}
