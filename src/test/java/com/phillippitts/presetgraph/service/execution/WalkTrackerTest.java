package com.phillippitts.presetgraph.service.execution;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WalkTrackerTest {

    private final AtomicInteger finished = new AtomicInteger();
    private final WalkTracker tracker = new WalkTracker(finished::incrementAndGet);

    @Test
    void rootWalkAloneFinishesTheRun() {
        tracker.walkFinished();

        assertThat(finished.get()).isEqualTo(1);
        assertThat(tracker.activeWalks()).isZero();
    }

    @Test
    void runFinishesOnlyAfterLastBranch() {
        tracker.branchStarted();
        tracker.branchStarted();

        tracker.walkFinished();
        tracker.walkFinished();
        assertThat(finished.get()).isZero();
        assertThat(tracker.activeWalks()).isEqualTo(1);

        tracker.walkFinished();
        assertThat(finished.get()).isEqualTo(1);
    }

    @Test
    void extraFinishIsRejected() {
        tracker.walkFinished();

        assertThatThrownBy(tracker::walkFinished).isInstanceOf(IllegalStateException.class);
        assertThat(finished.get()).isEqualTo(1);
    }
}
