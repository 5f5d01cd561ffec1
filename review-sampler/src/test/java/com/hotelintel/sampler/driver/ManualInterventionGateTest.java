package com.hotelintel.sampler.driver;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ManualInterventionGateTest {

    private final ManualInterventionGate gate = new ManualInterventionGate();

    @Test
    void resumeWithoutWaiterIsIgnored() {
        assertThat(gate.isWaiting()).isFalse();
        assertThat(gate.resume()).isFalse();
    }

    @Test
    void resumeReleasesWaiter() throws Exception {
        // given
        CompletableFuture<Boolean> waiter =
                CompletableFuture.supplyAsync(() -> gate.awaitResume(Duration.ofSeconds(10)));
        long deadline = System.currentTimeMillis() + 5_000;
        while (!gate.isWaiting() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }

        // when
        boolean resumed = gate.resume();

        // then
        assertThat(resumed).isTrue();
        assertThat(waiter.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(gate.isWaiting()).isFalse();
    }

    @Test
    void waitTimesOut() {
        assertThat(gate.awaitResume(Duration.ofMillis(50))).isFalse();
        assertThat(gate.isWaiting()).isFalse();
    }
}
