package io.leanweb.server.core;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectionAdmissionTest {

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new ConnectionAdmission(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void acquireBlocksWhenExhaustedUntilRelease() throws Exception {
        ConnectionAdmission admission = new ConnectionAdmission(1);
        admission.acquire();
        assertThat(admission.available()).isZero();

        AtomicBoolean acquired = new AtomicBoolean();
        CountDownLatch done = new CountDownLatch(1);
        Thread waiter = new Thread(() -> {
            try {
                admission.acquire();
                acquired.set(true);
                done.countDown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        waiter.start();

        assertThat(done.await(200, TimeUnit.MILLISECONDS)).isFalse();
        assertThat(acquired).isFalse();

        admission.release();
        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(admission.inUse()).isEqualTo(1);
        waiter.join();
    }

    @Test
    void unpairedReleaseFailsWithoutGrowingPool() {
        ConnectionAdmission admission = new ConnectionAdmission(2);
        assertThatThrownBy(admission::release).isInstanceOf(IllegalStateException.class);
        assertThat(admission.available()).isEqualTo(2);
        assertThat(admission.capacity()).isEqualTo(2);
    }
}
