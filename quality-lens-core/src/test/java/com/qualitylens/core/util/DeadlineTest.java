package com.qualitylens.core.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeadlineTest {

    @Test
    void checkpoint_beforeExpiry_doesNotThrow() {
        AtomicLong clock = new AtomicLong(1_000);
        Deadline deadline = Deadline.after(Duration.ofMillis(10), clock::get);

        clock.addAndGet(Duration.ofMillis(9).toNanos());

        assertThat(deadline.isExpired()).isFalse();
        assertThatCode(deadline::checkpoint).doesNotThrowAnyException();
    }

    @Test
    void checkpoint_afterExpiry_throwsTimeout() {
        AtomicLong clock = new AtomicLong(1_000);
        Deadline deadline = Deadline.after(Duration.ofMillis(10), clock::get);

        clock.addAndGet(Duration.ofMillis(10).toNanos());

        assertThat(deadline.isExpired()).isTrue();
        assertThatThrownBy(deadline::checkpoint)
            .isInstanceOf(AnalysisTimeoutException.class)
            .hasMessageContaining("10 ms");
    }

    @Test
    void after_hugeBudget_doesNotOverflow() {
        AtomicLong clock = new AtomicLong(Long.MAX_VALUE - 5);
        Deadline deadline = Deadline.after(Duration.ofDays(365), clock::get);

        assertThat(deadline.isExpired()).isFalse();
    }

    @Test
    void none_neverExpires() {
        assertThat(Deadline.none().isExpired()).isFalse();
        assertThatCode(() -> Deadline.none().checkpoint()).doesNotThrowAnyException();
    }
}
