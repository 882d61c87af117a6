package eu.okaeri.docengine.util;

import eu.okaeri.docengine.DatabaseException;
import eu.okaeri.docengine.connection.ConnectionSettings;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectionRetryTest {

    @Test
    void connect_succeeds_on_first_attempt() {
        String result = ConnectionRetry.of("default")
            .connector(() -> "connected")
            .connect();

        assertThat(result).isEqualTo("connected");
    }

    @Test
    void connect_retries_until_success() {
        AtomicInteger attempts = new AtomicInteger(0);
        AtomicInteger retries = new AtomicInteger(0);

        String result = ConnectionRetry.of("default")
            .connector(() -> {
                if (attempts.incrementAndGet() < 3) {
                    throw new IllegalStateException("connection refused");
                }
                return "connected";
            })
            .initialBackoff(Duration.ofMillis(5))
            .maxBackoff(Duration.ofMillis(10))
            .multiplier(10.0)
            .onRetry(attempt -> retries.incrementAndGet())
            .connect();

        assertThat(result).isEqualTo("connected");
        assertThat(attempts.get()).isEqualTo(3);
        assertThat(retries.get()).isEqualTo(2);
    }

    @Test
    void connect_fails_when_next_wait_passes_deadline() {
        AtomicInteger attempts = new AtomicInteger(0);

        assertThatThrownBy(() -> ConnectionRetry.of("analytics")
            .connector(() -> {
                attempts.incrementAndGet();
                throw new IllegalStateException("connection refused");
            })
            .initialBackoff(Duration.ofMillis(50))
            .timeout(Duration.ofMillis(120))
            .connect())
            .isInstanceOf(ConnectionRetry.ConnectionException.class)
            .isInstanceOf(DatabaseException.class)
            .hasMessageContaining("'analytics'")
            .hasMessageContaining("attempts")
            .hasCauseInstanceOf(IllegalStateException.class);

        assertThat(attempts.get()).isEqualTo(2);
    }

    @Test
    void settings_connect_timeout_bounds_retries() {
        ConnectionSettings settings = ConnectionSettings.builder()
            .alias("reports")
            .name("test")
            .option(ConnectionSettings.CONNECT_TIMEOUT, 0.1)
            .build();
        AtomicInteger attempts = new AtomicInteger(0);

        assertThatThrownBy(() -> ConnectionRetry.of(settings)
            .connector(() -> {
                attempts.incrementAndGet();
                throw new IllegalStateException("connection refused");
            })
            .initialBackoff(Duration.ofMillis(60))
            .connect())
            .isInstanceOf(ConnectionRetry.ConnectionException.class)
            .hasMessageContaining("'reports'");

        assertThat(attempts.get()).isEqualTo(2);
    }

    @Test
    void non_retryable_failure_ends_at_once() {
        AtomicInteger attempts = new AtomicInteger(0);

        assertThatThrownBy(() -> ConnectionRetry.of("default")
            .connector(() -> {
                attempts.incrementAndGet();
                throw new SecurityException("authentication failed");
            })
            .initialBackoff(Duration.ofMillis(5))
            .retryIf(exception -> !(exception instanceof SecurityException))
            .connect())
            .isInstanceOf(ConnectionRetry.ConnectionException.class)
            .hasMessage("Cannot connect 'default': authentication failed")
            .hasCauseInstanceOf(SecurityException.class);

        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    void connect_with_no_timeout_keeps_retrying() {
        AtomicInteger attempts = new AtomicInteger(0);

        String result = ConnectionRetry.of("default")
            .connector(() -> {
                if (attempts.incrementAndGet() < 5) {
                    throw new IllegalStateException("fail", new RuntimeException("inner cause"));
                }
                return "connected";
            })
            .initialBackoff(Duration.ofMillis(5))
            .timeout(Duration.ofMillis(1))
            .noTimeout()
            .connect();

        assertThat(result).isEqualTo("connected");
        assertThat(attempts.get()).isEqualTo(5);
    }

    @Test
    void multiplier_below_one_is_rejected() {
        assertThatThrownBy(() -> ConnectionRetry.of("default")
            .connector(() -> "connected")
            .multiplier(0.5))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("1.0");
    }

    @Test
    void interrupted_attempt_restores_interrupt_flag() {
        assertThatThrownBy(() -> ConnectionRetry.of("default")
            .connector(() -> {
                throw new InterruptedException("interrupted");
            })
            .connect())
            .isInstanceOf(ConnectionRetry.ConnectionException.class)
            .hasMessageContaining("interrupted")
            .hasCauseInstanceOf(InterruptedException.class);

        assertThat(Thread.interrupted()).isTrue();
    }
}
