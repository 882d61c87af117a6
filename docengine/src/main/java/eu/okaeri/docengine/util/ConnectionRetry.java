package eu.okaeri.docengine.util;

import eu.okaeri.docengine.DatabaseException;
import eu.okaeri.docengine.connection.ConnectionSettings;
import lombok.NonNull;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.logging.Logger;

/**
 * Establishes a connection, retrying failed attempts with exponential backoff until one succeeds
 * or the next wait would pass the deadline.
 * <p>
 * Defaults come from system properties:
 * <ul>
 *   <li>{@code okaeri.docengine.connectRetry.initialBackoffMs} - first wait in milliseconds (default: 1000)</li>
 *   <li>{@code okaeri.docengine.connectRetry.maxBackoffMs} - longest wait in milliseconds (default: 30000)</li>
 *   <li>{@code okaeri.docengine.connectRetry.multiplier} - backoff growth (default: 2.0)</li>
 *   <li>{@code okaeri.docengine.connectRetry.timeoutMs} - total time in milliseconds, 0 to retry forever (default: 300000)</li>
 * </ul>
 * {@link #of(ConnectionSettings)} takes the deadline from the {@code CONNECT_TIMEOUT} option instead.
 */
public final class ConnectionRetry<T> {

    private static final Logger LOGGER = Logger.getLogger(ConnectionRetry.class.getSimpleName());

    private static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofMillis(
        Long.parseLong(System.getProperty("okaeri.docengine.connectRetry.initialBackoffMs", "1000")));
    private static final Duration DEFAULT_MAX_BACKOFF = Duration.ofMillis(
        Long.parseLong(System.getProperty("okaeri.docengine.connectRetry.maxBackoffMs", "30000")));
    private static final double DEFAULT_MULTIPLIER =
        Double.parseDouble(System.getProperty("okaeri.docengine.connectRetry.multiplier", "2.0"));
    private static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(
        Long.parseLong(System.getProperty("okaeri.docengine.connectRetry.timeoutMs", "300000")));

    private final String alias;
    private final Callable<T> attempt;
    private Duration initialBackoff = DEFAULT_INITIAL_BACKOFF;
    private Duration maxBackoff = DEFAULT_MAX_BACKOFF;
    private double multiplier = DEFAULT_MULTIPLIER;
    private Duration timeout;
    private Predicate<? super Exception> retryable = exception -> true;
    private Consumer<Integer> onRetry;

    private ConnectionRetry(String alias, Duration timeout, Callable<T> attempt) {
        this.alias = alias;
        this.timeout = timeout;
        this.attempt = attempt;
    }

    /**
     * @param alias connection alias, used in log lines and errors
     */
    public static Builder of(@NonNull String alias) {
        return new Builder(alias, DEFAULT_TIMEOUT);
    }

    /**
     * Retry for the alias of the settings, bounded by their {@code CONNECT_TIMEOUT} when set.
     */
    public static Builder of(@NonNull ConnectionSettings settings) {
        return new Builder(settings.getAlias(), settings.getConnectTimeout().orElse(DEFAULT_TIMEOUT));
    }

    public ConnectionRetry<T> initialBackoff(@NonNull Duration backoff) {
        this.initialBackoff = backoff;
        return this;
    }

    public ConnectionRetry<T> maxBackoff(@NonNull Duration backoff) {
        this.maxBackoff = backoff;
        return this;
    }

    public ConnectionRetry<T> multiplier(double multiplier) {
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("Multiplier must be >= 1.0");
        }
        this.multiplier = multiplier;
        return this;
    }

    public ConnectionRetry<T> timeout(@NonNull Duration timeout) {
        this.timeout = timeout;
        return this;
    }

    public ConnectionRetry<T> noTimeout() {
        this.timeout = Duration.ZERO;
        return this;
    }

    /**
     * Failures not matching the predicate end the retry loop at once, e.g. rejected credentials.
     */
    public ConnectionRetry<T> retryIf(@NonNull Predicate<? super Exception> retryable) {
        this.retryable = retryable;
        return this;
    }

    public ConnectionRetry<T> onRetry(@NonNull Consumer<Integer> callback) {
        this.onRetry = callback;
        return this;
    }

    /**
     * @throws ConnectionException when no attempt succeeded in time, a failure is not retryable or the thread is interrupted
     */
    public T connect() {

        Instant start = Instant.now();
        Instant deadline = this.timeout.isZero() ? null : start.plus(this.timeout);
        Duration backoff = this.initialBackoff;

        for (int attempt = 1; ; attempt++) {
            try {
                return this.attempt.call();
            } catch (InterruptedException exception) {
                throw this.interrupted(exception);
            } catch (Exception exception) {
                if (!this.retryable.test(exception)) {
                    throw new ConnectionException("Cannot connect '" + this.alias + "': " + exception.getMessage(), exception);
                }
                if ((deadline != null) && !Instant.now().plus(backoff).isBefore(deadline)) {
                    throw new ConnectionException("Failed to connect '" + this.alias + "' after "
                        + format(Duration.between(start, Instant.now())) + " (" + attempt + " attempts)", exception);
                }
                this.logFailure(attempt, backoff, deadline, exception);
                this.sleep(backoff);
                backoff = this.next(backoff);
            }
        }
    }

    private void logFailure(int attempt, Duration backoff, Instant deadline, Exception exception) {
        String cause = (exception.getCause() != null) ? (" caused by " + exception.getCause().getMessage()) : "";
        String remaining = (deadline != null) ? (", timeout in " + format(Duration.between(Instant.now(), deadline))) : "";
        LOGGER.severe("[" + this.alias + "] Cannot connect (attempt " + attempt + ", waiting "
            + format(backoff) + remaining + "): " + exception.getMessage() + cause);
        if (this.onRetry != null) {
            this.onRetry.accept(attempt);
        }
    }

    private void sleep(Duration backoff) {
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException exception) {
            throw this.interrupted(exception);
        }
    }

    private Duration next(Duration backoff) {
        long next = (long) (backoff.toMillis() * this.multiplier);
        return Duration.ofMillis(Math.min(next, this.maxBackoff.toMillis()));
    }

    private ConnectionException interrupted(InterruptedException exception) {
        Thread.currentThread().interrupt();
        return new ConnectionException("Connection interrupted for '" + this.alias + "'", exception);
    }

    private static String format(Duration duration) {
        long seconds = duration.getSeconds();
        if (seconds < 60) {
            return seconds + "s";
        }
        long minutes = seconds / 60;
        long remainingSeconds = seconds % 60;
        return (remainingSeconds == 0) ? (minutes + "m") : (minutes + "m" + remainingSeconds + "s");
    }

    public static final class Builder {

        private final String alias;
        private final Duration timeout;

        private Builder(String alias, Duration timeout) {
            this.alias = alias;
            this.timeout = timeout;
        }

        public <T> ConnectionRetry<T> connector(@NonNull Callable<T> attempt) {
            return new ConnectionRetry<>(this.alias, this.timeout, attempt);
        }
    }

    /**
     * Initial connection could not be established.
     */
    public static class ConnectionException extends DatabaseException {
        public ConnectionException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
