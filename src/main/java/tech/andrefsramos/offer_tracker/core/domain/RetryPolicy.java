package tech.andrefsramos.offer_tracker.core.domain;

import java.time.Duration;
import java.util.Objects;

/*
 * Finalidade

 * Política de retentativa com espera FIXA (sem backoff exponencial).
 * maxAttempts conta a primeira chamada: 3 significa até duas retentativas.
 */
public record RetryPolicy(int maxAttempts, Duration delay) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts deve ser >= 1 (recebido " + maxAttempts + ")");
        }
        Objects.requireNonNull(delay, "delay is required");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay não pode ser negativo: " + delay);
        }
    }

    public static RetryPolicy fixed(int maxAttempts, Duration delay) {
        return new RetryPolicy(maxAttempts, delay);
    }

    public boolean canRetry(int attempt) {
        return attempt < maxAttempts;
    }
}
