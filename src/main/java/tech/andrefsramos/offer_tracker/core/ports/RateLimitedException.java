package tech.andrefsramos.offer_tracker.core.ports;

public class RateLimitedException extends InferenceException {

    public RateLimitedException(String message) {
        super(message);
    }
}
