package automihomo.probe;

/**
 * The subscription document is missing, unreadable or has no usable proxies.
 */
public class SubscriptionException extends RuntimeException {

    public SubscriptionException(String message) {
        super(message);
    }

    public SubscriptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
