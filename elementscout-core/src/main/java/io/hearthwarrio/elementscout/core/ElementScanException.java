package io.hearthwarrio.elementscout.core;

/**
 * Thrown when scan output cannot be serialized or parsed, or when an opt-in check on the scan fails.
 * <p>
 * The scan itself never throws it: irrelevant elements are omitted, and host failures propagate as they are.
 */
public class ElementScanException extends RuntimeException {
    public ElementScanException(String message) {
        super(message);
    }

    public ElementScanException(String message, Throwable cause) {
        super(message, cause);
    }
}
