package net.albumart.service.device;

/**
 * Raised when the playback device cannot be reached or answers with something unusable.
 * Callers at the poll boundary log it and retry on the next cycle.
 */
public class DeviceQueryException extends Exception {

    public DeviceQueryException(String message) {
        super(message);
    }

    public DeviceQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
