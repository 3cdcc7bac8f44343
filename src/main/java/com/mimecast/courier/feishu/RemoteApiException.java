package com.mimecast.courier.feishu;

/**
 * Exception thrown when a remote API call fails.
 *
 * <p>Covers transport failures, non-2xx responses and non-zero response codes.
 */
public class RemoteApiException extends Exception {

    /**
     * Constructs a new RemoteApiException.
     *
     * @param message Error message.
     */
    public RemoteApiException(String message) {
        super(message);
    }

    /**
     * Constructs a new RemoteApiException with cause.
     *
     * @param message Error message.
     * @param cause   Underlying cause.
     */
    public RemoteApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
