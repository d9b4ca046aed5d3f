package com.premiergroup.revcontent_client.exception;

/**
 * An authenticated call was made before {@code authenticate()} succeeded.
 */
public class NotAuthenticatedException extends RevcontentApiException {

    public NotAuthenticatedException() {
        super("Not authenticated. Call authenticate() first.");
    }
}
