package com.premiergroup.revcontent_client.exception;

import org.springframework.http.HttpStatusCode;

/**
 * The platform answered with a success status but the payload could not be interpreted
 * (missing token, missing campaign id, missing "data" key, malformed JSON).
 */
public class ProtocolViolationException extends RevcontentApiException {

    public ProtocolViolationException(String message, HttpStatusCode httpStatus, String responseBody) {
        super(message, httpStatus, responseBody);
    }

    public ProtocolViolationException(String message, HttpStatusCode httpStatus, String responseBody, Throwable cause) {
        super(message, httpStatus, responseBody, cause);
    }
}
