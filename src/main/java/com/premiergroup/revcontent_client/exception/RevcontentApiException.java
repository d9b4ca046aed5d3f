package com.premiergroup.revcontent_client.exception;

import org.springframework.http.HttpStatusCode;

/**
 * Base type for every failure raised by the Revcontent API client.
 * Carries the HTTP status and raw response body when the failure came from a response.
 */
public abstract class RevcontentApiException extends RuntimeException {

    private final HttpStatusCode httpStatus;
    private final String responseBody;

    protected RevcontentApiException(String message) {
        this(message, null, null, null);
    }

    protected RevcontentApiException(String message, HttpStatusCode httpStatus, String responseBody) {
        this(message, httpStatus, responseBody, null);
    }

    protected RevcontentApiException(String message, HttpStatusCode httpStatus, String responseBody, Throwable cause) {
        super(message, cause);
        this.httpStatus = httpStatus;
        this.responseBody = responseBody;
    }

    public HttpStatusCode getHttpStatus() {
        return httpStatus;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
