package com.premiergroup.revcontent_client.exception;

import org.springframework.http.HttpStatusCode;

public class RequestFailedException extends RevcontentApiException {

    public RequestFailedException(String message, HttpStatusCode httpStatus, String responseBody) {
        super(message, httpStatus, responseBody);
    }
}
