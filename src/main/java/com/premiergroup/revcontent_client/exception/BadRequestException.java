package com.premiergroup.revcontent_client.exception;

import org.springframework.http.HttpStatus;

/**
 * The platform rejected the request with HTTP 400.
 */
public class BadRequestException extends RevcontentApiException {

    public BadRequestException(String message, String responseBody) {
        super(message, HttpStatus.BAD_REQUEST, responseBody);
    }
}
