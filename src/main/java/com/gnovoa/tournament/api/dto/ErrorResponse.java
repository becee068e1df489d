package com.gnovoa.tournament.api.dto;

import java.util.Map;

/** Error body. {@code fieldErrors} is only set for request validation failures. */
public record ErrorResponse(String code, String message, Map<String, String> fieldErrors) {

    public static ErrorResponse of(String code, String message) {
        return new ErrorResponse(code, message, null);
    }
}
