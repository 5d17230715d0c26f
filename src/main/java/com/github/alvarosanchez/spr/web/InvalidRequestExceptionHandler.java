package com.github.alvarosanchez.spr.web;

import io.micronaut.context.annotation.Requires;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import jakarta.inject.Singleton;

/**
 * Maps rejected query parameters, such as a negative depth, to {@code 400}.
 */
@Produces
@Singleton
@Requires(classes = {IllegalArgumentException.class, ExceptionHandler.class})
public class InvalidRequestExceptionHandler implements ExceptionHandler<IllegalArgumentException, HttpResponse<ErrorResponse>> {

    static final String INVALID_REQUEST = "INVALID_REQUEST";

    @Override
    public HttpResponse<ErrorResponse> handle(HttpRequest request, IllegalArgumentException exception) {
        return HttpResponse.badRequest(new ErrorResponse(INVALID_REQUEST, exception.getMessage(), null));
    }
}
