package com.github.alvarosanchez.spr.web;

import com.github.alvarosanchez.spr.ErrorKind;
import com.github.alvarosanchez.spr.resolve.ResolutionException;
import io.micronaut.context.annotation.Requires;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import jakarta.inject.Singleton;

/**
 * Maps resolution failures to {@code 404} for missing configs and {@code 400} for everything else.
 */
@Produces
@Singleton
@Requires(classes = {ResolutionException.class, ExceptionHandler.class})
public class ResolutionExceptionHandler implements ExceptionHandler<ResolutionException, HttpResponse<ErrorResponse>> {

    @Override
    public HttpResponse<ErrorResponse> handle(HttpRequest request, ResolutionException exception) {
        ErrorResponse body = new ErrorResponse(exception.kind().name(), exception.getMessage(), exception.chain());
        return exception.kind() == ErrorKind.CONFIG_NOT_FOUND
            ? HttpResponse.notFound(body)
            : HttpResponse.badRequest(body);
    }
}
