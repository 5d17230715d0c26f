package com.github.alvarosanchez.spr.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.serde.annotation.Serdeable;
import java.util.List;

/**
 * Error body of the read API.
 *
 * @param error machine-readable error kind
 * @param message human-readable description
 * @param chain configs involved in the failure, when known
 */
@Serdeable
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error, String message, @Nullable List<String> chain) {
}
