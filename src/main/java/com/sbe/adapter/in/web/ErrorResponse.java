package com.sbe.adapter.in.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;

import java.util.List;

/**
 * Error body shared by all endpoints
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String status,
        String message,
        List<String> errors
) {
    public static ErrorResponse of(String message) {
        return new ErrorResponse("error", message, null);
    }

    public static ErrorResponse of(String message, List<String> errors) {
        return new ErrorResponse("error", message, errors);
    }

    public static void send(RoutingContext context, int statusCode, ErrorResponse response) {
        context.response()
                .setStatusCode(statusCode)
                .putHeader("Content-Type", "application/json")
                .end(JsonObject.mapFrom(response).encode());
    }
}
