package com.libragraph.plotstore.api;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

public record ErrorResponse(String error, String message) {

    Response toResponse(Response.Status status) {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(this)
                .build();
    }

    static Response notFound(String identifier) {
        return new ErrorResponse("not_found", "Image not found: " + identifier)
                .toResponse(Response.Status.NOT_FOUND);
    }
}
