package com.libragraph.plotstore.api;

import com.libragraph.plotstore.core.storage.AliasAlreadyExistsException;
import com.libragraph.plotstore.core.storage.PermissionDeniedException;
import com.libragraph.plotstore.core.storage.StorageException;
import com.libragraph.plotstore.core.storage.UnknownImageException;
import com.libragraph.plotstore.core.storage.ValidationException;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

/**
 * Maps storage exceptions to HTTP responses with an {@link ErrorResponse} body.
 */
public class StorageExceptionMappers {

    private static final Logger log = Logger.getLogger(StorageExceptionMappers.class);

    @ServerExceptionMapper
    public Response permissionDenied(PermissionDeniedException e) {
        return new ErrorResponse("permission_denied", e.getMessage()).toResponse(Response.Status.FORBIDDEN);
    }

    @ServerExceptionMapper
    public Response validation(ValidationException e) {
        if (e instanceof AliasAlreadyExistsException) {
            return new ErrorResponse("alias_exists", e.getMessage()).toResponse(Response.Status.CONFLICT);
        }
        if (e instanceof UnknownImageException) {
            return new ErrorResponse("unknown_image", e.getMessage()).toResponse(Response.Status.NOT_FOUND);
        }
        return new ErrorResponse("validation_error", e.getMessage()).toResponse(Response.Status.BAD_REQUEST);
    }

    @ServerExceptionMapper
    public Response storage(StorageException e) {
        log.errorf(e, "Storage failure: %s", e.getMessage());
        return new ErrorResponse("storage_error", e.getMessage())
                .toResponse(Response.Status.INTERNAL_SERVER_ERROR);
    }
}
