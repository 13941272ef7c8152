package com.libragraph.plotstore.api;

import com.libragraph.plotstore.core.storage.ImageStorage;
import jakarta.inject.Inject;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.LinkedHashMap;
import java.util.Map;

@Path("/api/aliases")
@Produces(MediaType.APPLICATION_JSON)
public class AliasResource {

    @Inject
    ImageStorage storage;

    @Inject
    CallerGroup callerGroup;

    /** Aliases registered in the caller's own scope. */
    @GET
    public Map<String, Object> list(@Context HttpHeaders headers) {
        String group = callerGroup.from(headers);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("group", group);
        body.put("aliases", storage.listAliases(group));
        return body;
    }

    @GET
    @Path("/{alias}")
    public Response resolve(@PathParam("alias") String alias, @Context HttpHeaders headers) {
        return storage.resolveIdentifier(alias, callerGroup.from(headers))
                .map(guid -> Response.ok(Map.of("alias", alias, "guid", guid)).build())
                .orElseGet(() -> new ErrorResponse("not_found", "Alias not found: " + alias)
                        .toResponse(Response.Status.NOT_FOUND));
    }

    @DELETE
    @Path("/{alias}")
    public Response unregister(@PathParam("alias") String alias, @Context HttpHeaders headers) {
        if (!storage.unregisterAlias(alias, callerGroup.from(headers))) {
            return new ErrorResponse("not_found", "Alias not found: " + alias)
                    .toResponse(Response.Status.NOT_FOUND);
        }
        return Response.noContent().build();
    }
}
