package com.libragraph.plotstore.api;

import com.libragraph.plotstore.core.storage.ImageStorage;
import com.libragraph.plotstore.core.storage.StoredImage;
import com.libragraph.plotstore.core.storage.ValidationException;
import com.libragraph.plotstore.types.ImageFormat;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Path("/api/images")
@Produces(MediaType.APPLICATION_JSON)
public class ImageResource {

    @Inject
    ImageStorage storage;

    @Inject
    CallerGroup callerGroup;

    public record AliasRequest(String alias) {
    }

    @POST
    @Consumes(MediaType.WILDCARD)
    public Response save(byte[] data, @QueryParam("format") String format,
                         @Context HttpHeaders headers, @Context UriInfo uriInfo) {
        if (format == null || format.isBlank()) {
            throw new ValidationException("Query parameter 'format' is required");
        }
        ImageFormat imageFormat = ImageFormat.tryFromExtension(format.trim())
                .orElseThrow(() -> new ValidationException("Unsupported image format: " + format));
        String guid = storage.saveImage(data == null ? new byte[0] : data, imageFormat, callerGroup.from(headers));
        return Response.created(uriInfo.getAbsolutePathBuilder().path(guid).build())
                .entity(Map.of("guid", guid))
                .build();
    }

    @GET
    public Map<String, Object> list(@Context HttpHeaders headers) {
        String group = callerGroup.from(headers);
        // without a group only public images are listed
        List<String> images = group == null ? storage.listPublicImages() : storage.listImages(group);
        // group may be null, which Map.of rejects
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("group", group);
        body.put("count", images.size());
        body.put("images", images);
        return body;
    }

    @GET
    @Path("/{identifier}")
    @Produces(MediaType.WILDCARD)
    public Response get(@PathParam("identifier") String identifier, @Context HttpHeaders headers) {
        Optional<StoredImage> image = storage.getImage(identifier, callerGroup.from(headers));
        if (image.isEmpty()) {
            return ErrorResponse.notFound(identifier);
        }
        StoredImage found = image.get();
        return Response.ok(found.data(), found.format().mimeType())
                .header("X-Image-Guid", found.guid())
                .build();
    }

    @DELETE
    @Path("/{identifier}")
    public Response delete(@PathParam("identifier") String identifier, @Context HttpHeaders headers) {
        if (!storage.deleteImage(identifier, callerGroup.from(headers))) {
            return ErrorResponse.notFound(identifier);
        }
        return Response.noContent().build();
    }

    @PUT
    @Path("/{guid}/alias")
    @Consumes(MediaType.APPLICATION_JSON)
    public Response registerAlias(@PathParam("guid") String guid, AliasRequest request,
                                  @Context HttpHeaders headers) {
        if (request == null || request.alias() == null) {
            throw new ValidationException("Request body must contain 'alias'");
        }
        storage.registerAlias(request.alias(), guid, callerGroup.from(headers));
        return Response.noContent().build();
    }

    @POST
    @Path("/purge")
    public Response purge(@QueryParam("ageDays") Integer ageDays, @Context HttpHeaders headers) {
        String group = callerGroup.from(headers);
        // unscoped purge is left to the retention sweep
        if (group == null) {
            return new ErrorResponse("permission_denied", "Purge requires a caller group")
                    .toResponse(Response.Status.FORBIDDEN);
        }
        if (ageDays == null) {
            throw new ValidationException("Query parameter 'ageDays' is required");
        }
        return Response.ok(Map.of("deleted", storage.purge(ageDays, group))).build();
    }
}
