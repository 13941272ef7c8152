package com.libragraph.plotstore.core.storage;

/**
 * The image exists but belongs to a different group than the caller's.
 *
 * <p>Never converted to "not found": callers answer 403, not 404.
 */
public class PermissionDeniedException extends RuntimeException {

    private final String identifier;
    private final String requestedGroup;

    public PermissionDeniedException(String identifier, String requestedGroup) {
        super("Access denied: image '" + identifier + "' belongs to a different group than '"
                + requestedGroup + "'");
        this.identifier = identifier;
        this.requestedGroup = requestedGroup;
    }

    public String identifier() {
        return identifier;
    }

    public String requestedGroup() {
        return requestedGroup;
    }
}
