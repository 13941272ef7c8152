package com.libragraph.plotstore.core.storage;

public class AliasAlreadyExistsException extends ValidationException {

    private final String alias;
    private final String existingGuid;

    public AliasAlreadyExistsException(String alias, String group, String existingGuid) {
        super("Alias '" + alias + "' already exists in group '" + group
                + "' for a different image (GUID: " + existingGuid + ")");
        this.alias = alias;
        this.existingGuid = existingGuid;
    }

    public String alias() {
        return alias;
    }

    public String existingGuid() {
        return existingGuid;
    }
}
