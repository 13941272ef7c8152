package com.libragraph.plotstore.core.storage.metadata;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.libragraph.plotstore.types.ImageFormat;

/**
 * On-disk shape of one record in {@code metadata.json}. The GUID is the enclosing key.
 * Null group/alias are written out explicitly; {@code alias_group} only when set.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"format", "size", "created_at", "group", "alias", "alias_group"})
public record MetadataEntry(
        @JsonProperty("format") String format,
        @JsonProperty("size") long size,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("group") String group,
        @JsonProperty("alias") String alias,
        @JsonProperty("alias_group") @JsonInclude(JsonInclude.Include.NON_NULL) String aliasGroup
) {

    static MetadataEntry from(ImageMetadata record) {
        return new MetadataEntry(record.format().extension(), record.size(), record.createdAt(),
                record.group(), record.alias(), record.aliasGroup());
    }

    /**
     * @throws IllegalArgumentException if the stored format is missing or unsupported
     */
    ImageMetadata toRecord(String guid) {
        return new ImageMetadata(guid, ImageFormat.fromExtension(format), size, createdAt,
                group, alias, aliasGroup);
    }
}
