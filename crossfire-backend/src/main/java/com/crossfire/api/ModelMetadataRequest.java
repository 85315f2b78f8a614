package com.crossfire.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;

/**
 * A request for the structure (dimensions, attributes, measures) of a model.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelMetadataRequest {
    private String uniqueClientIdentifier;
    private String region;
    private String targetDatabase;
    private String targetServer;
    private String resourceGroup;
    private String requestMetadata;

    @JsonIgnore
    public String getServerQualifiedName() {
        if (targetServer == null) {
            return null;
        }
        return (region + "." + resourceGroup + "." + targetServer).toLowerCase(Locale.ROOT);
    }
}
