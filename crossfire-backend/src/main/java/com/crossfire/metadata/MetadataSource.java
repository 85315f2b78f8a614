package com.crossfire.metadata;

import com.crossfire.api.ModelMetadataRequest;

/**
 * Reads model structure from the server a request targets.
 */
public interface MetadataSource {

    /**
     * Reads the structure of the requested model.
     *
     * @param request metadata request
     * @return raw model structure
     * @throws com.crossfire.service.ModelServerConnectionException when the server cannot be reached
     */
    ModelSchema retrieve(ModelMetadataRequest request);
}
