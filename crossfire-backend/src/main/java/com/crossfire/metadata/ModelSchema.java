package com.crossfire.metadata;

import lombok.Value;

import java.util.List;

/**
 * Raw model structure read from a model server.
 */
@Value
public class ModelSchema {
    String modelName;
    List<ModelTable> tables;
}
