package com.crossfire.materializer;

import lombok.Value;

/**
 * One element of the key/value array output format.
 */
@Value
public class KeyValue {
    String key;
    String value;
}
