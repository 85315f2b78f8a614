package com.crossfire.delivery;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A message bearing serialized model metadata.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MetadataMessage {
    private String payload;
    private String userSubscriberName;
}
