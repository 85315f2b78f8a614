package com.crossfire.delivery;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A message bearing a query result.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryResultMessage {
    /** Query result, serialized as JSON. */
    private String payload;
    /** Metadata sent by the client with the request, returned unchanged. */
    private String queryMetadata;
    private String userSubscriberName;
}
