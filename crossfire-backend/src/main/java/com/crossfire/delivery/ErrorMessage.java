package com.crossfire.delivery;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A message describing why a submitted request failed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorMessage {
    private String payload;
    private String userSubscriberName;
    /** The request that failed, echoed back to the client. */
    private Object submittedRequest;
}
