package com.crossfire.api;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Control request for an already submitted job.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class JobRequest {
    public static final String JOB_ACTION_CANCEL = "cancel";
    public static final String JOB_ACTION_REQUEUE = "requeue";
    public static final String JOB_ACTION_FAILURE = "failed";

    private String jobId;
    private String uniqueClientIdentifier;
    private String jobAction;
}
