package com.crossfire.delivery;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class JobStatusMessage {
    /** UTC, formatted {@code yyyy-MM-dd HH:mm:ss}. */
    private String timestamp;
    private String jobId;
    private String jobStatus;
}
