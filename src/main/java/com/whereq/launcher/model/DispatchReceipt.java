package com.whereq.launcher.model;

import lombok.Value;

/**
 * Acknowledgement that the cluster accepted a job
 */
@Value
public class DispatchReceipt {
    /**
     * Identifier assigned by the cluster runtime, null when it reports none
     */
    String submissionId;

    /**
     * Tail of the dispatcher's output
     */
    String detail;
}
