package com.whereq.launcher.dispatch;

import com.whereq.launcher.model.DispatchReceipt;
import com.whereq.launcher.model.SubmitInvocation;

/**
 * The one capability that talks to the cluster: hand over a job, learn whether it was accepted.
 */
public interface JobDispatcher {
    /**
     * Submit a job synchronously (blocking) in a single attempt.
     *
     * @param invocation the descriptor and its rendered spark-submit arguments
     * @return the cluster's acknowledgement
     * @throws com.whereq.launcher.exception.LaunchException with a dispatch kind if the
     *                                                       cluster could not be reached or refused the job
     */
    DispatchReceipt dispatch(SubmitInvocation invocation);
}
