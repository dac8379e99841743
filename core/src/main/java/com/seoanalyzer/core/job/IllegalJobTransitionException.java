package com.seoanalyzer.core.job;

import com.seoanalyzer.core.model.JobStatus;

/** 상태 머신 위반 (역행, 건너뛰기, 종결 후 변경) */
public class IllegalJobTransitionException extends IllegalStateException {
    private final String jobId;
    private final JobStatus from;
    private final JobStatus to;

    public IllegalJobTransitionException(String jobId, JobStatus from, JobStatus to) {
        super("Illegal transition for job " + jobId + ": " + from + " -> " + to);
        this.jobId = jobId;
        this.from = from;
        this.to = to;
    }

    public String getJobId() { return jobId; }
    public JobStatus getFrom() { return from; }
    public JobStatus getTo() { return to; }
}
