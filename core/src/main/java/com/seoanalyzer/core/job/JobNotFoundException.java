package com.seoanalyzer.core.job;

public class JobNotFoundException extends RuntimeException {
    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Analysis job not found: " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() { return jobId; }
}
