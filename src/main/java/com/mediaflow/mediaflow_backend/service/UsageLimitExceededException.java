package com.mediaflow.mediaflow_backend.service;

public class UsageLimitExceededException extends RuntimeException {

    public UsageLimitExceededException(String organizationId, long used, long limit) {
        super("Monthly job limit reached for organization " + organizationId + " (" + used + "/" + limit + ")");
    }
}
