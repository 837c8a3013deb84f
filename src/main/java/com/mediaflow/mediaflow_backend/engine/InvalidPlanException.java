package com.mediaflow.mediaflow_backend.engine;

/** A submitted plan that cannot be scheduled. Rejected before anything is persisted. */
public class InvalidPlanException extends IllegalArgumentException {

    public InvalidPlanException(String message) {
        super(message);
    }
}
