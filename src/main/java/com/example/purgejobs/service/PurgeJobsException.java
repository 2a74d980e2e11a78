package com.example.purgejobs.service;

import lombok.Getter;

/**
 * A request the engine refuses. The message is safe to show to the caller; store failures are
 * never wrapped in this type.
 */
public class PurgeJobsException extends RuntimeException {

    public enum Code {
        INVALID_REQUEST,
        NOT_FOUND,
        ALREADY_STARTED,
        IDENTITY_CONFLICT,
        CDN_LOCKED
    }

    @Getter
    private final Code code;

    private PurgeJobsException(Code code, String message) {
        super(message);
        this.code = code;
    }

    public static PurgeJobsException invalid(String message) {
        return new PurgeJobsException(Code.INVALID_REQUEST, message);
    }

    public static PurgeJobsException noSuchDeliveryService() {
        return new PurgeJobsException(Code.NOT_FOUND, "No such Delivery Service!");
    }

    public static PurgeJobsException noSuchJob(long jobId) {
        return new PurgeJobsException(Code.NOT_FOUND, "No job by id '" + jobId + "'!");
    }

    public static PurgeJobsException alreadyStarted() {
        return new PurgeJobsException(Code.ALREADY_STARTED, "Cannot modify a job that has already started!");
    }

    public static PurgeJobsException identityConflict(String field) {
        return new PurgeJobsException(Code.IDENTITY_CONFLICT,
                "Cannot change '" + field + "' of an existing invalidation job!");
    }

    public static PurgeJobsException cdnLocked(String cdnName, String holder) {
        return new PurgeJobsException(Code.CDN_LOCKED,
                "CDN '" + cdnName + "' is locked by user " + holder + "; only that user may modify it");
    }
}
