package com.example.formlayout.store;

import lombok.Getter;

@Getter
public class StaleRevisionException extends RuntimeException {

    private final String appId;
    private final long expectedRevision;
    private final long currentRevision;

    public StaleRevisionException(String appId, long expectedRevision, long currentRevision) {
        super("Layout of app " + appId + " is at revision " + currentRevision
                + ", the change was based on revision " + expectedRevision);
        this.appId = appId;
        this.expectedRevision = expectedRevision;
        this.currentRevision = currentRevision;
    }
}
