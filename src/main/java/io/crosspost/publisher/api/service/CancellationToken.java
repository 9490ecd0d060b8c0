package io.crosspost.publisher.api.service;

/**
 * Stop request for one run. Checked between documents only, so a document already in flight
 * finishes on every service.
 */
public class CancellationToken {

    private volatile boolean stopRequested;

    public void requestStop() {
        stopRequested = true;
    }

    public boolean isStopRequested() {
        return stopRequested;
    }
}
