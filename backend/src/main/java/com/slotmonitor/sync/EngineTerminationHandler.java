package com.slotmonitor.sync;

/**
 * Receives the fatal condition raised when the tracker or the worker pool ends while the engine is running.
 */
public interface EngineTerminationHandler {

    /**
     * @param component which side ended ("slot-tracker" or "fill-worker-pool")
     * @param cause     the failure, or null when the loop returned normally
     */
    void onUnexpectedTermination(String component, Throwable cause);
}
