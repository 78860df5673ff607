package com.peakrank.service;

/**
 * Delivery channel for engine events (push, email, activity feed).
 */
public interface GradingNotificationSink {

    void deliver(GradingEvent event);
}
