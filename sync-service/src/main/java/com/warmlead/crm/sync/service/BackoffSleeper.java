package com.warmlead.crm.sync.service;

/**
 * Waits between recovery attempts. Replaced in tests to record delays.
 */
@FunctionalInterface
public interface BackoffSleeper {

    void sleep(long delayMs) throws InterruptedException;
}
