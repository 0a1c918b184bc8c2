package com.tempmail.service;

/**
 * Expiry sweeper state
 */
public enum SweepState {
    IDLE,
    /** Selecting archive keys of expired messages */
    SCANNING,
    /** Deleting blobs, messages and mailboxes */
    PURGING
}
