package com.fieldservice.sale.service;

/**
 * Permission under which a record is written.
 */
public enum AccessMode {
    // Caller's own authorities apply
    USER,
    // Record derived from data the caller already owns; authority checks are skipped
    ELEVATED
}
