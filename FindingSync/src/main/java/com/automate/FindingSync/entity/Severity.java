package com.automate.FindingSync.entity;

/** Ordered lowest to highest; compare with {@link #compareTo}. */
public enum Severity {
    INFO,
    MINOR,
    MAJOR,
    CRITICAL,
    BLOCKER
}
