package com.automate.FindingSync.entity;

public enum HistoryAction {
    STATUS_CHANGE,
    ASSIGNMENT,
    PRIORITY_CHANGE,
    DUE_DATE_CHANGE,
    COMMENT_ADDED
}
