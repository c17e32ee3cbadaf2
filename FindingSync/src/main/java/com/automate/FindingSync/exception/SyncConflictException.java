package com.automate.FindingSync.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

// a sync for this project is already running and the policy rejects another one
public class SyncConflictException extends ResponseStatusException {
    public SyncConflictException(UUID projectId) {
        super(HttpStatus.CONFLICT, "Sync already running for project " + projectId);
    }
}
