package com.automate.FindingSync.exception;

import com.automate.FindingSync.entity.LocalStatus;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class InvalidLocalStatusTransitionException extends ResponseStatusException {
    public InvalidLocalStatusTransitionException(LocalStatus from, LocalStatus to) {
        super(HttpStatus.CONFLICT, "Cannot move finding from " + from + " to " + to);
    }
}
