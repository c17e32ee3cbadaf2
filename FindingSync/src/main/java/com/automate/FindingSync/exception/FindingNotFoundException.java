package com.automate.FindingSync.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

public class FindingNotFoundException extends ResponseStatusException {
    public FindingNotFoundException(UUID findingId) {
        this("Finding", findingId);
    }

    private FindingNotFoundException(String what, UUID id) {
        super(HttpStatus.NOT_FOUND, what + " not found: " + id);
    }

    public static FindingNotFoundException comment(UUID commentId) {
        return new FindingNotFoundException("Comment", commentId);
    }
}
