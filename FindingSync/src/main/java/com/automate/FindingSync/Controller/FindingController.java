package com.automate.FindingSync.Controller;

import com.automate.FindingSync.Service.FindingService;
import com.automate.FindingSync.dto.request.AssignRequest;
import com.automate.FindingSync.dto.request.CommentRequest;
import com.automate.FindingSync.dto.request.DueDateRequest;
import com.automate.FindingSync.dto.request.PriorityRequest;
import com.automate.FindingSync.dto.request.StatusUpdateRequest;
import com.automate.FindingSync.dto.response.CommentResponse;
import com.automate.FindingSync.dto.response.FindingResponse;
import com.automate.FindingSync.dto.response.HistoryResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/findings")
public class FindingController {

    private final FindingService findingService;

    public FindingController(FindingService findingService) {
        this.findingService = findingService;
    }

    @GetMapping("/{findingId}")
    public FindingResponse getFinding(@PathVariable UUID findingId) {
        return findingService.getFinding(findingId);
    }

    @PatchMapping("/{findingId}/status")
    public FindingResponse updateStatus(@PathVariable UUID findingId, @Valid @RequestBody StatusUpdateRequest body) {
        return findingService.updateLocalStatus(findingId, body.getStatus(), body.getPerformedBy());
    }

    @PatchMapping("/{findingId}/assign")
    public FindingResponse assign(@PathVariable UUID findingId, @Valid @RequestBody AssignRequest body) {
        return findingService.assign(findingId, body.getAssignedTo(), body.getPerformedBy());
    }

    @PatchMapping("/{findingId}/priority")
    public FindingResponse updatePriority(@PathVariable UUID findingId, @Valid @RequestBody PriorityRequest body) {
        return findingService.updatePriority(findingId, body.getPriority(), body.getPerformedBy());
    }

    @PatchMapping("/{findingId}/due-date")
    public FindingResponse updateDueDate(@PathVariable UUID findingId, @RequestBody DueDateRequest body) {
        return findingService.updateDueDate(findingId, body.getDueDate(), body.getPerformedBy());
    }

    @GetMapping("/{findingId}/comments")
    public List<CommentResponse> getComments(@PathVariable UUID findingId) {
        return findingService.getComments(findingId);
    }

    @PostMapping("/{findingId}/comments")
    public ResponseEntity<CommentResponse> addComment(@PathVariable UUID findingId,
                                                      @Valid @RequestBody CommentRequest body) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(findingService.addComment(findingId, body.getAuthor(), body.getContent()));
    }

    @PutMapping("/comments/{commentId}")
    public CommentResponse updateComment(@PathVariable UUID commentId, @Valid @RequestBody CommentRequest body) {
        return findingService.updateComment(commentId, body.getContent());
    }

    @DeleteMapping("/comments/{commentId}")
    public ResponseEntity<Void> deleteComment(@PathVariable UUID commentId) {
        findingService.deleteComment(commentId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{findingId}/history")
    public List<HistoryResponse> getHistory(@PathVariable UUID findingId,
                                            @RequestParam(defaultValue = "50") int limit) {
        return findingService.getHistory(findingId, limit);
    }
}
