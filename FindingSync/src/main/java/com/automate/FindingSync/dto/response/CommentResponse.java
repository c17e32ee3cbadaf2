package com.automate.FindingSync.dto.response;

import com.automate.FindingSync.entity.FindingCommentsEntity;

import java.time.LocalDateTime;
import java.util.UUID;

public record CommentResponse(
        UUID commentId,
        UUID findingId,
        String author,
        String content,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static CommentResponse of(FindingCommentsEntity c) {
        return new CommentResponse(c.getCommentId(), c.getFinding().getFindingId(), c.getAuthor(),
                c.getContent(), c.getCreatedAt(), c.getUpdatedAt());
    }
}
