package com.automate.FindingSync.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class CommentRequest {
    @NotBlank
    @Size(max = 255)
    private String author;

    @NotBlank
    @Size(max = 4000)
    private String content;
}
