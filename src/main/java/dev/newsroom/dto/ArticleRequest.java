package dev.newsroom.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArticleRequest {

    @NotBlank(message = "Title is required")
    @Size(max = 255, message = "Title must be at most 255 characters")
    private String title;

    @Size(max = 1000, message = "Summary must be at most 1000 characters")
    private String summary;

    @NotBlank(message = "Content is required")
    private String content;

    /** Optional publishing house; without one the article can never be approved. */
    private Long publisherId;

    private Long categoryId;
}
