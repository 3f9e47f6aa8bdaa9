package dev.newsroom.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Staff edit of a publishing house. The owner cannot be changed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublisherUpdateRequest {

    @Size(min = 1, max = 255, message = "Name must be between 1 and 255 characters")
    private String name;

    @Size(max = 2000, message = "Description must be at most 2000 characters")
    private String description;

    @Size(max = 500, message = "Website must be at most 500 characters")
    @Pattern(regexp = "^(https?://.*)?$", message = "Website must be an HTTP(S) URL")
    private String website;
}
