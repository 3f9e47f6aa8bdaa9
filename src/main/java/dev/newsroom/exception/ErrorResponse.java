package dev.newsroom.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private LocalDateTime timestamp;
    private int status;
    private String error;
    /** Stable machine-readable code, e.g. ALREADY_DECIDED or NOT_PUBLISHER_EDITOR. */
    private String code;
    private String message;
    private String path;
    private Map<String, String> validationErrors;
}
