package com.poultry.review.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Error body returned for every failed request")
public class ErrorResponse {

    @Schema(description = "Stable code for programmatic handling", example = "ALREADY_CLAIMED")
    private String errorCode;

    private String message;

    @Schema(example = "409")
    private int status;

    @Builder.Default
    private LocalDateTime timestamp = LocalDateTime.now();

    @Schema(example = "/api/v1/review/queue/APP-7f3c2a9e-L1/claim")
    private String path;
}
