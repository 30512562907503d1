package com.chs.calculator;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Body of every failed request: {@code {"detail": "..."}}.
 */
@Getter
@AllArgsConstructor
@Schema(description = "Error returned for any failed request")
public class ErrorResponse {

    @Schema(example = "Division by zero is not allowed")
    private final String detail;
}
