package com.chs.calculator;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
@Schema(description = "Result of a successful calculation")
public class CalculationResponse {

    @Schema(example = "15")
    private final Number result;
}
