package com.chs.calculator;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Request body shared by all four operations. Integers keep their integral type after
 * deserialization so that integer arithmetic stays exact.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Two operands")
public class CalculationRequest {

    @NotNull(message = "Field required")
    @Schema(description = "Left operand", example = "10", requiredMode = Schema.RequiredMode.REQUIRED)
    private Number a;

    @NotNull(message = "Field required")
    @Schema(description = "Right operand", example = "5", requiredMode = Schema.RequiredMode.REQUIRED)
    private Number b;
}
