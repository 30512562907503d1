package com.chs.calculator;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/post")
@CrossOrigin(origins = "${calculator.cors.allowed-origins}")
@RequiredArgsConstructor
@Tag(name = "calculator", description = "Arithmetic on two numbers")
public class CalculatorController {

    private final Calculator calculator;

    @PostMapping("/add")
    @Operation(summary = "a + b")
    public CalculationResponse add(@Valid @RequestBody CalculationRequest request) {
        return calculate(ArithmeticOperation.ADD, request);
    }

    @PostMapping("/subtract")
    @Operation(summary = "a - b")
    public CalculationResponse subtract(@Valid @RequestBody CalculationRequest request) {
        return calculate(ArithmeticOperation.SUBTRACT, request);
    }

    @PostMapping("/multiply")
    @Operation(summary = "a * b")
    public CalculationResponse multiply(@Valid @RequestBody CalculationRequest request) {
        return calculate(ArithmeticOperation.MULTIPLY, request);
    }

    @PostMapping("/divide")
    @Operation(summary = "a / b")
    @ApiResponse(responseCode = "400", description = "b is zero",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    public CalculationResponse divide(@Valid @RequestBody CalculationRequest request) {
        return calculate(ArithmeticOperation.DIVIDE, request);
    }

    private CalculationResponse calculate(ArithmeticOperation op, CalculationRequest request) {
        return new CalculationResponse(calculator.calculate(op, request.getA(), request.getB()));
    }
}
