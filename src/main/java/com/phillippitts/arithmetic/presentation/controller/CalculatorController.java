package com.phillippitts.arithmetic.presentation.controller;

import com.phillippitts.arithmetic.domain.Operator;
import com.phillippitts.arithmetic.presentation.dto.CalculationResponse;
import com.phillippitts.arithmetic.presentation.dto.OperandsRequest;
import com.phillippitts.arithmetic.service.calculation.CalculationService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Arithmetic endpoints.
 *
 * <ul>
 *   <li>{@code GET /calc?op=add&a=3&b=5} - operands and operator from the query string</li>
 *   <li>{@code POST /calc/{op}} - operands from a JSON body</li>
 *   <li>{@code POST /add}, {@code /sub}, {@code /mul}, {@code /div} - fixed-operator shortcuts</li>
 * </ul>
 *
 * <p>Failures surface as domain exceptions and are rendered by {@code GlobalExceptionHandler}.
 */
@RestController
class CalculatorController {

    private final CalculationService calculationService;

    CalculatorController(CalculationService calculationService) {
        this.calculationService = calculationService;
    }

    @GetMapping("/calc")
    CalculationResponse calcQuery(@RequestParam("op") String op,
                                  @RequestParam("a") double a,
                                  @RequestParam("b") double b) {
        return CalculationResponse.from(calculationService.calculate(a, b, op));
    }

    @PostMapping("/calc/{op}")
    CalculationResponse calcBody(@PathVariable("op") String op,
                                 @Valid @RequestBody OperandsRequest payload) {
        return CalculationResponse.from(calculationService.calculate(payload.a(), payload.b(), op));
    }

    @PostMapping("/add")
    CalculationResponse add(@Valid @RequestBody OperandsRequest payload) {
        return shortcut(payload, Operator.ADD);
    }

    @PostMapping("/sub")
    CalculationResponse sub(@Valid @RequestBody OperandsRequest payload) {
        return shortcut(payload, Operator.SUB);
    }

    @PostMapping("/mul")
    CalculationResponse mul(@Valid @RequestBody OperandsRequest payload) {
        return shortcut(payload, Operator.MUL);
    }

    @PostMapping("/div")
    CalculationResponse div(@Valid @RequestBody OperandsRequest payload) {
        return shortcut(payload, Operator.DIV);
    }

    private CalculationResponse shortcut(OperandsRequest payload, Operator op) {
        return CalculationResponse.from(calculationService.calculate(payload.a(), payload.b(), op));
    }
}
