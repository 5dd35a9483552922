package com.phillippitts.arithmetic.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Configuration properties for the calculator API.
 * Binds to properties prefixed with "calculator".
 *
 * <p>Example application.properties:
 * <pre>
 * calculator.greeting=Welcome to the two-number arithmetic API.
 * calculator.examples=/health,/calc?op=add&amp;a=3&amp;b=5
 * calculator.cors.allowed-origins=*
 * </pre>
 *
 * <p>Note: Bean created via {@code @EnableConfigurationProperties} on the application class.
 *
 * @param greeting message returned by the discovery endpoint
 * @param examples example request paths listed by the discovery endpoint
 * @param cors     CORS settings applied to every endpoint
 */
@ConfigurationProperties(prefix = "calculator")
@Validated
public record CalculatorProperties(
        @NotBlank(message = "Greeting must not be blank")
        @DefaultValue("Welcome to the two-number arithmetic API.")
        String greeting,

        @NotEmpty(message = "At least one example path is required")
        @DefaultValue({"/health", "/calc?op=add&a=3&b=5"})
        List<String> examples,

        @Valid
        @DefaultValue
        Cors cors
) {

    public CalculatorProperties {
        examples = examples == null ? List.of() : List.copyOf(examples);
    }

    /**
     * @param allowedOrigins origins allowed to call the API; {@code *} allows any
     */
    public record Cors(
            @NotEmpty(message = "CORS allowed origins must not be empty")
            @DefaultValue("*")
            List<String> allowedOrigins
    ) {
        public Cors {
            allowedOrigins = allowedOrigins == null ? List.of() : List.copyOf(allowedOrigins);
        }
    }
}
