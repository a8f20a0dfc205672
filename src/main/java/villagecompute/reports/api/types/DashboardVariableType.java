package villagecompute.reports.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;

/**
 * A single dashboard template variable binding, rendered as {@code var-<name>=<value>}.
 *
 * <p>
 * Schedules keep variables as an ordered list so the same name may appear several times (multi-value variables).
 */
public record DashboardVariableType(@JsonProperty("name") @NotBlank String name,
        @JsonProperty("value") String value) {
}
