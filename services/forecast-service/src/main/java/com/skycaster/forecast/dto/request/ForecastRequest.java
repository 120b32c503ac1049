package com.skycaster.forecast.dto.request;

import com.fasterxml.jackson.annotation.JsonAlias;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Forecast request body. Structural checks (ranges, timestamp format, future
 * timestamp) happen in the planner so rejected requests still reach the ledger.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ForecastRequest {

    @Schema(description = "Locations as [latitude, longitude] pairs", example = "[[26.85, 80.95]]")
    @JsonAlias("list_lat_lon")
    private List<List<Double>> coordinates;

    @Schema(description = "Weather variables to fetch", example = "[\"ambient_temp(K)\", \"ghi(W/m2)\"]")
    private List<String> variables;

    @Schema(description = "Forecast time, yyyy-MM-dd HH:mm:ss", example = "2030-01-01 12:00:00")
    private String timestamp;

    @Schema(description = "IANA timezone id", example = "Asia/Kolkata")
    private String timezone;

    @Schema(description = "Preferred billing currency", example = "USD")
    @Pattern(regexp = "^[A-Za-z]{3}$", message = "Currency must be a 3-letter ISO code")
    private String currency;
}
