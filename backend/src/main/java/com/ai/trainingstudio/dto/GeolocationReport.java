package com.ai.trainingstudio.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of the browser geolocation sensor, as reported by the UI.
 * Either both coordinates are set, or {@code error} is.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeolocationReport {

    public enum Failure {
        PERMISSION_DENIED,
        POSITION_UNAVAILABLE,
        TIMEOUT,
        UNSUPPORTED
    }

    @DecimalMin(value = "-90.0", message = "Latitude must be between -90 and 90")
    @DecimalMax(value = "90.0", message = "Latitude must be between -90 and 90")
    private Double lat;

    @DecimalMin(value = "-180.0", message = "Longitude must be between -180 and 180")
    @DecimalMax(value = "180.0", message = "Longitude must be between -180 and 180")
    private Double lon;

    private Failure error;

    public boolean hasCoordinates() {
        return error == null && lat != null && lon != null;
    }

    public static GeolocationReport coordinates(double lat, double lon) {
        return GeolocationReport.builder().lat(lat).lon(lon).build();
    }

    public static GeolocationReport failure(Failure error) {
        return GeolocationReport.builder().error(error).build();
    }
}
