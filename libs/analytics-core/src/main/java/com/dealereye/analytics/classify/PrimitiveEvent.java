package com.dealereye.analytics.classify;

import com.dealereye.eventmodel.ObjectClass;
import com.dealereye.eventmodel.ValidationResult;

import java.time.Instant;
import java.util.ArrayList;

/**
 * Raw line crossing or zone entry/exit for one track, before semantic interpretation.
 *
 * @param trackId identifier assigned by the upstream tracker
 * @param kind what happened
 * @param referenceId the line (for crossings) or zone (for entry/exit) involved
 * @param direction crossing direction relative to the line, e.g. "forward"; null for zones
 * @param confidence detector confidence for the object
 * @param objectClass detected class of the object
 * @param cameraId camera that observed it
 * @param siteId site of the camera
 * @param tenantId tenant owning the site
 * @param timestamp upstream observation time, may be null; domain events are stamped with the
 *     worker clock at processing instead
 */
public record PrimitiveEvent(
        String trackId,
        PrimitiveKind kind,
        String referenceId,
        String direction,
        double confidence,
        ObjectClass objectClass,
        String cameraId,
        String siteId,
        String tenantId,
        Instant timestamp) {

    /** Direction label that turns a door crossing into a lobby entry. */
    public static final String FORWARD = "forward";

    /**
     * Checks the fields needed to route and classify this primitive.
     */
    public ValidationResult validate() {
        var errors = new ArrayList<String>();
        if (trackId == null || trackId.isBlank()) {
            errors.add("trackId must not be null or blank");
        }
        if (kind == null) {
            errors.add("kind must not be null");
        }
        if (referenceId == null || referenceId.isBlank()) {
            errors.add("referenceId must not be null or blank");
        }
        if (objectClass == null) {
            errors.add("objectClass must not be null");
        }
        if (cameraId == null || cameraId.isBlank()) {
            errors.add("cameraId must not be null or blank");
        }
        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }
}
