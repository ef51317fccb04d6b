package com.dealereye.observability;

/**
 * Identity of the camera whose work is running on the current thread.
 * <p>
 * Installed by {@link CameraContextHolder} into the SLF4J MDC so log lines from a camera
 * worker can be filtered by tenant, site and camera.
 *
 * @param tenantId organization owning the site (nullable)
 * @param siteId   dealership location (nullable)
 * @param cameraId camera identifier
 */
public record CameraContext(String tenantId, String siteId, String cameraId) {

    /**
     * MDC key for tenant ID.
     */
    public static final String MDC_TENANT_ID = "tenantId";

    /**
     * MDC key for site ID.
     */
    public static final String MDC_SITE_ID = "siteId";

    /**
     * MDC key for camera ID.
     */
    public static final String MDC_CAMERA_ID = "cameraId";

    /**
     * Compact constructor; ensures cameraId is never null.
     */
    public CameraContext {
        if (cameraId == null || cameraId.isBlank()) {
            throw new IllegalArgumentException("cameraId must not be null or blank");
        }
    }
}
