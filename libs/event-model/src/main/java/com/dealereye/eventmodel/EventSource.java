package com.dealereye.eventmodel;

/**
 * Identifies where an event was produced: which tenant, which site, which camera.
 *
 * @param tenantId organization owning the site
 * @param siteId dealership location; all metric correlation is scoped by site
 * @param cameraId camera whose analytics pipeline observed the event
 */
public record EventSource(String tenantId, String siteId, String cameraId) {}
