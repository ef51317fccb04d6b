package com.dealereye.observability;

import org.slf4j.MDC;

import java.util.Optional;

/**
 * Scopes a {@link CameraContext} to a unit of work on the current thread.
 * <p>
 * Camera workers run every queued task through {@link #runWithContext(CameraContext, Runnable)}.
 * While it runs, the tenantId, siteId and cameraId MDC keys are set, so each log line names its
 * camera. Afterwards the outer context, if any, is back in place.
 */
public final class CameraContextHolder {

    private static final ThreadLocal<CameraContext> CONTEXT = new ThreadLocal<>();

    private CameraContextHolder() {
    }

    /** Context of the task running on this thread, if any. */
    public static Optional<CameraContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Runs {@code task} with {@code context} bound to this thread and mirrored into the MDC,
     * then rebinds whatever was bound before, also when the task throws.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void runWithContext(CameraContext context, Runnable task) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CameraContext outer = CONTEXT.get();
        bind(context);
        try {
            task.run();
        } finally {
            if (outer != null) {
                bind(outer);
            } else {
                CONTEXT.remove();
                MDC.remove(CameraContext.MDC_TENANT_ID);
                MDC.remove(CameraContext.MDC_SITE_ID);
                MDC.remove(CameraContext.MDC_CAMERA_ID);
            }
        }
    }

    private static void bind(CameraContext context) {
        CONTEXT.set(context);
        putOrRemove(CameraContext.MDC_TENANT_ID, context.tenantId());
        putOrRemove(CameraContext.MDC_SITE_ID, context.siteId());
        putOrRemove(CameraContext.MDC_CAMERA_ID, context.cameraId());
    }

    private static void putOrRemove(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
