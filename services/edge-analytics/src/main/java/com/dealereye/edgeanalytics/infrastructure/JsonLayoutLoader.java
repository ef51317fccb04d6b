package com.dealereye.edgeanalytics.infrastructure;

import com.dealereye.analytics.layout.CameraLayout;
import com.dealereye.eventmodel.EventSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads camera layouts from a JSON document of the form
 * {@code {"cameras":[{"camera_id":"cam-1","zones":[...],"lines":[...]}]}}.
 *
 * <p>Field names are snake_case, as on the event wire. Structural problems (too few polygon points,
 * duplicate ids, unknown zone or line types) fail the whole load.
 */
public class JsonLayoutLoader {

    private static final Logger log = LoggerFactory.getLogger(JsonLayoutLoader.class);

    private final ObjectMapper mapper;

    public JsonLayoutLoader() {
        this(EventSerializer.objectMapper());
    }

    public JsonLayoutLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Loads every camera layout of the document.
     *
     * @throws LayoutLoadException if the resource cannot be read or describes an invalid layout
     */
    public List<CameraLayout> load(Resource resource) {
        LayoutDocument document;
        try (InputStream in = resource.getInputStream()) {
            document = mapper.readValue(in, LayoutDocument.class);
        } catch (IOException e) {
            throw new LayoutLoadException("Failed to load camera layouts from " + resource.getDescription(), e);
        }

        List<CameraLayout> cameras = document.cameras() == null ? List.of() : document.cameras();
        Set<String> seen = new HashSet<>();
        for (CameraLayout camera : cameras) {
            if (!seen.add(camera.cameraId())) {
                throw new LayoutLoadException(
                        "Camera " + camera.cameraId() + " appears twice in " + resource.getDescription(), null);
            }
        }
        log.info("Loaded {} camera layouts from {}", cameras.size(), resource.getDescription());
        return cameras;
    }

    record LayoutDocument(List<CameraLayout> cameras) {
    }

    /** Thrown when the layout document is missing or malformed. */
    public static class LayoutLoadException extends RuntimeException {
        public LayoutLoadException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
