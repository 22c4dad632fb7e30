package com.calibrationplatform.calibration.config;

import com.calibrationplatform.common.exception.CalibrationConfigException;
import com.calibrationplatform.common.model.IntrinsicScore;
import com.calibrationplatform.common.model.IntrinsicStatus;
import com.calibrationplatform.common.registry.InMemoryIntrinsicScoreRegistry;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;

/**
 * Loads the intrinsic (BASE layer) score registry from JSON:
 * <pre>
 * { "methods": { "pkg.Class.method": { "status": "computed", "b_theory": 0.9, "b_impl": 0.8, "b_deploy": 0.7 } } }
 * </pre>
 * {@code computed} entries need all three components in [0,1]; other statuses ignore them.
 */
public class IntrinsicScoreLoader {

    private static final Logger log = LoggerFactory.getLogger(IntrinsicScoreLoader.class);

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    public IntrinsicScoreLoader(ObjectMapper objectMapper, ResourceLoader resourceLoader) {
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
    }

    public InMemoryIntrinsicScoreRegistry load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new CalibrationConfigException("intrinsic", "registry not found: " + location);
        }
        RegistryDocument doc;
        try (InputStream in = resource.getInputStream()) {
            doc = objectMapper.readValue(in, RegistryDocument.class);
        } catch (IOException e) {
            throw new CalibrationConfigException("intrinsic", "cannot parse " + location + ": " + e.getMessage(), e);
        }
        Map<String, IntrinsicScore> scores = new HashMap<>();
        if (doc.methods() != null) {
            doc.methods().forEach((methodId, entry) -> scores.put(methodId, toScore(methodId, entry)));
        }
        long pending = scores.values().stream().filter(s -> s.status() == IntrinsicStatus.PENDING).count();
        long excluded = scores.values().stream().filter(s -> s.status() == IntrinsicStatus.EXCLUDED).count();
        log.info("[IntrinsicRegistry] loaded location={} methods={} pending={} excluded={}",
            location, scores.size(), pending, excluded);
        return new InMemoryIntrinsicScoreRegistry(scores);
    }

    private static IntrinsicScore toScore(String methodId, EntryDocument entry) {
        IntrinsicStatus status;
        try {
            status = IntrinsicStatus.fromKey(entry.status());
        } catch (IllegalArgumentException e) {
            throw new CalibrationConfigException("intrinsic", methodId + ": unknown status " + entry.status(), e);
        }
        if (status != IntrinsicStatus.COMPUTED) {
            return IntrinsicScore.withStatus(status);
        }
        return IntrinsicScore.computed(
            component(methodId, "b_theory", entry.bTheory()),
            component(methodId, "b_impl", entry.bImpl()),
            component(methodId, "b_deploy", entry.bDeploy()));
    }

    private static double component(String methodId, String name, Double value) {
        if (value == null || value < 0.0 || value > 1.0) {
            throw new CalibrationConfigException("intrinsic", methodId + ": " + name + " must be in [0,1], got " + value);
        }
        return value;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RegistryDocument(@JsonProperty("methods") Map<String, EntryDocument> methods) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EntryDocument(
        @JsonProperty("status")   String status,
        @JsonProperty("b_theory") Double bTheory,
        @JsonProperty("b_impl")   Double bImpl,
        @JsonProperty("b_deploy") Double bDeploy
    ) {}
}
