package com.calibrationplatform.calibration.config;

import com.calibrationplatform.common.config.CalibrationConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the calibration configuration exactly once, on first access, and hands the
 * same immutable instance to every caller afterwards. Concurrent first calls block
 * until the single load finishes; a failed load is retried by the next caller.
 */
public class CalibrationConfigurationProvider {

    private static final Logger log = LoggerFactory.getLogger(CalibrationConfigurationProvider.class);

    private final CalibrationConfigurationLoader loader;
    private final String location;

    private volatile CalibrationConfiguration configuration;

    public CalibrationConfigurationProvider(CalibrationConfigurationLoader loader, String location) {
        this.loader = loader;
        this.location = location;
    }

    public CalibrationConfiguration get() {
        CalibrationConfiguration current = configuration;
        if (current != null) return current;
        synchronized (this) {
            if (configuration == null) {
                CalibrationConfiguration loaded = loader.load(location);
                log.info("[CalibrationConfig] loaded version={} configHash={} methods={}",
                    loaded.version(), loaded.configHash(), loaded.methods().size());
                configuration = loaded;
            }
            return configuration;
        }
    }
}
