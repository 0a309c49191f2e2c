package com.example.clipflow.config;

import com.example.clipflow.domain.PipelineSetting;
import com.example.clipflow.repository.PipelineSettingRepository;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Produces {@link PipelineSettings} snapshots from {@code clipflow.pipeline.*} properties overlaid with
 * rows of the {@code pipeline_settings} table. The current snapshot is swapped atomically on refresh.
 */
@Component
public class SettingsWatcher {

    private static final Logger log = LoggerFactory.getLogger(SettingsWatcher.class);
    static final String PROPERTY_PREFIX = "clipflow.pipeline.";

    private final PipelineSettingRepository settingRepository;
    private final Environment environment;
    private final AtomicReference<PipelineSettings> current = new AtomicReference<>();

    public SettingsWatcher(PipelineSettingRepository settingRepository, Environment environment) {
        this.settingRepository = settingRepository;
        this.environment = environment;
    }

    @PostConstruct
    void initialize() {
        current.set(PipelineSettings.fromValues(propertyValues()));
        refresh();
    }

    public PipelineSettings current() {
        return current.get();
    }

    @Scheduled(fixedDelayString = "${clipflow.settings.refresh-ms:60000}", initialDelayString = "${clipflow.settings.refresh-ms:60000}")
    public void refresh() {
        Map<String, String> values = propertyValues();
        try {
            for (PipelineSetting setting : settingRepository.findAll()) {
                if (PipelineSettings.KEYS.contains(setting.getKey())) {
                    values.put(setting.getKey(), setting.getValue());
                } else {
                    log.warn("[Settings] Ignoring unknown pipeline setting '{}'", setting.getKey());
                }
            }
        } catch (DataAccessException e) {
            log.warn("[Settings] Could not read setting overrides, keeping current snapshot: {}", e.getMessage());
            return;
        }

        try {
            PipelineSettings next = PipelineSettings.fromValues(values);
            PipelineSettings previous = current.getAndSet(next);
            if (!next.equals(previous)) {
                log.info("[Settings] Pipeline settings refreshed: {}", next);
            }
        } catch (RuntimeException e) {
            log.error("[Settings] Invalid pipeline setting override, keeping current snapshot: {}", e.getMessage());
        }
    }

    private Map<String, String> propertyValues() {
        Map<String, String> values = new HashMap<>();
        for (String key : PipelineSettings.KEYS) {
            String value = environment.getProperty(PROPERTY_PREFIX + key);
            if (value != null) {
                values.put(key, value);
            }
        }
        return values;
    }
}
