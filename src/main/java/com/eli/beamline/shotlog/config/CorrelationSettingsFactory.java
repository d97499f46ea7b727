package com.eli.beamline.shotlog.config;

import com.eli.beamline.shotlog.domain.CorrelationSettings;
import com.eli.beamline.shotlog.domain.FileSpec;
import com.eli.beamline.shotlog.domain.FolderRule;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the immutable {@link CorrelationSettings} snapshot from the mapped configuration.
 */
public final class CorrelationSettingsFactory {

    private CorrelationSettingsFactory() {
        // Utility class
    }

    public static CorrelationSettings fromConfig(ShotLogConfig config) {
        List<FolderRule> folders = new ArrayList<>();
        for (ShotLogConfig.Folder folder : config.folders()) {
            List<FileSpec> specs = new ArrayList<>();
            for (ShotLogConfig.Spec spec : folder.fileSpecs().orElse(List.of())) {
                specs.add(new FileSpec(spec.keyword().orElse(""), spec.extension().orElse("")));
            }
            folders.add(new FolderRule(folder.name(), folder.expected(), folder.trigger(), specs));
        }

        return new CorrelationSettings(
                config.fullWindow(),
                config.timeout(),
                config.globalTriggerKeyword().orElse(""),
                config.applyGlobalKeywordToAll(),
                config.testKeywords(),
                folders
        );
    }
}
