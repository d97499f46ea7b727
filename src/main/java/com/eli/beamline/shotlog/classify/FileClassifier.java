package com.eli.beamline.shotlog.classify;

import com.eli.beamline.shotlog.domain.CorrelationSettings;
import com.eli.beamline.shotlog.domain.FileEvent;
import com.eli.beamline.shotlog.domain.FolderRule;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Optional;

/**
 * Decides whether a camera file matches its folder's file specs and whether it is a trigger.
 * Matching is a case-insensitive substring test on the file name.
 */
@ApplicationScoped
public class FileClassifier {

    private static final Logger LOG = Logger.getLogger(FileClassifier.class);

    /**
     * @return the classified event, or empty when the file is to be ignored
     */
    public Optional<FileEvent> classify(Path path, String camera, LocalDateTime dt, CorrelationSettings settings) {
        Optional<FolderRule> folder = settings.folder(camera);
        if (folder.isEmpty()) {
            LOG.debugf("Ignoring file from unknown folder '%s': %s", camera, path);
            return Optional.empty();
        }

        String fileNameLower = fileNameOf(path).toLowerCase(Locale.ROOT);

        for (String testKeyword : settings.testKeywords()) {
            if (fileNameLower.contains(testKeyword)) {
                LOG.debugf("Ignoring test image (keyword '%s'): %s", testKeyword, path);
                return Optional.empty();
            }
        }

        if (!matches(folder.get(), fileNameLower, settings)) {
            LOG.debugf("No file spec of folder %s matches %s", camera, path);
            return Optional.empty();
        }

        boolean trigger = isTrigger(folder.get(), fileNameLower, settings);
        return Optional.of(FileEvent.of(path, camera, dt, trigger));
    }

    boolean matches(FolderRule folder, String fileNameLower, CorrelationSettings settings) {
        if (settings.applyGlobalKeywordToAll() && !containsGlobalKeyword(fileNameLower, settings)) {
            return false;
        }
        return folder.matchesAnySpec(fileNameLower);
    }

    boolean isTrigger(FolderRule folder, String fileNameLower, CorrelationSettings settings) {
        return folder.trigger() && containsGlobalKeyword(fileNameLower, settings);
    }

    private boolean containsGlobalKeyword(String fileNameLower, CorrelationSettings settings) {
        String keyword = settings.globalTriggerKeyword();
        return keyword.isEmpty() || fileNameLower.contains(keyword);
    }

    private String fileNameOf(Path path) {
        Path name = path.getFileName();
        return name != null ? name.toString() : path.toString();
    }
}
