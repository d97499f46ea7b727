package com.eli.beamline.shotlog.classify;

import com.eli.beamline.shotlog.domain.CorrelationSettings;
import com.eli.beamline.shotlog.domain.FileEvent;
import com.eli.beamline.shotlog.domain.FileSpec;
import com.eli.beamline.shotlog.domain.FolderRule;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileClassifierTest {

    private static final LocalDateTime DT = LocalDateTime.of(2024, 5, 6, 14, 30, 15);

    private final FileClassifier classifier = new FileClassifier();

    private static CorrelationSettings settings(String keyword, boolean applyToAll) {
        return new CorrelationSettings(
                Duration.ofSeconds(10),
                Duration.ofSeconds(20),
                keyword,
                applyToAll,
                List.of("test", "align"),
                List.of(
                        new FolderRule("Lanex5", true, true, List.of(new FileSpec("", "tif"))),
                        new FolderRule("Lyso", true, false, List.of(new FileSpec("lyso", ".png"), new FileSpec("", ".tif"))),
                        new FolderRule("FROG", false, false, List.of())
                )
        );
    }

    @Test
    void shouldClassifyTriggerFromTriggerFolder() {
        Optional<FileEvent> event = classifier.classify(Path.of("raw/Lanex5/Lanex5_SHOT_001.TIF"), "Lanex5", DT,
                settings("shot", false));

        assertTrue(event.isPresent());
        assertTrue(event.get().trigger());
        assertEquals("Lanex5", event.get().camera());
        assertEquals(LocalDate.of(2024, 5, 6), event.get().date());
        assertEquals(DT, event.get().dt());
    }

    @Test
    void shouldNotTreatFileWithoutKeywordAsTrigger() {
        Optional<FileEvent> event = classifier.classify(Path.of("raw/Lanex5/Lanex5_001.tif"), "Lanex5", DT,
                settings("shot", false));

        assertTrue(event.isPresent());
        assertFalse(event.get().trigger());
    }

    @Test
    void shouldTreatEveryMatchingFileAsTriggerWhenKeywordIsEmpty() {
        Optional<FileEvent> event = classifier.classify(Path.of("raw/Lanex5/Lanex5_001.tif"), "Lanex5", DT,
                settings("", false));

        assertTrue(event.get().trigger());
    }

    @Test
    void shouldNeverMarkNonTriggerFolderAsTrigger() {
        Optional<FileEvent> event = classifier.classify(Path.of("raw/Lyso/Lyso_shot_001.tif"), "Lyso", DT,
                settings("shot", false));

        assertTrue(event.isPresent());
        assertFalse(event.get().trigger());
    }

    @Test
    void shouldIgnoreTestImages() {
        assertTrue(classifier.classify(Path.of("raw/Lanex5/Lanex5_shot_TEST.tif"), "Lanex5", DT,
                settings("shot", false)).isEmpty());
        assertTrue(classifier.classify(Path.of("raw/Lyso/align_01.tif"), "Lyso", DT,
                settings("shot", false)).isEmpty());
    }

    @Test
    void shouldIgnoreUnknownFolder() {
        assertTrue(classifier.classify(Path.of("raw/Other/x_shot.tif"), "Other", DT,
                settings("shot", false)).isEmpty());
    }

    @Test
    void shouldMatchAnyOfTheFolderSpecs() {
        CorrelationSettings settings = settings("shot", false);

        assertTrue(classifier.classify(Path.of("raw/Lyso/lyso_01.png"), "Lyso", DT, settings).isPresent());
        assertTrue(classifier.classify(Path.of("raw/Lyso/cam_01.tif"), "Lyso", DT, settings).isPresent());
        assertTrue(classifier.classify(Path.of("raw/Lyso/cam_01.png"), "Lyso", DT, settings).isEmpty());
    }

    @Test
    void shouldMatchEverythingWhenFolderHasNoSpecs() {
        assertTrue(classifier.classify(Path.of("raw/FROG/trace.csv"), "FROG", DT,
                settings("shot", false)).isPresent());
    }

    @Test
    void shouldRequireGlobalKeywordEverywhereWhenAppliedToAll() {
        CorrelationSettings settings = settings("shot", true);

        assertTrue(classifier.classify(Path.of("raw/Lyso/cam_01.tif"), "Lyso", DT, settings).isEmpty());
        Optional<FileEvent> event = classifier.classify(Path.of("raw/Lyso/cam_shot_01.tif"), "Lyso", DT, settings);
        assertTrue(event.isPresent());
        assertFalse(event.get().trigger());
    }
}
