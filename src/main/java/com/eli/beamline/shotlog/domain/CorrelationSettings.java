package com.eli.beamline.shotlog.domain;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of the correlation parameters and folder rules.
 * A new snapshot replaces the previous one as a whole.
 */
public record CorrelationSettings(
        Duration fullWindow,
        Duration timeout,
        String globalTriggerKeyword,
        boolean applyGlobalKeywordToAll,
        List<String> testKeywords,
        List<FolderRule> folders
) {
    public CorrelationSettings {
        if (fullWindow == null || fullWindow.isNegative()) {
            throw new IllegalArgumentException("fullWindow must be zero or positive");
        }
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be zero or positive");
        }
        globalTriggerKeyword = globalTriggerKeyword != null
                ? globalTriggerKeyword.trim().toLowerCase(Locale.ROOT)
                : "";
        testKeywords = testKeywords != null
                ? testKeywords.stream()
                        .filter(k -> k != null && !k.isBlank())
                        .map(k -> k.trim().toLowerCase(Locale.ROOT))
                        .collect(Collectors.toUnmodifiableList())
                : List.of();
        folders = folders != null ? List.copyOf(folders) : List.of();

        Map<String, FolderRule> unique = new LinkedHashMap<>();
        for (FolderRule folder : folders) {
            if (unique.putIfAbsent(folder.name(), folder) != null) {
                throw new IllegalArgumentException("Duplicate folder name: " + folder.name());
            }
        }
    }

    public Optional<FolderRule> folder(String name) {
        return folders.stream().filter(f -> f.name().equals(name)).findFirst();
    }

    public List<String> folderNames() {
        return folders.stream().map(FolderRule::name).collect(Collectors.toUnmodifiableList());
    }

    public List<String> triggerCameras() {
        return folders.stream()
                .filter(FolderRule::trigger)
                .map(FolderRule::name)
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Cameras flagged as expected. When none is flagged, every configured folder is expected.
     */
    public List<String> expectedCameras() {
        List<String> expected = folders.stream()
                .filter(FolderRule::expected)
                .map(FolderRule::name)
                .collect(Collectors.toUnmodifiableList());
        return expected.isEmpty() ? folderNames() : expected;
    }

    public boolean hasExplicitExpectedCameras() {
        return folders.stream().anyMatch(FolderRule::expected);
    }

    public CorrelationSettings withTiming(Duration newFullWindow, Duration newTimeout) {
        return new CorrelationSettings(newFullWindow, newTimeout, globalTriggerKeyword,
                applyGlobalKeywordToAll, testKeywords, folders);
    }

    public CorrelationSettings withKeyword(String keyword, boolean applyToAll) {
        return new CorrelationSettings(fullWindow, timeout, keyword, applyToAll, testKeywords, folders);
    }

    /**
     * Marks exactly the given cameras as expected. Unknown names are ignored.
     */
    public CorrelationSettings withExpectedCameras(List<String> cameras) {
        List<FolderRule> updated = new ArrayList<>();
        for (FolderRule folder : folders) {
            updated.add(new FolderRule(folder.name(), cameras.contains(folder.name()),
                    folder.trigger(), folder.fileSpecs()));
        }
        return new CorrelationSettings(fullWindow, timeout, globalTriggerKeyword,
                applyGlobalKeywordToAll, testKeywords, updated);
    }

    /**
     * Human-readable description of the effective keyword rules, one line per entry.
     */
    public List<String> keywordDescription() {
        List<String> lines = new ArrayList<>();
        boolean useGlobal = applyGlobalKeywordToAll && !globalTriggerKeyword.isEmpty();
        lines.add(String.format("Global keyword = '%s', apply_to_all = %s",
                globalTriggerKeyword, applyGlobalKeywordToAll));
        folders.stream()
                .sorted((a, b) -> a.name().compareTo(b.name()))
                .forEach(folder -> {
                    lines.add(String.format("Folder %s: expected=%s, trigger=%s",
                            folder.name(), folder.expected(), folder.trigger()));
                    int idx = 1;
                    for (FileSpec spec : folder.fileSpecs()) {
                        String ext = spec.extension().isEmpty()
                                ? "ext='' (no extension filter)"
                                : "ext='" + spec.extension() + "'";
                        String kw;
                        if (useGlobal) {
                            kw = spec.keyword().isEmpty()
                                    ? "keyword='" + globalTriggerKeyword + "' (global)"
                                    : "keyword='" + spec.keyword() + "' + global='" + globalTriggerKeyword + "' enforced";
                        } else {
                            kw = spec.keyword().isEmpty()
                                    ? "keyword='' (matches all filenames)"
                                    : "keyword='" + spec.keyword() + "'";
                        }
                        lines.add(String.format("  File spec %d: %s, %s", idx++, kw, ext));
                    }
                });
        return lines;
    }
}
