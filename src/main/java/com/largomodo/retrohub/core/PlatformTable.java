package com.largomodo.retrohub.core;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable mapping of platform names to the ROM file extensions that identify them.
 * <p>
 * Built once at startup and handed to the {@link LibraryStore}. Extensions are stored
 * lower-cased with their leading dot. Each extension belongs to exactly one platform;
 * construction rejects ambiguous tables so detection never depends on iteration order.
 * <p>
 * Safe for concurrent use (no mutable state after construction).
 */
public final class PlatformTable {

    private final Map<String, Set<String>> extensionsByPlatform;
    private final Map<String, String> platformByExtension;

    /**
     * @param table Platform name → extensions (with or without leading dot, any case)
     * @throws IllegalArgumentException if the table is empty, a name is blank, or an
     *                                  extension is claimed by two platforms
     */
    public PlatformTable(Map<String, ? extends Iterable<String>> table) {
        if (table == null || table.isEmpty()) {
            throw new IllegalArgumentException("Platform table must define at least one platform");
        }

        Map<String, Set<String>> byPlatform = new LinkedHashMap<>();
        Map<String, String> byExtension = new HashMap<>();

        table.forEach((platform, extensions) -> {
            if (platform == null || platform.isBlank()) {
                throw new IllegalArgumentException("Platform name must not be blank");
            }
            Set<String> normalized = new LinkedHashSet<>();
            for (String ext : extensions) {
                String key = normalize(ext);
                String previous = byExtension.putIfAbsent(key, platform);
                if (previous != null && !previous.equals(platform)) {
                    throw new IllegalArgumentException(
                            "Extension " + key + " mapped to both " + previous + " and " + platform);
                }
                normalized.add(key);
            }
            byPlatform.put(platform, Collections.unmodifiableSet(normalized));
        });

        this.extensionsByPlatform = Collections.unmodifiableMap(byPlatform);
        this.platformByExtension = Collections.unmodifiableMap(byExtension);
    }

    /**
     * The stock table: NES, SNES, N64, GBA, GB and Atari 2600 cartridges.
     */
    public static PlatformTable defaults() {
        Map<String, List<String>> table = new LinkedHashMap<>();
        table.put("NES", List.of(".nes", ".unf", ".unif"));
        table.put("SNES", List.of(".sfc", ".smc"));
        table.put("N64", List.of(".n64", ".z64", ".v64"));
        table.put("GBA", List.of(".gba"));
        table.put("GB", List.of(".gb", ".gbc"));
        table.put("ATARI", List.of(".a26", ".bin"));
        return new PlatformTable(table);
    }

    /**
     * Look up the platform for an extension.
     *
     * @param extension Extension with leading dot, any case (e.g. ".SFC")
     * @return Platform name, or empty when the extension is not a known ROM type
     */
    public Optional<String> platformFor(String extension) {
        if (extension == null || extension.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(platformByExtension.get(extension.toLowerCase(Locale.ROOT)));
    }

    /**
     * Extensions registered for a platform (lower-cased, dot included), empty if unknown.
     */
    public Set<String> extensionsOf(String platform) {
        return extensionsByPlatform.getOrDefault(platform, Set.of());
    }

    public Set<String> platforms() {
        return extensionsByPlatform.keySet();
    }

    private static String normalize(String extension) {
        if (extension == null || extension.isBlank()) {
            throw new IllegalArgumentException("Extension must not be blank");
        }
        String lower = extension.strip().toLowerCase(Locale.ROOT);
        return lower.startsWith(".") ? lower : "." + lower;
    }

    @Override
    public String toString() {
        return "PlatformTable" + extensionsByPlatform;
    }
}
