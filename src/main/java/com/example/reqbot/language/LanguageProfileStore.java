package com.example.reqbot.language;

import com.example.reqbot.model.LanguageProfile;
import com.example.reqbot.model.Priority;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-mostly store of {@link LanguageProfile}s backed by a versioned JSON file.
 * <p>
 * The file is created from the bundled defaults when absent and rewritten with the defaults when it
 * cannot be parsed or violates the profile invariant. Neither case is fatal: the error is logged and the
 * store keeps serving the default profiles.
 * <p>
 * Profiles are loaded on first access. The loaded snapshot is published through a volatile field with
 * double-checked locking, so reads after warm-up take no lock. Unknown language codes yield empty results.
 */
public class LanguageProfileStore {

    private static final Logger log = LoggerFactory.getLogger(LanguageProfileStore.class);

    /** Version written into new configuration files. */
    public static final int CURRENT_VERSION = 1;

    static final String DEFAULT_RESOURCE = "/default-language-profiles.json";

    private final Path configPath;
    private final ObjectMapper objectMapper;
    private final Object initLock = new Object();

    private volatile Snapshot snapshot;

    private record Snapshot(int version, String defaultLanguage, Map<String, LanguageProfile> profiles) {}

    public LanguageProfileStore(Path configPath, ObjectMapper objectMapper) {
        this.configPath = configPath;
        this.objectMapper = objectMapper;
    }

    // ── Queries ──────────────────────────────────────────────────────────────

    public Optional<LanguageProfile> getProfile(String code) {
        if (code == null) return Optional.empty();
        return Optional.ofNullable(snapshot().profiles().get(code.trim().toLowerCase(Locale.ROOT)));
    }

    public Set<String> getKeywords(String code) {
        return getProfile(code).map(LanguageProfile::keywords).orElse(Set.of());
    }

    public Set<String> getPriorityKeywords(String code, Priority tier) {
        return getProfile(code).map(p -> p.priorityKeywords(tier)).orElse(Set.of());
    }

    public Set<String> getSecurityKeywords(String code) {
        return getProfile(code).map(LanguageProfile::securityKeywords).orElse(Set.of());
    }

    public Optional<String> getModelId(String code) {
        return getProfile(code).map(LanguageProfile::modelId);
    }

    /** Supported language codes in configuration order. */
    public List<String> supportedLanguages() {
        return List.copyOf(snapshot().profiles().keySet());
    }

    public boolean isSupported(String code) {
        return getProfile(code).isPresent();
    }

    public String defaultLanguage() {
        return snapshot().defaultLanguage();
    }

    public int version() {
        return snapshot().version();
    }

    public Path configPath() {
        return configPath;
    }

    // ── Lifecycle ────────────────────────────────────────────────────────────

    /**
     * Re-reads the configuration file and atomically replaces the loaded profiles.
     */
    public void reload() {
        synchronized (initLock) {
            snapshot = load();
        }
    }

    /** Writes the loaded profiles back to the configuration file. */
    public void save() {
        saveTo(configPath);
    }

    /**
     * Writes the loaded profiles to the given file.
     *
     * @throws UncheckedIOException if the file cannot be written
     */
    public void saveTo(Path target) {
        Snapshot current = snapshot();
        ProfileConfigDocument document = ProfileConfigDocument.from(
                CURRENT_VERSION, current.defaultLanguage(), current.profiles());
        try {
            createParentDirectories(target);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), document);
            log.info("Language profiles saved to {}", target);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to write language profiles to " + target, e);
        }
    }

    private Snapshot snapshot() {
        Snapshot local = snapshot;
        if (local == null) {
            synchronized (initLock) {
                local = snapshot;
                if (local == null) {
                    local = load();
                    snapshot = local;
                }
            }
        }
        return local;
    }

    private Snapshot load() {
        if (!Files.exists(configPath)) {
            log.info("Language profile config {} not found, creating it with defaults", configPath);
            return restoreDefaults();
        }
        try {
            ProfileConfigDocument document = objectMapper.readValue(configPath.toFile(), ProfileConfigDocument.class);
            Snapshot loaded = toSnapshot(document);
            if (loaded.version() != CURRENT_VERSION) {
                log.warn("Language profile config {} has version {} (expected {}), loading it as is",
                        configPath, loaded.version(), CURRENT_VERSION);
            }
            log.info("Loaded {} language profiles from {}: {}",
                    loaded.profiles().size(), configPath, loaded.profiles().keySet());
            return loaded;
        } catch (IOException | ConfigLoadException e) {
            log.error("Language profile config {} is unreadable or invalid ({}), regenerating defaults",
                    configPath, e.getMessage());
            return restoreDefaults();
        }
    }

    private Snapshot restoreDefaults() {
        byte[] defaults = readDefaultResource();
        try {
            createParentDirectories(configPath);
            Files.write(configPath, defaults);
        } catch (IOException e) {
            log.error("Unable to write default language profiles to {}: {}", configPath, e.getMessage());
        }
        try {
            return toSnapshot(objectMapper.readValue(defaults, ProfileConfigDocument.class));
        } catch (IOException e) {
            throw new IllegalStateException("Bundled default language profiles are not valid JSON", e);
        }
    }

    private Snapshot toSnapshot(ProfileConfigDocument document) {
        Map<String, LanguageProfile> profiles = document.toProfiles();
        String defaultLanguage = document.defaultLanguage() != null
                ? document.defaultLanguage().trim().toLowerCase(Locale.ROOT)
                : null;
        if (defaultLanguage == null || !profiles.containsKey(defaultLanguage)) {
            throw new ConfigLoadException("Default language '" + document.defaultLanguage() + "' has no profile");
        }
        return new Snapshot(document.version(), defaultLanguage, Collections.unmodifiableMap(profiles));
    }

    private static byte[] readDefaultResource() {
        try (InputStream in = LanguageProfileStore.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + DEFAULT_RESOURCE);
            }
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + DEFAULT_RESOURCE, e);
        }
    }

    private static void createParentDirectories(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
