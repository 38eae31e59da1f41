package org.carball.cinebot.memory;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.carball.cinebot.model.profile.PreferenceCategory;
import org.carball.cinebot.model.profile.UserProfile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Persists the user profile as a single JSON document and owns the misspelling table applied to
 * preference text before it is interpreted.
 */
@Slf4j
public class PreferenceMemory {

    static final Map<String, String> COMMON_CORRECTIONS = Map.of(
            "люлблю", "люблю",
            "люблбю", "люблю",
            "научные фантастики", "научную фантастику",
            "scifi", "sci-fi",
            "favourite", "favorite"
    );

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Map<Pattern, String> corrections;

    public PreferenceMemory(Path file) {
        this(file, Map.of());
    }

    public PreferenceMemory(Path file, Map<String, String> extraCorrections) {
        this.file = file;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        Map<String, String> table = new LinkedHashMap<>(COMMON_CORRECTIONS);
        table.putAll(extraCorrections);
        this.corrections = compile(table);
    }

    /**
     * Reads the profile, or returns an empty one when the file is absent or unreadable.
     */
    public UserProfile load() {
        if (!Files.exists(file)) {
            log.info("No stored profile at {}, starting with an empty one", file);
            return UserProfile.empty();
        }

        try {
            ProfileDocument document = objectMapper.readValue(file.toFile(), ProfileDocument.class);
            UserProfile profile = toProfile(document);
            log.info("Loaded profile from {}", file);
            return profile;
        } catch (IOException e) {
            log.error("Stored profile {} is unreadable, starting with an empty one: {}", file, e.getMessage());
            return UserProfile.empty();
        }
    }

    /**
     * Rewrites the whole profile file.
     *
     * @throws PersistenceException when the file cannot be written
     */
    public void save(UserProfile profile) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            Files.writeString(temp, objectMapper.writeValueAsString(toDocument(profile)), StandardCharsets.UTF_8);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Profile saved to {}", file);
        } catch (IOException e) {
            throw new PersistenceException("Failed to save profile to " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Replaces known misspellings (whole words, case-insensitive). Not a spell-checker: only the
     * literal entries of the correction table are touched.
     */
    public String applyCorrection(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String corrected = text;
        for (Map.Entry<Pattern, String> correction : corrections.entrySet()) {
            Matcher matcher = correction.getKey().matcher(corrected);
            corrected = matcher.replaceAll(Matcher.quoteReplacement(correction.getValue()));
        }
        return corrected;
    }

    public Path getFile() {
        return file;
    }

    private static Map<Pattern, String> compile(Map<String, String> table) {
        Map<Pattern, String> compiled = new LinkedHashMap<>();
        // Longer phrases first so that a phrase wins over a word it contains
        table.entrySet().stream()
                .sorted((a, b) -> Integer.compare(b.getKey().length(), a.getKey().length()))
                .forEach(entry -> compiled.put(
                        Pattern.compile("(?<![\\p{L}\\p{N}_])" + Pattern.quote(entry.getKey()) + "(?![\\p{L}\\p{N}_])",
                                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
                        entry.getValue()));
        return compiled;
    }

    private static ProfileDocument toDocument(UserProfile profile) {
        ProfileDocument document = new ProfileDocument();
        document.setName(profile.getName());
        for (PreferenceCategory category : PreferenceCategory.values()) {
            document.getPreferences().put(category.getKey(), new ArrayList<>(profile.getPreferences(category)));
        }
        return document;
    }

    private static UserProfile toProfile(ProfileDocument document) {
        UserProfile profile = UserProfile.empty();
        profile.setName(document.getName());
        if (document.getPreferences() == null) {
            return profile;
        }
        for (Map.Entry<String, List<String>> entry : document.getPreferences().entrySet()) {
            Optional<PreferenceCategory> category = PreferenceCategory.fromKey(entry.getKey());
            if (category.isEmpty()) {
                log.warn("Ignoring unknown preference category '{}' in stored profile", entry.getKey());
                continue;
            }
            if (entry.getValue() != null) {
                entry.getValue().forEach(value -> profile.addPreference(category.get(), value));
            }
        }
        return profile;
    }
}
