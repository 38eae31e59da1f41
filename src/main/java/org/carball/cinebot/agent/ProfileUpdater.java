package org.carball.cinebot.agent;

import lombok.extern.slf4j.Slf4j;
import org.carball.cinebot.memory.PersistenceException;
import org.carball.cinebot.memory.PreferenceExtractor;
import org.carball.cinebot.memory.PreferenceMemory;
import org.carball.cinebot.model.profile.UserProfile;

/**
 * Learns preferences from a user message and persists the profile when it changed. A failed save
 * keeps the in-memory profile for the rest of the session.
 */
@Slf4j
class ProfileUpdater {

    private final PreferenceExtractor extractor;
    private final PreferenceMemory memory;

    ProfileUpdater(PreferenceExtractor extractor, PreferenceMemory memory) {
        this.extractor = extractor;
        this.memory = memory;
    }

    UserProfile update(String userText, UserProfile profile) {
        if (!extractor.extract(userText, profile)) {
            return profile;
        }
        try {
            memory.save(profile);
        } catch (PersistenceException e) {
            log.error("Could not persist user profile, keeping it in memory only: {}", e.getMessage());
            log.debug("Persistence failure details", e);
        }
        return profile;
    }
}
