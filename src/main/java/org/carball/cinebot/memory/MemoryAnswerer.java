package org.carball.cinebot.memory;

import org.carball.cinebot.model.profile.PreferenceCategory;
import org.carball.cinebot.model.profile.UserProfile;

import java.util.Locale;
import java.util.Set;

/**
 * Answers questions about the user straight from the profile, without a model call.
 */
public class MemoryAnswerer {

    public boolean canAnswer(String userText) {
        return answer(userText, UserProfile.empty()) != null;
    }

    /**
     * @return the answer, or null when the message is not a question about the profile
     */
    public String answer(String userText, UserProfile profile) {
        if (userText == null) {
            return null;
        }
        String lowered = userText.toLowerCase(Locale.ROOT);

        if (lowered.contains("как меня зовут") || lowered.contains("what is my name")
                || lowered.contains("what's my name")) {
            return profile.hasName()
                    ? "Your name is " + profile.getName() + "."
                    : "I don't know your name yet.";
        }

        if (lowered.contains("какие жанры я люблю") || lowered.contains("what genres do i like")
                || lowered.contains("which genres do i like")) {
            Set<String> genres = profile.getPreferences(PreferenceCategory.GENRE);
            return genres.isEmpty()
                    ? "I don't know which genres you like yet."
                    : "You like " + String.join(", ", genres) + ".";
        }

        if (lowered.contains("что я люблю") || lowered.contains("what do i like")) {
            String preferences = profile.describePreferences();
            return preferences != null ? preferences : "You haven't told me what you like yet.";
        }

        return null;
    }
}
