package org.carball.cinebot.agent;

import java.util.Locale;

/**
 * Makes sure every answer shown to the user ends with an explanation line.
 */
public class AnswerFormatter {

    static final String EMPTY_ANSWER = "I couldn't put together a meaningful answer.";
    static final String EMPTY_EXPLANATION = "Explanation: I ran into an internal problem while processing the request.";
    static final String DEFAULT_EXPLANATION = "Explanation: I based this answer on your request, the conversation "
            + "so far and, where needed, the catalog, online lookups and what I remember about you.";

    public String format(String raw) {
        String text = raw == null ? "" : raw.trim();
        if (text.isEmpty()) {
            return EMPTY_ANSWER + "\n" + EMPTY_EXPLANATION;
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        if (lowered.contains("explanation:") || lowered.contains("пояснение:")) {
            return text;
        }
        return text + "\n\n" + DEFAULT_EXPLANATION;
    }
}
