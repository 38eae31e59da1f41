package org.carball.cinebot.model.conversation;

import lombok.Value;

@Value
public class FinalAnswer implements ModelDecision {
    String text;

    @Override
    public boolean isFinal() {
        return true;
    }
}
