package org.carball.cinebot.model.conversation;

public enum MessageRole {
    USER,
    ASSISTANT,
    TOOL
}
