package com.shelf.assistant.core.audio;

import java.time.Instant;

public final class SpokenPhrase {
    private final String text;
    private final Instant spokenAt;

    public SpokenPhrase(String text, Instant spokenAt) {
        this.text = text;
        this.spokenAt = spokenAt;
    }

    public String getText() { return text; }
    public Instant getSpokenAt() { return spokenAt; }

    @Override
    public String toString() {
        return spokenAt + " " + text;
    }
}
