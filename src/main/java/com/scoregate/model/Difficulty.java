package com.scoregate.model;

import java.util.Optional;

/**
 * Difficulty tiers. Each tier is backed by its own external leaderboard.
 * The tag is the value the game client sends.
 */
public enum Difficulty {
    EASY("easy"),
    MEDIUM("medium"),
    HARD("hard"),
    VERY_HARD("veryHard");

    private final String tag;

    Difficulty(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static Optional<Difficulty> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        for (Difficulty difficulty : values()) {
            if (difficulty.tag.equals(tag)) {
                return Optional.of(difficulty);
            }
        }
        return Optional.empty();
    }
}
