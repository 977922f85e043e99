package com.practicum.homeworkbot.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Closed set of review verdicts. Each verdict lists the raw status strings the API may send for it.
 */
public enum Verdict {
    PENDING("The work was taken for review by a reviewer.", "pending", "reviewing"),
    ACCEPTED("The work has been reviewed: the reviewer liked everything. Hooray!", "accepted", "approved"),
    REJECTED("The work has been reviewed: the reviewer has comments.", "rejected");

    private final String text;
    private final Set<String> rawStatuses;

    Verdict(String text, String... rawStatuses) {
        this.text = text;
        this.rawStatuses = Set.of(rawStatuses);
    }

    public String getText() {
        return text;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Verdict> fromRaw(String rawStatus) {
        if (rawStatus == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(v -> v.rawStatuses.contains(rawStatus))
                .findFirst();
    }
}
