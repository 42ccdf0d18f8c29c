package com.deepansh.orchestrator.core;

/**
 * The four pipeline stages. {@link #wireName()} is the name surfaced in
 * {@code agent} stream events and used as the key in the per-request timings map.
 */
public enum Stage {

    PLANNER("planner"),
    EXECUTOR("executor"),
    VALIDATOR("validator"),
    COMPOSER("composer");

    private final String wireName;

    Stage(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
