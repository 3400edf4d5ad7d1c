package com.example.servicedesk.controller;

/**
 * Who made an admin change, taken from the optional X-Actor header.
 */
final class Actors {

    static final String HEADER = "X-Actor";
    static final String DEFAULT_ACTOR = "admin";

    private Actors() {
    }

    static String orDefault(String actor) {
        return actor != null && !actor.isBlank() ? actor : DEFAULT_ACTOR;
    }
}
