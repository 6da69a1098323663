package com.pgoutbox.application.config;

import java.util.Objects;

/**
 * Coordinates of the PostgreSQL server for the dedicated replication connection.
 */
public record ConnectionSettings(String url, String username, String password) {

    public ConnectionSettings {
        Objects.requireNonNull(url, "url");
        if (!url.startsWith("jdbc:postgresql:")) {
            throw new IllegalArgumentException("Expected a jdbc:postgresql: URL, got " + url);
        }
    }

    @Override
    public String toString() {
        return "ConnectionSettings[url=" + url + ", username=" + username + ", password=****]";
    }
}
