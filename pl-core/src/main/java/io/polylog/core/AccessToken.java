package io.polylog.core;

import java.util.Objects;

/** Identity a write is made on behalf of. Carried for auditing, never checked here. */
public record AccessToken(String username, String reason) {
    public AccessToken {
        Objects.requireNonNull(username);
        if (reason == null) reason = "";
    }

    public static AccessToken of(String username) { return new AccessToken(username, ""); }
}
