package io.templatekit.core.model;

import java.util.Objects;

/** Author or committer identity with the time it was recorded. Displays as {@code name <email>}. */
public record Signature(String name, String email, Timestamp timestamp) {

    public Signature {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(email, "email must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    /** The part of the email before the first {@code @}, or the whole email if there is none. */
    public String username() {
        int at = email.indexOf('@');
        return at < 0 ? email : email.substring(0, at);
    }

    @Override
    public String toString() {
        return name + " <" + email + ">";
    }
}
