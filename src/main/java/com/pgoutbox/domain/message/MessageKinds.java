package com.pgoutbox.domain.message;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The wire discriminators of the user messages this service produces and consumes.
 * Discriminators are versioned; a breaking payload change gets a new one.
 */
public final class MessageKinds {

    public static final String USER_CREATED = "user.created.v1";
    public static final String USER_DELETED = "user.deleted.v1";
    public static final String USER_MODIFIED = "user.modified.v1";
    public static final String USER_SUBSCRIBED = "user.subscribed.v1";

    private static final Map<Class<?>, String> DISCRIMINATORS;

    static {
        Map<Class<?>, String> discriminators = new LinkedHashMap<>();
        discriminators.put(UserCreated.class, USER_CREATED);
        discriminators.put(UserDeleted.class, USER_DELETED);
        discriminators.put(UserModified.class, USER_MODIFIED);
        discriminators.put(UserSubscribed.class, USER_SUBSCRIBED);
        DISCRIMINATORS = Collections.unmodifiableMap(discriminators);
    }

    private MessageKinds() {}

    public static Map<Class<?>, String> discriminators() {
        return DISCRIMINATORS;
    }
}
