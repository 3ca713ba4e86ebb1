package com.nosota.landregistry.api;

import com.nosota.landregistry.api.model.ActorRole;
import org.springframework.http.HttpHeaders;

import java.util.function.Consumer;

/**
 * Headers carrying the caller identity resolved by the actor directory.
 *
 * <p>The gateway in front of the registry authenticates the token and forwards the
 * resolved actor id and role on every request.
 */
public final class ActorHeaders {

    public static final String ACTOR_ID = "X-Actor-Id";
    public static final String ACTOR_ROLE = "X-Actor-Role";

    private ActorHeaders() {
    }

    /**
     * Header customizer for WebClient requests made on behalf of an actor.
     */
    public static Consumer<HttpHeaders> of(Long actorId, ActorRole actorRole) {
        return headers -> {
            headers.set(ACTOR_ID, String.valueOf(actorId));
            headers.set(ACTOR_ROLE, actorRole.name());
        };
    }
}
