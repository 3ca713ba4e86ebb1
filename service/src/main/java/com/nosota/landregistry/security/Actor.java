package com.nosota.landregistry.security;

import com.nosota.landregistry.api.model.ActorRole;

import java.util.Objects;

/**
 * Caller identity as resolved by the actor directory.
 *
 * @param id   Actor id
 * @param role Role, never re-derived by the registry
 */
public record Actor(Long id, ActorRole role) {

    public Actor {
        Objects.requireNonNull(id, "actor id");
        Objects.requireNonNull(role, "actor role");
    }

    public static Actor of(Long id, ActorRole role) {
        return new Actor(id, role);
    }

    public boolean isStaff() {
        return role.isStaff();
    }

    public boolean is(Long actorId) {
        return id.equals(actorId);
    }

    @Override
    public String toString() {
        return role + "#" + id;
    }
}
