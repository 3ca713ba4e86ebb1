package com.nosota.landregistry.security;

import com.nosota.landregistry.api.model.ActorRole;
import com.nosota.landregistry.error.ForbiddenOperationException;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Authorization capability evaluated before every state-mutating operation.
 *
 * <p>A guard combines a role requirement with an ownership rule. Guards compose with
 * {@link #and(AccessGuard)} and {@link #or(AccessGuard)}; a failing guard raises
 * {@link ForbiddenOperationException} naming the capability the caller lacks.
 *
 * <p>Usage:
 * <pre>
 * AccessGuard.STAFF.and(AccessGuard.notSelf(property.getOwnerId())).check(actor);
 * </pre>
 */
public interface AccessGuard {

    /**
     * Land officers and admins.
     */
    AccessGuard STAFF = anyOf(ActorRole.LAND_OFFICER, ActorRole.ADMIN);

    AccessGuard ADMIN = anyOf(ActorRole.ADMIN);

    AccessGuard CITIZEN = anyOf(ActorRole.CITIZEN);

    boolean permits(Actor actor);

    /**
     * Human-readable name of the capability, used in error messages.
     */
    String describe();

    /**
     * @throws ForbiddenOperationException if the guard does not permit the actor
     */
    default void check(Actor actor) {
        if (!permits(actor)) {
            throw new ForbiddenOperationException(
                    String.format("Caller %s is not allowed to perform this operation: requires %s",
                            actor, describe()));
        }
    }

    default AccessGuard and(AccessGuard other) {
        AccessGuard self = this;
        return of(self.describe() + " and " + other.describe(),
                actor -> self.permits(actor) && other.permits(actor));
    }

    default AccessGuard or(AccessGuard other) {
        AccessGuard self = this;
        return of("(" + self.describe() + " or " + other.describe() + ")",
                actor -> self.permits(actor) || other.permits(actor));
    }

    static AccessGuard of(String description, Predicate<Actor> rule) {
        return new AccessGuard() {
            @Override
            public boolean permits(Actor actor) {
                return actor != null && rule.test(actor);
            }

            @Override
            public String describe() {
                return description;
            }
        };
    }

    static AccessGuard anyOf(ActorRole... roles) {
        Set<ActorRole> allowed = EnumSet.copyOf(Arrays.asList(roles));
        return of("role " + (allowed.size() == 1 ? allowed.iterator().next() : "one of " + allowed),
                actor -> allowed.contains(actor.role()));
    }

    /**
     * Caller must be the given owner.
     */
    static AccessGuard owner(Long ownerId) {
        return of("ownership of the resource", actor -> actor.is(ownerId));
    }

    static AccessGuard ownerOrAnyOf(Long ownerId, ActorRole... roles) {
        return owner(ownerId).or(anyOf(roles));
    }

    /**
     * Caller must be one of the listed parties.
     */
    static AccessGuard anyParty(Long... partyIds) {
        return of("being a party of the transfer",
                actor -> Arrays.stream(partyIds).anyMatch(id -> Objects.equals(id, actor.id())));
    }

    /**
     * Caller must not be the given owner, whatever its role.
     */
    static AccessGuard notSelf(Long ownerId) {
        return of("not acting on own application", actor -> !actor.is(ownerId));
    }
}
