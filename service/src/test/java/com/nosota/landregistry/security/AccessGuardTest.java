package com.nosota.landregistry.security;

import com.nosota.landregistry.api.model.ActorRole;
import com.nosota.landregistry.error.ForbiddenOperationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AccessGuardTest {

    private static final Actor CITIZEN = Actor.of(1L, ActorRole.CITIZEN);
    private static final Actor OFFICER = Actor.of(2L, ActorRole.LAND_OFFICER);
    private static final Actor ADMIN = Actor.of(3L, ActorRole.ADMIN);

    @Test
    void roleGuards() {
        assertThat(AccessGuard.STAFF.permits(OFFICER)).isTrue();
        assertThat(AccessGuard.STAFF.permits(ADMIN)).isTrue();
        assertThat(AccessGuard.STAFF.permits(CITIZEN)).isFalse();
        assertThat(AccessGuard.ADMIN.permits(OFFICER)).isFalse();
        assertThat(AccessGuard.CITIZEN.permits(CITIZEN)).isTrue();
    }

    @Test
    void officerCannotApproveOwnApplication() {
        Actor officerOwner = Actor.of(2L, ActorRole.LAND_OFFICER);
        AccessGuard guard = AccessGuard.STAFF.and(AccessGuard.notSelf(2L));

        assertThatThrownBy(() -> guard.check(officerOwner))
                .isInstanceOf(ForbiddenOperationException.class)
                .hasMessageContaining("not acting on own application");
        assertThatCode(() -> guard.check(ADMIN)).doesNotThrowAnyException();
    }

    @Test
    void ownerOrStaff() {
        AccessGuard guard = AccessGuard.ownerOrAnyOf(1L, ActorRole.LAND_OFFICER, ActorRole.ADMIN);

        assertThat(guard.permits(CITIZEN)).isTrue();
        assertThat(guard.permits(Actor.of(9L, ActorRole.CITIZEN))).isFalse();
        assertThat(guard.permits(OFFICER)).isTrue();
        assertThat(guard.permits(null)).isFalse();
    }

    @Test
    void anyParty() {
        AccessGuard guard = AccessGuard.anyParty(1L, 5L);

        assertThat(guard.permits(CITIZEN)).isTrue();
        assertThat(guard.permits(Actor.of(5L, ActorRole.CITIZEN))).isTrue();
        assertThat(guard.permits(OFFICER)).isFalse();
    }
}
