package tech.demoserver.platform.authorization;

import tech.demoserver.platform.principal.Role;

import java.util.Objects;

/**
 * A condition an authenticated principal must satisfy before a protected
 * operation runs.
 *
 * <p>Requirements are evaluated in ascending {@link #precedence()} order no
 * matter how they are declared, so an inactive admin is always rejected for
 * being inactive.
 */
public sealed interface AccessRequirement
    permits AccessRequirement.Active, AccessRequirement.HasRole, AccessRequirement.OwnerOrRole {

    int precedence();

    /**
     * The account must be active.
     */
    record Active() implements AccessRequirement {
        @Override
        public int precedence() {
            return 0;
        }
    }

    /**
     * The account must hold exactly this role.
     */
    record HasRole(Role role) implements AccessRequirement {
        public HasRole {
            Objects.requireNonNull(role, "role");
        }

        @Override
        public int precedence() {
            return 1;
        }
    }

    /**
     * The account must either be the resource owner or hold the role.
     */
    record OwnerOrRole(long ownerId, Role role) implements AccessRequirement {
        public OwnerOrRole {
            Objects.requireNonNull(role, "role");
        }

        @Override
        public int precedence() {
            return 1;
        }
    }

    static AccessRequirement active() {
        return new Active();
    }

    static AccessRequirement role(Role role) {
        return new HasRole(role);
    }

    static AccessRequirement ownerOrRole(long ownerId, Role role) {
        return new OwnerOrRole(ownerId, role);
    }
}
