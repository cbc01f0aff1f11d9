package no.cantara.tml.identity;

import no.cantara.tml.model.HumanIdentity;

import java.util.List;

/**
 * Resolves e-mail addresses to the real-world identities Archetypes and actors are anchored to.
 * Directory-backed implementations (workspace, SSO) plug in here.
 */
public interface IdentityProvider {

    /**
     * Always returns an identity; implementations without richer data derive a minimal one
     * from the address.
     *
     * @throws IllegalArgumentException if {@code email} is not an e-mail address
     */
    HumanIdentity resolve(String email);

    /** Every identity this provider knows about, ordered by display name. */
    List<HumanIdentity> listAvailable();
}
