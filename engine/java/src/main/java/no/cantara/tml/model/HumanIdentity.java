package no.cantara.tml.model;

/**
 * Real-world identity an Archetype or an actor is anchored to.
 */
public record HumanIdentity(
        String email,
        String displayName,
        String title,
        String department,
        String workspaceId
) {
    public HumanIdentity(String email, String displayName) {
        this(email, displayName, null, null, null);
    }
}
