package no.cantara.tml.model;

/**
 * One instance of one of the nine closed primitive types.
 *
 * <p>The grid is modelled as flat records sharing this interface rather than as a class
 * hierarchy; {@link #primitiveType()} is the discriminator used for storage and dispatch.
 */
public interface Primitive {

    String id();

    PrimitiveType primitiveType();

    /**
     * The Scope this primitive belongs to. A Scope owns itself.
     */
    String owningScopeId();
}
