package io.hearthwarrio.stableid.core;

/**
 * The externally visible identifier attribute of a UI node, as seen by the traversal layer.
 */
public interface IdentifiableNode {

    /**
     * Current identifier, or null when none is attached.
     */
    String getIdentifier();

    void setIdentifier(String identifier);
}
