package org.pragmatica.dvrtl.transform;

/**
 * Handler for one grammar production, applied once all children have been transformed.
 */
@FunctionalInterface
interface Production {
    /**
     * Build the value of a node from the values of its children.
     *
     * @param values the transformed children, in source order
     * @return the node's value
     */
    Object apply(ChildValues values);
}
