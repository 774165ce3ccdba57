package org.coregstack.tree;

import org.coregstack.stack.AcquisitionDate;

/**
 * {@code target} is coregistered using {@code source} as its local reference.
 *
 * @param source the local reference, either the stack reference or a date of a lower tier
 * @param target the date being aligned
 * @param tier   tier of the target
 */
public record CoregistrationEdge(AcquisitionDate source, AcquisitionDate target, int tier) {

    @Override
    public String toString() {
        return source + " -> " + target + " (tier " + tier + ")";
    }
}
