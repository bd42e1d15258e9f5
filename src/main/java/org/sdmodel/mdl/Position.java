package org.sdmodel.mdl;

/**
 * Sketch coordinates of a node centre.
 */
public record Position(int x, int y) {
}
