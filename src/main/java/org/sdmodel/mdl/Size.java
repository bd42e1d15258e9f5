package org.sdmodel.mdl;

/**
 * Sketch width and height of a node.
 */
public record Size(int width, int height) {
}
