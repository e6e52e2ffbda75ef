package com.tazifor.bidengine.geo.model;

/**
 * Identifier of a single grid cell. The format is owned by the {@code Tiler} that produced it.
 */
public record TileKey(String id) {
}
