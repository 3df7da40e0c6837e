package com.github.micycle1.kdtree;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable {@link KdPoint} backed by a private copy of a coordinate array.
 */
public final class ArrayPoint implements KdPoint {

	private final double[] coordinates;

	public ArrayPoint(double... coordinates) {
		Objects.requireNonNull(coordinates, "coordinates");
		if (coordinates.length == 0) {
			throw new IllegalArgumentException("A point needs at least one coordinate.");
		}
		this.coordinates = coordinates.clone();
	}

	@Override
	public int dimension() {
		return coordinates.length;
	}

	@Override
	public double getCoordinate(int axis) {
		return coordinates[axis];
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof ArrayPoint)) {
			return false;
		}
		return Arrays.equals(coordinates, ((ArrayPoint) o).coordinates);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(coordinates);
	}

	@Override
	public String toString() {
		return "ArrayPoint" + Arrays.toString(coordinates);
	}
}
