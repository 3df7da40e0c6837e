package com.github.micycle1.kdtree;

import java.util.Objects;

import org.locationtech.jts.geom.Coordinate;

/**
 * A point of fixed dimension that can be indexed by a {@link KDTree}.
 * <p>
 * Implementations expose their dimensionality and read access to each
 * coordinate by axis. The tree copies the coordinates at build time, so a point
 * may be mutable without corrupting an already built tree.
 */
public interface KdPoint {

	/**
	 * @return the number of coordinates of this point (D)
	 */
	int dimension();

	/**
	 * @param axis coordinate index, {@code 0 <= axis < dimension()}
	 * @return the coordinate value on the given axis
	 */
	double getCoordinate(int axis);

	/**
	 * Creates a point backed by a copy of the given coordinates.
	 *
	 * @param coordinates the coordinate values; the length is the dimension
	 * @return the point
	 */
	static KdPoint of(double... coordinates) {
		return new ArrayPoint(coordinates);
	}

	/**
	 * Adapts a JTS coordinate. The point is three-dimensional when the coordinate
	 * has a z value, two-dimensional otherwise.
	 *
	 * @param coordinate the JTS coordinate
	 * @return a view of the coordinate
	 */
	static KdPoint of(Coordinate coordinate) {
		Objects.requireNonNull(coordinate, "coordinate");
		return of(coordinate, Double.isNaN(coordinate.getZ()) ? 2 : 3);
	}

	/**
	 * Adapts a JTS coordinate using its first {@code dimension} ordinates
	 * (X, Y, Z, M in that order).
	 *
	 * @param coordinate the JTS coordinate
	 * @param dimension  number of ordinates to expose, 1 to 4
	 * @return a view of the coordinate
	 */
	static KdPoint of(Coordinate coordinate, int dimension) {
		Objects.requireNonNull(coordinate, "coordinate");
		if (dimension < 1 || dimension > 4) {
			throw new IllegalArgumentException("Coordinate dimension must be between 1 and 4, got " + dimension);
		}
		return new KdPoint() {
			@Override
			public int dimension() {
				return dimension;
			}

			@Override
			public double getCoordinate(int axis) {
				if (axis < 0 || axis >= dimension) {
					throw new IndexOutOfBoundsException("axis " + axis + " out of range for dimension " + dimension);
				}
				return coordinate.getOrdinate(axis);
			}

			@Override
			public String toString() {
				return coordinate.toString();
			}
		};
	}

}
