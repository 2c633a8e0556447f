package com.github.micycle1.pointset;

import java.util.Optional;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

/**
 * A set of 2D points supporting membership, axis-aligned range and nearest
 * neighbour queries. Points are deduplicated under {@link Point}'s tolerant
 * equality.
 * <p>
 * Implementations are not thread-safe.
 *
 * @author Michael Carleton
 */
public interface PointSet extends Iterable<Point> {

	boolean isEmpty();

	int size();

	/**
	 * Adds the point; does nothing if an equal point is already present.
	 */
	void put(Point point);

	boolean contains(Point point);

	/**
	 * @return every point of the set contained in the rectangle, in unspecified
	 *         order
	 */
	QueryIterator range(Rect rect);

	/**
	 * @return a point of the set closest to the given point; empty iff the set is
	 *         empty
	 */
	Optional<Point> nearest(Point point);

	/**
	 * Finds the k points closest to the given point, in unspecified order. Returns
	 * nothing for k = 0 and the whole set when k is at least {@link #size()}.
	 *
	 * @throws IllegalArgumentException if k is negative
	 */
	QueryIterator nearest(Point point, int k);

	/**
	 * @return a cursor over every point of the set
	 */
	@Override
	QueryIterator iterator();

	default void put(Coordinate coordinate) {
		put(Point.of(coordinate));
	}

	default boolean contains(Coordinate coordinate) {
		return contains(Point.of(coordinate));
	}

	default QueryIterator range(Envelope envelope) {
		return range(Rect.of(envelope));
	}

	default Optional<Point> nearest(Coordinate coordinate) {
		return nearest(Point.of(coordinate));
	}

	default QueryIterator nearest(Coordinate coordinate, int k) {
		return nearest(Point.of(coordinate), k);
	}

	/**
	 * Renders the points as {@code PointSet(p1, p2, ...)}.
	 */
	static String format(Iterable<Point> points) {
		StringBuilder sb = new StringBuilder("PointSet(");
		boolean first = true;
		for (Point p : points) {
			if (!first) {
				sb.append(", ");
			}
			sb.append(p);
			first = false;
		}
		return sb.append(')').toString();
	}
}
