package com.github.micycle1.pointset;

import org.locationtech.jts.geom.Coordinate;

/**
 * An immutable 2D point.
 * <p>
 * Ordering is tolerant: coordinates that differ by less than {@link #EPS} on an
 * axis are treated as equal on that axis. Ordering is
 * lexicographic, x first and y second. Because tolerant equality is not
 * transitive, the ordering is only a strict weak ordering away from inputs that
 * sit on an epsilon boundary.
 * <p>
 * {@link #equals(Object)} and {@link #hashCode()} compare exact coordinates;
 * ordered collections, which go through {@link #compareTo(Point)}, see the
 * tolerant equality.
 *
 * @author Michael Carleton
 */
public final class Point implements Comparable<Point> {

	/**
	 * Machine epsilon for doubles.
	 */
	public static final double EPS = Math.ulp(1.0);

	private final double x;
	private final double y;

	public Point(double x, double y) {
		this.x = x;
		this.y = y;
	}

	public static Point of(Coordinate coordinate) {
		return new Point(coordinate.x, coordinate.y);
	}

	public double x() {
		return x;
	}

	public double y() {
		return y;
	}

	/**
	 * @return the Euclidean distance to the other point
	 */
	public double distance(Point other) {
		return Math.hypot(x - other.x, y - other.y);
	}

	/**
	 * Tests whether the other point lies in the given closed quadrant anchored at
	 * this point. Points on the quadrant boundary (within {@link #EPS}) count as
	 * inside.
	 *
	 * @param other the point to classify
	 * @param quad  the quadrant, relative to this point
	 * @return true if other lies in quad
	 */
	public boolean inQuadrant(Point other, Quadrant quad) {
		switch (quad) {
			case NE:
				return other.x > x - EPS && other.y > y - EPS;
			case NW:
				return other.x < x + EPS && other.y > y - EPS;
			case SW:
				return other.x < x + EPS && other.y < y + EPS;
			case SE:
				return other.x > x - EPS && other.y < y + EPS;
			default:
				return false;
		}
	}

	public Coordinate toCoordinate() {
		return new Coordinate(x, y);
	}

	boolean lessThan(Point other) {
		return x < other.x || (Math.abs(x - other.x) < EPS && y < other.y);
	}

	/**
	 * @return true if both coordinates are within {@link #EPS} of the other's
	 */
	boolean tolerantlyEquals(Point other) {
		return Math.abs(x - other.x) < EPS && Math.abs(y - other.y) < EPS;
	}

	@Override
	public int compareTo(Point other) {
		if (tolerantlyEquals(other)) {
			return 0;
		}
		return lessThan(other) ? -1 : 1;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Point)) {
			return false;
		}
		Point other = (Point) obj;
		return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0;
	}

	@Override
	public int hashCode() {
		return 31 * Double.hashCode(x) + Double.hashCode(y);
	}

	@Override
	public String toString() {
		return "Point(" + x + "; " + y + ")";
	}

	/**
	 * Closed quadrants around an anchor point. NE, NW, SW and SE are the first,
	 * second, third and fourth quadrants respectively.
	 */
	public enum Quadrant {
		NE, NW, SW, SE
	}
}
