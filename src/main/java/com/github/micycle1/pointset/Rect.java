package com.github.micycle1.pointset;

import org.locationtech.jts.geom.Envelope;

import com.github.micycle1.pointset.Point.Quadrant;

/**
 * An immutable axis-aligned rectangle, given by its left-bottom and right-top
 * corners. A single point is a valid (zero-area) rectangle.
 * <p>
 * The left-bottom corner must not exceed the right-top corner on either axis.
 * This is not checked.
 *
 * @author Michael Carleton
 */
public final class Rect {

	private final Envelope env;

	public Rect(Point leftBottom, Point rightTop) {
		this(new Envelope(leftBottom.x(), rightTop.x(), leftBottom.y(), rightTop.y()));
	}

	private Rect(Envelope env) {
		this.env = env;
	}

	public static Rect of(Envelope envelope) {
		return new Rect(new Envelope(envelope));
	}

	/**
	 * @return the zero-area rectangle covering exactly the point
	 */
	public static Rect of(Point point) {
		return new Rect(point, point);
	}

	public double xmin() {
		return env.getMinX();
	}

	public double ymin() {
		return env.getMinY();
	}

	public double xmax() {
		return env.getMaxX();
	}

	public double ymax() {
		return env.getMaxY();
	}

	public Point leftBottom() {
		return new Point(xmin(), ymin());
	}

	public Point rightTop() {
		return new Point(xmax(), ymax());
	}

	/**
	 * Tolerant containment: the point lies NE of the left-bottom corner and SW of
	 * the right-top corner.
	 */
	public boolean contains(Point point) {
		return leftBottom().inQuadrant(point, Quadrant.NE) && rightTop().inQuadrant(point, Quadrant.SW);
	}

	public boolean intersects(Rect other) {
		return env.intersects(other.env);
	}

	/**
	 * Distance from the point to the nearest point of this rectangle; 0 if the
	 * point is contained. Never more than the distance from the point to any point
	 * inside the rectangle.
	 */
	public double distance(Point point) {
		if (contains(point)) {
			return 0;
		}
		Point leftBottom = leftBottom();
		Point rightTop = rightTop();
		if (rightTop.inQuadrant(point, Quadrant.NE)) {
			return rightTop.distance(point);
		}
		if (leftBottom.inQuadrant(point, Quadrant.SW)) {
			return leftBottom.distance(point);
		}
		if (rightTop.inQuadrant(point, Quadrant.SE)) {
			// east band, or the right-bottom corner
			return point.y() > ymin() ? point.x() - xmax() : point.distance(new Point(xmax(), ymin()));
		}
		if (leftBottom.inQuadrant(point, Quadrant.NW)) {
			// west band, or the left-top corner
			return point.y() < ymax() ? xmin() - point.x() : point.distance(new Point(xmin(), ymax()));
		}
		return point.y() > ymax() ? point.y() - ymax() : ymin() - point.y();
	}

	/**
	 * @return the smallest rectangle covering both rectangles
	 */
	public Rect union(Rect other) {
		Envelope merged = new Envelope(env);
		merged.expandToInclude(other.env);
		return new Rect(merged);
	}

	public Envelope toEnvelope() {
		return new Envelope(env);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Rect)) {
			return false;
		}
		return env.equals(((Rect) obj).env);
	}

	@Override
	public int hashCode() {
		return env.hashCode();
	}

	@Override
	public String toString() {
		return "Rect(" + leftBottom() + ", " + rightTop() + ")";
	}
}
