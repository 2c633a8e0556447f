package com.github.micycle1.pointset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import com.github.micycle1.pointset.Point.Quadrant;

public class PointTest {

	@Test
	public void testDistance() {
		assertEquals(5, new Point(0, 0).distance(new Point(3, 4)), 1e-12);
		assertEquals(0, new Point(-2, 7).distance(new Point(-2, 7)));
	}

	@Test
	public void testTolerantEquality() {
		assertTrue(new Point(0, 0).tolerantlyEquals(new Point(1e-17, -1e-17)), "Points within epsilon on both axes match.");
		assertFalse(new Point(0, 0).tolerantlyEquals(new Point(1e-10, 0)));
		assertFalse(new Point(0, 0).tolerantlyEquals(new Point(0, 1e-10)));
		assertEquals(0, new Point(0, 0).compareTo(new Point(1e-17, 0)));
	}

	@Test
	public void testEqualsAndHashCodeAreExact() {
		Point p = new Point(0, 0);
		Point near = new Point(1e-17, 0);
		assertNotEquals(p, near, "equals compares exact coordinates");
		assertEquals(0, p.compareTo(near));

		Point same = new Point(0, 0);
		assertEquals(p, same);
		assertEquals(p.hashCode(), same.hashCode());
		assertEquals(new Point(2.5, -7), new Point(2.5, -7));
		assertEquals(new Point(2.5, -7).hashCode(), new Point(2.5, -7).hashCode());

		Set<Point> hashed = new HashSet<>(List.of(p, near));
		assertEquals(2, hashed.size());
		assertTrue(hashed.contains(new Point(0, 0)));
		assertTrue(hashed.contains(new Point(1e-17, 0)));
		assertFalse(hashed.contains(new Point(-1e-17, 0)));
	}

	@Test
	public void testDistanceBetweenFarApartPoints() {
		assertEquals(2e200, new Point(1e200, 0).distance(new Point(-1e200, 0)));
		assertEquals(5e-200, new Point(0, 0).distance(new Point(3e-200, 4e-200)), 1e-212);
	}

	@Test
	public void testLexicographicOrdering() {
		assertTrue(new Point(0, 5).compareTo(new Point(1, 0)) < 0, "x is compared first");
		assertTrue(new Point(1, 0).compareTo(new Point(1, 2)) < 0, "y breaks ties on x");
		assertTrue(new Point(1e-17, 3).compareTo(new Point(0, 2)) > 0, "x within epsilon counts as a tie");

		TreeSet<Point> sorted = new TreeSet<>(List.of(new Point(2, 0), new Point(0, 1), new Point(0, 0), new Point(1e-17, 1e-17)));
		assertEquals(List.of(new Point(0, 0), new Point(0, 1), new Point(2, 0)), List.copyOf(sorted));
	}

	@Test
	public void testQuadrants() {
		Point anchor = new Point(1, 1);
		assertTrue(anchor.inQuadrant(new Point(2, 2), Quadrant.NE));
		assertTrue(anchor.inQuadrant(new Point(0, 2), Quadrant.NW));
		assertTrue(anchor.inQuadrant(new Point(0, 0), Quadrant.SW));
		assertTrue(anchor.inQuadrant(new Point(2, 0), Quadrant.SE));
		assertFalse(anchor.inQuadrant(new Point(2, 0), Quadrant.NE));
		assertFalse(anchor.inQuadrant(new Point(0, 2), Quadrant.SE));

		// closed quadrants: boundary points belong to both sides
		Point onBoundary = new Point(1, 2);
		assertTrue(anchor.inQuadrant(onBoundary, Quadrant.NE));
		assertTrue(anchor.inQuadrant(onBoundary, Quadrant.NW));
		assertFalse(anchor.inQuadrant(onBoundary, Quadrant.SW));
		for (Quadrant q : Quadrant.values()) {
			assertTrue(anchor.inQuadrant(anchor, q), "The anchor lies in every quadrant: " + q);
		}
	}

	@Test
	public void testCoordinateConversion() {
		Point p = Point.of(new Coordinate(3.5, -1));
		assertEquals(3.5, p.x());
		assertEquals(-1, p.y());
		assertEquals(new Coordinate(3.5, -1), p.toCoordinate());
		assertEquals("Point(3.5; -1.0)", p.toString());
	}
}
