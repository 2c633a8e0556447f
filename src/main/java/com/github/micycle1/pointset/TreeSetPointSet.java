package com.github.micycle1.pointset;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.TreeSet;

/**
 * A point set over a {@link TreeSet} ordered by {@link Point}'s tolerant
 * ordering. Range and nearest-neighbour queries scan every point.
 *
 * @author Michael Carleton
 */
public class TreeSetPointSet implements PointSet {

	private final TreeSet<Point> points;

	public TreeSetPointSet() {
		points = new TreeSet<>();
	}

	public TreeSetPointSet(Collection<Point> points) {
		this.points = new TreeSet<>(points);
	}

	public static TreeSetPointSet fromFile(Path path) throws IOException {
		return new TreeSetPointSet(PointReader.read(path));
	}

	public static TreeSetPointSet fromReader(Reader reader) throws IOException {
		return new TreeSetPointSet(PointReader.read(reader));
	}

	@Override
	public boolean isEmpty() {
		return points.isEmpty();
	}

	@Override
	public int size() {
		return points.size();
	}

	@Override
	public void put(Point point) {
		points.add(Objects.requireNonNull(point, "point"));
	}

	@Override
	public boolean contains(Point point) {
		return points.contains(Objects.requireNonNull(point, "point"));
	}

	@Override
	public QueryIterator range(Rect rect) {
		Objects.requireNonNull(rect, "rect");
		List<Point> result = new ArrayList<>();
		for (Point p : points) {
			if (rect.contains(p)) {
				result.add(p);
			}
		}
		return QueryIterator.ofList(result);
	}

	@Override
	public Optional<Point> nearest(Point point) {
		Objects.requireNonNull(point, "point");
		return points.stream().min(Comparator.comparingDouble(point::distance));
	}

	@Override
	public QueryIterator nearest(Point point, int k) {
		Objects.requireNonNull(point, "point");
		if (k < 0) {
			throw new IllegalArgumentException("k must not be negative: " + k);
		}
		if (k == 0) {
			return QueryIterator.empty();
		}
		if (k >= points.size()) {
			return iterator();
		}
		Comparator<Point> byDistance = Comparator.comparingDouble(point::distance);
		PriorityQueue<Point> heap = new PriorityQueue<>(k, byDistance.reversed());
		Iterator<Point> it = points.iterator();
		for (int i = 0; i < k; i++) {
			heap.add(it.next());
		}
		while (it.hasNext()) {
			Point p = it.next();
			if (byDistance.compare(p, heap.peek()) < 0) {
				heap.poll();
				heap.add(p);
			}
		}
		return QueryIterator.ofList(new ArrayList<>(heap));
	}

	/**
	 * @return a cursor over the points in ascending order
	 */
	@Override
	public QueryIterator iterator() {
		// consumed from the end, so hand over in descending order
		return QueryIterator.ofList(new ArrayList<>(points.descendingSet()));
	}

	@Override
	public String toString() {
		return PointSet.format(this);
	}
}
