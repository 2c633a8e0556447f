package com.github.micycle1.pointset;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import com.github.micycle1.pointset.KdPointSet.Node;

/**
 * A lazy, single-pass, forward-only cursor over the result of a point set
 * query.
 * <p>
 * A cursor is backed either by an in-order traversal of a kd-tree, stepping
 * from node to successor through child and parent links, or by a list of
 * already collected matches that is consumed from its end. The order of a
 * list-backed cursor is unspecified. Either way an exhausted cursor simply
 * reports {@code hasNext() == false}.
 * <p>
 * A cursor over a {@link KdPointSet} is invalidated by any later
 * {@link PointSet#put(Point) put}.
 *
 * @author Michael Carleton
 */
public final class QueryIterator implements Iterator<Point> {

	private final List<Point> pending; // non-null for a list-backed cursor
	private Node current; // next node of a traversal cursor; null once exhausted

	private QueryIterator(List<Point> pending, Node current) {
		this.pending = pending;
		this.current = current;
	}

	static QueryIterator empty() {
		return new QueryIterator(new ArrayList<>(0), null);
	}

	/**
	 * @param matches the matches, taken over by the cursor and consumed from the
	 *                last element backwards
	 */
	static QueryIterator ofList(List<Point> matches) {
		return new QueryIterator(matches, null);
	}

	/**
	 * @param first the first node of the in-order traversal, or null for an empty
	 *              traversal
	 */
	static QueryIterator ofTraversal(Node first) {
		return new QueryIterator(null, first);
	}

	@Override
	public boolean hasNext() {
		return pending != null ? !pending.isEmpty() : current != null;
	}

	/**
	 * Returns the element {@link #next()} would return, without advancing.
	 *
	 * @throws NoSuchElementException if the cursor is exhausted
	 */
	public Point peek() {
		if (!hasNext()) {
			throw new NoSuchElementException();
		}
		return pending != null ? pending.get(pending.size() - 1) : current.point;
	}

	@Override
	public Point next() {
		Point point = peek();
		if (pending != null) {
			pending.remove(pending.size() - 1);
		} else {
			current = KdPointSet.successor(current);
		}
		return point;
	}

	/**
	 * Drains the remaining elements into a list.
	 */
	public List<Point> toList() {
		List<Point> result = new ArrayList<>();
		forEachRemaining(result::add);
		return result;
	}
}
