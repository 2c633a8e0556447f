package com.github.micycle1.pointset;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A point set backed by a weight-balanced 2D kd-tree.
 * <p>
 * Nodes split on x at even depths and on y at odd depths. Every node carries
 * the size of its subtree and a bounding rectangle of all the points in it,
 * which range and nearest-neighbour searches use to prune. After an insertion,
 * the topmost node on the insertion path whose left or right subtree holds more
 * than {@link #ALPHA} of its points is flattened and rebuilt as a perfectly
 * balanced subtree (scapegoat rebalancing).
 * <p>
 * Single-nearest search is branch-and-bound; k-nearest search scans every point
 * in order and so is linear in the size of the set.
 *
 * @author Michael Carleton
 */
public class KdPointSet implements PointSet {

	private static final Logger log = LoggerFactory.getLogger(KdPointSet.class);

	/**
	 * Largest fraction of a subtree's points either child may hold.
	 */
	static final double ALPHA = 0.65;

	Node root;

	/**
	 * Creates an empty set.
	 */
	public KdPointSet() {
	}

	/**
	 * Creates a balanced set of the given points. Points equal under tolerant
	 * equality are collapsed.
	 */
	public KdPointSet(Collection<Point> points) {
		TreeSet<Point> distinct = new TreeSet<>(points);
		Node[] nodes = new Node[distinct.size()];
		int i = 0;
		for (Point p : distinct) {
			nodes[i++] = new Node(p);
		}
		root = build(nodes, 0, nodes.length, true);
		if (root != null) {
			root.parent = null;
		}
		log.debug("Built kd-tree of {} points from {} inputs", nodes.length, points.size());
	}

	/**
	 * Creates a deep copy of another set.
	 */
	public KdPointSet(KdPointSet other) {
		root = other.root == null ? null : new Node(other.root);
		if (root != null) {
			setParents(root);
		}
	}

	public static KdPointSet fromFile(Path path) throws IOException {
		return new KdPointSet(PointReader.read(path));
	}

	public static KdPointSet fromReader(Reader reader) throws IOException {
		return new KdPointSet(PointReader.read(reader));
	}

	@Override
	public boolean isEmpty() {
		return root == null;
	}

	@Override
	public int size() {
		return sizeOf(root);
	}

	@Override
	public void put(Point point) {
		Objects.requireNonNull(point, "point");
		if (root == null) {
			root = new Node(point);
			return;
		}

		// Descend to the empty slot for the point.
		Node node = root;
		boolean checkX = true;
		while (true) {
			if (node.point.tolerantlyEquals(point)) {
				return;
			}
			boolean goLeft = less(point, node.point, checkX);
			Node child = goLeft ? node.left : node.right;
			if (child == null) {
				Node leaf = new Node(point);
				leaf.parent = node;
				if (goLeft) {
					node.left = leaf;
				} else {
					node.right = leaf;
				}
				break;
			}
			node = child;
			checkX = !checkX;
		}

		// Ascend to the root, refreshing each ancestor and remembering the topmost
		// one that is out of balance.
		Node scapegoat = null;
		boolean scapegoatCheckX = true;
		for (Node n = node; n != null; n = n.parent) {
			n.updateData();
			if (!n.isBalanced()) {
				scapegoat = n;
				scapegoatCheckX = checkX;
			}
			checkX = !checkX;
		}
		if (scapegoat != null) {
			rebuild(scapegoat, scapegoatCheckX);
		}
	}

	@Override
	public boolean contains(Point point) {
		Objects.requireNonNull(point, "point");
		Node current = root;
		boolean checkX = true;
		while (current != null) {
			if (current.point.tolerantlyEquals(point)) {
				return true;
			}
			current = less(point, current.point, checkX) ? current.left : current.right;
			checkX = !checkX;
		}
		return false;
	}

	@Override
	public QueryIterator range(Rect rect) {
		Objects.requireNonNull(rect, "rect");
		List<Point> result = new ArrayList<>();
		range(root, rect, result);
		return QueryIterator.ofList(result);
	}

	@Override
	public Optional<Point> nearest(Point point) {
		Objects.requireNonNull(point, "point");
		NearestSearch search = new NearestSearch(point);
		search.visit(root);
		return search.best == null ? Optional.empty() : Optional.of(search.best.point);
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
		if (k >= size()) {
			return iterator();
		}

		// Bounded max-heap: the head is the farthest of the k best so far.
		Comparator<Node> byDistance = Comparator.comparingDouble(n -> point.distance(n.point));
		PriorityQueue<Node> heap = new PriorityQueue<>(k, byDistance.reversed());
		Node current = leftmost(root);
		for (int i = 0; i < k; i++) {
			heap.add(current);
			current = successor(current);
		}
		for (; current != null; current = successor(current)) {
			if (byDistance.compare(current, heap.peek()) < 0) {
				heap.poll();
				heap.add(current);
			}
		}

		List<Point> result = new ArrayList<>(k);
		for (Node n : heap) {
			result.add(n.point);
		}
		return QueryIterator.ofList(result);
	}

	/**
	 * @return a cursor visiting every point in in-order (tree) order
	 */
	@Override
	public QueryIterator iterator() {
		return QueryIterator.ofTraversal(leftmost(root));
	}

	@Override
	public String toString() {
		return PointSet.format(this);
	}

	/**
	 * Verifies the structural invariants of the tree: subtree sizes, bounding
	 * rectangles, parent references and the alternating-axis ordering. Each
	 * violation is logged.
	 *
	 * @return true if the tree is consistent
	 */
	public boolean checkConsistency() {
		if (root != null && root.parent != null) {
			log.error("Error: root " + root.point + " has a parent");
			return false;
		}
		return checkConsistency(root, true);
	}

	private static boolean checkConsistency(Node node, boolean checkX) {
		if (node == null) {
			return true;
		}
		int expectedSize = 1 + sizeOf(node.left) + sizeOf(node.right);
		if (node.size != expectedSize) {
			log.error("Error: node " + node.point + " has size " + node.size + ", expected " + expectedSize);
			return false;
		}
		Rect expectedRect = Rect.of(node.point);
		for (Node child : Arrays.asList(node.left, node.right)) {
			if (child == null) {
				continue;
			}
			if (child.parent != node) {
				log.error("Error: child " + child.point + " does not refer back to parent " + node.point);
				return false;
			}
			expectedRect = expectedRect.union(child.rect);
		}
		if (!node.rect.equals(expectedRect)) {
			log.error("Error: node " + node.point + " has bound " + node.rect + ", expected " + expectedRect);
			return false;
		}
		double split = checkX ? node.point.x() : node.point.y();
		if (node.left != null && !((checkX ? node.left.rect.xmax() : node.left.rect.ymax()) < split)) {
			log.error("Error: left subtree of " + node.point + " is not below " + split + " on " + axisName(checkX));
			return false;
		}
		if (node.right != null && (checkX ? node.right.rect.xmin() : node.right.rect.ymin()) < split) {
			log.error("Error: right subtree of " + node.point + " reaches below " + split + " on " + axisName(checkX));
			return false;
		}
		return checkConsistency(node.left, !checkX) && checkConsistency(node.right, !checkX);
	}

	/**
	 * @return true if no node has a child holding more than {@link #ALPHA} of its
	 *         subtree
	 */
	boolean isWeightBalanced() {
		return isWeightBalanced(root);
	}

	private static boolean isWeightBalanced(Node node) {
		if (node == null) {
			return true;
		}
		return node.isBalanced() && isWeightBalanced(node.left) && isWeightBalanced(node.right);
	}

	int height() {
		return height(root);
	}

	private static int height(Node node) {
		return node == null ? 0 : 1 + Math.max(height(node.left), height(node.right));
	}

	/**
	 * Replaces the subtree rooted at the node by a balanced rebuild of the same
	 * nodes, splitting on the axis the subtree root used.
	 */
	private void rebuild(Node subtree, boolean checkX) {
		Node parent = subtree.parent;
		Node[] nodes = new Node[subtree.size];
		flatten(subtree, nodes, 0);
		Node rebuilt = build(nodes, 0, nodes.length, checkX);
		rebuilt.parent = parent;
		if (parent == null) {
			root = rebuilt;
		} else if (parent.left == subtree) {
			parent.left = rebuilt;
		} else {
			parent.right = rebuilt;
		}
		if (log.isDebugEnabled()) {
			log.debug("Rebuilt subtree of " + nodes.length + " nodes splitting on " + axisName(checkX));
		}
	}

	/**
	 * Builds a balanced subtree of nodes[from, to). The nodes are reordered in
	 * place and their children and parent references overwritten; the parent of
	 * the returned root is left for the caller to set.
	 */
	private static Node build(Node[] nodes, int from, int to, boolean checkX) {
		if (from == to) {
			return null;
		}
		Arrays.sort(nodes, from, to, (a, b) -> less(a.point, b.point, checkX) ? -1 : less(b.point, a.point, checkX) ? 1 : 0);
		int median = from + (to - from) / 2;
		// Take the first of a run of nodes tied with the median on this axis, so that
		// the right subtree holds every node not less than it.
		while (median != from && !less(nodes[median - 1].point, nodes[median].point, checkX)) {
			--median;
		}
		Node node = nodes[median];
		node.left = build(nodes, from, median, !checkX);
		node.right = build(nodes, median + 1, to, !checkX);
		if (node.left != null) {
			node.left.parent = node;
		}
		if (node.right != null) {
			node.right.parent = node;
		}
		node.updateData();
		return node;
	}

	/**
	 * Writes the subtree's nodes in in-order into the array from index i.
	 *
	 * @return the index after the last node written
	 */
	private static int flatten(Node node, Node[] into, int i) {
		if (node == null) {
			return i;
		}
		i = flatten(node.left, into, i);
		into[i++] = node;
		return flatten(node.right, into, i);
	}

	private static void setParents(Node node) {
		if (node.left != null) {
			node.left.parent = node;
			setParents(node.left);
		}
		if (node.right != null) {
			node.right.parent = node;
			setParents(node.right);
		}
	}

	private static void range(Node node, Rect rect, List<Point> result) {
		if (node == null || !node.rect.intersects(rect)) {
			return;
		}
		if (rect.contains(node.point)) {
			result.add(node.point);
		}
		if (node.left != null && node.left.rect.intersects(rect)) {
			range(node.left, rect, result);
		}
		if (node.right != null && node.right.rect.intersects(rect)) {
			range(node.right, rect, result);
		}
	}

	static Node leftmost(Node node) {
		if (node == null) {
			return null;
		}
		while (node.left != null) {
			node = node.left;
		}
		return node;
	}

	/**
	 * @return the in-order successor of the node, or null if it is the last
	 */
	static Node successor(Node node) {
		if (node.right != null) {
			return leftmost(node.right);
		}
		Node child = node;
		Node parent = node.parent;
		while (parent != null && parent.right == child) {
			child = parent;
			parent = parent.parent;
		}
		return parent;
	}

	private static boolean less(Point a, Point b, boolean checkX) {
		return checkX ? a.x() < b.x() : a.y() < b.y();
	}

	private static int sizeOf(Node node) {
		return node == null ? 0 : node.size;
	}

	private static String axisName(boolean checkX) {
		return checkX ? "x" : "y";
	}

	/**
	 * A tree node. It owns its children; the parent reference is only used to walk
	 * the tree in order.
	 */
	static final class Node {
		final Point point;
		/**
		 * Bound of this node's point and every point below it.
		 */
		Rect rect;
		int size = 1;
		Node left;
		Node right;
		Node parent;

		Node(Point point) {
			this.point = point;
			this.rect = Rect.of(point);
		}

		/**
		 * Deep copy of the subtree, without parent references.
		 */
		Node(Node other) {
			this.point = other.point;
			this.rect = other.rect;
			this.size = other.size;
			this.left = other.left == null ? null : new Node(other.left);
			this.right = other.right == null ? null : new Node(other.right);
		}

		/**
		 * Recomputes size and bound from the children.
		 */
		void updateData() {
			size = 1 + sizeOf(left) + sizeOf(right);
			Rect bound = Rect.of(point);
			if (left != null) {
				bound = bound.union(left.rect);
			}
			if (right != null) {
				bound = bound.union(right.rect);
			}
			rect = bound;
		}

		boolean isBalanced() {
			return sizeOf(left) <= ALPHA * size && sizeOf(right) <= ALPHA * size;
		}

		@Override
		public String toString() {
			return "Node(" + point + ", size=" + size + ", " + rect + ")";
		}
	}

	private static final class NearestSearch {
		final Point query;
		double bestDistance = Double.POSITIVE_INFINITY;
		Node best;

		NearestSearch(Point query) {
			this.query = query;
		}

		void visit(Node node) {
			if (node == null || (best != null && node.rect.distance(query) >= bestDistance)) {
				return;
			}
			double d = query.distance(node.point);
			if (d < bestDistance) {
				bestDistance = d;
				best = node;
			}
			visit(node.left);
			visit(node.right);
		}
	}
}
