package com.github.micycle1.kdtree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A static k-d tree over a fixed set of points.
 * <p>
 * The tree is built once from a list of points by recursively splitting the
 * point indices at the lower median of an axis that cycles with depth. The
 * result is balanced regardless of input order. It then answers nearest
 * neighbour, k-nearest neighbour, radius and (two-dimensional) window queries by
 * branch-and-bound descent.
 * <p>
 * Results are reported as indices into the list given to {@link #build(List)}.
 * Queries only read state that is fixed after a build and may run concurrently;
 * {@link #build(List)} itself must not race with queries.
 *
 * @param <P> the point type
 * @author Michael Carleton
 */
public class KDTree<P extends KdPoint> {

	private static final Logger LOG = LoggerFactory.getLogger(KDTree.class);

	Node root;
	private List<P> points;
	private double[] coords; // owned copy, row-major: coords[index * dimension + axis]
	private int dimension;

	/**
	 * Creates an empty tree. Every query on it returns an empty result.
	 */
	public KDTree() {
		this.root = null;
		this.points = Collections.emptyList();
		this.coords = new double[0];
		this.dimension = 0;
	}

	/**
	 * Creates a tree over the given points.
	 *
	 * @param points the points to index; may be empty
	 */
	public KDTree(List<? extends P> points) {
		this();
		build(points);
	}

	/**
	 * Discards the current tree and builds a new one over the given points. The
	 * coordinates are copied, so later changes to the point objects do not affect
	 * the tree.
	 *
	 * @param points the points to index; may be empty
	 * @throws DimensionMismatchException if the points do not share one dimension
	 * @throws IllegalArgumentException   if a coordinate is NaN
	 */
	public void build(List<? extends P> points) {
		List<P> copy = List.copyOf(Objects.requireNonNull(points, "points"));
		int n = copy.size();
		int d = n == 0 ? 0 : copy.get(0).dimension();
		if (n > 0 && d < 1) {
			throw new IllegalArgumentException("Point dimension must be positive, got " + d);
		}

		double[] c = new double[n * d];
		for (int i = 0; i < n; i++) {
			P p = copy.get(i);
			if (p.dimension() != d) {
				throw new DimensionMismatchException(d, p.dimension());
			}
			for (int axis = 0; axis < d; axis++) {
				double v = p.getCoordinate(axis);
				if (Double.isNaN(v)) {
					throw new IllegalArgumentException("Point " + i + " has a NaN coordinate on axis " + axis);
				}
				c[i * d + axis] = v;
			}
		}

		int[] indices = new int[n];
		for (int i = 0; i < n; i++) {
			indices[i] = i;
		}
		Node newRoot = buildRecursive(c, d, indices, 0, n, 0);

		// swap in only once the new tree is complete
		this.coords = c;
		this.dimension = d;
		this.points = copy;
		this.root = newRoot;

		if (LOG.isDebugEnabled()) {
			LOG.debug("Built k-d tree over {} points (dimension {}, height {})", n, d, height());
		}
	}

	/**
	 * Builds the subtree over {@code indices[lo, hi)}.
	 */
	private static Node buildRecursive(double[] c, int d, int[] indices, int lo, int hi, int depth) {
		if (hi <= lo) {
			return null;
		}
		final int axis = depth % d;
		final int mid = lo + (hi - lo - 1) / 2;

		select(c, d, indices, lo, hi, mid, axis);

		Node left = buildRecursive(c, d, indices, lo, mid, depth + 1);
		Node right = buildRecursive(c, d, indices, mid + 1, hi, depth + 1);
		return new Node(indices[mid], axis, left, right);
	}

	/**
	 * Partially orders {@code indices[lo, hi)} by coordinate on {@code axis} so
	 * that position {@code nth} holds the element a full sort would put there, no
	 * element before it is greater and no element after it is smaller
	 * (quickselect with a three-way partition, so runs of equal keys stay cheap).
	 */
	private static void select(double[] c, int d, int[] indices, int lo, int hi, int nth, int axis) {
		int left = lo;
		int right = hi - 1;
		while (right > left) {
			final double pivot = c[indices[(left + right) >>> 1] * d + axis];
			int lt = left;
			int i = left;
			int gt = right;
			while (i <= gt) {
				double v = c[indices[i] * d + axis];
				if (v < pivot) {
					swap(indices, lt++, i++);
				} else if (v > pivot) {
					swap(indices, i, gt--);
				} else {
					i++;
				}
			}
			// [left, lt) < pivot, [lt, gt] == pivot, (gt, right] > pivot
			if (nth < lt) {
				right = lt - 1;
			} else if (nth > gt) {
				left = gt + 1;
			} else {
				return;
			}
		}
	}

	private static void swap(int[] a, int i, int j) {
		int t = a[i];
		a[i] = a[j];
		a[j] = t;
	}

	/**
	 * Checks the partition property one level deep at every node that has two
	 * children: the pivot coordinate on the node's axis is not less than the left
	 * child's and not greater than the right child's.
	 *
	 * @return true if every node satisfies the property (an empty tree does)
	 */
	public boolean validate() {
		return validateRecursive(root);
	}

	private boolean validateRecursive(Node node) {
		if (node == null) {
			return true;
		}
		final int axis = node.axis;
		if (node.left != null && node.right != null) {
			double pivot = coordinate(node.index, axis);
			if (pivot < coordinate(node.left.index, axis) || pivot > coordinate(node.right.index, axis)) {
				LOG.warn("Partition violated at point {} on axis {}", node.index, axis);
				return false;
			}
		}
		return validateRecursive(node.left) && validateRecursive(node.right);
	}

	/**
	 * Finds the point closest to {@code query} (Euclidean distance). If several
	 * points are equally close, the first one met during the descent is returned.
	 *
	 * @param query the query point
	 * @return the nearest point's index and distance, or {@link Neighbor#NONE} if
	 *         the tree is empty
	 * @throws DimensionMismatchException if the query dimension differs from the
	 *                                    tree's
	 * @throws IllegalArgumentException   if a query coordinate is NaN or infinite
	 */
	public Neighbor nnSearch(KdPoint query) {
		Objects.requireNonNull(query, "query");
		if (root == null) {
			return Neighbor.NONE;
		}
		double[] q = toArray(query);
		NearestCandidate best = new NearestCandidate();
		nnSearchRecursive(q, root, best);
		return new Neighbor(best.index, best.distance);
	}

	/**
	 * Convenience form of {@link #nnSearch(KdPoint)} that returns the point object
	 * itself.
	 *
	 * @param query the query point
	 * @return the nearest point, or empty if the tree is empty
	 */
	public Optional<P> nearest(KdPoint query) {
		Neighbor n = nnSearch(query);
		return n.isFound() ? Optional.of(points.get(n.getIndex())) : Optional.empty();
	}

	private void nnSearchRecursive(double[] query, Node node, NearestCandidate best) {
		if (node == null) {
			return;
		}

		final double dist = distance(query, node.index);
		// the first node is always taken, distances may all be infinite
		if (best.index < 0 || dist < best.distance) {
			best.distance = dist;
			best.index = node.index;
		}

		final int axis = node.axis;
		final double diff = query[axis] - coordinate(node.index, axis);
		final Node near = diff < 0 ? node.left : node.right;
		final Node far = diff < 0 ? node.right : node.left;

		nnSearchRecursive(query, near, best);
		if (Math.abs(diff) < best.distance) {
			nnSearchRecursive(query, far, best);
		}
	}

	/**
	 * Finds the {@code k} points closest to {@code query}.
	 *
	 * @param query the query point
	 * @param k     number of neighbours wanted, must be positive
	 * @return up to {@code min(k, size())} indices, closest first; equally distant
	 *         points are ordered by ascending index
	 * @throws IllegalArgumentException if {@code k <= 0} or a query coordinate is
	 *                                  NaN or infinite
	 */
	public List<Integer> knnSearch(KdPoint query, int k) {
		List<Neighbor> neighbors = knnNeighbors(query, k);
		List<Integer> indices = new ArrayList<>(neighbors.size());
		for (Neighbor n : neighbors) {
			indices.add(n.getIndex());
		}
		return indices;
	}

	/**
	 * As {@link #knnSearch(KdPoint, int)}, but keeps the distance of each
	 * neighbour.
	 *
	 * @param query the query point
	 * @param k     number of neighbours wanted, must be positive
	 * @return up to {@code min(k, size())} neighbours, closest first
	 */
	public List<Neighbor> knnNeighbors(KdPoint query, int k) {
		Objects.requireNonNull(query, "query");
		if (k <= 0) {
			throw new IllegalArgumentException("k must be positive, got " + k);
		}
		if (root == null) {
			return Collections.emptyList();
		}
		double[] q = toArray(query);
		BoundedPriorityQueue<Neighbor> queue = BoundedPriorityQueue.of(k);
		knnSearchRecursive(q, root, queue);
		return queue.toList();
	}

	private void knnSearchRecursive(double[] query, Node node, BoundedPriorityQueue<Neighbor> queue) {
		if (node == null) {
			return;
		}

		queue.push(new Neighbor(node.index, distance(query, node.index)));

		final int axis = node.axis;
		final double diff = query[axis] - coordinate(node.index, axis);
		final Node near = diff < 0 ? node.left : node.right;
		final Node far = diff < 0 ? node.right : node.left;

		knnSearchRecursive(query, near, queue);
		if (!queue.isFull() || Math.abs(diff) < queue.back().getDistance()) {
			knnSearchRecursive(query, far, queue);
		}
	}

	/**
	 * Finds every point whose distance to {@code query} is strictly less than
	 * {@code radius}.
	 *
	 * @param query  the query point
	 * @param radius search radius, non-negative
	 * @return the matching indices, in no particular order
	 * @throws IllegalArgumentException if the radius is negative or NaN, or a
	 *                                  query coordinate is NaN or infinite
	 */
	public List<Integer> rangeSearch(KdPoint query, double radius) {
		Objects.requireNonNull(query, "query");
		if (!(radius >= 0)) {
			throw new IllegalArgumentException("Radius must be non-negative, got " + radius);
		}
		List<Integer> results = new ArrayList<>();
		if (root == null) {
			return results;
		}
		double[] q = toArray(query);
		rangeSearchRecursive(q, root, radius, results);
		return results;
	}

	private void rangeSearchRecursive(double[] query, Node node, double radius, List<Integer> results) {
		if (node == null) {
			return;
		}

		if (distance(query, node.index) < radius) {
			results.add(node.index);
		}

		final int axis = node.axis;
		final double diff = query[axis] - coordinate(node.index, axis);
		final Node near = diff < 0 ? node.left : node.right;
		final Node far = diff < 0 ? node.right : node.left;

		rangeSearchRecursive(query, near, radius, results);
		if (Math.abs(diff) < radius) {
			rangeSearchRecursive(query, far, radius, results);
		}
	}

	/**
	 * Finds every point whose first two coordinates lie within the given window
	 * (bounds inclusive). Higher coordinates are ignored.
	 *
	 * @param window the search region
	 * @return the matching indices, in no particular order
	 * @throws DimensionMismatchException if the tree holds points of fewer than two
	 *                                    dimensions
	 * @throws IllegalArgumentException   if a window bound is NaN
	 */
	public List<Integer> search(Envelope window) {
		Objects.requireNonNull(window, "window");
		List<Integer> results = new ArrayList<>();
		if (root == null || window.isNull()) {
			return results;
		}
		if (dimension < 2) {
			throw new DimensionMismatchException(2, dimension);
		}
		if (Double.isNaN(window.getMinX()) || Double.isNaN(window.getMaxX()) || Double.isNaN(window.getMinY())
				|| Double.isNaN(window.getMaxY())) {
			throw new IllegalArgumentException("Window has a NaN bound: " + window);
		}
		search(root, window, results);
		return results;
	}

	private void search(Node node, Envelope window, List<Integer> results) {
		if (node == null) {
			return;
		}
		final double x = coordinate(node.index, 0);
		final double y = coordinate(node.index, 1);
		if (window.contains(x, y)) {
			results.add(node.index);
		}

		// equal keys may sit on either side of the pivot, hence the inclusive tests
		boolean goLeft = true;
		boolean goRight = true;
		if (node.axis == 0) {
			goLeft = window.getMinX() <= x;
			goRight = window.getMaxX() >= x;
		} else if (node.axis == 1) {
			goLeft = window.getMinY() <= y;
			goRight = window.getMaxY() >= y;
		}
		if (goLeft) {
			search(node.left, window, results);
		}
		if (goRight) {
			search(node.right, window, results);
		}
	}

	/**
	 * @return the number of indexed points
	 */
	public int size() {
		return points.size();
	}

	public boolean isEmpty() {
		return root == null;
	}

	/**
	 * @return the dimension of the indexed points, or 0 for an empty tree
	 */
	public int dimension() {
		return dimension;
	}

	/**
	 * @param index a point index, as returned by the queries
	 * @return the point given to {@link #build(List)} at that position
	 */
	public P getPoint(int index) {
		return points.get(index);
	}

	/**
	 * @return the number of nodes on the longest root-to-leaf path (0 when empty)
	 */
	public int height() {
		return height(root);
	}

	private static int height(Node node) {
		if (node == null) {
			return 0;
		}
		return 1 + Math.max(height(node.left), height(node.right));
	}

	private double coordinate(int index, int axis) {
		return coords[index * dimension + axis];
	}

	private double distance(double[] query, int index) {
		final int offset = index * dimension;
		double dist = 0;
		for (int axis = 0; axis < dimension; axis++) {
			double delta = query[axis] - coords[offset + axis];
			dist += delta * delta;
		}
		return Math.sqrt(dist);
	}

	private double[] toArray(KdPoint query) {
		if (query.dimension() != dimension) {
			throw new DimensionMismatchException(dimension, query.dimension());
		}
		double[] q = new double[dimension];
		for (int axis = 0; axis < dimension; axis++) {
			double v = query.getCoordinate(axis);
			if (!Double.isFinite(v)) {
				throw new IllegalArgumentException("Query coordinate on axis " + axis + " is not finite: " + v);
			}
			q[axis] = v;
		}
		return q;
	}

	/* ===================== Supporting Classes ==================== */

	/**
	 * A tree node: the index of its pivot point, the splitting axis
	 * ({@code depth % dimension}) and its two optional subtrees. Points with a
	 * smaller or equal coordinate on the axis are in {@code left}, points with a
	 * greater or equal one in {@code right}.
	 */
	static final class Node {
		final int index;
		final int axis;
		final Node left;
		final Node right;

		Node(int index, int axis, Node left, Node right) {
			this.index = index;
			this.axis = axis;
			this.left = left;
			this.right = right;
		}

		@Override
		public String toString() {
			return "Node(index=" + index + ", axis=" + axis + ")";
		}
	}

	/**
	 * A query result: a point index and its distance to the query point. Ordered by
	 * distance, then by index.
	 */
	public static final class Neighbor implements Comparable<Neighbor> {

		/**
		 * Returned by {@link KDTree#nnSearch(KdPoint)} on an empty tree.
		 */
		public static final Neighbor NONE = new Neighbor(-1, Double.POSITIVE_INFINITY);

		private final int index;
		private final double distance;

		public Neighbor(int index, double distance) {
			this.index = index;
			this.distance = distance;
		}

		public int getIndex() {
			return index;
		}

		public double getDistance() {
			return distance;
		}

		/**
		 * @return false for {@link #NONE}
		 */
		public boolean isFound() {
			return index >= 0;
		}

		@Override
		public int compareTo(Neighbor other) {
			int c = Double.compare(distance, other.distance);
			return c != 0 ? c : Integer.compare(index, other.index);
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) {
				return true;
			}
			if (!(o instanceof Neighbor)) {
				return false;
			}
			Neighbor other = (Neighbor) o;
			return index == other.index && Double.compare(distance, other.distance) == 0;
		}

		@Override
		public int hashCode() {
			return 31 * Integer.hashCode(index) + Double.hashCode(distance);
		}

		@Override
		public String toString() {
			return "Neighbor(index=" + index + ", distance=" + distance + ")";
		}
	}

	// best-so-far holder for the nearest neighbour descent
	private static final class NearestCandidate {
		int index = -1;
		double distance = Double.POSITIVE_INFINITY;
	}

}
