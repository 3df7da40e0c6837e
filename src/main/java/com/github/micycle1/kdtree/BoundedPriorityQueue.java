package com.github.micycle1.kdtree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * A fixed-capacity list kept in ascending order.
 * <p>
 * Used by {@link KDTree#knnSearch} to hold the best k candidates seen so far.
 * Each {@link #push(Object) push} does an insertion-sort step (O(bound)) and
 * then drops whatever falls beyond the bound, so the worst retained element is
 * always {@link #back()}.
 *
 * @param <T> the element type
 */
public class BoundedPriorityQueue<T> {

	private final int bound;
	private final Comparator<? super T> comparator;
	private final List<T> elements;

	/**
	 * @param bound      maximum number of retained elements, must be positive
	 * @param comparator ordering of the elements, smallest first
	 */
	public BoundedPriorityQueue(int bound, Comparator<? super T> comparator) {
		if (bound <= 0) {
			throw new IllegalArgumentException("Queue bound must be positive, got " + bound);
		}
		this.bound = bound;
		this.comparator = Objects.requireNonNull(comparator, "comparator");
		this.elements = new ArrayList<>(Math.min(bound, 1024) + 1);
	}

	/**
	 * Creates a queue ordered by the elements' natural ordering.
	 */
	public static <T extends Comparable<? super T>> BoundedPriorityQueue<T> of(int bound) {
		return new BoundedPriorityQueue<>(bound, Comparator.naturalOrder());
	}

	/**
	 * Inserts a value immediately before the first element that is strictly
	 * greater than it (an upper-bound insertion point), so among equal elements the
	 * newest comes last rather than first. If the queue then exceeds its bound the
	 * last element is discarded.
	 *
	 * @param value the value to insert
	 * @return true if the value is still in the queue after truncation
	 */
	public boolean push(T value) {
		Objects.requireNonNull(value, "value");
		int position = elements.size();
		for (int i = 0; i < elements.size(); i++) {
			if (comparator.compare(value, elements.get(i)) < 0) {
				position = i;
				break;
			}
		}
		elements.add(position, value);

		if (elements.size() > bound) {
			elements.remove(elements.size() - 1);
		}
		return position < bound;
	}

	/**
	 * @return the worst (last) retained element
	 * @throws NoSuchElementException if the queue is empty
	 */
	public T back() {
		if (elements.isEmpty()) {
			throw new NoSuchElementException("Queue is empty.");
		}
		return elements.get(elements.size() - 1);
	}

	public T get(int index) {
		return elements.get(index);
	}

	public int size() {
		return elements.size();
	}

	public boolean isEmpty() {
		return elements.isEmpty();
	}

	/**
	 * @return true once the queue holds {@link #bound()} elements
	 */
	public boolean isFull() {
		return elements.size() >= bound;
	}

	public int bound() {
		return bound;
	}

	/**
	 * @return an unmodifiable snapshot of the elements in ascending order
	 */
	public List<T> toList() {
		return Collections.unmodifiableList(new ArrayList<>(elements));
	}

	@Override
	public String toString() {
		return "BoundedPriorityQueue(bound=" + bound + "): " + elements;
	}
}
