package org.avlset.collect;

import java.util.NoSuchElementException;

/**
 * A stable position in a {@link LinkedSequence}. A position stays valid while other elements are added to or removed from the sequence,
 * so it may be held by another structure (e.g. a tree node) as a reference to its element's place in order.
 * 
 * Each sequence has exactly one {@link #isEnd() end} position, which sits one past the last element and holds no value.
 * 
 * Positions are compared by identity.
 * 
 * @param <E> The type of value in the element
 */
public interface SequenceElement<E> {
	/**
	 * @return The value at this position
	 * @throws NoSuchElementException If this is the end position
	 */
	E get() throws NoSuchElementException;

	/** @return Whether this is the one-past-last position of its sequence */
	boolean isEnd();

	/** @return Whether this element is still linked into its sequence. Always true for the end position. */
	boolean isPresent();

	/**
	 * @return The position following this one, which is the end position if this is the last element
	 * @throws NoSuchElementException If this is the end position
	 * @throws IllegalStateException If this element has been removed from its sequence
	 */
	SequenceElement<E> next() throws NoSuchElementException, IllegalStateException;
}
