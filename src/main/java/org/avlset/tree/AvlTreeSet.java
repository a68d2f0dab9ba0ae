package org.avlset.tree;

import java.util.AbstractSet;
import java.util.Comparator;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;

import org.apache.log4j.Logger;
import org.avlset.collect.SequenceElement;

import com.google.common.collect.Ordering;

/**
 * <p>
 * A {@link java.util.Set} of distinct values kept in ascending order by an {@link AvlTree}. Membership, insertion, removal and
 * {@link #lowerBound(Object) lower-bound} searches take logarithmic time. Iteration walks a linked sequence that mirrors the tree's
 * order, so each step is constant-time.
 * </p>
 * <p>
 * Two values are the same element of the set when neither is less than the other according to the set's comparator, regardless of
 * {@link Object#equals(Object)}.
 * </p>
 * <p>
 * This class is not thread-safe. Its iterators fail fast when the set is modified other than through the iterator.
 * </p>
 * 
 * @param <E> The type of values in the set
 */
public class AvlTreeSet<E> extends AbstractSet<E> {
	private static final Logger log = Logger.getLogger(AvlTreeSet.class);

	private final AvlTree<E> theTree;
	private int theSize;

	/** @param compare The ordering for the set's values */
	public AvlTreeSet(Comparator<? super E> compare) {
		theTree = new AvlTree<>(compare);
	}

	/**
	 * @param compare The ordering for the set's values
	 * @param values The initial values for the set. Duplicates are ignored.
	 */
	public AvlTreeSet(Comparator<? super E> compare, Iterable<? extends E> values) {
		this(compare, values.iterator());
	}

	/**
	 * @param compare The ordering for the set's values
	 * @param values The initial values for the set, consumed to exhaustion. Duplicates are ignored.
	 */
	public AvlTreeSet(Comparator<? super E> compare, Iterator<? extends E> values) {
		this(compare);
		while (values.hasNext())
			insert(values.next());
	}

	/**
	 * Creates an independent copy of a set, with the same ordering and values
	 * 
	 * @param other The set to copy
	 */
	public AvlTreeSet(AvlTreeSet<E> other) {
		this(other.comparator(), other.iterator());
		if (log.isDebugEnabled())
			log.debug("Copied set of " + theSize + " values");
	}

	/**
	 * @param <E> The type of values for the set
	 * @return An empty set ordered by its values' natural ordering
	 */
	public static <E extends Comparable<? super E>> AvlTreeSet<E> natural() {
		return new AvlTreeSet<>(Ordering.<E> natural());
	}

	/**
	 * @param <E> The type of values for the set
	 * @param values The values for the set. Duplicates are ignored.
	 * @return A set of the given values, ordered by their natural ordering
	 */
	@SafeVarargs
	public static <E extends Comparable<? super E>> AvlTreeSet<E> of(E... values) {
		AvlTreeSet<E> set = natural();
		for (E value : values)
			set.insert(value);
		return set;
	}

	/** @return The ordering of this set's values */
	public Comparator<? super E> comparator() {
		return theTree.comparator();
	}

	/** @return An independent copy of this set */
	public AvlTreeSet<E> copy() {
		return new AvlTreeSet<>(this);
	}

	/**
	 * Replaces this set's content with that of another set. This set keeps its own ordering.
	 * 
	 * @param other The set whose values to copy into this set
	 * @return This set
	 */
	public AvlTreeSet<E> assign(AvlTreeSet<? extends E> other) {
		if (other == this)
			return this;
		clear();
		for (E value : other)
			insert(value);
		if (log.isDebugEnabled())
			log.debug("Assigned " + theSize + " values");
		return this;
	}

	@Override
	public int size() {
		return theSize;
	}

	@Override
	public boolean isEmpty() {
		return theSize == 0;
	}

	/**
	 * @param value The value to add
	 * @return Whether the value was added, false if an equal value was already present
	 */
	public boolean insert(E value) {
		if (!theTree.insert(value))
			return false;
		theSize++;
		return true;
	}

	/**
	 * @param value The value to remove
	 * @return Whether an equal value was present and removed
	 */
	public boolean erase(E value) {
		if (!theTree.erase(value))
			return false;
		theSize--;
		return true;
	}

	@Override
	public boolean add(E e) {
		return insert(e);
	}

	@Override
	public boolean remove(Object o) {
		return erase((E) o);
	}

	@Override
	public boolean contains(Object o) {
		return !find((E) o).isEnd();
	}

	@Override
	public void clear() {
		theTree.clear();
		theSize = 0;
	}

	/**
	 * @param value The value to search for
	 * @return The position of the equal value in this set, or {@link #end()} if there is none
	 */
	public SequenceElement<E> find(E value) {
		return theTree.search(value);
	}

	/**
	 * @param value The value to search for
	 * @return The position of the least value in this set that is not less than the given one, or {@link #end()} if there is none
	 */
	public SequenceElement<E> lowerBound(E value) {
		return theTree.lowerBound(value);
	}

	/** @return The position of the least value in this set, or {@link #end()} if the set is empty */
	public SequenceElement<E> begin() {
		return theTree.begin();
	}

	/** @return The position one past the greatest value in this set */
	public SequenceElement<E> end() {
		return theTree.end();
	}

	@Override
	public Iterator<E> iterator() {
		return new Itr();
	}

	/** @return The height of the tree backing this set, 0 if the set is empty */
	public int height() {
		return theTree.height();
	}

	/**
	 * Runs debugging checks on this set's structures
	 * 
	 * @throws IllegalStateException If any internal constraint is violated
	 */
	public void checkValid() throws IllegalStateException {
		theTree.checkValid();
		if (theSize != theTree.size())
			throw new IllegalStateException("Size " + theSize + " does not match tree size " + theTree.size());
	}

	/** Iterates the set's order sequence, removing through the tree so both structures stay in step */
	class Itr implements Iterator<E> {
		private SequenceElement<E> theNext;
		private SequenceElement<E> theLast;
		private long theStamp;

		Itr() {
			theNext = theTree.begin();
			theStamp = theTree.getStamp();
		}

		@Override
		public boolean hasNext() {
			checkStamp();
			return !theNext.isEnd();
		}

		@Override
		public E next() {
			checkStamp();
			if (theNext.isEnd())
				throw new NoSuchElementException();
			theLast = theNext;
			theNext = theNext.next();
			return theLast.get();
		}

		@Override
		public void remove() {
			if (theLast == null)
				throw new IllegalStateException("remove() must be called once, after next()");
			checkStamp();
			erase(theLast.get());
			theLast = null;
			theStamp = theTree.getStamp();
		}

		private void checkStamp() {
			if (theStamp != theTree.getStamp())
				throw new ConcurrentModificationException("Set modified outside of this iterator");
		}
	}
}
