package org.avlset.collect;

import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * A doubly-linked sequence whose elements are addressed by {@link SequenceElement} handles. Adding before a known position and removing a
 * known element are constant-time, and a handle stays valid until its own element is removed.
 * 
 * The list is circular around a sentinel node which serves as the {@link #end() end} position.
 * 
 * This class is not thread-safe. Its iterators fail fast when the sequence is modified other than through the iterator.
 * 
 * @param <E> The type of values in the sequence
 */
public class LinkedSequence<E> implements Iterable<E> {
	private final Node<E> theEnd;
	private int theSize;
	private long theModCount;

	/** Creates an empty sequence */
	public LinkedSequence() {
		theEnd = new Node<>(this, null);
		theEnd.theNext = theEnd.thePrevious = theEnd;
	}

	/** @return The number of elements in this sequence */
	public int size() {
		return theSize;
	}

	/** @return Whether this sequence has no elements */
	public boolean isEmpty() {
		return theSize == 0;
	}

	/** @return The stamp of this sequence, which changes every time an element is added or removed */
	public long getStamp() {
		return theModCount;
	}

	/** @return The first element in this sequence, or the {@link #end() end} position if the sequence is empty */
	public SequenceElement<E> begin() {
		return theEnd.theNext;
	}

	/** @return The position one past the last element of this sequence */
	public SequenceElement<E> end() {
		return theEnd;
	}

	/**
	 * @param position The position to insert the new element before. May be {@link #end()} to append.
	 * @param value The value to add
	 * @return The handle of the new element
	 * @throws IllegalArgumentException If the position does not belong to this sequence or has been removed
	 */
	public SequenceElement<E> addBefore(SequenceElement<E> position, E value) throws IllegalArgumentException {
		Node<E> next = check(position);
		Node<E> node = new Node<>(this, value);
		Node<E> prev = next.thePrevious;
		node.thePrevious = prev;
		node.theNext = next;
		prev.theNext = node;
		next.thePrevious = node;
		theSize++;
		theModCount++;
		return node;
	}

	/**
	 * @param value The value to add to the end of this sequence
	 * @return The handle of the new element
	 */
	public SequenceElement<E> addLast(E value) {
		return addBefore(theEnd, value);
	}

	/**
	 * @param element The element to remove
	 * @throws IllegalArgumentException If the element does not belong to this sequence, has already been removed, or is the end position
	 */
	public void remove(SequenceElement<E> element) throws IllegalArgumentException {
		Node<E> node = check(element);
		if (node == theEnd)
			throw new IllegalArgumentException("The end position cannot be removed");
		unlink(node);
	}

	private void unlink(Node<E> node) {
		node.thePrevious.theNext = node.theNext;
		node.theNext.thePrevious = node.thePrevious;
		node.theNext = node.thePrevious = null;
		theSize--;
		theModCount++;
	}

	/** Removes every element from this sequence */
	public void clear() {
		Node<E> node = theEnd.theNext;
		while (node != theEnd) {
			Node<E> next = node.theNext;
			node.theNext = node.thePrevious = null;
			node = next;
		}
		theEnd.theNext = theEnd.thePrevious = theEnd;
		theSize = 0;
		theModCount++;
	}

	private Node<E> check(SequenceElement<E> element) {
		if (!(element instanceof Node) || ((Node<E>) element).theSequence != this)
			throw new IllegalArgumentException("Element " + element + " does not belong to this sequence");
		Node<E> node = (Node<E>) element;
		if (!node.isPresent())
			throw new IllegalArgumentException("Element " + element + " has been removed");
		return node;
	}

	@Override
	public Iterator<E> iterator() {
		return new Itr();
	}

	@Override
	public String toString() {
		StringBuilder str = new StringBuilder().append('[');
		for (Node<E> node = theEnd.theNext; node != theEnd; node = node.theNext) {
			if (node != theEnd.theNext)
				str.append(", ");
			str.append(node.theValue);
		}
		return str.append(']').toString();
	}

	class Itr implements Iterator<E> {
		private Node<E> theNext;
		private Node<E> theLast;
		private long theItrMods;

		Itr() {
			theNext = theEnd.theNext;
			theItrMods = theModCount;
		}

		@Override
		public boolean hasNext() {
			checkMods();
			return theNext != theEnd;
		}

		@Override
		public E next() {
			checkMods();
			if (theNext == theEnd)
				throw new NoSuchElementException();
			theLast = theNext;
			theNext = theNext.theNext;
			return theLast.theValue;
		}

		@Override
		public void remove() {
			if (theLast == null)
				throw new IllegalStateException("remove() must be called once, after next()");
			checkMods();
			unlink(theLast);
			theLast = null;
			theItrMods = theModCount;
		}

		private void checkMods() {
			if (theItrMods != theModCount)
				throw new ConcurrentModificationException("Sequence modified outside of this iterator");
		}
	}

	static class Node<E> implements SequenceElement<E> {
		final LinkedSequence<E> theSequence;
		final E theValue;
		Node<E> thePrevious;
		Node<E> theNext;

		Node(LinkedSequence<E> sequence, E value) {
			theSequence = sequence;
			theValue = value;
		}

		@Override
		public E get() {
			if (isEnd())
				throw new NoSuchElementException("The end position has no value");
			return theValue;
		}

		@Override
		public boolean isEnd() {
			return this == theSequence.theEnd;
		}

		@Override
		public boolean isPresent() {
			return theNext != null;
		}

		@Override
		public SequenceElement<E> next() {
			if (isEnd())
				throw new NoSuchElementException("Cannot advance past the end position");
			else if (!isPresent())
				throw new IllegalStateException("Element " + this + " has been removed");
			return theNext;
		}

		@Override
		public String toString() {
			return isEnd() ? "end" : String.valueOf(theValue);
		}
	}
}
