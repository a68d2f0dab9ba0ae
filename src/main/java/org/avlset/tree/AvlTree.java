package org.avlset.tree;

import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;

import org.apache.log4j.Logger;
import org.avlset.collect.LinkedSequence;
import org.avlset.collect.SequenceElement;

/**
 * <p>
 * A height-balanced (AVL) binary search tree of distinct values, coupled with a {@link LinkedSequence} that holds the same values in
 * ascending order. Each node keeps the handle of its value's element in the sequence, so searches return sequence positions and in-order
 * traversal is a constant-time step along the sequence.
 * </p>
 * <p>
 * Only the "less than" answer of the comparator is used: two values are equal when neither is less than the other.
 * </p>
 * 
 * @param <E> The type of values stored in the tree
 */
public class AvlTree<E> {
	private static final Logger log = Logger.getLogger(AvlTree.class);

	/** 1/log2(golden ratio), the worst-case height factor of an AVL tree */
	private static final double HEIGHT_FACTOR = 1.4405;

	private final Comparator<? super E> theCompare;
	private final LinkedSequence<E> theSequence;
	private AvlNode<E> theRoot;

	/** @param compare The ordering for values in the tree */
	public AvlTree(Comparator<? super E> compare) {
		if (compare == null)
			throw new NullPointerException("A comparator is required");
		theCompare = compare;
		theSequence = new LinkedSequence<>();
	}

	/** @return The ordering of values in this tree */
	public Comparator<? super E> comparator() {
		return theCompare;
	}

	/** @return The root node of this tree, or null if the tree is empty */
	public AvlNode<E> getRoot() {
		return theRoot;
	}

	/** @return The number of values in this tree */
	public int size() {
		return theSequence.size();
	}

	/** @return The height of this tree, 0 if it is empty */
	public int height() {
		return AvlNode.height(theRoot);
	}

	/** @return The stamp of this tree's sequence, which changes with every insertion or removal */
	public long getStamp() {
		return theSequence.getStamp();
	}

	/** @return The position of the least value in this tree, or {@link #end()} if the tree is empty */
	public SequenceElement<E> begin() {
		return theSequence.begin();
	}

	/** @return The position one past the greatest value in this tree */
	public SequenceElement<E> end() {
		return theSequence.end();
	}

	/**
	 * @param value The value to add
	 * @return Whether the value was added, false if an equal value was already present
	 */
	public boolean insert(E value) {
		if (theRoot == null)
			theCompare.compare(value, value); // type (and possibly null) check
		else if (!search(value).isEnd())
			return false;
		theRoot = put(theRoot, value);
		return true;
	}

	/**
	 * @param value The value to remove
	 * @return Whether a value equal to the given one was present and removed
	 */
	public boolean erase(E value) {
		if (search(value).isEnd())
			return false;
		theRoot = del(theRoot, value);
		return true;
	}

	/**
	 * @param value The value to search for
	 * @return The position of the value equal to the given one, or {@link #end()} if there is none
	 */
	public SequenceElement<E> search(E value) {
		return search(theRoot, value);
	}

	/**
	 * @param value The value to search for
	 * @return The position of the least value not less than the given one, or {@link #end()} if there is none
	 */
	public SequenceElement<E> lowerBound(E value) {
		return lowerBound(theRoot, value);
	}

	/** Removes every value from this tree */
	public void clear() {
		if (theRoot != null) {
			int cleared = 0;
			Deque<AvlNode<E>> stack = new ArrayDeque<>();
			stack.push(theRoot);
			while (!stack.isEmpty()) {
				AvlNode<E> node = stack.pop();
				if (node.getLeft() != null)
					stack.push(node.getLeft());
				if (node.getRight() != null)
					stack.push(node.getRight());
				node.setLeft(null);
				node.setRight(null);
				cleared++;
			}
			theRoot = null;
			if (log.isTraceEnabled())
				log.trace("Cleared " + cleared + " nodes");
		}
		theSequence.clear();
	}

	private boolean isLess(E v1, E v2) {
		return theCompare.compare(v1, v2) < 0;
	}

	private AvlNode<E> put(AvlNode<E> node, E value) {
		if (node == null) {
			// Rebalancing never changes a node's rank, so the successor in the tree as it is now is the new value's successor
			SequenceElement<E> next = lowerBound(theRoot, value);
			return new AvlNode<>(value, theSequence.addBefore(next, value));
		}

		if (isLess(value, node.getValue()))
			node.setLeft(put(node.getLeft(), value));
		else
			node.setRight(put(node.getRight(), value));
		return balance(node);
	}

	private AvlNode<E> del(AvlNode<E> node, E value) {
		if (node == null)
			return null;

		if (isLess(value, node.getValue()))
			node.setLeft(del(node.getLeft(), value));
		else if (isLess(node.getValue(), value))
			node.setRight(del(node.getRight(), value));
		else {
			AvlNode<E> left = node.getLeft();
			AvlNode<E> right = node.getRight();
			theSequence.remove(node.getElement());
			node.setLeft(null);
			node.setRight(null);
			if (right == null)
				return left;

			AvlNode<E> min = findMin(right);
			min.setRight(removeMin(right));
			min.setLeft(left);
			return balance(min);
		}
		return balance(node);
	}

	private static <E> AvlNode<E> findMin(AvlNode<E> node) {
		while (node.getLeft() != null)
			node = node.getLeft();
		return node;
	}

	private AvlNode<E> removeMin(AvlNode<E> node) {
		if (node.getLeft() == null)
			return node.getRight();
		node.setLeft(removeMin(node.getLeft()));
		return balance(node);
	}

	private SequenceElement<E> search(AvlNode<E> node, E value) {
		while (node != null) {
			if (isLess(value, node.getValue()))
				node = node.getLeft();
			else if (isLess(node.getValue(), value))
				node = node.getRight();
			else
				return node.getElement();
		}
		return theSequence.end();
	}

	private SequenceElement<E> lowerBound(AvlNode<E> node, E value) {
		if (node == null)
			return theSequence.end();

		if (isLess(value, node.getValue())) {
			SequenceElement<E> left = lowerBound(node.getLeft(), value);
			return left.isEnd() ? node.getElement() : left;
		} else if (isLess(node.getValue(), value))
			return lowerBound(node.getRight(), value);
		else
			return node.getElement();
	}

	/**
	 * Must be called on every node whose subtree was structurally changed, on the way back up from the change
	 * 
	 * @param node The node to rebalance
	 * @return The root of the rebalanced subtree
	 */
	private AvlNode<E> balance(AvlNode<E> node) {
		node.relax();
		int balance = AvlNode.balanceOf(node);
		if (balance == 2) {
			if (AvlNode.balanceOf(node.getRight()) < 0)
				node.setRight(rotateRight(node.getRight()));
			return rotateLeft(node);
		} else if (balance == -2) {
			if (AvlNode.balanceOf(node.getLeft()) > 0)
				node.setLeft(rotateLeft(node.getLeft()));
			return rotateRight(node);
		}
		return node;
	}

	private AvlNode<E> rotateLeft(AvlNode<E> node) {
		if (log.isTraceEnabled())
			log.trace("Rotating left at " + node);
		AvlNode<E> center = node.getRight();
		node.setRight(center.getLeft());
		center.setLeft(node);
		node.relax();
		center.relax();
		return center;
	}

	private AvlNode<E> rotateRight(AvlNode<E> node) {
		if (log.isTraceEnabled())
			log.trace("Rotating right at " + node);
		AvlNode<E> center = node.getLeft();
		node.setLeft(center.getRight());
		center.setRight(node);
		node.relax();
		center.relax();
		return center;
	}

	/**
	 * Runs debugging checks on this tree to assure that all internal constraints are currently met: heights and balance of every node,
	 * ascending order, the correspondence of nodes to sequence elements, and the overall height bound.
	 * 
	 * @throws IllegalStateException If any constraint is violated
	 */
	public void checkValid() throws IllegalStateException {
		try {
			if (theRoot != null)
				theRoot.checkValid();
			// In-order walk of the tree must visit exactly the sequence's elements, in sequence order
			SequenceElement<E> element = theSequence.begin();
			int count = 0;
			Deque<AvlNode<E>> stack = new ArrayDeque<>();
			AvlNode<E> node = theRoot;
			AvlNode<E> prev = null;
			while (node != null || !stack.isEmpty()) {
				while (node != null) {
					stack.push(node);
					node = node.getLeft();
				}
				node = stack.pop();
				if (prev != null && !isLess(prev.getValue(), node.getValue()))
					throw new IllegalStateException("Nodes out of order: " + prev + " then " + node);
				if (element.isEnd())
					throw new IllegalStateException("Sequence ended before node " + node);
				if (element != node.getElement())
					throw new IllegalStateException("Node " + node + " does not reference its sequence element " + element);
				if (!element.isPresent())
					throw new IllegalStateException("Node " + node + " references a removed element");
				if (isLess(element.get(), node.getValue()) || isLess(node.getValue(), element.get()))
					throw new IllegalStateException("Node " + node + " holds a different value from its element " + element);
				element = element.next();
				count++;
				prev = node;
				node = node.getRight();
			}
			if (!element.isEnd())
				throw new IllegalStateException("Sequence has more elements than the tree, starting at " + element);
			if (count != theSequence.size())
				throw new IllegalStateException("Sequence size " + theSequence.size() + " does not match node count " + count);
			double maxHeight = HEIGHT_FACTOR * Math.log(count + 2) / Math.log(2);
			if (height() > maxHeight)
				throw new IllegalStateException("Height " + height() + " exceeds the bound " + maxHeight + " for " + count + " nodes");
		} catch (IllegalStateException e) {
			log.error("Tree integrity failure\n" + this, e);
			throw e;
		}
	}

	@Override
	public String toString() {
		return AvlNode.print(theRoot);
	}
}
