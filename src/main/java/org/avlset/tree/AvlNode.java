package org.avlset.tree;

import org.avlset.collect.SequenceElement;

/**
 * A node in an {@link AvlTree}. The node owns its two subtrees exclusively and holds a reference to its value's element in the tree's
 * ordered sequence. Rotations only rewire child links, so the element reference never changes for the life of the node.
 * 
 * @param <E> The type of value that the node holds
 */
public final class AvlNode<E> {
	private final E theValue;
	private final SequenceElement<E> theElement;
	private int theHeight;
	private AvlNode<E> theLeft;
	private AvlNode<E> theRight;

	AvlNode(E value, SequenceElement<E> element) {
		theValue = value;
		theElement = element;
		theHeight = 1;
	}

	/** @return This node's value */
	public E getValue() {
		return theValue;
	}

	/** @return This node's element in the tree's ordered sequence */
	public SequenceElement<E> getElement() {
		return theElement;
	}

	/** @return The height of the subtree rooted at this node, 1 for a leaf */
	public int getHeight() {
		return theHeight;
	}

	/** @return The child node that is on the left of this node */
	public AvlNode<E> getLeft() {
		return theLeft;
	}

	/** @return The child node that is on the right of this node */
	public AvlNode<E> getRight() {
		return theRight;
	}

	void setLeft(AvlNode<E> left) {
		theLeft = left;
	}

	void setRight(AvlNode<E> right) {
		theRight = right;
	}

	/** Recomputes this node's height from its children, which must already be correct */
	void relax() {
		theHeight = 1 + Math.max(height(theLeft), height(theRight));
	}

	/**
	 * @param node The node to get the height of
	 * @return The height of the node's subtree, or 0 if the node is null
	 */
	public static int height(AvlNode<?> node) {
		return node == null ? 0 : node.theHeight;
	}

	/**
	 * @param node The node to get the balance of
	 * @return The height of the node's right subtree minus that of its left, or 0 if the node is null
	 */
	public static int balanceOf(AvlNode<?> node) {
		return node == null ? 0 : height(node.theRight) - height(node.theLeft);
	}

	/**
	 * Checks the height and balance of this node and its whole subtree
	 * 
	 * @throws IllegalStateException If any node's stored height is wrong or its subtrees' heights differ by more than one
	 */
	void checkValid() throws IllegalStateException {
		if (theLeft != null)
			theLeft.checkValid();
		if (theRight != null)
			theRight.checkValid();
		if (theHeight != 1 + Math.max(height(theLeft), height(theRight)))
			throw new IllegalStateException("Height is incorrect: " + this + " (" + theHeight + ")");
		int balance = balanceOf(this);
		if (balance < -1 || balance > 1)
			throw new IllegalStateException("Node " + this + " is unbalanced: " + balance);
	}

	@Override
	public String toString() {
		return String.valueOf(theValue);
	}

	/**
	 * @param tree The root of the subtree to print, may be null
	 * @return The subtree, one node per line as <code>value h=height b=balance</code>, indented by depth with the right subtree above
	 *         each node and the left below
	 */
	public static String print(AvlNode<?> tree) {
		StringBuilder ret = new StringBuilder();
		if (tree != null)
			print(tree, ret, 0);
		return ret.toString();
	}

	private static void print(AvlNode<?> node, StringBuilder str, int depth) {
		if (node.theRight != null)
			print(node.theRight, str, depth + 1);
		for (int i = 0; i < depth; i++)
			str.append("  ");
		str.append(node.theValue).append(" h=").append(node.theHeight).append(" b=").append(balanceOf(node)).append('\n');
		if (node.theLeft != null)
			print(node.theLeft, str, depth + 1);
	}
}
