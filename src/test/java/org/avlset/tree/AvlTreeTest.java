package org.avlset.tree;

import static java.util.Arrays.asList;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

import org.avlset.TestUtil;
import org.avlset.collect.SequenceElement;
import org.junit.Test;

import com.google.common.collect.Lists;
import com.google.common.collect.Ordering;

/** Tests the balancing and the order sequence of {@link AvlTree} */
public class AvlTreeTest {
	private static boolean PRINT = false;

	private static AvlTree<Integer> tree(Integer... values) {
		AvlTree<Integer> tree = new AvlTree<>(Ordering.<Integer> natural());
		for (Integer value : values) {
			tree.insert(value);
			if (PRINT)
				System.out.println(tree + " ---- ");
			tree.checkValid();
		}
		return tree;
	}

	private static List<Integer> contents(AvlTree<Integer> tree) {
		List<Integer> values = new ArrayList<>();
		for (SequenceElement<Integer> el = tree.begin(); !el.isEnd(); el = el.next())
			values.add(el.get());
		return values;
	}

	/** Ascending insertion, the worst case for an unbalanced tree, stays balanced */
	@Test
	public void testAscendingInsert() {
		AvlTree<Integer> tree = tree(1, 2, 3, 4, 5);
		assertEquals(3, tree.height());
		assertEquals(Integer.valueOf(2), tree.getRoot().getValue());
		assertEquals(Integer.valueOf(4), tree.getRoot().getRight().getValue());
		assertEquals(asList(1, 2, 3, 4, 5), contents(tree));
	}

	/** Each of the four rotation cases brings the middle value to the root */
	@Test
	public void testRotationCases() {
		for (Integer[] order : new Integer[][] { { 3, 2, 1 }, { 1, 2, 3 }, { 3, 1, 2 }, { 1, 3, 2 } }) {
			AvlTree<Integer> tree = tree(order);
			AvlNode<Integer> root = tree.getRoot();
			assertEquals(Integer.valueOf(2), root.getValue());
			assertEquals(Integer.valueOf(1), root.getLeft().getValue());
			assertEquals(Integer.valueOf(3), root.getRight().getValue());
			assertEquals(2, root.getHeight());
			assertEquals(asList(1, 2, 3), contents(tree));
		}
	}

	/** Erasing a node with two children lifts the minimum of its right subtree into its place */
	@Test
	public void testEraseWithTwoChildren() {
		AvlTree<Integer> tree = tree(1, 2, 3, 4, 5);
		assertTrue(tree.erase(2));
		tree.checkValid();
		AvlNode<Integer> root = tree.getRoot();
		assertEquals(Integer.valueOf(3), root.getValue());
		assertEquals(Integer.valueOf(1), root.getLeft().getValue());
		assertEquals(Integer.valueOf(4), root.getRight().getValue());
		assertNull(root.getRight().getLeft());
		assertEquals(asList(1, 3, 4, 5), contents(tree));
	}

	/** Erasure rebalances ancestors on the way back up */
	@Test
	public void testEraseRebalance() {
		AvlTree<Integer> tree = tree(4, 2, 6, 1, 3, 5, 7);
		assertEquals(3, tree.height());
		for (int value : new int[] { 1, 3, 2 }) {
			assertTrue(tree.erase(value));
			tree.checkValid();
		}
		assertEquals(Integer.valueOf(6), tree.getRoot().getValue());
		assertEquals(Integer.valueOf(4), tree.getRoot().getLeft().getValue());
		assertEquals(3, tree.height());
		assertEquals(asList(4, 5, 6, 7), contents(tree));

		assertFalse(tree.erase(1));
		assertEquals(4, tree.size());
	}

	/** Searches return sequence positions or the end position */
	@Test
	public void testSearch() {
		AvlTree<Integer> tree = tree(20, 10, 30);
		assertEquals(Integer.valueOf(10), tree.search(10).get());
		assertTrue(tree.search(15).isEnd());
		assertSame(tree.end(), tree.search(40));

		assertEquals(Integer.valueOf(10), tree.lowerBound(5).get());
		assertEquals(Integer.valueOf(10), tree.lowerBound(10).get());
		assertEquals(Integer.valueOf(20), tree.lowerBound(15).get());
		assertEquals(Integer.valueOf(30), tree.lowerBound(21).get());
		assertSame(tree.end(), tree.lowerBound(31));

		AvlTree<Integer> empty = new AvlTree<>(Ordering.<Integer> natural());
		assertSame(empty.end(), empty.lowerBound(0));
		assertTrue(empty.search(0).isEnd());
	}

	/** A held position keeps pointing at its value while the tree is rebalanced around it */
	@Test
	public void testPositionStability() {
		AvlTree<Integer> tree = new AvlTree<>(Ordering.<Integer> natural());
		tree.insert(500);
		SequenceElement<Integer> held = tree.search(500);
		for (int i = 0; i < 1000; i++) {
			if (i != 500)
				tree.insert(i);
		}
		for (int i = 0; i < 1000; i += 3) {
			if (i != 500)
				tree.erase(i);
		}
		tree.checkValid();
		assertTrue(held.isPresent());
		assertSame(held, tree.search(500));
		assertEquals(Integer.valueOf(502), held.next().get()); // 501 was erased
		assertEquals(Integer.valueOf(499), tree.lowerBound(498).get());

		tree.erase(500);
		assertFalse(held.isPresent());
	}

	/** The printed tree shows each node's height and balance, right subtree above */
	@Test
	public void testPrint() {
		AvlTree<Integer> tree = tree(1, 2, 3, 4);
		assertEquals("    4 h=1 b=0\n"//
			+ "  3 h=2 b=1\n"//
			+ "2 h=3 b=1\n"//
			+ "  1 h=1 b=0\n", tree.toString());
		assertEquals("", new AvlTree<>(Ordering.<Integer> natural()).toString());
	}

	/** Clearing releases every node and element */
	@Test
	public void testClear() {
		AvlTree<Integer> tree = tree(5, 3, 8, 1, 4, 7, 9);
		SequenceElement<Integer> element = tree.search(4);
		tree.clear();
		assertNull(tree.getRoot());
		assertEquals(0, tree.size());
		assertEquals(0, tree.height());
		assertFalse(element.isPresent());
		assertSame(tree.end(), tree.begin());
		tree.checkValid();

		tree.insert(2);
		assertEquals(asList(2), contents(tree));
	}

	/** Null is rejected by natural ordering even when the tree is empty */
	@Test
	public void testNullValue() {
		AvlTree<Integer> tree = new AvlTree<>(Ordering.<Integer> natural());
		try {
			tree.insert(null);
			fail("Expected NullPointerException");
		} catch (NullPointerException e) {
		}
		assertEquals(0, tree.size());
		assertNull(tree.getRoot());
	}

	/** Random insertions and erasures against {@link TreeSet}, validating the structure after every step */
	@Test
	public void testRandomOperations() {
		TestUtil random = new TestUtil();
		AvlTree<Integer> tree = new AvlTree<>(Ordering.<Integer> natural());
		TreeSet<Integer> expected = new TreeSet<>();
		for (int i = 0; i < 5000; i++) {
			int value = random.getInt(0, 500);
			if (random.getBoolean(0.6))
				assertEquals(random.toString(), expected.add(value), tree.insert(value));
			else
				assertEquals(random.toString(), expected.remove(value), tree.erase(value));
			tree.checkValid();
			assertEquals(random.toString(), expected.size(), tree.size());
		}
		assertEquals(random.toString(), Lists.newArrayList(expected), contents(tree));
	}
}
