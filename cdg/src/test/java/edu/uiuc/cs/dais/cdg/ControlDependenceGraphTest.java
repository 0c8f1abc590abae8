package edu.uiuc.cs.dais.cdg;

import static java.util.Arrays.asList;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import org.junit.Test;

import com.ibm.wala.util.graph.traverse.DFS;

import edu.uiuc.cs.dais.cdg.dot.DotWriter;

public class ControlDependenceGraphTest {

	@Test
	public void singleBlockHangsOffRoot() {
		CfgFixture f = new CfgFixture().blocks("A");
		ControlDependenceGraph<String> cdg = f.build("A", "A");

		assertEquals(2, cdg.getNumberOfNodes());
		ControlDependenceNode<String> a = cdg.getNode("A");
		assertEquals(asList(a), cdg.getRoot().getChildren(EdgeType.OTHER));
		assertEquals(asList(cdg.getRoot()), a.getParents());
		assertEquals(0, a.getNumChildren());
		assertFalse(cdg.controls("A", "A"));
		assertFalse(cdg.influences("A", "A"));
	}

	@Test
	public void diamond() {
		ControlDependenceGraph<String> cdg = CfgFixture.diamond().build("A", "D");
		ControlDependenceNode<String> root = cdg.getRoot();
		ControlDependenceNode<String> a = cdg.getNode("A");

		assertEquals(5, cdg.getNumberOfNodes());
		assertEquals(asList(cdg.getNode("B")), a.getChildren(EdgeType.TRUE));
		assertEquals(asList(cdg.getNode("C")), a.getChildren(EdgeType.FALSE));
		assertTrue(a.getChildren(EdgeType.OTHER).isEmpty());
		// D runs on both paths
		assertEquals(asList(a, cdg.getNode("D")), root.getChildren(EdgeType.OTHER));
		assertEquals(asList(root), cdg.getNode("D").getParents());

		assertTrue(cdg.controls("A", "B"));
		assertTrue(cdg.controls("A", "C"));
		assertFalse(cdg.controls("A", "D"));
		assertFalse(cdg.controls("B", "C"));
		assertFalse(cdg.controls("C", "B"));
		assertFalse(cdg.controls("B", "A"));
	}

	@Test
	public void influencesInBothDirections() {
		ControlDependenceGraph<String> cdg = CfgFixture.diamond().build("A", "D");

		assertTrue(cdg.influences("A", "B"));
		assertTrue(cdg.influences("B", "A"));
		assertTrue(cdg.influences("C", "A"));
		assertFalse(cdg.influences("B", "C"));
		assertFalse(cdg.influences("D", "A"));
		assertFalse(cdg.influences("A", "D"));
	}

	@Test
	public void loopBodyDependsOnLoopTest() {
		ControlDependenceGraph<String> cdg = CfgFixture.loop().build("A", "C");
		ControlDependenceNode<String> a = cdg.getNode("A");
		ControlDependenceNode<String> b = cdg.getNode("B");

		assertEquals(asList(a), b.getChildren(EdgeType.TRUE));
		assertTrue(b.getChildren(EdgeType.FALSE).isEmpty());
		// the first iteration is unconditional
		assertEquals(asList(cdg.getRoot(), b), a.getParents());
		// C post-dominates the test, the loop always exits to it
		assertEquals(asList(cdg.getRoot()), cdg.getNode("C").getParents());

		assertTrue(cdg.controls("B", "A"));
		assertFalse(cdg.controls("A", "B"));
		assertFalse(cdg.controls("B", "C"));
		assertTrue(cdg.influences("A", "B"));
	}

	@Test
	public void loopExitDependsOnLoopTest() {
		ControlDependenceGraph<String> cdg = CfgFixture.loopWithReturn().build("S", "R");
		ControlDependenceNode<String> h = cdg.getNode("H");
		ControlDependenceNode<String> bd = cdg.getNode("Bd");

		assertEquals(asList(bd), h.getChildren(EdgeType.TRUE));
		assertEquals(asList(cdg.getNode("X")), h.getChildren(EdgeType.FALSE));
		assertEquals(asList(h), bd.getChildren(EdgeType.FALSE));
		assertEquals(asList(cdg.getRoot(), bd), h.getParents());
		assertEquals(asList(cdg.getRoot()), cdg.getNode("R").getParents());

		assertTrue(cdg.controls("H", "X"));
		assertTrue(cdg.controls("Bd", "X"));
		assertFalse(cdg.controls("X", "H"));
		assertFalse(cdg.controls("H", "H"));
		assertFalse(cdg.controls("S", "H"));
		assertConnected(cdg);
	}

	@Test
	public void nestedConditionsAreTransitive() {
		ControlDependenceGraph<String> cdg = CfgFixture.nestedIf().build("A", "F");

		assertTrue(cdg.controls("A", "B"));
		assertTrue(cdg.controls("A", "C"));
		assertTrue(cdg.controls("A", "E"));
		assertTrue(cdg.controls("B", "D"));
		assertFalse(cdg.controls("B", "E"));
		assertFalse(cdg.controls("C", "D"));
		assertFalse(cdg.controls("A", "F"));
		assertTrue(cdg.influences("D", "A"));
		assertFalse(cdg.influences("E", "C"));
	}

	@Test
	public void everyNodeIsReachableFromRoot() {
		assertConnected(CfgFixture.diamond().build("A", "D"));
		assertConnected(CfgFixture.nestedIf().build("A", "F"));
		assertConnected(CfgFixture.sequenceOnTrueArm().build("A", "D"));
		assertConnected(CfgFixture.loop().build("A", "C"));
	}

	@Test
	public void structuredGraphsAreAcyclic() {
		for (ControlDependenceGraph<String> cdg : asList(CfgFixture.diamond().build("A", "D"), CfgFixture.nestedIf()
				.build("A", "F"), CfgFixture.loop().build("A", "C")))
			for (ControlDependenceNode<String> node : cdg)
				assertFalse(node + " reaches itself", cdg.getDescendants(node).contains(node));
	}

	@Test
	public void buildIsDeterministic() throws Exception {
		String first = new DotWriter<>(CfgFixture.nestedIf().build("A", "F")).toDot();
		String second = new DotWriter<>(CfgFixture.nestedIf().build("A", "F")).toDot();
		assertEquals(first, second);
	}

	@Test
	public void unreachableBlocksAreLeftOut() {
		CfgFixture f = CfgFixture.diamond().blocks("Z").edge("Z", "D");
		ControlDependenceGraph<String> cdg = f.build("A", "D");

		assertNull(cdg.getNode("Z"));
		assertEquals(5, cdg.getNumberOfNodes());
		assertEquals(asList("A", "B", "C", "D"), cdg.getBlocks());
		try {
			cdg.controls("A", "Z");
			fail();
		} catch (IllegalArgumentException e) {
			// expected
		}
		try {
			cdg.influences("Z", "A");
			fail();
		} catch (IllegalArgumentException e) {
			// expected
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void rejectsBlocksThatCannotReachTheExit() {
		// B spins forever
		new CfgFixture().blocks("A", "B", "C").branch("A", "B", "C").edge("B", "B").build("A", "C");
	}

	@Test(expected = IllegalArgumentException.class)
	public void rejectsUnknownEntry() {
		CfgFixture.diamond().build("Q", "D");
	}

	@Test(expected = IllegalArgumentException.class)
	public void rejectsUnknownExit() {
		CfgFixture.diamond().build("A", "Q");
	}

	@Test
	public void graphViewFollowsChildEdges() {
		ControlDependenceGraph<String> cdg = CfgFixture.diamond().build("A", "D");
		ControlDependenceNode<String> a = cdg.getNode("A");
		ControlDependenceNode<String> b = cdg.getNode("B");

		assertEquals(2, cdg.getSuccNodeCount(a));
		assertTrue(cdg.hasEdge(a, b));
		assertFalse(cdg.hasEdge(b, a));
		assertSame(a, cdg.getPredNodes(b).next());
		assertTrue(cdg.containsNode(b));

		List<ControlDependenceEdge<String>> in = cdg.getEdgeManager().getInEdges(b);
		assertEquals(asList(new ControlDependenceEdge<>(a, b, EdgeType.TRUE)), in);
		assertEquals(4, cdg.getEdgeManager().getEdges().size());

		Set<ControlDependenceNode<String>> below = cdg.getDescendants(a);
		assertEquals(2, below.size());
		assertTrue(below.contains(cdg.getNode("C")));
	}

	@Test(expected = UnsupportedOperationException.class)
	public void graphViewIsReadOnly() {
		ControlDependenceGraph<String> cdg = CfgFixture.diamond().build("A", "D");
		cdg.addEdge(cdg.getNode("B"), cdg.getNode("C"));
	}

	@Test
	public void linksAreSymmetricAndIdempotent() {
		ControlDependenceNode<String> parent = new ControlDependenceNode<>(1, "P", false);
		ControlDependenceNode<String> child = new ControlDependenceNode<>(2, "C", false);

		assertTrue(parent.addChild(EdgeType.TRUE, child));
		assertFalse(parent.addChild(EdgeType.TRUE, child));
		assertTrue(parent.addChild(EdgeType.FALSE, child));
		assertEquals(asList(parent), child.getParents());
		assertEquals(2, parent.getNumChildren());

		parent.removeChild(EdgeType.TRUE, child);
		assertEquals(asList(parent), child.getParents());
		parent.removeChild(EdgeType.FALSE, child);
		assertTrue(child.getParents().isEmpty());
		assertFalse(parent.hasChild(child));
	}

	@Test
	public void clearingParentsUnlinksEveryLabel() {
		ControlDependenceNode<String> first = new ControlDependenceNode<>(1, "P", false);
		ControlDependenceNode<String> second = new ControlDependenceNode<>(2, "Q", false);
		ControlDependenceNode<String> child = new ControlDependenceNode<>(3, "C", false);
		first.addChild(EdgeType.TRUE, child);
		first.addChild(EdgeType.OTHER, child);
		second.addChild(EdgeType.FALSE, child);

		child.clearParents();
		assertTrue(child.getParents().isEmpty());
		assertEquals(0, first.getNumChildren());
		assertEquals(0, second.getNumChildren());
	}

	@Test
	public void selfBranchDoesNotMakeABlockDependOnItself() {
		// A spins on its true arm and leaves to B on its false arm
		CfgFixture f = new CfgFixture().blocks("S", "A", "B").edge("S", "A").branch("A", "A", "B");
		ControlDependenceGraph<String> cdg = f.build("S", "B");
		ControlDependenceNode<String> a = cdg.getNode("A");

		assertEquals(4, cdg.getNumberOfNodes());
		assertFalse(a.hasChild(a));
		assertEquals(0, a.getNumChildren());
		assertEquals(asList(cdg.getRoot()), a.getParents());
		assertEquals(asList(cdg.getNode("S"), a, cdg.getNode("B")), cdg.getRoot().getChildren(EdgeType.OTHER));
		assertFalse(cdg.controls("A", "A"));
		assertFalse(cdg.getDescendants(a).contains(a));
	}

	@Test
	public void logsGraphSizeOnlyWhenFineIsEnabled() {
		Logger logger = Logger.getLogger(ControlDependenceGraph.class.getName());
		final List<String> messages = new ArrayList<>();
		Handler handler = new Handler() {
			@Override
			public void publish(LogRecord record) {
				messages.add(record.getMessage());
			}

			@Override
			public void flush() {
			}

			@Override
			public void close() {
			}
		};
		handler.setLevel(Level.ALL);
		Level level = logger.getLevel();
		logger.addHandler(handler);
		try {
			logger.setLevel(Level.FINE);
			CfgFixture.diamond().build("A", "D");
			assertEquals(asList("Control dependence graph of 4 blocks has 5 nodes"), messages);

			messages.clear();
			logger.setLevel(Level.INFO);
			CfgFixture.diamond().build("A", "D");
			assertTrue(messages.isEmpty());
		} finally {
			logger.removeHandler(handler);
			logger.setLevel(level);
		}
	}

	static void assertConnected(ControlDependenceGraph<String> cdg) {
		assertEquals(0, cdg.getRoot().getNumParents());
		for (ControlDependenceNode<String> node : cdg)
			if (!node.isRoot())
				assertTrue(node + " has no parent", node.getNumParents() > 0);
		Set<ControlDependenceNode<String>> reachable = DFS.getReachableNodes(cdg, Collections.singleton(cdg
				.getRoot()));
		assertEquals(cdg.getNumberOfNodes(), reachable.size());
	}

}
