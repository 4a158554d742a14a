package works.quill;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import works.quill.exceptions.StructuralEditException;

import static java.util.stream.Collectors.toList;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HistoryTreeTest {
	static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");
	Clock clock;

	@BeforeEach
	void setupClock() {
		clock = Clock.fixed(NOW, ZoneOffset.UTC);
	}

	/**
	 * Distinct, easily recognized states: a sequence holding just {@code n}.
	 */
	static Snapshot state(long n) {
		return Snapshot.of(TestDocuments.sequenceOf(n), Path.just(0));
	}

	HistoryTree newHistory(int capacity) {
		return new HistoryTree(state(0), capacity, clock);
	}

	@Test
	void initialState() {
		HistoryTree history = newHistory(10);
		assertEquals(0, history.current().sequence());
		assertSame(history.root(), history.current());
		assertTrue(history.current().isRoot());
		assertFalse(history.canUndo());
		assertFalse(history.canRedo());
		assertEquals(Optional.empty(), history.undo());
		assertEquals(Optional.empty(), history.redo());
		assertEquals(1, history.size());
		assertEquals(NOW, history.root().timestamp());
	}

	@Test
	void capacityBelowOne_throws() {
		assertThrows(IllegalArgumentException.class, () -> new HistoryTree(state(0), 0));
	}

	@Test
	void checkpoint_addsChildOfCurrent() {
		HistoryTree history = newHistory(10);
		HistoryNode first = history.checkpoint(state(1));
		HistoryNode second = history.checkpoint(state(2), Path.empty());

		assertEquals(1, first.sequence());
		assertEquals(2, second.sequence());
		assertSame(second, history.current());
		assertSame(first, second.parent().get());
		assertSame(history.root(), first.parent().get());
		assertEquals(List.of(second), first.children());
		assertEquals(Path.empty(), second.editCursor());
		assertEquals(Path.just(0), first.editCursor(), "Defaults to the snapshot's cursor");
	}

	@Test
	void undoRedo_walkTheWholeChain() {
		HistoryTree history = newHistory(10);
		for (long i = 1; i <= 4; i++) {
			history.checkpoint(state(i));
		}
		for (long i = 3; i >= 0; i--) {
			assertEquals(state(i), history.undo().get());
		}
		assertEquals(Optional.empty(), history.undo());
		assertEquals(0, history.current().sequence());

		for (long i = 1; i <= 4; i++) {
			assertEquals(state(i), history.redo().get());
		}
		assertEquals(Optional.empty(), history.redo());
		assertEquals(4, history.current().sequence());
	}

	@Test
	void redo_followsNewestBranch() throws StructuralEditException {
		DocumentTree tree = TestDocuments.sequenceOf(1, 2, 3);
		HistoryTree history = new HistoryTree(Snapshot.of(tree, Path.empty()), 10, clock);
		Snapshot s0 = history.current().snapshot();

		tree.delete(Path.just(0));
		Snapshot s1 = Snapshot.of(tree, Path.just(0));
		history.checkpoint(s1);

		DocumentTree undone = history.undo().get().tree();
		assertEquals(s0.tree(), undone);

		undone.delete(Path.just(1));
		Snapshot s2 = Snapshot.of(undone, Path.just(1));
		history.checkpoint(s2);

		HistoryNode branchPoint = history.root();
		assertEquals(2, branchPoint.children().size(), "Old branch is kept");
		assertEquals(2, history.branchCount());

		assertEquals(s0, history.undo().get());
		assertEquals(s2, history.redo().get(), "Redo goes to the newer branch");
		assertEquals(TestDocuments.sequenceOf(1, 3), history.current().snapshot().tree());
	}

	@Test
	void jumpTo_reachesAnyBranch() {
		HistoryTree history = newHistory(10);
		history.checkpoint(state(1));
		history.undo();
		history.checkpoint(state(2));

		assertEquals(state(1), history.jumpTo(1).get());
		assertEquals(1, history.current().sequence());
		assertFalse(history.canRedo());
		assertEquals(state(0), history.undo().get());
		assertEquals(state(2), history.redo().get());

		assertEquals(Optional.empty(), history.jumpTo(99));
		assertEquals(2, history.current().sequence(), "Failed jump doesn't move");
	}

	@Test
	void snapshots_areIsolatedFromCallers() throws StructuralEditException {
		HistoryTree history = newHistory(10);
		DocumentTree restored = history.current().snapshot().tree();
		restored.delete(Path.just(0));
		assertEquals(state(0), history.current().snapshot());
	}

	@Test
	void pruning_removesOldestInactiveLeafFirst() {
		HistoryTree history = newHistory(4);
		history.checkpoint(state(1));          // 0-1
		history.checkpoint(state(2));          // 0-1-2
		history.undo();
		history.undo();
		history.checkpoint(state(3));          // 0-1-2, 0-3
		assertEquals(4, history.size());

		history.checkpoint(state(4));          // Leaf 2 is the oldest inactive one
		assertEquals(4, history.size());
		assertEquals(Optional.empty(), history.node(2));
		assertTrue(history.node(1).get().children().isEmpty());
		assertEquals(List.of(0L, 1L, 3L, 4L), sequences(history));

		history.checkpoint(state(5));          // Then leaf 1
		assertEquals(List.of(0L, 3L, 4L, 5L), sequences(history));
		assertEquals(List.of(0L, 3L, 4L, 5L), history.activePath().stream().map(HistoryNode::sequence).collect(toList()));
	}

	@Test
	void pruning_reRootsWhenEverythingIsActive() {
		HistoryTree history = newHistory(3);
		history.checkpoint(state(1));
		history.checkpoint(state(2));
		history.checkpoint(state(3));

		assertEquals(3, history.size());
		assertEquals(1, history.root().sequence());
		assertTrue(history.root().isRoot());
		assertEquals(List.of(1L, 2L, 3L), sequences(history));

		assertEquals(state(2), history.undo().get());
		assertEquals(state(1), history.undo().get());
		assertEquals(Optional.empty(), history.undo(), "Oldest retained state is the new root");
	}

	@Test
	void capacityOne_keepsOnlyCurrent() {
		HistoryTree history = newHistory(1);
		HistoryNode node = history.checkpoint(state(1));
		assertEquals(1, history.size());
		assertSame(node, history.root());
		assertSame(node, history.current());
		assertFalse(history.canUndo());
		assertEquals(Optional.empty(), history.node(0));

		history.checkpoint(state(2));
		assertEquals(List.of(2L), sequences(history));
	}

	@ParameterizedTest
	@ValueSource(ints = { 1, 2, 3, 7 })
	void sequenceNumbers_areNeverReused(int capacity) {
		HistoryTree history = newHistory(capacity);
		long previous = history.current().sequence();
		for (int i = 1; i <= 20; i++) {
			if (i % 3 == 0) {
				history.undo();
			}
			long sequence = history.checkpoint(state(i)).sequence();
			assertTrue(sequence > previous);
			previous = sequence;
			assertTrue(history.size() <= capacity);
		}
	}

	@Test
	void linksStayConsistentAfterPruning() {
		HistoryTree history = newHistory(5);
		for (int i = 1; i <= 30; i++) {
			if (i % 4 == 0) {
				history.undo();
				history.undo();
			}
			history.checkpoint(state(i));
		}
		int roots = 0;
		for (HistoryNode node : history.nodes()) {
			if (node.isRoot()) {
				roots++;
				assertSame(history.root(), node);
			} else {
				HistoryNode parent = node.parent().get();
				assertTrue(parent.children().contains(node));
				assertTrue(history.node(parent.sequence()).isPresent(), "Parent is retained");
				assertTrue(parent.sequence() < node.sequence());
			}
			for (HistoryNode child : node.children()) {
				assertSame(node, child.parent().get());
			}
		}
		assertEquals(1, roots);
		assertTrue(history.activePath().contains(history.current()));
	}

	private static List<Long> sequences(HistoryTree history) {
		return history.nodes().stream().map(HistoryNode::sequence).collect(toList());
	}
}
