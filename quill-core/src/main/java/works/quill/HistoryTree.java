package works.quill;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Branching undo history, in the style of vim's undo tree.
 * <p>
 * The root records the document as it was opened. Each {@link #checkpoint}
 * adds a child of the {@link #current() current} node and moves there.
 * {@link #undo()} moves to the parent; {@link #redo()} moves to the newest child.
 * Undoing and then checkpointing starts a new branch beside the old one
 * rather than discarding it, so nothing reachable is ever lost except to
 * the capacity limit.
 *
 * <h2>Capacity</h2>
 * At most {@link #capacity()} nodes are kept. When a checkpoint would exceed that,
 * room is made first by removing the oldest leaves that are not on the path
 * from the root to the current node. If every node is on that path, the history
 * is re-rooted instead: the root is dropped and its child on the path takes over,
 * repeatedly, until the new node fits. The current state is never pruned,
 * but the oldest undo steps are.
 * <p>
 * Sequence numbers are never reused, even after pruning.
 * <p>
 * Not thread-safe.
 */
public final class HistoryTree {
	private final NavigableMap<Long, HistoryNode> nodesBySequence = new TreeMap<>();
	private final int capacity;
	private final Clock clock;
	private HistoryNode root;
	private HistoryNode current;
	private long nextSequence;

	public HistoryTree(Snapshot initialSnapshot, int capacity) {
		this(initialSnapshot, capacity, Clock.systemUTC());
	}

	HistoryTree(Snapshot initialSnapshot, int capacity, Clock clock) {
		if (capacity < 1) {
			throw new IllegalArgumentException("History capacity must be at least 1: " + capacity);
		}
		this.capacity = capacity;
		this.clock = requireNonNull(clock);
		this.root = new HistoryNode(requireNonNull(initialSnapshot), initialSnapshot.cursor(), 0, clock.instant(), null);
		this.current = root;
		this.nextSequence = 1;
		nodesBySequence.put(0L, root);
	}

	/**
	 * Records {@code snapshot} as the newest state, with its own cursor as the edit cursor.
	 *
	 * @see #checkpoint(Snapshot, Path)
	 */
	public HistoryNode checkpoint(Snapshot snapshot) {
		return checkpoint(snapshot, snapshot.cursor());
	}

	/**
	 * Records {@code snapshot} as a new child of the current node and makes it current.
	 * Any existing children of the current node stay where they are;
	 * the new node becomes their newest sibling.
	 *
	 * @param editCursor where the cursor was when the edit producing {@code snapshot} was issued
	 * @return the new current node
	 */
	public HistoryNode checkpoint(Snapshot snapshot, Path editCursor) {
		requireNonNull(snapshot);
		requireNonNull(editCursor);
		makeRoomForOneMore();
		long sequence = nextSequence++;
		HistoryNode node = new HistoryNode(snapshot, editCursor, sequence, clock.instant(), current);
		if (current == null) {
			// Capacity 1: the only node was dropped to make room
			root = node;
		} else {
			current.addChild(node);
		}
		nodesBySequence.put(sequence, node);
		current = node;
		LOGGER.debug("Checkpoint {} (parent {}, {} nodes)", sequence, node.parent().map(HistoryNode::sequence).orElse(null), nodesBySequence.size());
		return node;
	}

	/**
	 * Moves to the parent of the current node.
	 *
	 * @return the parent's snapshot, or empty if the current node is the root,
	 * in which case nothing changes
	 */
	public Optional<Snapshot> undo() {
		Optional<HistoryNode> parent = current.parent();
		if (parent.isEmpty()) {
			LOGGER.debug("Undo: already at oldest state {}", current.sequence());
			return Optional.empty();
		}
		current = parent.get();
		LOGGER.debug("Undo to {}", current.sequence());
		return Optional.of(current.snapshot());
	}

	/**
	 * Moves to the most recently created child of the current node.
	 *
	 * @return that child's snapshot, or empty if the current node has no children,
	 * in which case nothing changes
	 */
	public Optional<Snapshot> redo() {
		Optional<HistoryNode> child = current.newestChild();
		if (child.isEmpty()) {
			LOGGER.debug("Redo: already at newest state {}", current.sequence());
			return Optional.empty();
		}
		current = child.get();
		LOGGER.debug("Redo to {}", current.sequence());
		return Optional.of(current.snapshot());
	}

	/**
	 * Moves straight to any retained node, on any branch.
	 *
	 * @return its snapshot, or empty if no node with that sequence number is retained
	 */
	public Optional<Snapshot> jumpTo(long sequence) {
		HistoryNode target = nodesBySequence.get(sequence);
		if (target == null) {
			return Optional.empty();
		}
		current = target;
		LOGGER.debug("Jump to {}", sequence);
		return Optional.of(target.snapshot());
	}

	public boolean canUndo() {
		return !current.isRoot();
	}

	public boolean canRedo() {
		return !current.children().isEmpty();
	}

	public HistoryNode current() {
		return current;
	}

	public HistoryNode root() {
		return root;
	}

	public Optional<HistoryNode> node(long sequence) {
		return Optional.ofNullable(nodesBySequence.get(sequence));
	}

	/**
	 * @return all retained nodes, oldest first
	 */
	public Collection<HistoryNode> nodes() {
		return Collections.unmodifiableCollection(nodesBySequence.values());
	}

	public int size() {
		return nodesBySequence.size();
	}

	public int capacity() {
		return capacity;
	}

	/**
	 * @return the nodes from the root to the current node, inclusive
	 */
	public List<HistoryNode> activePath() {
		List<HistoryNode> result = new ArrayList<>();
		for (HistoryNode n = current; n != null; n = n.parent().orElse(null)) {
			result.add(n);
		}
		Collections.reverse(result);
		return result;
	}

	/**
	 * @return the number of leaves, which is the number of distinct lines of editing
	 */
	public int branchCount() {
		int result = 0;
		for (HistoryNode n : nodesBySequence.values()) {
			if (n.children().isEmpty()) {
				result++;
			}
		}
		return result;
	}

	private void makeRoomForOneMore() {
		while (nodesBySequence.size() + 1 > capacity) {
			Set<HistoryNode> active = new HashSet<>(activePath());
			HistoryNode victim = oldestInactiveLeaf(active);
			if (victim != null) {
				HistoryNode parent = victim.parent().orElseThrow(() -> new AssertionError("Inactive leaf must have a parent"));
				parent.removeChild(victim);
				nodesBySequence.remove(victim.sequence());
				LOGGER.debug("Pruned history node {}", victim.sequence());
			} else {
				reRoot();
			}
		}
	}

	private HistoryNode oldestInactiveLeaf(Set<HistoryNode> active) {
		for (HistoryNode n : nodesBySequence.values()) {
			if (n.children().isEmpty() && !active.contains(n)) {
				return n;
			}
		}
		return null;
	}

	/**
	 * Every node is on the active path, so the tree is a single chain.
	 * Drop the root and promote its only child.
	 */
	private void reRoot() {
		HistoryNode oldRoot = root;
		nodesBySequence.remove(oldRoot.sequence());
		if (oldRoot == current) {
			root = null;
			current = null;
			LOGGER.debug("Dropped history root {} to make room", oldRoot.sequence());
			return;
		}
		assert oldRoot.children().size() == 1: "Re-rooting requires a single chain";
		HistoryNode newRoot = oldRoot.children().get(0);
		oldRoot.removeChild(newRoot);
		root = newRoot;
		LOGGER.debug("Re-rooted history from {} to {}", oldRoot.sequence(), newRoot.sequence());
	}

	@Override
	public String toString() {
		return "HistoryTree{" +
			"size=" + nodesBySequence.size() +
			", capacity=" + capacity +
			", current=" + (current == null ? "none" : current.sequence()) +
			'}';
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(HistoryTree.class);
}
