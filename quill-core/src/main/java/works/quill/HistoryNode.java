package works.quill;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * One recorded state in a {@link HistoryTree}.
 * <p>
 * Ordering between nodes, including across branches, comes from {@link #sequence()}.
 * The {@link #timestamp()} is for display and diagnostics only.
 */
public final class HistoryNode {
	private final Snapshot snapshot;
	private final Path editCursor;
	private final long sequence;
	private final Instant timestamp;
	@Nullable private HistoryNode parent;
	private final List<HistoryNode> children = new ArrayList<>();

	HistoryNode(Snapshot snapshot, Path editCursor, long sequence, Instant timestamp, @Nullable HistoryNode parent) {
		this.snapshot = snapshot;
		this.editCursor = editCursor;
		this.sequence = sequence;
		this.timestamp = timestamp;
		this.parent = parent;
	}

	public Snapshot snapshot() {
		return snapshot;
	}

	/**
	 * Where the cursor was when the edit that produced this state was issued.
	 * Undoing that edit puts the cursor back here.
	 * For the history root, the snapshot's own cursor.
	 */
	public Path editCursor() {
		return editCursor;
	}

	public long sequence() {
		return sequence;
	}

	public Instant timestamp() {
		return timestamp;
	}

	public Optional<HistoryNode> parent() {
		return Optional.ofNullable(parent);
	}

	public boolean isRoot() {
		return parent == null;
	}

	/**
	 * @return the children in creation order
	 */
	public List<HistoryNode> children() {
		return Collections.unmodifiableList(children);
	}

	/**
	 * @return the most recently created child, which is where redo goes
	 */
	public Optional<HistoryNode> newestChild() {
		HistoryNode newest = null;
		for (HistoryNode child : children) {
			if (newest == null || child.sequence > newest.sequence) {
				newest = child;
			}
		}
		return Optional.ofNullable(newest);
	}

	void addChild(HistoryNode child) {
		assert child.parent == this;
		children.add(child);
	}

	void removeChild(HistoryNode child) {
		boolean removed = children.remove(child);
		assert removed: "Node " + child.sequence + " is not a child of " + sequence;
		child.parent = null;
	}

	@Override
	public String toString() {
		return "HistoryNode{" +
			"sequence=" + sequence +
			", parent=" + (parent == null ? "none" : parent.sequence) +
			", children=" + children.size() +
			'}';
	}
}
