package works.quill;

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * The whole document and the cursor at one moment, frozen.
 * <p>
 * A snapshot owns a private copy of the tree. It copies on the way in and
 * again on the way out, so neither the tree it was taken from nor any tree
 * restored from it can change what it records.
 */
public final class Snapshot {
	private final DocumentTree tree;
	private final Path cursor;

	private Snapshot(DocumentTree tree, Path cursor) {
		this.tree = tree;
		this.cursor = cursor;
	}

	public static Snapshot of(DocumentTree tree, Path cursor) {
		return new Snapshot(tree.duplicate(), requireNonNull(cursor));
	}

	/**
	 * @return a fresh, independent copy of the recorded tree,
	 * which the caller is free to mutate
	 */
	public DocumentTree tree() {
		return tree.duplicate();
	}

	public Path cursor() {
		return cursor;
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		Snapshot that = (Snapshot) o;
		return tree.equals(that.tree) && cursor.equals(that.cursor);
	}

	@Override
	public int hashCode() {
		return Objects.hash(tree, cursor);
	}

	@Override
	public String toString() {
		return "Snapshot{cursor=" + cursor + ", tree=" + tree + '}';
	}
}
