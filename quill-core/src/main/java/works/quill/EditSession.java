package works.quill;

import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.quill.exceptions.PathNotFoundException;
import works.quill.exceptions.StructuralEditException;
import works.quill.logging.MappedDiagnosticContext.MDCScope;

import static java.util.Objects.requireNonNull;
import static works.quill.logging.MappedDiagnosticContext.setupMDC;

/**
 * One user's editing of one document: the live {@link DocumentTree}, the cursor,
 * and the {@link HistoryTree} that makes every edit undoable.
 * <p>
 * Each successful edit method records exactly one history checkpoint holding the
 * resulting document, so the history root is the document as opened and
 * every later node is the state after one edit. Use {@link #edit} to make
 * several tree changes count as a single undo step.
 * <p>
 * A failed edit throws a {@link StructuralEditException} and leaves the document,
 * cursor and history exactly as they were.
 * <p>
 * Readers such as serializers and query engines may use {@link #tree()} freely
 * between edits. Changing that tree directly bypasses the history;
 * go through this class instead.
 * <p>
 * Not thread-safe.
 */
public final class EditSession {
	private final QuillSettings settings;
	private final HistoryTree history;
	private DocumentTree tree;
	private Path cursor;
	private long savedSequence;

	/**
	 * A group of tree changes to be recorded as one undo step.
	 */
	@FunctionalInterface
	public interface CompoundEdit {
		/**
		 * @param tree the live document, to be changed in place
		 * @param cursor the cursor before the edit
		 * @return where the cursor should go afterward
		 */
		Path apply(DocumentTree tree, Path cursor) throws StructuralEditException;
	}

	public EditSession(DocumentTree tree, QuillSettings settings) {
		this(tree, Path.empty(), settings);
	}

	public EditSession(DocumentTree tree, Path cursor, QuillSettings settings) {
		this.settings = requireNonNull(settings);
		this.tree = requireNonNull(tree);
		this.cursor = tree.nearestExisting(cursor);
		this.history = new HistoryTree(Snapshot.of(tree, this.cursor), settings.getUndoLimit());
		this.savedSequence = history.current().sequence();
	}

	public DocumentTree tree() {
		return tree;
	}

	public Path cursor() {
		return cursor;
	}

	public HistoryTree history() {
		return history;
	}

	public QuillSettings settings() {
		return settings;
	}

	/**
	 * Moves the cursor to {@code path}, or to the nearest ancestor of it that exists.
	 * Cursor movement is not an edit and is not recorded in the history.
	 *
	 * @return the cursor's new position
	 */
	public Path moveCursor(Path path) {
		cursor = tree.nearestExisting(path);
		return cursor;
	}

	/**
	 * @see DocumentTree#insert
	 */
	public void insert(Path parentPath, int position, @Nullable String key, Node node) throws StructuralEditException {
		try (MDCScope ignored = setupMDC(settings.getSessionName())) {
			tree.insert(parentPath, position, key, node);
			commit("insert", parentPath.then(position));
		}
	}

	/**
	 * Deletes the node at {@code path}. The cursor goes to {@code path} if something
	 * has shifted into that position, otherwise to its nearest existing ancestor.
	 *
	 * @return the removed node
	 * @see DocumentTree#delete
	 */
	public Node delete(Path path) throws StructuralEditException {
		try (MDCScope ignored = setupMDC(settings.getSessionName())) {
			Node removed = tree.delete(path);
			commit("delete", tree.nearestExisting(path));
			return removed;
		}
	}

	/**
	 * @see DocumentTree#replace
	 */
	public void replace(Path path, Value newValue) throws StructuralEditException {
		try (MDCScope ignored = setupMDC(settings.getSessionName())) {
			tree.replace(path, newValue);
			commit("replace", path);
		}
	}

	/**
	 * Sets the text of the string at {@code path}, keeping its
	 * {@link StringStyle style}. A non-string node becomes a plain string.
	 */
	public void setText(Path path, String text) throws StructuralEditException {
		requireNonNull(text);
		Optional<Node> node = tree.read(path);
		if (node.isEmpty()) {
			throw new PathNotFoundException(path);
		}
		Value newValue;
		if (node.get().value() instanceof StringValue s) {
			newValue = s.withText(text);
		} else {
			newValue = StringValue.plain(text);
		}
		replace(path, newValue);
	}

	/**
	 * @see DocumentTree#renameKey
	 */
	public void renameKey(Path path, String newKey) throws StructuralEditException {
		try (MDCScope ignored = setupMDC(settings.getSessionName())) {
			tree.renameKey(path, newKey);
			commit("rename", path);
		}
	}

	/**
	 * Applies {@code edit} to the live tree and records the outcome as a single
	 * undo step. If {@code edit} throws, every change it made is rolled back
	 * before the exception propagates.
	 * <p>
	 * If {@code edit} returns null, the cursor stays put.
	 */
	public void edit(String description, CompoundEdit edit) throws StructuralEditException {
		try (MDCScope ignored = setupMDC(settings.getSessionName())) {
			Path newCursor;
			try {
				newCursor = edit.apply(tree, cursor);
			} catch (StructuralEditException | RuntimeException e) {
				rollBack(description);
				throw e;
			}
			commit(description, newCursor == null ? cursor : newCursor);
		}
	}

	/**
	 * Restores the state before the most recent edit on the current branch,
	 * with the cursor where it was when that edit was made.
	 *
	 * @return false if there is nothing to undo, in which case nothing changes
	 */
	public boolean undo() {
		try (MDCScope ignored = setupMDC(settings.getSessionName())) {
			HistoryNode undone = history.current();
			Optional<Snapshot> snapshot = history.undo();
			if (snapshot.isEmpty()) {
				return false;
			}
			tree = snapshot.get().tree();
			cursor = tree.nearestExisting(undone.editCursor());
			LOGGER.debug("Undid {}; cursor at {}", undone.sequence(), cursor);
			return true;
		}
	}

	/**
	 * Re-applies the most recently created edit that follows the current state.
	 *
	 * @return false if there is nothing to redo, in which case nothing changes
	 */
	public boolean redo() {
		try (MDCScope ignored = setupMDC(settings.getSessionName())) {
			Optional<Snapshot> snapshot = history.redo();
			if (snapshot.isEmpty()) {
				return false;
			}
			restore(snapshot.get());
			LOGGER.debug("Redid {}; cursor at {}", history.current().sequence(), cursor);
			return true;
		}
	}

	/**
	 * Goes straight to any retained state, on any branch.
	 *
	 * @return false if no state with that sequence number is retained
	 */
	public boolean jumpTo(long sequence) {
		try (MDCScope ignored = setupMDC(settings.getSessionName())) {
			Optional<Snapshot> snapshot = history.jumpTo(sequence);
			snapshot.ifPresent(this::restore);
			return snapshot.isPresent();
		}
	}

	public boolean canUndo() {
		return history.canUndo();
	}

	public boolean canRedo() {
		return history.canRedo();
	}

	/**
	 * @return true if the document differs from the state last {@link #markSaved saved}
	 * (initially, the state it was opened in)
	 */
	public boolean isDirty() {
		return history.current().sequence() != savedSequence;
	}

	/**
	 * Records that the current state has been written out.
	 * Undoing or redoing away from it makes the session dirty again;
	 * coming back makes it clean.
	 */
	public void markSaved() {
		savedSequence = history.current().sequence();
	}

	private void commit(String description, Path newCursor) {
		Path editCursor = cursor;
		cursor = tree.nearestExisting(newCursor);
		HistoryNode node = history.checkpoint(Snapshot.of(tree, cursor), editCursor);
		LOGGER.debug("Recorded {} as {}; cursor {} -> {}", description, node.sequence(), editCursor, cursor);
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("Document after {}: {}", description, tree);
		}
	}

	private void restore(Snapshot snapshot) {
		tree = snapshot.tree();
		cursor = tree.nearestExisting(snapshot.cursor());
	}

	private void rollBack(String description) {
		LOGGER.debug("Edit \"{}\" failed; rolling back to {}", description, history.current().sequence());
		tree = history.current().snapshot().tree();
	}

	@Override
	public String toString() {
		return "EditSession{" +
			"name=" + settings.getSessionName() +
			", cursor=" + cursor +
			", history=" + history +
			'}';
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(EditSession.class);
}
