package works.quill;

import java.util.Optional;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;
import works.quill.exceptions.DuplicateKeyException;
import works.quill.exceptions.PathNotFoundException;
import works.quill.exceptions.RootDeletionException;
import works.quill.exceptions.StructuralEditException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EditSessionTest {

	static EditSession session(DocumentTree tree) {
		return new EditSession(tree, QuillSettings.defaults());
	}

	@Test
	void deleteThenUndo_restoresDocumentAndCursor() throws StructuralEditException {
		EditSession session = session(TestDocuments.twoKeys());
		session.moveCursor(Path.just(1));

		session.delete(Path.just(1));
		assertEquals(new DocumentTree(Node.of(MappingValue.empty().with("a", Node.integer(1)))), session.tree());
		assertEquals(Path.empty(), session.cursor(), "Cursor falls back to the nearest existing ancestor");

		assertTrue(session.undo());
		assertEquals(TestDocuments.twoKeys(), session.tree());
		assertEquals(Path.just(1), session.cursor(), "Cursor returns to where the delete was issued");
	}

	@Test
	void insertIntoSequence() throws StructuralEditException {
		EditSession session = session(TestDocuments.sequenceOf(10, 30));
		session.insert(Path.empty(), 1, null, Node.integer(20));
		assertEquals(TestDocuments.sequenceOf(10, 20, 30), session.tree());
		assertEquals(Path.just(1), session.cursor());
	}

	@Test
	void undoThenNewEdit_redoFollowsNewBranch() throws StructuralEditException {
		EditSession session = session(TestDocuments.sequenceOf(1, 2, 3));
		session.delete(Path.just(0));
		assertTrue(session.undo());
		session.delete(Path.just(1));

		assertTrue(session.undo());
		assertEquals(TestDocuments.sequenceOf(1, 2, 3), session.tree());
		assertTrue(session.redo());
		assertEquals(TestDocuments.sequenceOf(1, 3), session.tree());
		assertEquals(2, session.history().root().children().size());
	}

	@Test
	void deleteRoot_failsWithoutChange() {
		EditSession session = session(TestDocuments.sample());
		RootDeletionException e = assertThrows(RootDeletionException.class, () -> session.delete(Path.empty()));
		assertEquals("Cannot delete root node", e.getMessage());
		assertEquals(TestDocuments.sample(), session.tree());
		assertEquals(1, session.history().size(), "Failed edits record nothing");
		assertFalse(session.isDirty());
	}

	@Test
	void readPastEnd_isAbsent() {
		EditSession session = session(TestDocuments.sequenceOf(1, 2));
		assertEquals(Optional.empty(), session.tree().read(Path.just(5)));
	}

	@Test
	void undoRedo_atEnds_returnFalse() throws StructuralEditException {
		EditSession session = session(TestDocuments.sample());
		assertFalse(session.undo());
		assertFalse(session.redo());

		session.replace(Path.just(0), NumberValue.of(2));
		assertFalse(session.redo());
		assertTrue(session.undo());
		assertFalse(session.undo());
		assertEquals(TestDocuments.sample(), session.tree());
	}

	@Test
	void redo_restoresPostEditCursor() throws StructuralEditException {
		EditSession session = session(TestDocuments.sequenceOf(1, 2));
		session.moveCursor(Path.just(1));
		session.insert(Path.empty(), 0, null, Node.integer(0));
		assertEquals(Path.just(0), session.cursor());

		session.undo();
		assertEquals(Path.just(1), session.cursor());
		session.redo();
		assertEquals(Path.just(0), session.cursor());
		assertEquals(TestDocuments.sequenceOf(0, 1, 2), session.tree());
	}

	@Test
	void edit_recordsOneUndoStep() throws StructuralEditException {
		EditSession session = session(TestDocuments.sample());
		session.edit("swap", (tree, cursor) -> {
			Node first = tree.delete(Path.of(1, 0));
			tree.insert(Path.just(1), 1, null, first);
			tree.replace(Path.just(0), NumberValue.of(100));
			return Path.of(1, 1);
		});
		assertEquals(2, session.history().size());
		assertEquals(Path.of(1, 1), session.cursor());
		assertEquals(Node.bool(true), session.tree().read(Path.of(1, 1)).get());
		assertEquals(Node.integer(100), session.tree().read(Path.just(0)).get());

		assertTrue(session.undo());
		assertEquals(TestDocuments.sample(), session.tree());
	}

	@Test
	void edit_failure_rollsBackEverything() throws StructuralEditException {
		EditSession session = session(TestDocuments.sample());
		session.replace(Path.just(0), NumberValue.of(5));
		DocumentTree before = session.tree().duplicate();
		Path cursorBefore = session.cursor();

		assertThrows(DuplicateKeyException.class, () -> session.edit("half done", (tree, cursor) -> {
			tree.delete(Path.of(1, 0));
			tree.insert(Path.empty(), 0, "a", Node.nullNode());
			return cursor;
		}));

		assertEquals(before, session.tree());
		assertEquals(cursorBefore, session.cursor());
		assertEquals(2, session.history().size());
		assertTrue(session.undo());
		assertEquals(TestDocuments.sample(), session.tree());
	}

	@Test
	void edit_runtimeFailure_rollsBack() {
		EditSession session = session(TestDocuments.sample());
		assertThrows(IllegalStateException.class, () -> session.edit("broken", (tree, cursor) -> {
			tree.delete(Path.just(2));
			throw new IllegalStateException("boom");
		}));
		assertEquals(TestDocuments.sample(), session.tree());
		assertFalse(session.isDirty());
	}

	@Test
	void setText_keepsStringStyle() throws StructuralEditException {
		DocumentTree tree = new DocumentTree(Node.sequence(
			Node.string("old", StringStyle.LITERAL),
			Node.integer(7)));
		EditSession session = session(tree);
		session.setText(Path.just(0), "new");
		assertEquals(new StringValue("new", StringStyle.LITERAL), session.tree().read(Path.just(0)).get().value());
		session.setText(Path.just(1), "seven");
		assertEquals(StringValue.plain("seven"), session.tree().read(Path.just(1)).get().value());
		assertThrows(PathNotFoundException.class, () -> session.setText(Path.just(2), "nope"));
	}

	@Test
	void renameKey_isUndoable() throws StructuralEditException {
		EditSession session = session(TestDocuments.twoKeys());
		session.renameKey(Path.just(1), "c");
		assertEquals(Optional.of("c"), session.tree().keyAt(Path.just(1)));
		session.undo();
		assertEquals(Optional.of("b"), session.tree().keyAt(Path.just(1)));
	}

	@Test
	void dirtyFlag_tracksSavedState() throws StructuralEditException {
		EditSession session = session(TestDocuments.sample());
		assertFalse(session.isDirty());

		session.replace(Path.just(0), NumberValue.of(2));
		assertTrue(session.isDirty());
		session.markSaved();
		assertFalse(session.isDirty());

		session.undo();
		assertTrue(session.isDirty());
		session.redo();
		assertFalse(session.isDirty());
	}

	@Test
	void jumpTo_restoresRecordedState() throws StructuralEditException {
		EditSession session = session(TestDocuments.sequenceOf(1, 2, 3));
		session.delete(Path.just(0));
		session.delete(Path.just(0));
		assertTrue(session.jumpTo(0));
		assertEquals(TestDocuments.sequenceOf(1, 2, 3), session.tree());
		assertTrue(session.jumpTo(1));
		assertEquals(TestDocuments.sequenceOf(2, 3), session.tree());
		assertFalse(session.jumpTo(42));
	}

	@Test
	void moveCursor_clampsToExistingPath() {
		EditSession session = session(TestDocuments.sample());
		assertEquals(Path.of(1, 1), session.moveCursor(Path.of(1, 1)));
		assertEquals(Path.just(1), session.moveCursor(Path.of(1, 9)));
		assertEquals(1, session.history().size(), "Cursor moves aren't edits");
	}

	@Test
	void undoneState_isIndependentOfLiveTree() throws StructuralEditException {
		EditSession session = session(TestDocuments.sample());
		session.replace(Path.just(0), NumberValue.of(2));
		DocumentTree afterEdit = session.tree();
		session.undo();
		assertNotSame(afterEdit, session.tree());
		session.delete(Path.just(2));
		assertTrue(session.jumpTo(1));
		assertEquals(Node.integer(2), session.tree().read(Path.just(0)).get());
		assertEquals(3, session.tree().childCount(Path.empty()).getAsInt());
	}

	@Test
	void undoLimit_boundsHistory() throws StructuralEditException {
		EditSession session = new EditSession(TestDocuments.sequenceOf(), QuillSettings.builder().undoLimit(3).build());
		for (int i = 0; i < 5; i++) {
			session.insert(Path.empty(), i, null, Node.integer(i));
		}
		assertEquals(3, session.history().size());
		assertTrue(session.undo());
		assertTrue(session.undo());
		assertFalse(session.undo());
		assertEquals(TestDocuments.sequenceOf(0, 1, 2), session.tree());
	}

	@Test
	void replaceWithRootValue_recordsHistoryAndUndoes() throws StructuralEditException {
		EditSession session = session(TestDocuments.sample());
		session.replace(Path.just(0), session.tree().root().value());
		assertEquals(TestDocuments.sample().root(), session.tree().read(Path.just(0)).get());
		assertEquals(2, session.history().size());

		assertTrue(session.undo());
		assertEquals(TestDocuments.sample(), session.tree());
		assertTrue(session.redo());
		assertEquals(OptionalInt.of(3), session.tree().childCount(Path.just(0)));
	}
}
