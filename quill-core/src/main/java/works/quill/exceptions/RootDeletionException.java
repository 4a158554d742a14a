package works.quill.exceptions;

import works.quill.Path;

public class RootDeletionException extends StructuralEditException {
	public RootDeletionException() {
		super(Path.empty(), "Cannot delete root node");
	}
}
