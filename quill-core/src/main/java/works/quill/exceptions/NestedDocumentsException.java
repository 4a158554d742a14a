package works.quill.exceptions;

import works.quill.Path;

/**
 * A document stream may only be the value of the root.
 */
public class NestedDocumentsException extends StructuralEditException {
	public NestedDocumentsException(Path path) {
		super(path, "A document stream can't be placed at " + path);
	}
}
