package works.quill.exceptions;

import works.quill.Path;

/**
 * A key was supplied, or asked for, where the entries have none:
 * sequence elements, stream documents, and the root.
 */
public class UnexpectedKeyException extends StructuralEditException {
	public UnexpectedKeyException(Path path, String reason) {
		super(path, "Node at " + path + " has no key: " + reason);
	}
}
