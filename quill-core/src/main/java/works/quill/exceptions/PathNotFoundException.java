package works.quill.exceptions;

import works.quill.Path;

public class PathNotFoundException extends StructuralEditException {
	public PathNotFoundException(Path path) {
		super(path, "No node at " + path);
	}
}
