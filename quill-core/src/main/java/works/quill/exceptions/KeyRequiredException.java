package works.quill.exceptions;

import works.quill.Path;

public class KeyRequiredException extends StructuralEditException {
	public KeyRequiredException(Path mappingPath) {
		super(mappingPath, "Inserting into the mapping at " + mappingPath + " requires a key");
	}
}
