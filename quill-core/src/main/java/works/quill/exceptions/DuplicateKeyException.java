package works.quill.exceptions;

import works.quill.Path;

public class DuplicateKeyException extends StructuralEditException {
	private final String key;

	public DuplicateKeyException(Path mappingPath, String key) {
		super(mappingPath, "Mapping at " + mappingPath + " already has key \"" + key + "\"");
		this.key = key;
	}

	public String key() {
		return key;
	}
}
