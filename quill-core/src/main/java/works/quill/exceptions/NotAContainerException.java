package works.quill.exceptions;

import works.quill.Path;

public class NotAContainerException extends StructuralEditException {
	private final String actualKind;

	public NotAContainerException(Path path, String actualKind) {
		super(path, "Node at " + path + " is a " + actualKind + ", not a container");
		this.actualKind = actualKind;
	}

	public String actualKind() {
		return actualKind;
	}
}
