package works.quill.exceptions;

import works.quill.Path;

/**
 * An edit to a {@link works.quill.DocumentTree} was refused because it would
 * leave the tree structurally invalid, or because what it names isn't there.
 * <p>
 * Always local and recoverable: the operation that throws this has made no
 * change at all, so an interactive caller can report it and carry on.
 */
public abstract class StructuralEditException extends Exception {
	private final Path path;

	protected StructuralEditException(Path path, String message) {
		super(message);
		this.path = path;
	}

	/**
	 * @return the path the failed operation was aimed at
	 */
	public Path path() {
		return path;
	}
}
