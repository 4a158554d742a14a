package works.quill.exceptions;

import works.quill.Path;

/**
 * The container exists, but the requested position isn't one of its slots.
 */
public class PositionOutOfRangeException extends StructuralEditException {
	private final int position;
	private final int size;

	public PositionOutOfRangeException(Path containerPath, int position, int size) {
		super(containerPath, "Position " + position + " out of range for " + containerPath + " with " + size + " children");
		this.position = position;
		this.size = size;
	}

	public int position() {
		return position;
	}

	public int size() {
		return size;
	}
}
