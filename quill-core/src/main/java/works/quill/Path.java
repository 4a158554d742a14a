package works.quill;

import java.util.ArrayList;
import java.util.List;
import org.pcollections.PVector;
import org.pcollections.TreePVector;

/**
 * The location of a node in a {@link DocumentTree}, as a sequence of positions
 * starting from the root. Each position selects the N-th entry of a mapping
 * (in insertion order, regardless of its key) or the N-th element of a sequence.
 * <p>
 * The empty path denotes the root.
 * <p>
 * Paths are immutable values. Deriving one path from another shares the
 * common prefix, so saving a cursor path is cheap, and a saved path keeps
 * describing the same place even after the tree it came from is replaced.
 */
public final class Path {
	private static final Path EMPTY = new Path(TreePVector.empty());

	private final PVector<Integer> indices;

	private Path(PVector<Integer> indices) {
		this.indices = indices;
	}

	public static Path empty() {
		return EMPTY;
	}

	public static Path just(int index) {
		return EMPTY.then(index);
	}

	public static Path of(int... indices) {
		Path result = EMPTY;
		for (int index : indices) {
			result = result.then(index);
		}
		return result;
	}

	public static Path of(List<Integer> indices) {
		Path result = EMPTY;
		for (int index : indices) {
			result = result.then(index);
		}
		return result;
	}

	/**
	 * Inverse of {@link #toString()}: {@code "/"} for the root, otherwise
	 * slash-prefixed positions like {@code "/0/3/1"}.
	 *
	 * @throws IllegalArgumentException if the string isn't in that form
	 */
	public static Path parse(String pathString) {
		if (!pathString.startsWith("/")) {
			throw new IllegalArgumentException("Path must start with a slash: \"" + pathString + "\"");
		}
		if (pathString.equals("/")) {
			return EMPTY;
		}
		String[] segments = pathString.substring(1).split("/", -1);
		List<Integer> indices = new ArrayList<>(segments.length);
		for (String segment : segments) {
			try {
				indices.add(Integer.parseInt(segment));
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException("Invalid path segment \"" + segment + "\" in \"" + pathString + "\"", e);
			}
		}
		return of(indices);
	}

	public int length() {
		return indices.size();
	}

	public boolean isEmpty() {
		return indices.isEmpty();
	}

	public int index(int depth) {
		return indices.get(depth);
	}

	/**
	 * @throws IllegalStateException if this is the root path
	 */
	public int lastIndex() {
		if (isEmpty()) {
			throw new IllegalStateException("Root path has no last index");
		}
		return indices.get(indices.size() - 1);
	}

	/**
	 * @return the path of the child at {@code index} under this one
	 */
	public Path then(int index) {
		if (index < 0) {
			throw new IllegalArgumentException("Path index can't be negative: " + index);
		}
		return new Path(indices.plus(index));
	}

	/**
	 * @return this path with the last {@code n} indices removed
	 * @throws IllegalArgumentException if the path has fewer than {@code n} indices
	 */
	public Path truncatedBy(int n) {
		if (n < 0 || n > indices.size()) {
			throw new IllegalArgumentException("Can't truncate " + this + " by " + n);
		}
		return truncatedTo(indices.size() - n);
	}

	public Path truncatedTo(int length) {
		if (length == indices.size()) {
			return this;
		} else if (length == 0) {
			return EMPTY;
		}
		return new Path(indices.subList(0, length));
	}

	/**
	 * @throws IllegalStateException if this is the root path
	 */
	public Path parent() {
		if (isEmpty()) {
			throw new IllegalStateException("Root path has no parent");
		}
		return truncatedBy(1);
	}

	/**
	 * @return this path with the last index replaced
	 */
	public Path sibling(int index) {
		return parent().then(index);
	}

	/**
	 * @return true if {@code other} is this path or lies beneath it
	 */
	public boolean isPrefixOf(Path other) {
		if (other.length() < this.length()) {
			return false;
		}
		for (int i = 0; i < indices.size(); i++) {
			if (!indices.get(i).equals(other.indices.get(i))) {
				return false;
			}
		}
		return true;
	}

	public List<Integer> indices() {
		return indices;
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		return indices.equals(((Path) o).indices);
	}

	@Override
	public int hashCode() {
		return indices.hashCode();
	}

	@Override
	public String toString() {
		if (isEmpty()) {
			return "/";
		}
		StringBuilder sb = new StringBuilder();
		for (int index : indices) {
			sb.append('/').append(index);
		}
		return sb.toString();
	}
}
