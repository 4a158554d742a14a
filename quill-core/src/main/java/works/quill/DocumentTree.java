package works.quill;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.quill.exceptions.DuplicateKeyException;
import works.quill.exceptions.KeyRequiredException;
import works.quill.exceptions.NestedDocumentsException;
import works.quill.exceptions.NotAContainerException;
import works.quill.exceptions.PathNotFoundException;
import works.quill.exceptions.PositionOutOfRangeException;
import works.quill.exceptions.RootDeletionException;
import works.quill.exceptions.UnexpectedKeyException;

import static java.util.Objects.requireNonNull;

/**
 * A parsed document: one root {@link Node}, every position of which is
 * reachable by a {@link Path}.
 *
 * <h2>Reading</h2>
 * {@link #read} resolves a path one index at a time. Running into a scalar
 * before the path is used up, or an index past the end of a container,
 * yields {@link Optional#empty() empty}. That is an ordinary answer, not an error:
 * the path just doesn't denote anything in this tree.
 *
 * <h2>Writing</h2>
 * The mutators ({@link #insert}, {@link #delete}, {@link #replace}, {@link #renameKey})
 * either succeed completely or throw a
 * {@link works.quill.exceptions.StructuralEditException StructuralEditException}
 * having changed nothing, not even modified flags.
 * A successful write marks every node from the root down to the one changed
 * as modified, because a node whose descendant changed can no longer be
 * reproduced from its original source text.
 * <p>
 * Not thread-safe. Readers must not run concurrently with writers.
 */
public final class DocumentTree {
	@NotNull private final Node root;
	@Nullable private final String originalSource;

	public DocumentTree(Node root) {
		this(root, null);
	}

	/**
	 * @param originalSource the text {@code root} was parsed from, if any,
	 *                       against which node {@link TextSpan spans} are resolved
	 */
	public DocumentTree(Node root, @Nullable String originalSource) {
		this.root = requireNonNull(root);
		this.originalSource = originalSource;
	}

	public Node root() {
		return root;
	}

	public Optional<String> originalSource() {
		return Optional.ofNullable(originalSource);
	}

	/**
	 * @return true if anything in the tree differs from what was parsed
	 */
	public boolean isModified() {
		return root.isModified();
	}

	public Optional<Node> read(Path path) {
		return Optional.ofNullable(resolve(path));
	}

	/**
	 * Like {@link #read}, but for a caller that intends to change the node in place.
	 * If the path resolves, the node and all its ancestors are marked modified.
	 * If it doesn't, nothing is marked.
	 */
	public Optional<Node> readWrite(Path path) {
		List<Node> route = route(path);
		if (route == null) {
			return Optional.empty();
		}
		route.forEach(Node::markModified);
		return Optional.of(route.get(route.size() - 1));
	}

	public boolean exists(Path path) {
		return resolve(path) != null;
	}

	/**
	 * @return the number of children of the node at {@code path}
	 * (zero for a scalar), or empty if there's no such node
	 */
	public OptionalInt childCount(Path path) {
		Node node = resolve(path);
		return node == null ? OptionalInt.empty() : OptionalInt.of(node.childCount());
	}

	/**
	 * @return the key under which the node at {@code path} is stored,
	 * or empty if its parent isn't a mapping or there's no such node
	 */
	public Optional<String> keyAt(Path path) {
		if (path.isEmpty()) {
			return Optional.empty();
		}
		Node parent = resolve(path.parent());
		if (parent != null && parent.value() instanceof MappingValue m && path.lastIndex() < m.size()) {
			return Optional.of(m.keyAt(path.lastIndex()));
		}
		return Optional.empty();
	}

	/**
	 * The cursor fallback policy after a structural change: {@code path} itself
	 * if it still resolves, otherwise its longest prefix that does.
	 * Always succeeds, because the root always resolves.
	 */
	public Path nearestExisting(Path path) {
		Node current = root;
		for (int depth = 0; depth < path.length(); depth++) {
			int index = path.index(depth);
			if (current.value() instanceof ContainerValue c && index < c.size()) {
				current = c.child(index);
			} else {
				return path.truncatedTo(depth);
			}
		}
		return path;
	}

	/**
	 * Places {@code node} into the container at {@code parentPath} so that it ends up
	 * at {@code position}; children at or after {@code position} shift up by one.
	 * {@code position == childCount} appends.
	 * <p>
	 * The tree stores a deep copy of {@code node}, so a node that is already part of
	 * this tree, even an ancestor of the insertion point, can be inserted without
	 * two positions sharing it.
	 *
	 * @param key required for a mapping, and must not already be present there;
	 *            must be null for sequences and document streams
	 * @throws PathNotFoundException if {@code parentPath} doesn't resolve
	 * @throws NotAContainerException if it resolves to a scalar
	 * @throws PositionOutOfRangeException if {@code position} isn't in {@code [0, childCount]}
	 * @throws KeyRequiredException if the container is a mapping and {@code key} is null
	 * @throws DuplicateKeyException if the mapping already has {@code key}
	 * @throws UnexpectedKeyException if the container isn't a mapping and {@code key} isn't null
	 * @throws NestedDocumentsException if {@code node} is a document stream
	 */
	public void insert(Path parentPath, int position, @Nullable String key, Node node) throws
		PathNotFoundException,
		NotAContainerException,
		PositionOutOfRangeException,
		KeyRequiredException,
		DuplicateKeyException,
		UnexpectedKeyException,
		NestedDocumentsException
	{
		requireNonNull(node);
		List<Node> route = requireRoute(parentPath);
		Node parent = route.get(route.size() - 1);
		if (!(parent.value() instanceof ContainerValue container)) {
			throw new NotAContainerException(parentPath, parent.value().kind());
		}
		if (node.isDocuments()) {
			throw new NestedDocumentsException(parentPath.then(Math.max(position, 0)));
		}
		if (position < 0 || position > container.size()) {
			throw new PositionOutOfRangeException(parentPath, position, container.size());
		}
		if (container instanceof MappingValue mapping) {
			if (key == null) {
				throw new KeyRequiredException(parentPath);
			}
			if (mapping.containsKey(key)) {
				throw new DuplicateKeyException(parentPath, key);
			}
			Node copy = node.duplicate();
			route.forEach(Node::markModified);
			mapping.insert(position, key, copy);
		} else {
			if (key != null) {
				throw new UnexpectedKeyException(parentPath.then(position), "parent is a " + container.kind());
			}
			Node copy = node.duplicate();
			route.forEach(Node::markModified);
			((ElementsValue) container).insert(position, copy);
		}
		LOGGER.debug("Inserted {} at {}", node.value().kind(), parentPath.then(position));
	}

	/**
	 * Removes the node at {@code path} from its parent; later siblings shift down by one.
	 * <p>
	 * Picking a new cursor afterward is up to the caller;
	 * {@link #nearestExisting} implements the usual policy.
	 *
	 * @return the removed node, now owned by the caller
	 * @throws RootDeletionException if {@code path} is empty
	 * @throws PathNotFoundException if the parent path doesn't resolve
	 * @throws NotAContainerException if the parent path resolves to a scalar
	 * @throws PositionOutOfRangeException if the parent has no child at the last index
	 */
	public Node delete(Path path) throws
		RootDeletionException,
		PathNotFoundException,
		NotAContainerException,
		PositionOutOfRangeException
	{
		if (path.isEmpty()) {
			throw new RootDeletionException();
		}
		Path parentPath = path.parent();
		List<Node> route = requireRoute(parentPath);
		Node parent = route.get(route.size() - 1);
		if (!(parent.value() instanceof ContainerValue container)) {
			throw new NotAContainerException(parentPath, parent.value().kind());
		}
		int index = path.lastIndex();
		if (index >= container.size()) {
			throw new PositionOutOfRangeException(parentPath, index, container.size());
		}
		route.forEach(Node::markModified);
		Node removed = container.removeAt(index);
		LOGGER.debug("Deleted {} at {}", removed.value().kind(), path);
		return removed;
	}

	/**
	 * Gives the node at {@code path} a new value. This is the scalar edit,
	 * but any value may replace any other, including the whole root.
	 * The node keeps its position and, in a mapping, its key.
	 * Like {@link #insert}, this stores a deep copy of {@code newValue}.
	 *
	 * @throws PathNotFoundException if {@code path} doesn't resolve
	 * @throws NestedDocumentsException if {@code newValue} is a document stream
	 * and {@code path} isn't the root
	 */
	public void replace(Path path, Value newValue) throws PathNotFoundException, NestedDocumentsException {
		requireNonNull(newValue);
		List<Node> route = requireRoute(path);
		if (newValue.isDocuments() && !path.isEmpty()) {
			throw new NestedDocumentsException(path);
		}
		Value copy = newValue.duplicate();
		route.forEach(Node::markModified);
		route.get(route.size() - 1).setValue(copy);
		LOGGER.debug("Replaced value at {} with {}", path, newValue.kind());
	}

	/**
	 * Changes the key of the mapping entry at {@code path}, leaving its position
	 * and value alone.
	 *
	 * @throws PathNotFoundException if {@code path} doesn't resolve
	 * @throws UnexpectedKeyException if {@code path} is the root or its parent isn't a mapping
	 * @throws DuplicateKeyException if a different entry already has {@code newKey}
	 */
	public void renameKey(Path path, String newKey) throws PathNotFoundException, UnexpectedKeyException, DuplicateKeyException {
		requireNonNull(newKey);
		if (path.isEmpty()) {
			throw new UnexpectedKeyException(path, "the root has no key");
		}
		Path parentPath = path.parent();
		List<Node> route = route(parentPath);
		if (route == null) {
			throw new PathNotFoundException(path);
		}
		Node parent = route.get(route.size() - 1);
		if (!(parent.value() instanceof ContainerValue container) || path.lastIndex() >= container.size()) {
			throw new PathNotFoundException(path);
		}
		if (!(container instanceof MappingValue mapping)) {
			throw new UnexpectedKeyException(path, "parent is a " + container.kind());
		}
		int existing = mapping.indexOf(newKey);
		if (existing >= 0 && existing != path.lastIndex()) {
			throw new DuplicateKeyException(parentPath, newKey);
		}
		route.forEach(Node::markModified);
		mapping.renameAt(path.lastIndex(), newKey);
		LOGGER.debug("Renamed key at {}", path);
	}

	/**
	 * @return a fully independent deep copy: no node is shared, so
	 * mutating either tree never affects the other
	 */
	public DocumentTree duplicate() {
		return new DocumentTree(root.duplicate(), originalSource);
	}

	@Nullable
	private Node resolve(Path path) {
		Node current = root;
		for (int depth = 0; depth < path.length(); depth++) {
			int index = path.index(depth);
			if (current.value() instanceof ContainerValue c && index < c.size()) {
				current = c.child(index);
			} else {
				return null;
			}
		}
		return current;
	}

	/**
	 * @return the nodes from the root down to the one at {@code path}, inclusive,
	 * or null if {@code path} doesn't resolve
	 */
	@Nullable
	private List<Node> route(Path path) {
		List<Node> result = new ArrayList<>(path.length() + 1);
		Node current = root;
		result.add(current);
		for (int depth = 0; depth < path.length(); depth++) {
			int index = path.index(depth);
			if (current.value() instanceof ContainerValue c && index < c.size()) {
				current = c.child(index);
				result.add(current);
			} else {
				return null;
			}
		}
		return result;
	}

	private List<Node> requireRoute(Path path) throws PathNotFoundException {
		List<Node> result = route(path);
		if (result == null) {
			throw new PathNotFoundException(path);
		}
		return result;
	}

	/**
	 * Structural equality of the documents. Modified flags, spans, and source text are ignored.
	 */
	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		return root.equals(((DocumentTree) o).root);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(root);
	}

	@Override
	public String toString() {
		return "DocumentTree" + root;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(DocumentTree.class);
}
