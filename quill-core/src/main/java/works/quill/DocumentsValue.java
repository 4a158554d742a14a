package works.quill;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * The root of a multi-document stream (JSON Lines, or YAML with several {@code ---} documents).
 * Each element is one document.
 * <p>
 * Only ever appears as the value of a tree's root node:
 * {@link DocumentTree} refuses to place one anywhere else, and refuses to
 * nest one document stream inside another.
 */
public final class DocumentsValue implements ElementsValue {
	private final List<Node> documents;

	private DocumentsValue(List<Node> documents) {
		this.documents = documents;
	}

	public static DocumentsValue empty() {
		return new DocumentsValue(new ArrayList<>());
	}

	public static DocumentsValue of(Node... documents) {
		DocumentsValue result = empty();
		for (Node n : documents) {
			result.insert(result.size(), n);
		}
		return result;
	}

	@Override
	public List<Node> elements() {
		return Collections.unmodifiableList(documents);
	}

	@Override
	public int size() {
		return documents.size();
	}

	@Override
	public Node child(int position) {
		return documents.get(position);
	}

	@Override
	public void insert(int position, Node node) {
		requireNonNull(node);
		if (node.value().isDocuments()) {
			throw new IllegalArgumentException("Document streams can't be nested");
		}
		if (position < 0 || position > documents.size()) {
			throw new IndexOutOfBoundsException("Position " + position + " out of range for stream with " + documents.size() + " documents");
		}
		documents.add(position, node);
	}

	@Override
	public Node removeAt(int position) {
		return documents.remove(position);
	}

	@Override
	public DocumentsValue duplicate() {
		List<Node> copy = new ArrayList<>(documents.size());
		for (Node n : documents) {
			copy.add(n.duplicate());
		}
		return new DocumentsValue(copy);
	}

	@Override
	public String kind() {
		return "documents";
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		return documents.equals(((DocumentsValue) o).documents);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(documents);
	}

	@Override
	public String toString() {
		return "---" + documents;
	}
}
