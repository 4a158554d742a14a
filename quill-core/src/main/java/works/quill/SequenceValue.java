package works.quill;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * An ordered list of nodes.
 */
public final class SequenceValue implements ElementsValue {
	private final List<Node> elements;

	private SequenceValue(List<Node> elements) {
		this.elements = elements;
	}

	public static SequenceValue empty() {
		return new SequenceValue(new ArrayList<>());
	}

	public static SequenceValue of(Node... elements) {
		SequenceValue result = empty();
		for (Node n : elements) {
			result.insert(result.size(), n);
		}
		return result;
	}

	@Override
	public List<Node> elements() {
		return Collections.unmodifiableList(elements);
	}

	@Override
	public int size() {
		return elements.size();
	}

	@Override
	public Node child(int position) {
		return elements.get(position);
	}

	@Override
	public void insert(int position, Node node) {
		requireNonNull(node);
		if (position < 0 || position > elements.size()) {
			throw new IndexOutOfBoundsException("Position " + position + " out of range for sequence with " + elements.size() + " elements");
		}
		elements.add(position, node);
	}

	@Override
	public Node removeAt(int position) {
		return elements.remove(position);
	}

	@Override
	public SequenceValue duplicate() {
		List<Node> copy = new ArrayList<>(elements.size());
		for (Node n : elements) {
			copy.add(n.duplicate());
		}
		return new SequenceValue(copy);
	}

	@Override
	public String kind() {
		return "sequence";
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		return elements.equals(((SequenceValue) o).elements);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(elements);
	}

	@Override
	public String toString() {
		return elements.toString();
	}
}
