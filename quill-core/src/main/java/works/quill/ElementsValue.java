package works.quill;

import java.util.List;

/**
 * A container whose children are an ordered list of nodes with no keys.
 */
public sealed interface ElementsValue extends ContainerValue permits SequenceValue, DocumentsValue {
	/**
	 * @return an unmodifiable view of the elements
	 */
	List<Node> elements();

	/**
	 * @throws IndexOutOfBoundsException if {@code position} is not in {@code [0, size()]}
	 */
	void insert(int position, Node node);
}
