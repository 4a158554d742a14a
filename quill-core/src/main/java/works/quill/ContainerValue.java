package works.quill;

/**
 * A {@link Value} with positionally-addressed children.
 * Position {@code i} is the i-th entry in insertion order for a mapping,
 * and the i-th element otherwise.
 */
public sealed interface ContainerValue extends Value permits MappingValue, ElementsValue {
	int size();

	default boolean isEmpty() {
		return size() == 0;
	}

	/**
	 * @throws IndexOutOfBoundsException if {@code position} is not in {@code [0, size())}
	 */
	Node child(int position);

	/**
	 * Removes the child at {@code position}, shifting later children down by one.
	 *
	 * @return the removed node, no longer owned by this container
	 * @throws IndexOutOfBoundsException if {@code position} is not in {@code [0, size())}
	 */
	Node removeAt(int position);

	@Override
	ContainerValue duplicate();
}
