package works.quill;

/**
 * The payload of a {@link Node}: one variant of a parsed JSON-family value.
 * <p>
 * Scalars are immutable records. Containers ({@link MappingValue},
 * {@link SequenceValue}, {@link DocumentsValue}) are mutable and own their child
 * {@link Node}s outright; a node is never shared between two slots.
 * <p>
 * Equality is structural throughout. The bookkeeping carried by {@link Node}
 * does not participate.
 */
public sealed interface Value permits
	NullValue,
	BooleanValue,
	NumberValue,
	StringValue,
	AliasValue,
	ContainerValue
{
	default boolean isContainer() {
		return this instanceof ContainerValue;
	}

	default boolean isMapping() {
		return this instanceof MappingValue;
	}

	default boolean isSequence() {
		return this instanceof SequenceValue;
	}

	default boolean isDocuments() {
		return this instanceof DocumentsValue;
	}

	default boolean isScalar() {
		return !isContainer();
	}

	/**
	 * @return a value equal to this one sharing no mutable state with it.
	 * Immutable scalars may return themselves.
	 */
	Value duplicate();

	/**
	 * Short human-readable name of the variant, for messages.
	 */
	String kind();
}
