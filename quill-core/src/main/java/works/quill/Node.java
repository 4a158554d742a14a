package works.quill;

import java.util.Objects;
import java.util.Optional;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * One vertex of a {@link DocumentTree}: a {@link Value} plus the bookkeeping
 * a format-preserving serializer needs.
 * <p>
 * The <em>modified</em> flag says whether the node's rendering may differ from
 * its original source text. Parsed nodes start clean; nodes built by callers
 * start modified, having no source to pass through. Any write access marks
 * the node modified whether or not the value really changes.
 * <p>
 * A node knows nothing of its parent. Where it lives is described only by the
 * {@link Path} used to reach it.
 * <p>
 * Equality compares values only; the modified flag and span are ignored.
 */
public final class Node {
	@NotNull private Value value;
	private boolean modified;
	@Nullable private final TextSpan span;

	private Node(@NotNull Value value, boolean modified, @Nullable TextSpan span) {
		this.value = requireNonNull(value);
		this.modified = modified;
		this.span = span;
	}

	/**
	 * @return a new, modified node with no source span
	 */
	public static Node of(Value value) {
		return new Node(value, true, null);
	}

	/**
	 * For parsers: an unmodified node that came from {@code span} of the source text.
	 */
	public static Node parsed(Value value, @Nullable TextSpan span) {
		return new Node(value, false, span);
	}

	public static Node nullNode() {
		return of(NullValue.NULL);
	}

	public static Node bool(boolean value) {
		return of(BooleanValue.of(value));
	}

	public static Node integer(long value) {
		return of(NumberValue.of(value));
	}

	public static Node floating(double value) {
		return of(NumberValue.of(value));
	}

	public static Node string(String text) {
		return of(StringValue.plain(text));
	}

	public static Node string(String text, StringStyle style) {
		return of(new StringValue(text, style));
	}

	public static Node alias(String anchor) {
		return of(new AliasValue(anchor));
	}

	public static Node sequence(Node... elements) {
		return of(SequenceValue.of(elements));
	}

	public static Node mapping() {
		return of(MappingValue.empty());
	}

	public Value value() {
		return value;
	}

	/**
	 * Grants mutable access to this node's value, so a container's children can be
	 * changed in place. Marks this node modified as a side effect.
	 */
	public Value valueForWrite() {
		modified = true;
		return value;
	}

	/**
	 * Replaces the value outright. Marks this node modified.
	 */
	public void setValue(Value newValue) {
		this.value = requireNonNull(newValue);
		this.modified = true;
	}

	public boolean isModified() {
		return modified;
	}

	void markModified() {
		modified = true;
	}

	public Optional<TextSpan> span() {
		return Optional.ofNullable(span);
	}

	public boolean isContainer() {
		return value.isContainer();
	}

	public boolean isMapping() {
		return value.isMapping();
	}

	public boolean isSequence() {
		return value.isSequence();
	}

	public boolean isDocuments() {
		return value.isDocuments();
	}

	public boolean isScalar() {
		return value.isScalar();
	}

	/**
	 * @return the number of children, or zero for a scalar
	 */
	public int childCount() {
		if (value instanceof ContainerValue c) {
			return c.size();
		} else {
			return 0;
		}
	}

	/**
	 * @return a deep copy sharing nothing mutable with this node,
	 * with the same modified flags and spans throughout
	 */
	public Node duplicate() {
		return new Node(value.duplicate(), modified, span);
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		return value.equals(((Node) o).value);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(value);
	}

	@Override
	public String toString() {
		return value.toString();
	}
}
