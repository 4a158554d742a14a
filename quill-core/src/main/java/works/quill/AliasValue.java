package works.quill;

import org.jetbrains.annotations.NotNull;

/**
 * A cross-reference to an anchored node elsewhere in the document
 * (a YAML {@code *alias}).
 * <p>
 * This is a leaf, not an edge: the tree never links to the anchored node,
 * so it stays a tree with one owner per node. Callers that need the target
 * resolve {@link #anchor} by name through their own side table.
 */
public record AliasValue(@NotNull String anchor) implements Value {
	public AliasValue {
		if (anchor.isEmpty()) {
			throw new IllegalArgumentException("Alias anchor can't be empty");
		}
	}

	@Override
	public AliasValue duplicate() {
		return this;
	}

	@Override
	public String kind() {
		return "alias";
	}

	@Override
	public String toString() {
		return "*" + anchor;
	}
}
