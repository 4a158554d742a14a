package works.quill;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.jetbrains.annotations.NotNull;

import static java.util.Objects.requireNonNull;

/**
 * An ordered mapping from string keys to nodes.
 * <p>
 * Insertion order is part of the value: two mappings with the same entries
 * in a different order are not equal, and positions are assigned in that order.
 * Keys are unique.
 */
public final class MappingValue implements ContainerValue {
	private final List<Entry> entries;

	public record Entry(@NotNull String key, @NotNull Node node) {
		public Entry {
			requireNonNull(key);
			requireNonNull(node);
		}

		Entry duplicate() {
			return new Entry(key, node.duplicate());
		}
	}

	private MappingValue(List<Entry> entries) {
		this.entries = entries;
	}

	public static MappingValue empty() {
		return new MappingValue(new ArrayList<>());
	}

	/**
	 * Appends an entry. Intended for building values before they are placed in a tree.
	 *
	 * @return this
	 * @throws IllegalArgumentException if {@code key} is already present
	 */
	public MappingValue with(String key, Node node) {
		insert(entries.size(), key, node);
		return this;
	}

	/**
	 * @return an unmodifiable view of the entries in order
	 */
	public List<Entry> entries() {
		return Collections.unmodifiableList(entries);
	}

	@Override
	public int size() {
		return entries.size();
	}

	@Override
	public Node child(int position) {
		return entries.get(position).node();
	}

	public String keyAt(int position) {
		return entries.get(position).key();
	}

	public boolean containsKey(String key) {
		return indexOf(key) >= 0;
	}

	/**
	 * @return the position of {@code key}, or -1 if absent
	 */
	public int indexOf(String key) {
		for (int i = 0; i < entries.size(); i++) {
			if (entries.get(i).key().equals(key)) {
				return i;
			}
		}
		return -1;
	}

	public Optional<Node> get(String key) {
		int index = indexOf(key);
		return index < 0 ? Optional.empty() : Optional.of(entries.get(index).node());
	}

	/**
	 * Splices a new entry in at {@code position}; entries at or after it shift up by one.
	 *
	 * @throws IllegalArgumentException if {@code key} is already present
	 * @throws IndexOutOfBoundsException if {@code position} is not in {@code [0, size()]}
	 */
	public void insert(int position, String key, Node node) {
		if (containsKey(key)) {
			throw new IllegalArgumentException("Duplicate key \"" + key + "\"");
		}
		if (position < 0 || position > entries.size()) {
			throw new IndexOutOfBoundsException("Position " + position + " out of range for mapping with " + entries.size() + " entries");
		}
		entries.add(position, new Entry(key, node));
	}

	/**
	 * Changes the key at {@code position}, keeping the entry where it is.
	 *
	 * @throws IllegalArgumentException if another entry already uses {@code newKey}
	 */
	public void renameAt(int position, String newKey) {
		int existing = indexOf(newKey);
		if (existing >= 0 && existing != position) {
			throw new IllegalArgumentException("Duplicate key \"" + newKey + "\"");
		}
		entries.set(position, new Entry(newKey, entries.get(position).node()));
	}

	@Override
	public Node removeAt(int position) {
		return entries.remove(position).node();
	}

	@Override
	public MappingValue duplicate() {
		List<Entry> copy = new ArrayList<>(entries.size());
		for (Entry e : entries) {
			copy.add(e.duplicate());
		}
		return new MappingValue(copy);
	}

	@Override
	public String kind() {
		return "mapping";
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		return entries.equals(((MappingValue) o).entries);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(entries);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("{");
		for (int i = 0; i < entries.size(); i++) {
			if (i > 0) {
				sb.append(", ");
			}
			sb.append('"').append(entries.get(i).key()).append("\": ").append(entries.get(i).node());
		}
		return sb.append('}').toString();
	}
}
