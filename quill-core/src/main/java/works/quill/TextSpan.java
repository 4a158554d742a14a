package works.quill;

/**
 * A character range {@code [start, end)} in the source text a node was parsed from.
 */
public record TextSpan(int start, int end) {
	public TextSpan {
		if (start < 0 || end < start) {
			throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
		}
	}

	public int length() {
		return end - start;
	}

	/**
	 * @return the spanned text, or null if the span doesn't fit inside {@code source}
	 */
	public String in(String source) {
		if (end > source.length()) {
			return null;
		}
		return source.substring(start, end);
	}

	public TextSpan shiftedBy(int offset) {
		return new TextSpan(start + offset, end + offset);
	}
}
