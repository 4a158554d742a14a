package works.quill;

/**
 * How a string scalar is presented in block-capable formats such as YAML.
 * The style belongs to the value, not the text, so it survives content edits.
 */
public enum StringStyle {
	/**
	 * Flow scalar: plain or quoted, on one line.
	 */
	PLAIN,

	/**
	 * Block literal ({@code |}): line breaks kept as written.
	 */
	LITERAL,

	/**
	 * Block folded ({@code >}): line breaks folded to spaces.
	 */
	FOLDED,
}
