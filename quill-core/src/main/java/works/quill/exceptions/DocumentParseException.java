package works.quill.exceptions;

/**
 * Source text could not be turned into a {@link works.quill.DocumentTree}.
 */
public class DocumentParseException extends Exception {
	private final int line;
	private final int column;

	public DocumentParseException(String message, int line, int column, Throwable cause) {
		super(message + " (line " + line + ", column " + column + ")", cause);
		this.line = line;
		this.column = column;
	}

	public DocumentParseException(String message, int line, int column) {
		this(message, line, column, null);
	}

	/**
	 * @return one-based line number, or -1 if unknown
	 */
	public int line() {
		return line;
	}

	/**
	 * @return one-based column number, or -1 if unknown
	 */
	public int column() {
		return column;
	}
}
