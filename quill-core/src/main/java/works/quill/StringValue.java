package works.quill;

import org.jetbrains.annotations.NotNull;

import static java.util.Objects.requireNonNull;

public record StringValue(@NotNull String text, @NotNull StringStyle style) implements Value {
	public StringValue {
		requireNonNull(text);
		requireNonNull(style);
	}

	public static StringValue plain(String text) {
		return new StringValue(text, StringStyle.PLAIN);
	}

	/**
	 * @return a string with the new text and this string's style
	 */
	public StringValue withText(String newText) {
		return new StringValue(newText, style);
	}

	@Override
	public StringValue duplicate() {
		return this;
	}

	@Override
	public String kind() {
		return "string";
	}

	@Override
	public String toString() {
		return '"' + text + '"';
	}
}
