package works.quill;

public record NullValue() implements Value {
	public static final NullValue NULL = new NullValue();

	@Override
	public NullValue duplicate() {
		return this;
	}

	@Override
	public String kind() {
		return "null";
	}

	@Override
	public String toString() {
		return "null";
	}
}
