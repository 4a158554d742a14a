package works.quill;

public record BooleanValue(boolean value) implements Value {
	public static final BooleanValue TRUE = new BooleanValue(true);
	public static final BooleanValue FALSE = new BooleanValue(false);

	public static BooleanValue of(boolean value) {
		return value ? TRUE : FALSE;
	}

	@Override
	public BooleanValue duplicate() {
		return this;
	}

	@Override
	public String kind() {
		return "boolean";
	}

	@Override
	public String toString() {
		return Boolean.toString(value);
	}
}
