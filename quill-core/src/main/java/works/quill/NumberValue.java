package works.quill;

/**
 * A numeric scalar. Integers and floating-point numbers are kept apart
 * because the source formats render them differently: {@code 1} and {@code 1.0}
 * are not the same text.
 */
public sealed interface NumberValue extends Value permits NumberValue.IntegerNumber, NumberValue.FloatNumber {

	static IntegerNumber of(long value) {
		return new IntegerNumber(value);
	}

	static FloatNumber of(double value) {
		return new FloatNumber(value);
	}

	double doubleValue();

	@Override
	default NumberValue duplicate() {
		return this;
	}

	record IntegerNumber(long value) implements NumberValue {
		@Override
		public double doubleValue() {
			return value;
		}

		@Override
		public String kind() {
			return "integer";
		}

		@Override
		public String toString() {
			return Long.toString(value);
		}
	}

	/**
	 * Always finite: none of the source formats can write NaN or an infinity
	 * as a number.
	 */
	record FloatNumber(double value) implements NumberValue {
		public FloatNumber {
			if (!Double.isFinite(value)) {
				throw new IllegalArgumentException("Number must be finite: " + value);
			}
		}

		@Override
		public double doubleValue() {
			return value;
		}

		@Override
		public String kind() {
			return "float";
		}

		@Override
		public String toString() {
			return Double.toString(value);
		}
	}
}
