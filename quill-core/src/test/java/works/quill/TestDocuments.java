package works.quill;

/**
 * Small documents shared by the tests in this package.
 * Each call builds a fresh tree, so tests may mutate what they get.
 */
final class TestDocuments {

	/**
	 * <pre>
	 * { "a": 1, "b": [ true, "x" ], "c": {} }
	 * </pre>
	 * parsed, so every node starts unmodified.
	 */
	static DocumentTree sample() {
		MappingValue root = MappingValue.empty()
			.with("a", parsed(NumberValue.of(1)))
			.with("b", parsed(SequenceValue.of(parsed(BooleanValue.TRUE), parsed(StringValue.plain("x")))))
			.with("c", parsed(MappingValue.empty()));
		return new DocumentTree(parsed(root));
	}

	/**
	 * <pre>
	 * { "a": 1, "b": 2 }
	 * </pre>
	 */
	static DocumentTree twoKeys() {
		return new DocumentTree(parsed(MappingValue.empty()
			.with("a", parsed(NumberValue.of(1)))
			.with("b", parsed(NumberValue.of(2)))));
	}

	static DocumentTree emptySequence() {
		return new DocumentTree(parsed(SequenceValue.empty()));
	}

	static DocumentTree emptyMapping() {
		return new DocumentTree(parsed(MappingValue.empty()));
	}

	static DocumentTree sequenceOf(long... values) {
		SequenceValue sequence = SequenceValue.empty();
		for (long v : values) {
			sequence.insert(sequence.size(), parsed(NumberValue.of(v)));
		}
		return new DocumentTree(parsed(sequence));
	}

	static Node parsed(Value value) {
		return Node.parsed(value, null);
	}

	private TestDocuments() {}
}
