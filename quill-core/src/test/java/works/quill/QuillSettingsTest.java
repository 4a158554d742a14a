package works.quill;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QuillSettingsTest {

	@Test
	void defaults() {
		QuillSettings settings = QuillSettings.defaults();
		assertEquals(50, settings.getUndoLimit());
		assertTrue(settings.isPreserveFormatting());
		assertEquals(2, settings.getIndentSize());
		assertEquals("quill", settings.getSessionName());
	}

	@Test
	void toBuilder_changesOnlyWhatIsSet() {
		QuillSettings settings = QuillSettings.defaults().toBuilder()
			.preserveFormatting(false)
			.sessionName("scratch")
			.build();
		assertFalse(settings.isPreserveFormatting());
		assertEquals("scratch", settings.getSessionName());
		assertEquals(50, settings.getUndoLimit());
		assertEquals(QuillSettings.defaults(), QuillSettings.builder().build());
	}
}
