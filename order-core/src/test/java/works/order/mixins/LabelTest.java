package works.order.mixins;

import org.junit.jupiter.api.Test;
import works.order.exceptions.InvalidTypeException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LabelTest {

	@Test
	void unset_fallsBack() {
		Label label = new Label(null, null, () -> "name");
		assertEquals("name", label.label());
		assertEquals("name", label.labelShort());
	}

	@Test
	void noFallback_isNull() {
		Label label = new Label();
		assertNull(label.label());
		assertNull(label.labelShort());
		assertNull(label.labelRoot());
	}

	@Test
	void shortLabel_fallsBackToLabel() {
		Label label = new Label("Long $\\mu$", null, () -> "name");
		assertEquals("Long $\\mu$", label.labelShort());
		assertEquals("Long #mu", label.labelShortRoot());
		label.setLabelShort("$\\mu$");
		assertEquals("#mu", label.labelShortRoot());
		label.setLabelShort(null);
		assertEquals("Long $\\mu$", label.labelShort());
	}

	@Test
	void nonString_throws() {
		Label label = new Label("keep", null, null);
		assertThrows(InvalidTypeException.class, () -> label.setLabel(1));
		assertEquals("keep", label.label());
	}
}
