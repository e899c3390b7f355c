package works.order.util;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ValuesTest {

	@Test
	void asList_wrapsSingleValues() {
		assertEquals(List.of("a"), Values.asList("a"));
		assertEquals(Arrays.asList((Object) null), Values.asList(null));
	}

	@Test
	void asList_unpacksSequences() {
		assertEquals(List.of("a", "b"), Values.asList(List.of("a", "b")));
		assertEquals(List.of(1, 2), Values.asList(new int[] { 1, 2 }));
		assertEquals(List.of("x"), Values.asList(Set.of("x")));
	}

	@Test
	void isSequence() {
		assertTrue(Values.isSequence(List.of()));
		assertTrue(Values.isSequence(new String[0]));
		assertFalse(Values.isSequence("abc"));
		assertFalse(Values.isSequence(null));
	}

	@Test
	void formatDecimal_plainRange() {
		assertEquals("0.5", Values.formatDecimal(0.5));
		assertEquals("1.0", Values.formatDecimal(1));
		assertEquals("-2.67", Values.formatDecimal(-2.67));
		assertEquals("10000000.0", Values.formatDecimal(1e7));
		assertEquals("0.0001", Values.formatDecimal(1e-4));
		assertEquals("1234567890123456.0", Values.formatDecimal(1234567890123456.0));
	}

	@Test
	void formatDecimal_exponentOutsidePlainRange() {
		assertEquals("1e+16", Values.formatDecimal(1e16));
		assertEquals("2.5e-05", Values.formatDecimal(2.5e-5));
		assertEquals("-1.5e+20", Values.formatDecimal(-1.5e20));
	}

	@Test
	void formatDecimal_specialValues() {
		assertEquals("0.0", Values.formatDecimal(0.0));
		assertEquals("-0.0", Values.formatDecimal(-0.0));
		assertEquals("inf", Values.formatDecimal(Double.POSITIVE_INFINITY));
		assertEquals("nan", Values.formatDecimal(Double.NaN));
	}
}
