package works.order.model;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.order.UniqueObjectRegistry;
import works.order.exceptions.ConfigurationException;
import works.order.exceptions.DuplicateObjectException;
import works.order.exceptions.InvalidTypeException;
import works.order.exceptions.InvalidValueException;
import works.order.util.JoinOptions;
import works.order.util.SelectionDialect;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VariableTest {
	UniqueObjectRegistry registry;

	@BeforeEach
	void setupRegistry() {
		registry = UniqueObjectRegistry.builder().name("VariableTest").build();
	}

	Variable.Builder variable(String name) {
		return Variable.builder(name)
			.expression("myBranchA * myBranchB")
			.selection("myBranchC > 0")
			.binning(20, 0, 10)
			.xTitle("p_{T}")
			.unit("GeV");
	}

	@Test
	void constructor_works() {
		Variable v = variable("constructor_var").build(registry);
		assertEquals("constructor_var", v.name());
		assertEquals(0, v.id());
		assertEquals("myBranchA * myBranchB", v.expression());
		assertEquals("(myBranchC > 0)", v.selection());
		assertEquals(Binning.of(20, 0, 10), v.binning());
		assertEquals("constructor_var;p_{T} [GeV];Entries / 0.5 GeV", v.fullTitle());
		assertSame(v, registry.get(Variable.class, "constructor_var"));
	}

	@Test
	void defaults_areApplied() {
		Variable v = Variable.builder("pt").build(registry);
		assertEquals("pt", v.expression());
		assertEquals(Variable.DEFAULT_BINNING, v.binning());
		assertEquals("", v.xTitle());
		assertEquals("Entries", v.yTitle());
		assertEquals("1", v.unit());
		assertFalse(v.logX());
		assertFalse(v.logY());
		assertEquals("1", v.selection());
		assertEquals(SelectionDialect.ROOT, v.selectionMode());
		assertTrue(v.tags().isEmpty());
		assertTrue(v.aux().isEmpty());
		assertEquals("pt;;Entries / 1.0", v.fullTitle());
	}

	@Test
	void attributeMap_works() {
		Variable v = new Variable(registry, Map.of(
			"name", "eta",
			"id", 7,
			"context", "analysis",
			"binning", List.of(10, -2.5, 2.5),
			"tags", List.of("forward", "central"),
			"selectionMode", "numexpr",
			"selection", List.of("a", "b"),
			"aux", Map.of("color", "red")));
		assertEquals(7, v.id());
		assertEquals(List.of("analysis"), v.contexts());
		assertEquals(0.5, v.binWidth());
		assertTrue(v.hasTag("for*"));
		assertEquals("(a) & (b)", v.selection());
		assertEquals("red", v.getAux("color"));
	}

	@Test
	void unknownAttribute_throwsWithoutRegistering() {
		assertThrows(ConfigurationException.class, () -> new Variable(registry, Map.of("name", "v", "colour", "red")));
		assertFalse(registry.hasContext(UniqueObjectRegistry.DEFAULT_CONTEXT));
	}

	@Test
	void parsing_validatesTypes() {
		Variable v = variable("parsing_var").build(registry);

		v.setExpression("foo");
		assertEquals("foo", v.expression());
		assertThrows(InvalidTypeException.class, () -> v.setExpression(1));
		assertThrows(InvalidValueException.class, () -> v.setExpression(""));
		v.setExpression(null);
		assertEquals("parsing_var", v.expression());

		v.setSelection("foo");
		assertEquals("(foo)", v.selection());

		v.setBinning(List.of(10, 0.0, 1.0));
		assertEquals(Binning.of(10, 0, 1), v.binning());
		assertThrows(InvalidTypeException.class, () -> v.setBinning(Map.of()));
		assertThrows(InvalidValueException.class, () -> v.setBinning(List.of(10, 0.0)));

		v.setXTitle("foo");
		assertEquals("foo", v.xTitle());
		assertThrows(InvalidTypeException.class, () -> v.setXTitle(1));

		v.setYTitle("foo");
		assertEquals("foo", v.yTitle());
		assertThrows(InvalidTypeException.class, () -> v.setYTitle(1));

		v.setXTitleShort("bar");
		assertEquals("bar", v.xTitleShort());
		assertThrows(InvalidTypeException.class, () -> v.setXTitleShort(1));
		v.setXTitleShort(null);
		assertEquals("foo", v.xTitleShort());

		v.setYTitleShort("bar");
		assertEquals("bar", v.yTitleShort());
		assertThrows(InvalidTypeException.class, () -> v.setYTitleShort(1));
		v.setYTitleShort(null);
		assertEquals("foo", v.yTitleShort());

		v.setLogX(true);
		assertTrue(v.logX());
		assertThrows(InvalidTypeException.class, () -> v.setLogX(Map.of()));

		v.setLogY(true);
		assertTrue(v.logY());
		assertThrows(InvalidTypeException.class, () -> v.setLogY(Map.of()));

		v.setUnit("GeV");
		assertEquals("GeV", v.unit());
		assertThrows(InvalidTypeException.class, () -> v.setUnit(Map.of()));
		v.setUnit(null);
		assertNull(v.unit());
	}

	@Test
	void titles_work() {
		Variable v = variable("foo")
			.xTitle("Muon transverse momentum")
			.xTitleShort("$\\mu p_{T}$")
			.yTitle("Entries")
			.yTitleShort("N")
			.binning(40, 0, 10)
			.build(registry);

		assertEquals("Muon transverse momentum [GeV]", v.fullXTitle());
		assertEquals("$\\mu p_{T}$ [GeV]", v.fullXTitle(true, false));
		assertEquals("#mu p_{T} [GeV]", v.fullXTitle(true, true));
		assertEquals("#mu p_{T}", v.xTitleShortRoot());
		assertEquals("Entries / 0.25 GeV", v.fullYTitle());
		assertEquals("Entries / 0.2 GeV", v.fullYTitle(0.2, false, false));
		assertEquals("N / 0.25 GeV", v.fullYTitle(null, true, false));
		assertEquals("foo;Muon transverse momentum [GeV];Entries / 0.25 GeV", v.fullTitle());
		assertEquals("foo;#mu p_{T} [GeV];N / 0.25 GeV", v.fullTitle(true));
		assertEquals("hist;Muon transverse momentum [GeV];N / 0.25 GeV", v.fullTitle("hist", false, true, true, null));
	}

	@Test
	void binWidth_isRoundedInTitle() {
		Variable v = Variable.builder("x").binning(3, 0, 1).build(registry);
		assertEquals("Entries / 0.33", v.fullYTitle());
		// 107 / 40 is stored just below 2.675
		Variable w = Variable.builder("w").binning(40, 0, 107).build(registry);
		assertEquals(2.675, w.binWidth());
		assertEquals("Entries / 2.67", w.fullYTitle());
	}

	@Test
	void wideBins_arePrintedWithoutExponent() {
		Variable v = Variable.builder("x").binning(1, 0, 1e7).build(registry);
		assertEquals("Entries / 10000000.0", v.fullYTitle());
		Variable huge = Variable.builder("huge").binning(1, 0, 1e16).build(registry);
		assertEquals("Entries / 1e+16", huge.fullYTitle());
	}

	@Test
	void unitOne_isHidden() {
		Variable v = Variable.builder("n").xTitle("Count").binning(10, 0, 10).unit("1").build(registry);
		assertEquals("Count", v.fullXTitle());
		assertEquals("Entries / 1.0", v.fullYTitle());
	}

	@Test
	void selection_canBeExtended() {
		Variable v = Variable.builder("v").selection("branchA > 0").build(registry);
		v.addSelection("myBranchB < 100", JoinOptions.bracketed());
		assertEquals("((branchA > 0) && (myBranchB < 100))", v.selection());
	}

	@Test
	void copy_overridesAndKeepsRest() {
		Variable original = variable("copy_var").tags("a").aux("list", List.of(1)).build(registry);
		Variable copy = original.copy(Map.of("name", "otherVar", "expression", "otherExpression"));

		assertEquals("otherVar", copy.name());
		assertEquals(1, copy.id());
		assertEquals("otherExpression", copy.expression());
		assertEquals("(myBranchC > 0)", copy.selection());
		assertEquals(original.binning(), copy.binning());
		assertEquals("GeV", copy.unit());
		assertSame(registry, copy.registry());
		assertThat(copy.tags(), contains("a"));

		copy.addTag("b");
		copy.setAux("extra", true);
		assertFalse(original.hasTag("b"));
		assertFalse(original.hasAux("extra"));
	}

	@Test
	void copy_usesEffectiveExpression() {
		Variable original = Variable.builder("pt").build(registry);
		Variable copy = original.copy(Map.of("name", "pt2"));
		assertEquals("pt", copy.expression());
	}

	@Test
	void copyWithSameName_throws() {
		Variable original = variable("v").build(registry);
		assertThrows(DuplicateObjectException.class, original::copy);
		assertEquals(1, registry.index(Variable.class).size());
	}

	@Test
	void failedConstruction_leavesNoRegistration() {
		Map<String, Object> attributes = new HashMap<>();
		attributes.put("name", "broken");
		attributes.put("binning", List.of(1, 2));
		assertThrows(InvalidValueException.class, () -> new Variable(registry, attributes));
		assertFalse(registry.contains(Variable.class, "broken", UniqueObjectRegistry.DEFAULT_CONTEXT));
		assertFalse(registry.hasContext(UniqueObjectRegistry.DEFAULT_CONTEXT));
		assertEquals(0, Variable.builder("ok").build(registry).id());

		attributes.put("binning", List.of(1, 0, 1));
		Variable fixed = new Variable(registry, attributes);
		assertEquals("broken", fixed.name());
		assertEquals(1, fixed.id());
	}

	@Test
	void multipleContexts_work() {
		Variable v = Variable.builder("v").contexts("a", "b").build(registry);
		assertSame(v, registry.get(Variable.class, "v", "a"));
		assertSame(v, registry.get(Variable.class, "v", "b"));
		v.remove("a");
		assertEquals(List.of("b"), v.contexts());
	}
}
