package works.order.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.order.Attributes;
import works.order.Parser;
import works.order.Parsers;
import works.order.PropertyHolder;
import works.order.PropertyStore;
import works.order.TypedProperty;
import works.order.UniqueObject;
import works.order.UniqueObjectRegistry;
import works.order.exceptions.ConfigurationException;
import works.order.exceptions.DuplicateObjectException;
import works.order.exceptions.ValidationException;
import works.order.mixins.AuxData;
import works.order.mixins.AuxDataHolder;
import works.order.mixins.CopySpec;
import works.order.mixins.Copyable;
import works.order.mixins.EntityFactory;
import works.order.mixins.Selectable;
import works.order.mixins.Selection;
import works.order.mixins.Taggable;
import works.order.mixins.Tags;
import works.order.util.RootLatex;
import works.order.util.SelectionDialect;
import works.order.util.Values;

import static java.util.Arrays.asList;
import static java.util.Objects.requireNonNull;

/**
 * A quantity to be plotted: how to compute it, how to bin it, and how to title its axes.
 *
 * <pre>{@code
 * Variable pt = Variable.builder("pt")
 *     .expression("Muon.pt")
 *     .binning(20, 0, 10)
 *     .xTitle("p_{T}")
 *     .unit("GeV")
 *     .build(registry);
 *
 * pt.fullTitle(); // "pt;p_{T} [GeV];Entries / 0.5 GeV"
 * }</pre>
 *
 * Variables can also be constructed from an attribute map whose keys are the
 * {@code *_KEY} constants of this class; unknown keys are rejected.
 * <p>
 * A unit of {@code null} or {@code "1"} is never shown in titles.
 */
public final class Variable extends UniqueObject implements PropertyHolder, Copyable<Variable>, AuxDataHolder, Taggable, Selectable {
	public static final String NAME_KEY = "name";
	public static final String ID_KEY = "id";
	public static final String CONTEXT_KEY = "context";
	public static final String EXPRESSION_KEY = "expression";
	public static final String BINNING_KEY = "binning";
	public static final String X_TITLE_KEY = "xTitle";
	public static final String X_TITLE_SHORT_KEY = "xTitleShort";
	public static final String Y_TITLE_KEY = "yTitle";
	public static final String Y_TITLE_SHORT_KEY = "yTitleShort";
	public static final String LOG_X_KEY = "logX";
	public static final String LOG_Y_KEY = "logY";
	public static final String UNIT_KEY = "unit";
	public static final String SELECTION_KEY = "selection";
	public static final String SELECTION_MODE_KEY = "selectionMode";
	public static final String TAGS_KEY = "tags";
	public static final String AUX_KEY = "aux";

	public static final Binning DEFAULT_BINNING = new Binning(1, 0.0, 1.0);
	public static final String DEFAULT_Y_TITLE = "Entries";
	public static final String DEFAULT_UNIT = "1";

	private static final List<String> KNOWN_KEYS = List.of(
		NAME_KEY, ID_KEY, CONTEXT_KEY, EXPRESSION_KEY, BINNING_KEY,
		X_TITLE_KEY, X_TITLE_SHORT_KEY, Y_TITLE_KEY, Y_TITLE_SHORT_KEY,
		LOG_X_KEY, LOG_Y_KEY, UNIT_KEY, SELECTION_KEY, SELECTION_MODE_KEY, TAGS_KEY, AUX_KEY);

	static final TypedProperty<Variable, String> EXPRESSION = TypedProperty.<Variable, String>of(EXPRESSION_KEY, Parser.nullable(Parsers.nonEmptyString(EXPRESSION_KEY))).notDeletable();
	static final TypedProperty<Variable, Binning> BINNING = TypedProperty.<Variable, Binning>of(BINNING_KEY, (owner, raw) -> Binning.parse(raw)).notDeletable();
	static final TypedProperty<Variable, String> X_TITLE = TypedProperty.<Variable, String>of(X_TITLE_KEY, Parsers.string(X_TITLE_KEY)).notDeletable();
	static final TypedProperty<Variable, String> X_TITLE_SHORT = TypedProperty.<Variable, String>of(X_TITLE_SHORT_KEY, Parsers.nullableString(X_TITLE_SHORT_KEY)).notDeletable();
	static final TypedProperty<Variable, String> Y_TITLE = TypedProperty.<Variable, String>of(Y_TITLE_KEY, Parsers.string(Y_TITLE_KEY)).notDeletable();
	static final TypedProperty<Variable, String> Y_TITLE_SHORT = TypedProperty.<Variable, String>of(Y_TITLE_SHORT_KEY, Parsers.nullableString(Y_TITLE_SHORT_KEY)).notDeletable();
	static final TypedProperty<Variable, Boolean> LOG_X = TypedProperty.<Variable, Boolean>of(LOG_X_KEY, Parsers.bool(LOG_X_KEY)).notDeletable();
	static final TypedProperty<Variable, Boolean> LOG_Y = TypedProperty.<Variable, Boolean>of(LOG_Y_KEY, Parsers.bool(LOG_Y_KEY)).notDeletable();
	static final TypedProperty<Variable, String> UNIT = TypedProperty.<Variable, String>of(UNIT_KEY, Parsers.nullableString(UNIT_KEY)).notDeletable();

	private static final CopySpec<Variable> COPY_SPEC = CopySpec.<Variable>builder()
		.attribute(EXPRESSION_KEY, Variable::expression)
		.attribute(BINNING_KEY, Variable::binning)
		.attribute(X_TITLE_KEY, Variable::xTitle)
		.attribute(X_TITLE_SHORT_KEY, Variable::xTitleShort)
		.attribute(Y_TITLE_KEY, Variable::yTitle)
		.attribute(Y_TITLE_SHORT_KEY, Variable::yTitleShort)
		.attribute(LOG_X_KEY, Variable::logX)
		.attribute(LOG_Y_KEY, Variable::logY)
		.attribute(UNIT_KEY, Variable::unit)
		.attribute(SELECTION_MODE_KEY, Variable::selectionMode)
		.attribute(SELECTION_KEY, Variable::selection)
		.attribute(TAGS_KEY, Variable::tags)
		.attribute(AUX_KEY, Variable::aux)
		.build();

	private final PropertyStore properties = new PropertyStore();
	private final AuxData aux;
	private final Tags tags;
	private final Selection selection;

	/**
	 * @throws ConfigurationException if {@code attributes} has an unknown key or an invalid context
	 * @throws ValidationException if an attribute has the wrong type or value
	 * @throws DuplicateObjectException if the name or id is taken
	 * @see UniqueObject#UniqueObject(UniqueObjectRegistry, Object, Object, Object)
	 */
	public Variable(UniqueObjectRegistry registry, Map<String, ?> attributes) {
		super(registry, knownAttributes(attributes).get(NAME_KEY), attributes.get(ID_KEY), attributes.get(CONTEXT_KEY));
		try {
			aux = new AuxData(attributes.get(AUX_KEY));
			tags = new Tags(attributes.get(TAGS_KEY));
			selection = new Selection(attributes.get(SELECTION_KEY), attributes.get(SELECTION_MODE_KEY));
			EXPRESSION.initialize(this, attributes.get(EXPRESSION_KEY));
			BINNING.initialize(this, Attributes.getOrDefault(attributes, BINNING_KEY, DEFAULT_BINNING));
			X_TITLE.initialize(this, Attributes.getOrDefault(attributes, X_TITLE_KEY, ""));
			X_TITLE_SHORT.initialize(this, attributes.get(X_TITLE_SHORT_KEY));
			Y_TITLE.initialize(this, Attributes.getOrDefault(attributes, Y_TITLE_KEY, DEFAULT_Y_TITLE));
			Y_TITLE_SHORT.initialize(this, attributes.get(Y_TITLE_SHORT_KEY));
			LOG_X.initialize(this, Attributes.getOrDefault(attributes, LOG_X_KEY, false));
			LOG_Y.initialize(this, Attributes.getOrDefault(attributes, LOG_Y_KEY, false));
			UNIT.initialize(this, Attributes.getOrDefault(attributes, UNIT_KEY, DEFAULT_UNIT));
		} catch (RuntimeException e) {
			LOGGER.debug("Abandoning registration of {} after failed initialization", uniqueKey());
			abandonRegistration();
			throw e;
		}
	}

	public Variable(Map<String, ?> attributes) {
		this(UniqueObjectRegistry.global(), attributes);
	}

	private static Map<String, ?> knownAttributes(Map<String, ?> attributes) {
		Attributes.requireKnown(Variable.class, requireNonNull(attributes), KNOWN_KEYS);
		return attributes;
	}

	public static Builder builder(String name) {
		return new Builder(name);
	}

	@Override
	public PropertyStore propertyStore() {
		return properties;
	}

	@Override
	public AuxData auxState() {
		return aux;
	}

	@Override
	public Tags tagState() {
		return tags;
	}

	@Override
	public Selection selectionState() {
		return selection;
	}

	@Override
	public CopySpec<Variable> copySpec() {
		return COPY_SPEC;
	}

	/**
	 * Copies land in this variable's registry. A copy into the same context needs
	 * a {@code name} override (and an {@code id} override when the id is not automatic).
	 */
	@Override
	public EntityFactory<Variable> copyFactory() {
		UniqueObjectRegistry registry = registry();
		return attributes -> new Variable(registry, attributes);
	}

	// Expression

	/**
	 * @return the expression, or the name if none is set
	 */
	public String expression() {
		String expression = EXPRESSION.get(this);
		return expression == null ? name() : expression;
	}

	/**
	 * @param expression a non-empty string, or null to fall back to the name
	 */
	public void setExpression(@Nullable Object expression) {
		EXPRESSION.set(this, expression);
	}

	// Binning

	public Binning binning() {
		return BINNING.get(this);
	}

	public void setBinning(Object binning) {
		BINNING.set(this, binning);
	}

	public double binWidth() {
		return binning().binWidth();
	}

	// Axes

	public String xTitle() {
		return X_TITLE.get(this);
	}

	public void setXTitle(Object xTitle) {
		X_TITLE.set(this, xTitle);
	}

	public String xTitleRoot() {
		return RootLatex.convert(xTitle());
	}

	public String xTitleShort() {
		String xTitleShort = X_TITLE_SHORT.get(this);
		return xTitleShort == null ? xTitle() : xTitleShort;
	}

	public void setXTitleShort(@Nullable Object xTitleShort) {
		X_TITLE_SHORT.set(this, xTitleShort);
	}

	public String xTitleShortRoot() {
		return RootLatex.convert(xTitleShort());
	}

	public String yTitle() {
		return Y_TITLE.get(this);
	}

	public void setYTitle(Object yTitle) {
		Y_TITLE.set(this, yTitle);
	}

	public String yTitleRoot() {
		return RootLatex.convert(yTitle());
	}

	public String yTitleShort() {
		String yTitleShort = Y_TITLE_SHORT.get(this);
		return yTitleShort == null ? yTitle() : yTitleShort;
	}

	public void setYTitleShort(@Nullable Object yTitleShort) {
		Y_TITLE_SHORT.set(this, yTitleShort);
	}

	public String yTitleShortRoot() {
		return RootLatex.convert(yTitleShort());
	}

	public boolean logX() {
		return LOG_X.get(this);
	}

	public void setLogX(Object logX) {
		LOG_X.set(this, logX);
	}

	public boolean logY() {
		return LOG_Y.get(this);
	}

	public void setLogY(Object logY) {
		LOG_Y.set(this, logY);
	}

	public @Nullable String unit() {
		return UNIT.get(this);
	}

	public void setUnit(@Nullable Object unit) {
		UNIT.set(this, unit);
	}

	private boolean showsUnit() {
		String unit = unit();
		return unit != null && !DEFAULT_UNIT.equals(unit);
	}

	// Full titles

	public String fullXTitle() {
		return fullXTitle(false, false);
	}

	/**
	 * @param shortTitle use {@link #xTitleShort()} instead of {@link #xTitle()}
	 * @param root convert the result with {@link RootLatex}
	 */
	public String fullXTitle(boolean shortTitle, boolean root) {
		String title = shortTitle ? xTitleShort() : xTitle();
		if (showsUnit()) {
			title += " [" + unit() + "]";
		}
		return root ? RootLatex.convert(title) : title;
	}

	public String fullYTitle() {
		return fullYTitle(null, false, false);
	}

	/**
	 * @param binWidth shown instead of {@link #binWidth()}, which is rounded to two decimals; may be null
	 */
	public String fullYTitle(@Nullable Double binWidth, boolean shortTitle, boolean root) {
		String title = shortTitle ? yTitleShort() : yTitle();
		double width = binWidth == null ? roundedBinWidth() : binWidth;
		title += " / " + Values.formatDecimal(width);
		if (showsUnit()) {
			title += " " + unit();
		}
		return root ? RootLatex.convert(title) : title;
	}

	private double roundedBinWidth() {
		return new BigDecimal(binWidth()).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
	}

	/**
	 * @return {@code "name;x title;y title"} as understood by ROOT histograms, with long titles converted to ROOT latex
	 */
	public String fullTitle() {
		return fullTitle(name(), false, false, true, null);
	}

	public String fullTitle(boolean shortTitles) {
		return fullTitle(name(), shortTitles, shortTitles, true, null);
	}

	public String fullTitle(String name, boolean shortX, boolean shortY, boolean root, @Nullable Double binWidth) {
		return String.join(";", name, fullXTitle(shortX, root), fullYTitle(binWidth, shortY, root));
	}

	/**
	 * Fills an attribute map for the {@link Variable#Variable(UniqueObjectRegistry, Map) constructor}.
	 */
	public static final class Builder {
		private final Map<String, Object> attributes = new LinkedHashMap<>();

		Builder(String name) {
			attributes.put(NAME_KEY, name);
		}

		public Builder id(int id) {
			return set(ID_KEY, id);
		}

		public Builder context(String context) {
			return set(CONTEXT_KEY, context);
		}

		public Builder contexts(String... contexts) {
			return contexts(asList(contexts));
		}

		public Builder contexts(Collection<String> contexts) {
			return set(CONTEXT_KEY, List.copyOf(contexts));
		}

		public Builder expression(String expression) {
			return set(EXPRESSION_KEY, expression);
		}

		public Builder binning(int nBins, double min, double max) {
			return binning(new Binning(nBins, min, max));
		}

		public Builder binning(Binning binning) {
			return set(BINNING_KEY, binning);
		}

		public Builder xTitle(String xTitle) {
			return set(X_TITLE_KEY, xTitle);
		}

		public Builder xTitleShort(String xTitleShort) {
			return set(X_TITLE_SHORT_KEY, xTitleShort);
		}

		public Builder yTitle(String yTitle) {
			return set(Y_TITLE_KEY, yTitle);
		}

		public Builder yTitleShort(String yTitleShort) {
			return set(Y_TITLE_SHORT_KEY, yTitleShort);
		}

		public Builder logX(boolean logX) {
			return set(LOG_X_KEY, logX);
		}

		public Builder logY(boolean logY) {
			return set(LOG_Y_KEY, logY);
		}

		public Builder unit(String unit) {
			return set(UNIT_KEY, unit);
		}

		public Builder selection(String selection) {
			return set(SELECTION_KEY, selection);
		}

		public Builder selection(Collection<String> clauses) {
			return set(SELECTION_KEY, List.copyOf(clauses));
		}

		public Builder selectionMode(SelectionDialect selectionMode) {
			return set(SELECTION_MODE_KEY, selectionMode);
		}

		public Builder tags(String... tags) {
			return set(TAGS_KEY, List.of(tags));
		}

		public Builder aux(String key, Object value) {
			@SuppressWarnings("unchecked")
			Map<String, Object> aux = (Map<String, Object>) attributes.computeIfAbsent(AUX_KEY, k -> new LinkedHashMap<String, Object>());
			aux.put(key, value);
			return this;
		}

		private Builder set(String key, Object value) {
			attributes.put(key, value);
			return this;
		}

		public Variable build(UniqueObjectRegistry registry) {
			return new Variable(registry, attributes);
		}

		public Variable build() {
			return build(UniqueObjectRegistry.global());
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Variable.class);
}
