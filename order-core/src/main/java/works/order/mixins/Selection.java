package works.order.mixins;

import java.util.ArrayList;
import java.util.List;
import works.order.PropertyHolder;
import works.order.PropertyStore;
import works.order.TypedProperty;
import works.order.exceptions.InvalidTypeException;
import works.order.util.JoinOptions;
import works.order.util.SelectionDialect;
import works.order.util.Selections;
import works.order.util.Values;

/**
 * A selection expression together with the {@link SelectionDialect} it is written in.
 * <p>
 * Whatever is assigned is normalized through the dialect's {@link Selections#join join},
 * so {@code "a > 0"} is stored as {@code "(a > 0)"} and an empty selection as {@code "1"}.
 */
public final class Selection implements PropertyHolder {
	static final TypedProperty<Selection, SelectionDialect> MODE = TypedProperty.<Selection, SelectionDialect>of("selectionMode", (owner, raw) -> parseMode(raw)).notDeletable();
	static final TypedProperty<Selection, String> EXPRESSION = TypedProperty.<Selection, String>of("selection", Selection::parseExpression).notDeletable();

	private final PropertyStore properties = new PropertyStore();

	public Selection() {
		this(null, null);
	}

	/**
	 * @param selection null for {@code "1"}, an expression, or a collection of clauses to be joined
	 * @param mode null for {@link SelectionDialect#ROOT}, a dialect, or its {@link SelectionDialect#modeName() name}
	 */
	public Selection(Object selection, Object mode) {
		MODE.initialize(this, mode == null ? SelectionDialect.ROOT : mode);
		EXPRESSION.initialize(this, selection == null ? Selections.TRUE : selection);
	}

	@Override
	public PropertyStore propertyStore() {
		return properties;
	}

	private static SelectionDialect parseMode(Object raw) {
		if (raw instanceof SelectionDialect dialect) {
			return dialect;
		} else if (raw instanceof String name) {
			return SelectionDialect.fromModeName(name);
		}
		throw InvalidTypeException.of("selectionMode", raw);
	}

	private static String parseExpression(Selection owner, Object raw) {
		if (!(raw instanceof String) && !Values.isSequence(raw)) {
			throw InvalidTypeException.of("selection", raw);
		}
		List<String> clauses = new ArrayList<>();
		for (Object clause : Values.asList(raw)) {
			if (!(clause instanceof String s)) {
				throw InvalidTypeException.of("selection clause", clause);
			}
			clauses.add(s);
		}
		return Selections.join(owner.mode(), clauses);
	}

	public String get() {
		return EXPRESSION.get(this);
	}

	public void set(Object selection) {
		EXPRESSION.set(this, selection);
	}

	public SelectionDialect mode() {
		return MODE.get(this);
	}

	/**
	 * Changes the dialect used for subsequent joins. The current expression is kept as is.
	 */
	public void setMode(Object mode) {
		MODE.set(this, mode);
	}

	/**
	 * Combines {@code clause} with the current expression using the dialect's logical AND.
	 */
	public void add(String clause) {
		add(clause, JoinOptions.defaults());
	}

	public void add(String clause, JoinOptions options) {
		EXPRESSION.set(this, Selections.join(mode(), get(), clause, options));
	}

	@Override
	public String toString() {
		return "Selection(" + mode() + ": " + get() + ")";
	}
}
