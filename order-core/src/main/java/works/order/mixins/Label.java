package works.order.mixins;

import java.util.function.Supplier;
import org.jetbrains.annotations.Nullable;
import works.order.Parsers;
import works.order.PropertyHolder;
import works.order.PropertyStore;
import works.order.TypedProperty;
import works.order.util.RootLatex;

/**
 * A display label and a short form of it.
 * <p>
 * An unset label falls back to the {@code fallback} supplier, typically the owner's name;
 * an unset short label falls back to the label.
 */
public final class Label implements PropertyHolder {
	static final TypedProperty<Label, String> LABEL = TypedProperty.<Label, String>of("label", Parsers.nullableString("label")).notDeletable();
	static final TypedProperty<Label, String> LABEL_SHORT = TypedProperty.<Label, String>of("labelShort", Parsers.nullableString("labelShort")).notDeletable();

	private final PropertyStore properties = new PropertyStore();
	private final @Nullable Supplier<String> fallback;

	public Label() {
		this(null, null, null);
	}

	/**
	 * @param fallback supplies the label when none is set; may be null
	 */
	public Label(@Nullable Object label, @Nullable Object labelShort, @Nullable Supplier<String> fallback) {
		this.fallback = fallback;
		LABEL.initialize(this, label);
		LABEL_SHORT.initialize(this, labelShort);
	}

	@Override
	public PropertyStore propertyStore() {
		return properties;
	}

	public String label() {
		String label = LABEL.get(this);
		if (label != null || fallback == null) {
			return label;
		}
		return fallback.get();
	}

	/**
	 * @param label null to fall back again
	 */
	public void setLabel(Object label) {
		LABEL.set(this, label);
	}

	public String labelRoot() {
		return RootLatex.convert(label());
	}

	public String labelShort() {
		String labelShort = LABEL_SHORT.get(this);
		return labelShort == null ? label() : labelShort;
	}

	public void setLabelShort(Object labelShort) {
		LABEL_SHORT.set(this, labelShort);
	}

	public String labelShortRoot() {
		return RootLatex.convert(labelShort());
	}

	@Override
	public String toString() {
		return "Label(" + label() + ", " + labelShort() + ")";
	}
}
