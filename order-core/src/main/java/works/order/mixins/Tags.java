package works.order.mixins;

import java.util.Collection;
import java.util.List;
import org.pcollections.OrderedPSet;
import org.pcollections.PSet;
import works.order.Parsers;
import works.order.PropertyHolder;
import works.order.PropertyStore;
import works.order.TypedProperty;
import works.order.util.MatchMode;
import works.order.util.PatternSyntax;
import works.order.util.Patterns;

/**
 * A set of string tags that can be queried with patterns.
 * <p>
 * A query pattern matches when at least one tag matches it.
 * When several patterns are given, the {@link MatchMode} decides whether
 * any or all of them have to match.
 */
public final class Tags implements PropertyHolder {
	static final TypedProperty<Tags, PSet<String>> TAGS = TypedProperty.<Tags, PSet<String>>of("tags", Parsers.stringSet("tags")).notDeletable();

	private final PropertyStore properties = new PropertyStore();

	public Tags() {
		TAGS.initialize(this, OrderedPSet.empty());
	}

	/**
	 * @param tags null, one tag, or a collection of tags
	 */
	public Tags(Object tags) {
		this();
		if (tags != null) {
			set(tags);
		}
	}

	@Override
	public PropertyStore propertyStore() {
		return properties;
	}

	/**
	 * @return an immutable snapshot in insertion order
	 */
	public PSet<String> get() {
		return TAGS.get(this);
	}

	public void set(Object tags) {
		TAGS.set(this, tags);
	}

	/**
	 * @param tags one tag or a collection of tags
	 */
	public void add(Object tags) {
		TAGS.set(this, get().plusAll(TAGS.parse(this, tags)));
	}

	public void remove(Object tags) {
		TAGS.set(this, get().minusAll(TAGS.parse(this, tags)));
	}

	public boolean has(String pattern) {
		return has(List.of(pattern), MatchMode.ANY, PatternSyntax.GLOB);
	}

	public boolean has(Collection<String> patterns, MatchMode mode) {
		return has(patterns, mode, PatternSyntax.GLOB);
	}

	public boolean has(Collection<String> patterns, MatchMode mode, PatternSyntax syntax) {
		PSet<String> tags = get();
		return mode.test(patterns, pattern -> tags.stream()
			.anyMatch(tag -> Patterns.matches(tag, List.of(pattern), MatchMode.ANY, syntax)));
	}

	@Override
	public String toString() {
		return "Tags" + get();
	}
}
