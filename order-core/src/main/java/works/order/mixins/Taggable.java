package works.order.mixins;

import java.util.Collection;
import java.util.Set;
import works.order.util.MatchMode;
import works.order.util.PatternSyntax;

public interface Taggable {
	Tags tagState();

	default Set<String> tags() {
		return tagState().get();
	}

	default void setTags(Object tags) {
		tagState().set(tags);
	}

	default void addTag(Object tags) {
		tagState().add(tags);
	}

	default void removeTag(Object tags) {
		tagState().remove(tags);
	}

	default boolean hasTag(String pattern) {
		return tagState().has(pattern);
	}

	default boolean hasTag(Collection<String> patterns, MatchMode mode) {
		return tagState().has(patterns, mode);
	}

	default boolean hasTag(Collection<String> patterns, MatchMode mode, PatternSyntax syntax) {
		return tagState().has(patterns, mode, syntax);
	}
}
