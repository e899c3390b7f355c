package works.order.mixins;

import works.order.util.JoinOptions;
import works.order.util.SelectionDialect;

public interface Selectable {
	Selection selectionState();

	default String selection() {
		return selectionState().get();
	}

	default void setSelection(Object selection) {
		selectionState().set(selection);
	}

	default SelectionDialect selectionMode() {
		return selectionState().mode();
	}

	default void setSelectionMode(Object mode) {
		selectionState().setMode(mode);
	}

	default void addSelection(String clause) {
		selectionState().add(clause);
	}

	default void addSelection(String clause, JoinOptions options) {
		selectionState().add(clause, options);
	}
}
