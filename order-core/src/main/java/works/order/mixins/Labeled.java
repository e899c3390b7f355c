package works.order.mixins;

public interface Labeled {
	Label labelState();

	default String label() {
		return labelState().label();
	}

	default void setLabel(Object label) {
		labelState().setLabel(label);
	}

	default String labelRoot() {
		return labelState().labelRoot();
	}

	default String labelShort() {
		return labelState().labelShort();
	}

	default void setLabelShort(Object labelShort) {
		labelState().setLabelShort(labelShort);
	}

	default String labelShortRoot() {
		return labelState().labelShortRoot();
	}
}
