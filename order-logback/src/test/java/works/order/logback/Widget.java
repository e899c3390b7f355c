package works.order.logback;

import works.order.UniqueObject;
import works.order.UniqueObjectRegistry;

class Widget extends UniqueObject {
	Widget(UniqueObjectRegistry registry, String name, String context) {
		super(registry, name, null, context);
	}
}
