package works.order.mixins;

import java.util.List;
import java.util.Map;
import works.order.Attributes;
import works.order.UniqueObject;
import works.order.UniqueObjectRegistry;

/**
 * An entity composing every capability, for tests.
 */
class Sample extends UniqueObject implements Copyable<Sample>, AuxDataHolder, Taggable, DataSourceAware, Selectable, Labeled {
	static final CopySpec<Sample> COPY_SPEC = CopySpec.<Sample>builder()
		.attribute("isData", Sample::isData)
		.attribute("label", Sample::label)
		.attribute("selectionMode", Sample::selectionMode)
		.attribute("selection", Sample::selection)
		.attribute("tags", Sample::tags)
		.attribute("aux", Sample::aux)
		.build();

	private final AuxData aux;
	private final Tags tags;
	private final DataSource dataSource;
	private final Selection selection;
	private final Label label;

	Sample(UniqueObjectRegistry registry, Map<String, ?> attributes) {
		super(registry, attributes.get("name"), attributes.get("id"), attributes.get("context"));
		Attributes.requireKnown(Sample.class, attributes, List.of("name", "id", "context", "isData", "label", "selectionMode", "selection", "tags", "aux"));
		aux = new AuxData(attributes.get("aux"));
		tags = new Tags(attributes.get("tags"));
		dataSource = new DataSource(Attributes.getOrDefault(attributes, "isData", false));
		selection = new Selection(attributes.get("selection"), attributes.get("selectionMode"));
		label = new Label(attributes.get("label"), null, this::name);
	}

	Sample(UniqueObjectRegistry registry, String name) {
		this(registry, Map.of("name", name));
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
	public DataSource dataSourceState() {
		return dataSource;
	}

	@Override
	public Selection selectionState() {
		return selection;
	}

	@Override
	public Label labelState() {
		return label;
	}

	@Override
	public CopySpec<Sample> copySpec() {
		return COPY_SPEC;
	}

	@Override
	public EntityFactory<Sample> copyFactory() {
		UniqueObjectRegistry registry = registry();
		return attributes -> new Sample(registry, attributes);
	}
}
