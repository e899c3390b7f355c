package works.order.mixins;

import works.order.Parser;
import works.order.Parsers;
import works.order.PropertyHolder;
import works.order.PropertyStore;
import works.order.TypedProperty;

/**
 * Distinguishes real data from simulation ("mc").
 * The two flags are mutually exclusive: setting one sets the other to its negation.
 */
public final class DataSource implements PropertyHolder {
	public static final String DATA = "data";
	public static final String MC = "mc";

	static final TypedProperty<DataSource, Boolean> IS_DATA = TypedProperty.<DataSource, Boolean>of("isData", Parsers.bool("isData")).notDeletable();
	private static final Parser<DataSource, Boolean> IS_MC = Parsers.bool("isMc");

	private final PropertyStore properties = new PropertyStore();

	public DataSource() {
		this(false);
	}

	public DataSource(Object isData) {
		IS_DATA.initialize(this, isData);
	}

	@Override
	public PropertyStore propertyStore() {
		return properties;
	}

	public boolean isData() {
		return IS_DATA.get(this);
	}

	public void setIsData(Object isData) {
		IS_DATA.set(this, isData);
	}

	public boolean isMc() {
		return !isData();
	}

	public void setIsMc(Object isMc) {
		boolean mc = IS_MC.parse(this, isMc);
		IS_DATA.set(this, !mc);
	}

	/**
	 * @return {@link #DATA} or {@link #MC}
	 */
	public String dataSource() {
		return isData() ? DATA : MC;
	}

	@Override
	public String toString() {
		return "DataSource(" + dataSource() + ")";
	}
}
