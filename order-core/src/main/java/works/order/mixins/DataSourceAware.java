package works.order.mixins;

public interface DataSourceAware {
	DataSource dataSourceState();

	default boolean isData() {
		return dataSourceState().isData();
	}

	default void setIsData(Object isData) {
		dataSourceState().setIsData(isData);
	}

	default boolean isMc() {
		return dataSourceState().isMc();
	}

	default void setIsMc(Object isMc) {
		dataSourceState().setIsMc(isMc);
	}

	default String dataSource() {
		return dataSourceState().dataSource();
	}
}
