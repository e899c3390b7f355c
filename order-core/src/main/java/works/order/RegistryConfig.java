package works.order;

import static java.util.Objects.requireNonNull;

public final class RegistryConfig {
	private final IdAllocation idAllocation;

	private RegistryConfig(IdAllocation idAllocation) {
		this.idAllocation = idAllocation;
	}

	/**
	 * @return the configuration used when none is given:
	 *   {@link IdAllocation#HIGH_WATER_MARK high-water-mark} id allocation
	 */
	public static RegistryConfig simple() {
		return SIMPLE_CONFIG;
	}

	public static Builder builder() {
		return new Builder();
	}

	public IdAllocation idAllocation() {
		return idAllocation;
	}

	@Override
	public String toString() {
		return "RegistryConfig(idAllocation=" + idAllocation + ")";
	}

	public static class Builder {
		private IdAllocation idAllocation;

		Builder() {
			idAllocation = IdAllocation.HIGH_WATER_MARK;
		}

		public Builder idAllocation(IdAllocation idAllocation) {
			this.idAllocation = requireNonNull(idAllocation);
			return this;
		}

		public RegistryConfig build() {
			return new RegistryConfig(this.idAllocation);
		}

		@Override
		public String toString() {
			return "RegistryConfig.Builder(idAllocation=" + this.idAllocation + ")";
		}
	}

	private static final RegistryConfig SIMPLE_CONFIG = new RegistryConfig(IdAllocation.HIGH_WATER_MARK);
}
