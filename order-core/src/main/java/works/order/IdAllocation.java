package works.order;

import java.util.Collection;

/**
 * How {@link UniqueObject#AUTO_ID automatic ids} are picked within one index.
 * Ids are 0-based: an index that never held anything hands out 0.
 */
public enum IdAllocation {
	/**
	 * One more than the largest id ever added to the index.
	 * Ids of removed objects are not handed out again until the index is cleared.
	 */
	HIGH_WATER_MARK {
		@Override
		int nextId(int highWaterMark, Collection<Integer> currentIds) {
			return Math.addExact(highWaterMark, 1);
		}
	},

	/**
	 * One more than the largest id currently in the index, so that
	 * removing the newest object makes its id available again.
	 */
	MAX_EXISTING {
		@Override
		int nextId(int highWaterMark, Collection<Integer> currentIds) {
			int max = -1;
			for (int id : currentIds) {
				max = Math.max(max, id);
			}
			return Math.addExact(max, 1);
		}
	};

	/**
	 * @throws ArithmeticException if the next id would be past {@link Integer#MAX_VALUE}
	 */
	abstract int nextId(int highWaterMark, Collection<Integer> currentIds);
}
