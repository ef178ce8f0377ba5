package io.github.bluuewhale.extendiblehash;

/**
 * Thrown when an insert lands in a full bucket whose entries cannot be told apart
 * by any hash bit below the table's maximum global depth, so no number of splits
 * would make room. The table is left unchanged by the failed insert.
 */
public final class HashCapacityExhaustedException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

	private final int hash;
	private final int maxGlobalDepth;

	HashCapacityExhaustedException(int hash, int bucketCapacity, int maxGlobalDepth) {
		super(String.format(
			"Cannot insert key with hash 0x%08x: more than %d keys share its low %d hash bits",
			hash, bucketCapacity, maxGlobalDepth));
		this.hash = hash;
		this.maxGlobalDepth = maxGlobalDepth;
	}

	/** Hash of the key that could not be inserted. */
	public int hash() {
		return hash;
	}

	public int maxGlobalDepth() {
		return maxGlobalDepth;
	}
}
