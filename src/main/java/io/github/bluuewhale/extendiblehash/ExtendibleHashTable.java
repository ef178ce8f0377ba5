package io.github.bluuewhale.extendiblehash;

import java.util.Objects;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.StampedLock;
import java.util.function.ToIntFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe extendible hash table (null keys and null values NOT allowed).
 *
 * <p>Keys are routed by the low {@code globalDepth} bits of their hash through a
 * {@link Directory} of bucket references. A full bucket is split on its next hash bit,
 * doubling the directory only when the bucket already uses every global bit, so the
 * table grows one bucket at a time and never rehashes as a whole. Nothing shrinks:
 * removals leave global depth and bucket count as they are.
 *
 * <p>Locking is two-tier. The directory's {@link StampedLock} is held shared while a key
 * is routed to its bucket, and exclusively while a split rewires the directory. Each
 * bucket has its own lock, taken before the directory lock is let go. A thread never asks
 * for the directory lock while it holds a bucket lock.
 *
 * <p>An insert whose key shares all of its low {@code maxGlobalDepth} hash bits with a full
 * bucket's worth of keys cannot be placed and fails with
 * {@link HashCapacityExhaustedException}.
 */
public final class ExtendibleHashTable<K, V> implements HashTable<K, V> {

	private static final Logger LOG = LoggerFactory.getLogger(ExtendibleHashTable.class);

	/* Defaults */
	public static final int DEFAULT_BUCKET_CAPACITY = 16;
	public static final int DEFAULT_MAX_GLOBAL_DEPTH = Hashing.MAX_GLOBAL_DEPTH;

	private final Directory<K, V> directory;
	private final int bucketCapacity;
	private final int maxGlobalDepth;
	private final ToIntFunction<? super K> hasher;
	private final LongAdder size = new LongAdder();

	public ExtendibleHashTable() {
		this(DEFAULT_BUCKET_CAPACITY);
	}

	public ExtendibleHashTable(int bucketCapacity) {
		this(bucketCapacity, DEFAULT_MAX_GLOBAL_DEPTH);
	}

	public ExtendibleHashTable(int bucketCapacity, int maxGlobalDepth) {
		this(bucketCapacity, maxGlobalDepth, Hashing::smearedHash);
	}

	/**
	 * @param bucketCapacity entries a bucket holds before it splits, at least 1
	 * @param maxGlobalDepth ceiling on the directory depth, in [0, 30]; the directory never
	 *                       exceeds {@code 2^maxGlobalDepth} slots
	 * @param hasher         hash function routing keys; only its low {@code maxGlobalDepth}
	 *                       bits are ever used
	 */
	public ExtendibleHashTable(int bucketCapacity, int maxGlobalDepth, ToIntFunction<? super K> hasher) {
		if (bucketCapacity < 1) {
			throw new IllegalArgumentException("bucketCapacity must be >= 1: " + bucketCapacity);
		}
		if (maxGlobalDepth < 0 || maxGlobalDepth > Hashing.MAX_GLOBAL_DEPTH) {
			throw new IllegalArgumentException(
				"maxGlobalDepth must be in [0," + Hashing.MAX_GLOBAL_DEPTH + "]: " + maxGlobalDepth);
		}
		this.bucketCapacity = bucketCapacity;
		this.maxGlobalDepth = maxGlobalDepth;
		this.hasher = Objects.requireNonNull(hasher, "hasher");
		this.directory = new Directory<>(bucketCapacity);
	}

	/** The hash this table routes {@code key} with. */
	public int hashKey(K key) {
		Objects.requireNonNull(key, "key");
		return hasher.applyAsInt(key);
	}

	/* ------------ HashTable API ------------ */

	@Override
	public V find(K key) {
		int h = hashKey(key);
		StampedLock structure = directory.structure;
		Bucket<K, V> bucket;
		long bucketStamp;
		long stamp = structure.readLock();
		try {
			bucket = directory.bucketAt(directory.slotFor(h));
			bucketStamp = bucket.lock.readLock();
		} finally {
			structure.unlockRead(stamp);
		}
		try {
			return bucket.get(key, h);
		} finally {
			bucket.lock.unlockRead(bucketStamp);
		}
	}

	public boolean contains(K key) {
		return find(key) != null;
	}

	@Override
	public void insert(K key, V value) {
		int h = hashKey(key);
		Objects.requireNonNull(value, "value");

		// Fast path: overwrite or append without touching the directory.
		StampedLock structure = directory.structure;
		Bucket<K, V> bucket;
		long bucketStamp;
		long stamp = structure.readLock();
		try {
			bucket = directory.bucketAt(directory.slotFor(h));
			bucketStamp = bucket.lock.writeLock();
		} finally {
			structure.unlockRead(stamp);
		}
		try {
			if (bucket.replace(key, h, value)) return;
			if (bucket.append(key, h, value)) {
				size.increment();
				return;
			}
		} finally {
			bucket.lock.unlockWrite(bucketStamp);
		}

		insertSplitting(key, h, value);
	}

	/**
	 * Slow path: holds the directory exclusively and splits the target bucket until the
	 * key fits. The bucket is re-resolved and re-checked on each round, since another
	 * writer may have split it or made room in the meantime.
	 */
	private void insertSplitting(K key, int h, V value) {
		StampedLock structure = directory.structure;
		long stamp = structure.writeLock();
		try {
			for (;;) {
				int slot = directory.slotFor(h);
				Bucket<K, V> bucket = directory.bucketAt(slot);
				long bucketStamp = bucket.lock.writeLock();
				try {
					if (bucket.replace(key, h, value)) return;
					if (bucket.append(key, h, value)) {
						size.increment();
						return;
					}
					if (bucket.firstDifferingBit(h) >= maxGlobalDepth) {
						LOG.warn("Bucket at slot {} holds {} keys sharing the low {} hash bits of 0x{}; rejecting insert",
							slot, bucketCapacity, maxGlobalDepth, Integer.toHexString(h));
						throw new HashCapacityExhaustedException(h, bucketCapacity, maxGlobalDepth);
					}
					directory.split(slot);
				} finally {
					bucket.lock.unlockWrite(bucketStamp);
				}
			}
		} finally {
			structure.unlockWrite(stamp);
		}
	}

	@Override
	public boolean remove(K key) {
		int h = hashKey(key);
		StampedLock structure = directory.structure;
		Bucket<K, V> bucket;
		long bucketStamp;
		long stamp = structure.readLock();
		try {
			bucket = directory.bucketAt(directory.slotFor(h));
			bucketStamp = bucket.lock.writeLock();
		} finally {
			structure.unlockRead(stamp);
		}
		try {
			if (!bucket.remove(key, h)) return false;
			size.decrement();
			return true;
		} finally {
			bucket.lock.unlockWrite(bucketStamp);
		}
	}

	/* ------------ Introspection ------------ */

	public int getGlobalDepth() {
		StampedLock structure = directory.structure;
		long stamp = structure.tryOptimisticRead();
		int depth = directory.globalDepth();
		if (!structure.validate(stamp)) {
			stamp = structure.readLock();
			try {
				depth = directory.globalDepth();
			} finally {
				structure.unlockRead(stamp);
			}
		}
		return depth;
	}

	/**
	 * Local depth of the bucket referenced by directory slot {@code slotIndex}.
	 *
	 * @throws IndexOutOfBoundsException if {@code slotIndex} is not in [0, directory size)
	 */
	public int getLocalDepth(int slotIndex) {
		StampedLock structure = directory.structure;
		long stamp = structure.readLock();
		try {
			Objects.checkIndex(slotIndex, directory.size());
			return directory.bucketAt(slotIndex).localDepth;
		} finally {
			structure.unlockRead(stamp);
		}
	}

	/** Number of distinct buckets; several directory slots may share one bucket. */
	public int getNumBuckets() {
		StampedLock structure = directory.structure;
		long stamp = structure.tryOptimisticRead();
		int n = directory.bucketCount();
		if (!structure.validate(stamp)) {
			stamp = structure.readLock();
			try {
				n = directory.bucketCount();
			} finally {
				structure.unlockRead(stamp);
			}
		}
		return n;
	}

	/** Number of directory slots, always {@code 2^getGlobalDepth()}. */
	public int getDirectorySize() {
		StampedLock structure = directory.structure;
		long stamp = structure.readLock();
		try {
			return directory.size();
		} finally {
			structure.unlockRead(stamp);
		}
	}

	public int getBucketCapacity() {
		return bucketCapacity;
	}

	public int getMaxGlobalDepth() {
		return maxGlobalDepth;
	}

	public int size() {
		long n = size.sum();
		if (n > Integer.MAX_VALUE) return Integer.MAX_VALUE;
		return (int) n;
	}

	public boolean isEmpty() {
		return size() == 0;
	}

	/** Checks the directory invariants; for tests, with no writer running. */
	void verifyInvariants() {
		StampedLock structure = directory.structure;
		long stamp = structure.readLock();
		try {
			directory.verify();
		} finally {
			structure.unlockRead(stamp);
		}
	}

	@Override
	public String toString() {
		StampedLock structure = directory.structure;
		long stamp = structure.readLock();
		try {
			return "ExtendibleHashTable{size=" + size() + "} " + directory;
		} finally {
			structure.unlockRead(stamp);
		}
	}
}
