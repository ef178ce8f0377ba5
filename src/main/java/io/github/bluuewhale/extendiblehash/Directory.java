package io.github.bluuewhale.extendiblehash;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Formatter;
import java.util.concurrent.locks.StampedLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Power-of-two sized sequence of slots, each holding the arena index of a {@link Bucket}.
 *
 * <p>Given global depth {@code g}, a bucket with local depth {@code d} is referenced by the
 * {@code 2^(g-d)} slots whose low {@code d} bits equal the bucket's discriminant. Buckets are
 * never removed from the arena: a split keeps the original and appends the sibling, so the
 * arena size is the number of distinct buckets the slots reference.
 *
 * <p>{@link #structure} guards {@link #slots}, {@link #globalDepth}, the arena and every
 * bucket's local depth. Read it shared to resolve a slot; hold it exclusively to split.
 */
final class Directory<K, V> {

	private static final Logger LOG = LoggerFactory.getLogger(Directory.class);

	final StampedLock structure = new StampedLock();

	private final int bucketCapacity;
	private final ArrayList<Bucket<K, V>> arena = new ArrayList<>();
	private int[] slots;
	private int globalDepth;

	Directory(int bucketCapacity) {
		this.bucketCapacity = bucketCapacity;
		this.arena.add(new Bucket<>(0, bucketCapacity));
		this.slots = new int[1];
		this.globalDepth = 0;
	}

	int globalDepth() {
		return globalDepth;
	}

	int size() {
		return slots.length;
	}

	int bucketCount() {
		return arena.size();
	}

	int slotFor(int hash) {
		return hash & Hashing.mask(globalDepth);
	}

	Bucket<K, V> bucketAt(int slot) {
		return arena.get(slots[slot]);
	}

	/**
	 * Splits the bucket referenced by {@code slot} on its next hash bit, doubling the
	 * slot array first if the bucket already uses every global bit.
	 *
	 * <p>Caller holds {@link #structure} exclusively and the bucket's write lock.
	 * Returns the new sibling, which nobody else can see until the lock is released.
	 */
	Bucket<K, V> split(int slot) {
		int arenaIndex = slots[slot];
		Bucket<K, V> bucket = arena.get(arenaIndex);
		int d = bucket.localDepth;

		bucket.localDepth = d + 1;
		if (d + 1 > globalDepth) grow();

		Bucket<K, V> sibling = new Bucket<>(d + 1, bucketCapacity);
		int siblingIndex = arena.size();
		arena.add(sibling);

		int moved = bucket.splitInto(sibling, d);

		// Slots agreeing with the bucket on the low d bits and having bit d set.
		int stride = 1 << (d + 1);
		for (int i = (slot & Hashing.mask(d)) | (1 << d); i < slots.length; i += stride) {
			assert slots[i] == arenaIndex : "slot " + i + " does not reference bucket " + arenaIndex;
			slots[i] = siblingIndex;
		}

		LOG.debug("Split bucket {} at local depth {} into sibling {}: {} of {} entries moved",
			arenaIndex, d + 1, siblingIndex, moved, bucketCapacity);
		return sibling;
	}

	private void grow() {
		int n = slots.length;
		int[] grown = Arrays.copyOf(slots, n << 1);
		System.arraycopy(slots, 0, grown, n, n);
		slots = grown;
		globalDepth++;
		LOG.debug("Directory doubled to {} slots, global depth {}", grown.length, globalDepth);
	}

	/**
	 * Checks the slot/bucket invariants and throws {@link IllegalStateException} on the
	 * first violation. Caller holds {@link #structure} (shared is enough) and no bucket
	 * is being mutated.
	 */
	void verify() {
		if (slots.length != 1 << globalDepth) {
			throw new IllegalStateException("slot count " + slots.length + " != 2^" + globalDepth);
		}
		int[] refs = new int[arena.size()];
		int[] firstSlot = new int[arena.size()];
		Arrays.fill(firstSlot, -1);
		for (int i = 0; i < slots.length; i++) {
			int b = slots[i];
			refs[b]++;
			if (firstSlot[b] < 0) firstSlot[b] = i;
			int d = arena.get(b).localDepth;
			if ((i & Hashing.mask(d)) != (firstSlot[b] & Hashing.mask(d))) {
				throw new IllegalStateException("slot " + i + " disagrees with bucket " + b + " on low " + d + " bits");
			}
		}
		for (int b = 0; b < arena.size(); b++) {
			Bucket<K, V> bucket = arena.get(b);
			int d = bucket.localDepth;
			if (d > globalDepth) {
				throw new IllegalStateException("bucket " + b + " local depth " + d + " > global depth " + globalDepth);
			}
			if (refs[b] != 1 << (globalDepth - d)) {
				throw new IllegalStateException("bucket " + b + " referenced by " + refs[b] + " slots, expected " + (1 << (globalDepth - d)));
			}
			if (bucket.size() > bucket.capacity()) {
				throw new IllegalStateException("bucket " + b + " holds " + bucket.size() + " entries");
			}
			int discriminant = firstSlot[b] & Hashing.mask(d);
			for (int e = 0; e < bucket.size(); e++) {
				if ((bucket.hashAt(e) & Hashing.mask(d)) != discriminant) {
					throw new IllegalStateException("bucket " + b + " holds an entry outside its discriminant");
				}
			}
		}
	}

	/**
	 * Human friendly dump, one line per slot. Caller holds {@link #structure}.
	 */
	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append("Directory{globalDepth=").append(globalDepth)
			.append(", slots=").append(slots.length)
			.append(", buckets=").append(arena.size())
			.append(", bucketCapacity=").append(bucketCapacity)
			.append('}');
		Formatter f = new Formatter(sb);
		for (int i = 0; i < slots.length; i++) {
			Bucket<K, V> b = arena.get(slots[i]);
			f.format("%n%4d [%" + Math.max(1, globalDepth) + "s] => bucket %d (k=%d, n=%d)",
				i, Hashing.lowBits(i, globalDepth), slots[i], b.localDepth, b.size());
		}
		return sb.toString();
	}
}
