package io.github.bluuewhale.extendiblehash;

import java.util.concurrent.locks.StampedLock;

/**
 * Bounded container of key/value entries sharing one local-depth discriminant.
 *
 * <p>Entries live in parallel arrays (keys, values, cached hashes) filled from the front;
 * removal moves the last entry into the hole. The cached hash lets a split redistribute
 * entries without calling {@code hashCode()} again.
 *
 * <p>Not thread-safe on its own: callers hold {@link #lock} while touching entries, and
 * {@link #localDepth} only changes while the directory is exclusively locked.
 */
final class Bucket<K, V> {

	final StampedLock lock = new StampedLock();

	int localDepth;

	private final Object[] keys;
	private final Object[] vals;
	private final int[] hashes;
	private int size;

	Bucket(int localDepth, int capacity) {
		this.localDepth = localDepth;
		this.keys = new Object[capacity];
		this.vals = new Object[capacity];
		this.hashes = new int[capacity];
	}

	int size() {
		return size;
	}

	int capacity() {
		return keys.length;
	}

	boolean isFull() {
		return size == keys.length;
	}

	private int indexOf(Object key, int hash) {
		for (int i = 0; i < size; i++) {
			if (hashes[i] != hash) continue;
			Object k = keys[i];
			if (k == key || k.equals(key)) return i;
		}
		return -1;
	}

	boolean containsKey(Object key, int hash) {
		return indexOf(key, hash) >= 0;
	}

	V get(Object key, int hash) {
		int idx = indexOf(key, hash);
		return (idx < 0) ? null : castValue(vals[idx]);
	}

	/** Overwrites the value of an existing key; returns false if the key is absent. */
	boolean replace(K key, int hash, V value) {
		int idx = indexOf(key, hash);
		if (idx < 0) return false;
		vals[idx] = value;
		return true;
	}

	/** Appends a new entry; returns false if the bucket is full. The key must be absent. */
	boolean append(K key, int hash, V value) {
		if (isFull()) return false;
		keys[size] = key;
		vals[size] = value;
		hashes[size] = hash;
		size++;
		return true;
	}

	boolean remove(Object key, int hash) {
		int idx = indexOf(key, hash);
		if (idx < 0) return false;
		int last = --size;
		keys[idx] = keys[last];
		vals[idx] = vals[last];
		hashes[idx] = hashes[last];
		keys[last] = null;
		vals[last] = null;
		hashes[last] = 0;
		return true;
	}

	/**
	 * Moves every entry whose hash has {@code bit} set into {@code sibling}.
	 * Returns the number of entries moved.
	 */
	int splitInto(Bucket<K, V> sibling, int bit) {
		int moved = 0;
		int i = 0;
		while (i < size) {
			if (Hashing.testBit(hashes[i], bit)) {
				sibling.append(castKey(keys[i]), hashes[i], castValue(vals[i]));
				int last = --size;
				keys[i] = keys[last];
				vals[i] = vals[last];
				hashes[i] = hashes[last];
				keys[last] = null;
				vals[last] = null;
				hashes[last] = 0;
				moved++;
			} else {
				i++;
			}
		}
		return moved;
	}

	/**
	 * Lowest bit at which {@code hash} or any stored hash differs from the others,
	 * or 32 when they are all identical. A split on a lower bit cannot separate them.
	 */
	int firstDifferingBit(int hash) {
		int diff = 0;
		for (int i = 0; i < size; i++) diff |= hashes[i] ^ hash;
		return Integer.numberOfTrailingZeros(diff);
	}

	/** Hash of the entry at {@code i}; used by invariant checks. */
	int hashAt(int i) {
		return hashes[i];
	}

	@SuppressWarnings("unchecked")
	private K castKey(Object k) {
		return (K) k;
	}

	@SuppressWarnings("unchecked")
	private V castValue(Object v) {
		return (V) v;
	}
}
