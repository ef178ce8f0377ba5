package io.github.bluuewhale.extendiblehash;

/**
 * Key/value index consumed by a buffer or cache manager, e.g. as a page table mapping
 * page ids to frames. Implementations do not allow null keys or null values, so a
 * {@code null} from {@link #find} always means the key is absent.
 */
public interface HashTable<K, V> {

	/** Returns the value mapped to {@code key}, or {@code null} if there is none. */
	V find(K key);

	/** Maps {@code key} to {@code value}, overwriting any previous value. */
	void insert(K key, V value);

	/** Removes the mapping for {@code key}; returns whether one existed. */
	boolean remove(K key);
}
