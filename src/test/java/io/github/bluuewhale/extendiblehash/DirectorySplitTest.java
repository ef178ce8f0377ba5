package io.github.bluuewhale.extendiblehash;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashMap;
import java.util.Random;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

class DirectorySplitTest {

	private static ExtendibleHashTable<Integer, Integer> identityTable(int bucketCapacity) {
		return new ExtendibleHashTable<>(bucketCapacity, ExtendibleHashTable.DEFAULT_MAX_GLOBAL_DEPTH, Integer::intValue);
	}

	@Test
	void splitGrowsDirectoryWhenLocalDepthEqualsGlobalDepth() {
		var t = identityTable(2);
		t.insert(0, 0);
		t.insert(1, 1);
		t.insert(2, 2);
		// slots: 0 -> {0, 2}, 1 -> {1}
		assertEquals(1, t.getGlobalDepth());
		assertEquals(t.getGlobalDepth(), t.getLocalDepth(0));

		int buckets = t.getNumBuckets();
		t.insert(4, 4); // slot 0 is full at local depth == global depth
		assertEquals(2, t.getGlobalDepth());
		assertEquals(buckets + 1, t.getNumBuckets());
		assertEquals(2, t.getLocalDepth(0));
		assertEquals(2, t.getLocalDepth(2));
		assertEquals(1, t.getLocalDepth(1));
		assertEquals(1, t.getLocalDepth(3));
		t.verifyInvariants();
	}

	@Test
	void splitKeepsDirectoryWhenLocalDepthBelowGlobalDepth() {
		var t = identityTable(2);
		for (int k : new int[] { 0, 1, 2, 4 }) t.insert(k, k);
		// slots 1 and 3 share one bucket {1} at local depth 1
		assertEquals(2, t.getGlobalDepth());
		t.insert(3, 3);
		assertEquals(4 - 1, t.getNumBuckets());

		int depth = t.getGlobalDepth();
		int buckets = t.getNumBuckets();
		assertTrue(t.getLocalDepth(1) < depth);

		t.insert(5, 5); // {1, 3} is full: split on bit 1 moves 3 away
		assertEquals(depth, t.getGlobalDepth());
		assertEquals(buckets + 1, t.getNumBuckets());
		assertEquals(2, t.getLocalDepth(1));
		assertEquals(2, t.getLocalDepth(3));
		for (int k : new int[] { 0, 1, 2, 3, 4, 5 }) assertEquals(k, t.find(k));
		t.verifyInvariants();
	}

	@Test
	void cascadingSplitsUntilKeysSeparate() {
		// 0 and 8 agree on bits 0..2, so the second insert splits four times
		var t = identityTable(1);
		t.insert(0, 0);
		t.insert(8, 8);
		assertEquals(4, t.getGlobalDepth());
		assertEquals(5, t.getNumBuckets());
		assertEquals(16, t.getDirectorySize());
		assertEquals(0, t.find(0));
		assertEquals(8, t.find(8));
		assertEquals(4, t.getLocalDepth(0));
		assertEquals(4, t.getLocalDepth(8));
		assertEquals(1, t.getLocalDepth(1));
		t.verifyInvariants();
	}

	@Test
	void sharedSlotsAliasOneBucket() {
		var t = identityTable(1);
		t.insert(0, 0);
		t.insert(8, 8);
		// the bucket split off on bit 0 is still referenced by every odd slot
		for (int i = 1; i < t.getDirectorySize(); i += 2) assertEquals(1, t.getLocalDepth(i));
		t.insert(1, 1);
		t.insert(3, 3);
		assertEquals(1, t.find(1));
		assertEquals(3, t.find(3));
		t.verifyInvariants();
	}

	@ParameterizedTest(name = "bucketCapacity={0}")
	@ValueSource(ints = { 1, 2, 3, 8, 32 })
	void randomWorkloadKeepsInvariants(int bucketCapacity) {
		var t = new ExtendibleHashTable<Integer, Integer>(bucketCapacity);
		var model = new HashMap<Integer, Integer>();
		var rnd = new Random(42L + bucketCapacity);
		int lastDepth = 0;
		int lastBuckets = 1;

		for (int op = 0; op < 20_000; op++) {
			int k = rnd.nextInt(2_000);
			if (rnd.nextInt(4) == 0) {
				assertEquals(model.remove(k) != null, t.remove(k));
			} else {
				int v = rnd.nextInt();
				t.insert(k, v);
				model.put(k, v);
			}

			int depth = t.getGlobalDepth();
			int buckets = t.getNumBuckets();
			assertTrue(depth >= lastDepth, "global depth decreased");
			assertTrue(buckets >= lastBuckets, "bucket count decreased");
			assertEquals(1 << depth, t.getDirectorySize());
			lastDepth = depth;
			lastBuckets = buckets;
		}

		assertEquals(model.size(), t.size());
		for (var e : model.entrySet()) assertEquals(e.getValue(), t.find(e.getKey()));
		for (int i = 0; i < t.getDirectorySize(); i++) assertTrue(t.getLocalDepth(i) <= t.getGlobalDepth());
		t.verifyInvariants();
	}

	@Test
	void splitTriggerOnFullInitialBucket() {
		int capacity = 4;
		var t = new ExtendibleHashTable<Integer, Integer>(capacity);
		for (int i = 0; i < capacity; i++) t.insert(i, i);
		assertEquals(1, t.getNumBuckets());
		assertEquals(0, t.getGlobalDepth());

		t.insert(capacity, capacity);
		assertTrue(t.getNumBuckets() >= 2);
		assertTrue(t.getGlobalDepth() >= 1);
		for (int i = 0; i <= capacity; i++) assertEquals(i, t.find(i));
	}
}
