package io.github.bluuewhale.extendiblehash;

import java.util.HashMap;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Threads;
import org.openjdk.jmh.annotations.Warmup;

@Warmup(iterations = 3)
@Measurement(iterations = 5)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
public class HashTableBenchmark {

	@State(Scope.Benchmark)
	public static class ReadState {
		@Param({ "1000", "100000" })
		int size;

		@Param({ "16", "64" })
		int bucketCapacity;

		ExtendibleHashTable<Integer, Integer> ext;
		HashMap<Integer, Integer> jdk;
		ConcurrentHashMap<Integer, Integer> chm;
		int[] keys;
		int[] misses;

		@Setup(Level.Trial)
		public void setup() {
			var rnd = new Random(123);
			keys = new int[size];
			misses = new int[size];
			Set<Integer> keySet = new java.util.HashSet<>(size * 2);
			for (int i = 0; i < size; i++) {
				int k = rnd.nextInt();
				keys[i] = k;
				keySet.add(k);
			}
			for (int i = 0; i < size; i++) {
				int miss;
				do { miss = rnd.nextInt(); } while (keySet.contains(miss));
				misses[i] = miss;
			}
			ext = new ExtendibleHashTable<>(bucketCapacity);
			jdk = new HashMap<>();
			chm = new ConcurrentHashMap<>();
			for (int i = 0; i < size; i++) {
				ext.insert(keys[i], i);
				jdk.put(keys[i], i);
				chm.put(keys[i], i);
			}
		}
	}

	@State(Scope.Thread)
	public static class Cursor {
		Random rnd = new Random(7);

		int nextKey(ReadState s) { return s.keys[rnd.nextInt(s.keys.length)]; }
		int nextMiss(ReadState s) { return s.misses[rnd.nextInt(s.misses.length)]; }
	}

	@State(Scope.Thread)
	public static class MutateState {
		@Param({ "1000", "100000" })
		int size;

		@Param({ "16", "64" })
		int bucketCapacity;

		int[] keys;
		int next;
		ExtendibleHashTable<Integer, Integer> ext;
		HashMap<Integer, Integer> jdk;

		@Setup(Level.Trial)
		public void initKeys() {
			var rnd = new Random(456);
			keys = IntStream.range(0, size).map(i -> rnd.nextInt()).toArray();
		}

		@Setup(Level.Iteration)
		public void resetTables() {
			ext = new ExtendibleHashTable<>(bucketCapacity);
			jdk = new HashMap<>();
			next = 0;
		}

		int nextKey() {
			int k = keys[next];
			next = (next + 1) % keys.length;
			return k;
		}
	}

	// ------- find hit/miss -------
	@Benchmark
	public int extFindHit(ReadState s, Cursor c) {
		return s.ext.find(c.nextKey(s));
	}

	@Benchmark
	public int jdkGetHit(ReadState s, Cursor c) {
		return s.jdk.get(c.nextKey(s));
	}

	@Benchmark
	public int extFindMiss(ReadState s, Cursor c) {
		Integer v = s.ext.find(c.nextMiss(s));
		return v == null ? -1 : v;
	}

	@Benchmark
	public int jdkGetMiss(ReadState s, Cursor c) {
		Integer v = s.jdk.get(c.nextMiss(s));
		return v == null ? -1 : v;
	}

	// ------- contended reads -------
	@Benchmark
	@Threads(4)
	public int extFindHitContended(ReadState s, Cursor c) {
		return s.ext.find(c.nextKey(s));
	}

	@Benchmark
	@Threads(4)
	public int chmGetHitContended(ReadState s, Cursor c) {
		return s.chm.get(c.nextKey(s));
	}

	// ------- insert (growing, includes splits) -------
	@Benchmark
	public int extInsert(MutateState s) {
		int k = s.nextKey();
		s.ext.insert(k, k);
		return k;
	}

	@Benchmark
	public int jdkPut(MutateState s) {
		int k = s.nextKey();
		s.jdk.put(k, k);
		return k;
	}

	// ------- insert/remove churn on a warm table -------
	@Benchmark
	public boolean extInsertRemove(MutateState s) {
		int k = s.nextKey();
		s.ext.insert(k, k);
		return s.ext.remove(k);
	}

	@Benchmark
	public boolean jdkPutRemove(MutateState s) {
		int k = s.nextKey();
		s.jdk.put(k, k);
		return s.jdk.remove(k) != null;
	}
}
