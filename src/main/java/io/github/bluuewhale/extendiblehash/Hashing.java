package io.github.bluuewhale.extendiblehash;

/**
 * Static helpers based on the hash utilities authored by Guava contributors.
 * Original code by Kevin Bourrillion, Jesse Wilson, and Austin Appleby,
 * derived from the MurmurHash3 intermediate step (public domain).
 */
final class Hashing {

	private Hashing() {}

	/*
	 * Use longs to preserve precision (mirrors the Guava implementation).
	 */
	private static final long C1 = 0xcc9e2d51L;
	private static final long C2 = 0x1b873593L;

	/*
	 * Upper bound on the directory depth: 1 << 30 slots is the largest
	 * power-of-two int[] a JVM hands out (Guava's Ints.MAX_POWER_OF_TWO).
	 */
	static final int MAX_GLOBAL_DEPTH = 30;

	/*
	 * This method was rewritten in Java from an intermediate step of the Murmur hash function in
	 * http://code.google.com/p/smhasher/source/browse/trunk/MurmurHash3.cpp, which contained the
	 * following header:
	 *
	 * MurmurHash3 was written by Austin Appleby, and is placed in the public domain. The author
	 * hereby disclaims copyright to this source code.
	 */
	static int smear(int hashCode) {
		return (int) (C2 * Integer.rotateLeft((int) (hashCode * C1), 15));
	}

	static int smearedHash(Object o) {
		if (o == null) throw new NullPointerException("Null keys not supported");
		return smear(o.hashCode());
	}

	/** Low-bit mask selecting {@code depth} bits, {@code depth} in [0, 31]. */
	static int mask(int depth) {
		return (1 << depth) - 1;
	}

	/** Whether bit {@code bit} of {@code hash} is set. */
	static boolean testBit(int hash, int bit) {
		return ((hash >>> bit) & 1) != 0;
	}

	static String lowBits(int value, int depth) {
		if (depth == 0) return "";
		String s = Integer.toBinaryString(value & mask(depth));
		if (s.length() < depth) s = "0".repeat(depth - s.length()) + s;
		return s;
	}
}
