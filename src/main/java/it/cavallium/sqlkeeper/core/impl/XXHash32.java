package it.cavallium.sqlkeeper.core.impl;

import java.util.HexFormat;

/**
 * 32-bit xxHash. Used to fingerprint migration files.
 */
public abstract class XXHash32 {

	public static XXHash32 getInstance() {
		return XXHash32JavaSafe.INSTANCE;
	}

	public abstract int hash(byte[] buf, int off, int len, int seed);

	public int hash(byte[] buf) {
		return hash(buf, 0, buf.length, 0);
	}

	/**
	 * @return the seed 0 hash of {@code buf} as 8 lowercase hex digits
	 */
	public String hashHex(byte[] buf) {
		return HexFormat.of().toHexDigits(hash(buf));
	}
}
