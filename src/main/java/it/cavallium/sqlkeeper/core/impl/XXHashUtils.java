package it.cavallium.sqlkeeper.core.impl;

final class XXHashUtils {

	static final int PRIME1 = -1640531535;
	static final int PRIME2 = -2048144777;
	static final int PRIME3 = -1028477379;
	static final int PRIME4 = 668265263;
	static final int PRIME5 = 374761393;

	private XXHashUtils() {
	}
}
