package it.cavallium.sqlkeeper.core.test;

import it.cavallium.sqlkeeper.core.impl.XXHash32;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ThreadLocalRandom;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class XXHash32Test {

	@Test
	public void testBytes() {
		var safeXxhash32 = net.jpountz.xxhash.XXHashFactory.safeInstance().hash32();
		var myXxhash32 = XXHash32.getInstance();
		for (int runs = 0; runs < 3; runs++) {
			for (int len = 0; len < 600; len++) {
				byte[] bytes = new byte[len];
				ThreadLocalRandom.current().nextBytes(bytes);
				var hash = safeXxhash32.hash(bytes, 0, bytes.length, Integer.MIN_VALUE);
				Assertions.assertEquals(hash, myXxhash32.hash(bytes, 0, bytes.length, Integer.MIN_VALUE));
			}
		}
	}

	@Test
	public void testSlice() {
		var safeXxhash32 = net.jpountz.xxhash.XXHashFactory.safeInstance().hash32();
		var myXxhash32 = XXHash32.getInstance();
		byte[] bytes = new byte[256];
		ThreadLocalRandom.current().nextBytes(bytes);
		for (int off = 0; off < 64; off++) {
			Assertions.assertEquals(safeXxhash32.hash(bytes, off, 100, 0), myXxhash32.hash(bytes, off, 100, 0));
		}
	}

	@Test
	public void testHex() {
		var myXxhash32 = XXHash32.getInstance();
		var content = "CREATE TABLE users (id INTEGER PRIMARY KEY)".getBytes(StandardCharsets.UTF_8);
		var hex = myXxhash32.hashHex(content);
		Assertions.assertEquals(8, hex.length());
		Assertions.assertEquals(myXxhash32.hash(content), Integer.parseUnsignedInt(hex, 16));
	}
}
