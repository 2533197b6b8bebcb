package it.cavallium.sqlkeeper.core.impl.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import it.cavallium.sqlkeeper.core.common.cdc.CdcFilter;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class CdcFilterTest {

	@Test
	void parse() {
		var filter = CdcFilter.parse("price=gte.1.5");
		assertNotNull(filter);
		assertEquals("price", filter.column());
		assertEquals("gte", filter.operator());
		assertEquals("1.5", filter.value());
		assertEquals("price=gte.1.5", filter.toString());

		assertNull(CdcFilter.parse(null));
		assertNull(CdcFilter.parse(""));
		assertNull(CdcFilter.parse("price"));
		assertNull(CdcFilter.parse("price=gte"));
	}

	@ParameterizedTest
	@CsvSource({
			"author_id=eq.123, true",
			"author_id=eq.456, false",
			"author_id=neq.456, true",
			"author_id=gt.100, true",
			"author_id=gte.123, true",
			"author_id=lt.123, false",
			"author_id=lte.123, true",
			"title=like.ell, true",
			"title=like.xyz, false",
			"title=gt.1, false",
			"author_id=regex.anything, true"
	})
	void matches(String filter, boolean expected) {
		Map<String, Object> row = Map.of("author_id", 123L, "title", "hello");
		assertEquals(expected, CdcFilter.parse(filter).matches(row));
	}

	@Test
	void missingColumnIsEmpty() {
		var row = new HashMap<String, Object>();
		row.put("deleted_at", null);
		assertTrue(CdcFilter.parse("deleted_at=eq.").matches(row));
		assertTrue(CdcFilter.parse("missing=lte.0").matches(row));
		assertFalse(CdcFilter.parse("missing=gt.0").matches(row));
	}
}
