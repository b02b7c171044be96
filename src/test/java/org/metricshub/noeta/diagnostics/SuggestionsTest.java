package org.metricshub.noeta.diagnostics;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;

public class SuggestionsTest {

	@Test
	public void testLevenshtein() {
		assertEquals(0, Suggestions.levenshtein("sales", "sales"));
		assertEquals(1, Suggestions.levenshtein("sale", "sales"));
		assertEquals(3, Suggestions.levenshtein("kitten", "sitting"));
		assertEquals(5, Suggestions.levenshtein("", "price"));
		assertEquals(Suggestions.levenshtein("flaw", "lawn"), Suggestions.levenshtein("lawn", "flaw"));
	}

	@Test
	public void testSimilarIsSortedByDistance() {
		List<String> available = Arrays.asList("quantity", "price", "prices", "prize", "region");
		assertEquals(Arrays.asList("price", "prices", "prize"), Suggestions.similar("pric", available));
	}

	@Test
	public void testSimilarIgnoresCase() {
		assertEquals(Collections.singletonList("Revenue"),
				Suggestions.similar("REVENUE", Arrays.asList("Revenue", "region_code")));
	}

	@Test
	public void testSimilarKeepsTiesInOrder() {
		assertEquals(Arrays.asList("cat", "bat", "hat"),
				Suggestions.similar("at", Arrays.asList("cat", "bat", "hat", "rat")));
	}

	@Test
	public void testNothingClose() {
		assertTrue(Suggestions.similar("customer", Arrays.asList("price", "qty")).isEmpty());
		assertNull(Suggestions.nearest("customer", Arrays.asList("price", "qty")));
		assertNull(Suggestions.nearest("x", Collections.<String>emptyList()));
		assertNull(Suggestions.nearest(null, Arrays.asList("x")));
	}
}
