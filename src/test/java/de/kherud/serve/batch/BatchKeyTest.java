package de.kherud.serve.batch;

import org.junit.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class BatchKeyTest {

	@Test
	public void testEqualIndependentOfKeyOrder() {
		Map<String, Object> first = new LinkedHashMap<>();
		first.put("temperature", 0.7);
		first.put("max_new_tokens", 32);
		Map<String, Object> second = new LinkedHashMap<>();
		second.put("max_new_tokens", 32);
		second.put("temperature", 0.7);

		BatchKey a = BatchKey.of(first);
		BatchKey b = BatchKey.of(second);
		assertEquals(a, b);
		assertEquals(a.hashCode(), b.hashCode());
		assertEquals(a.toString(), b.toString());
	}

	@Test
	public void testIntegralNumbersCompareByValue() {
		assertEquals(BatchKey.of(Map.of("max_new_tokens", 32)), BatchKey.of(Map.of("max_new_tokens", 32L)));
	}

	@Test
	public void testDifferentValuesDiffer() {
		assertNotEquals(BatchKey.of(Map.of("max_new_tokens", 32)), BatchKey.of(Map.of("max_new_tokens", 64)));
		assertNotEquals(BatchKey.of(Map.of("temperature", 0.7)), BatchKey.of(Map.of("temperature", 0.7, "top_p", 0.9)));
	}

	@Test
	public void testNestedStructures() {
		Map<String, Object> nested = new HashMap<>();
		nested.put("stop", List.of("</s>", "###"));
		nested.put("logit_bias", Map.of("b", 1, "a", 2));
		BatchKey key = BatchKey.of(nested);
		assertEquals(BatchKey.of(Map.of("logit_bias", Map.of("a", 2L, "b", 1L), "stop", List.of("</s>", "###"))), key);
		assertEquals("{\"logit_bias\":{\"a\":2,\"b\":1},\"stop\":[\"</s>\",\"###\"]}", key.toString());
	}

	@Test
	public void testEmptyAndNullConfigShareAKey() {
		assertEquals(BatchKey.of(null), BatchKey.of(Map.of()));
		assertTrue(BatchKey.of(null).config().isEmpty());
	}

	@Test
	public void testFloatAndDoubleOptionsShareKey() {
		assertEquals(BatchKey.of(Map.of("temperature", 0.7f)), BatchKey.of(Map.of("temperature", 0.7)));
		assertEquals(BatchKey.of(Map.of("temperature", 0.7f)).hashCode(), BatchKey.of(Map.of("temperature", 0.7)).hashCode());
	}
}
