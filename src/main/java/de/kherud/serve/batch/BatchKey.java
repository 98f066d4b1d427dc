package de.kherud.serve.batch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Canonical identity of a request's generation options. Two requests may share one backend call only if their
 * keys are equal. Equality is structural over the normalized option tree: map entries are key-ordered and integral
 * numbers compare by value regardless of their boxed type.
 */
public final class BatchKey {

	private static final ObjectMapper MAPPER = new ObjectMapper()
		.configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

	private final Map<String, Object> config;
	private final int hash;

	private BatchKey(Map<String, Object> config) {
		this.config = config;
		this.hash = config.hashCode();
	}

	public static BatchKey of(Map<String, ?> config) {
		if (config == null || config.isEmpty()) {
			return new BatchKey(Collections.emptyMap());
		}
		return new BatchKey(canonicalMap(config));
	}

	/**
	 * The normalized options, in key order. This is what the backend receives for the group.
	 */
	public Map<String, Object> config() {
		return config;
	}

	private static Map<String, Object> canonicalMap(Map<?, ?> source) {
		TreeMap<String, Object> sorted = new TreeMap<>();
		source.forEach((key, value) -> sorted.put(String.valueOf(key), canonical(value)));
		return Collections.unmodifiableMap(sorted);
	}

	private static Object canonical(Object value) {
		if (value instanceof Map) {
			return canonicalMap((Map<?, ?>) value);
		}
		if (value instanceof List) {
			List<Object> copy = new ArrayList<>();
			for (Object item : (List<?>) value) {
				copy.add(canonical(item));
			}
			return Collections.unmodifiableList(copy);
		}
		if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
			return ((Number) value).longValue();
		}
		if (value instanceof BigInteger) {
			BigInteger big = (BigInteger) value;
			return big.bitLength() < 64 ? (Object) big.longValue() : big;
		}
		if (value instanceof Float) {
			// decimal form, so 0.7f and 0.7d meet
			return Double.parseDouble(value.toString());
		}
		if (value instanceof BigDecimal) {
			return ((BigDecimal) value).doubleValue();
		}
		return value;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof BatchKey)) {
			return false;
		}
		return config.equals(((BatchKey) o).config);
	}

	@Override
	public int hashCode() {
		return hash;
	}

	/**
	 * Canonical JSON rendering, for logs only. It is never parsed back.
	 */
	@Override
	public String toString() {
		try {
			return MAPPER.writeValueAsString(config);
		} catch (JsonProcessingException e) {
			return config.toString();
		}
	}
}
