package org.abif.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lightweight JSON builder: an ordered key/value tree.
 *
 * Keys may be dotted paths. <pre>put("viable.count", 3)</pre> creates the nested
 * Lson "viable" if necessary. toString() serializes the tree with Jackson.
 */
public class Lson extends LinkedHashMap<String, Object> {

	private static final ObjectMapper mapper = new ObjectMapper()
			.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

	public Lson() {
		super();
	}

	public static Lson builder() {
		return new Lson();
	}

	/**
	 * Put a value under a (dotted) path. Intermediate maps are created when necessary.
	 * @param path key or dotted path, e.g. "parent.child.attribute"
	 * @param value any Jackson serializable value
	 * @return this, for chaining
	 */
	public Lson put(String path, Object value) {
		int dot = path.indexOf('.');
		if (dot < 0) {
			super.put(path, value);
			return this;
		}
		String head = path.substring(0, dot);
		Object child = super.get(head);
		if (!(child instanceof Lson)) {
			// a plain map is replaced by an Lson with the same entries
			Lson nested = new Lson();
			if (child instanceof Map) ((Map<?, ?>)child).forEach((k, v) -> nested.putKey(String.valueOf(k), v));
			super.put(head, nested);
			child = nested;
		}
		((Lson)child).put(path.substring(dot + 1), value);
		return this;
	}

	/** Put a value under exactly this key. Dots in the key are not interpreted. */
	private void putKey(String key, Object value) {
		super.put(key, value);
	}

	/** Only put the value, if it is not null. */
	public Lson putIfNotNull(String path, Object value) {
		if (value != null) put(path, value);
		return this;
	}

	/**
	 * Get the value under a (dotted) path
	 * @param path key or dotted path
	 * @return the value or null if there is nothing under that path
	 */
	public Object get(String path) {
		int dot = path.indexOf('.');
		if (dot < 0) return super.get(path);
		Object child = super.get(path.substring(0, dot));
		if (child instanceof Lson) return ((Lson)child).get(path.substring(dot + 1));
		if (child instanceof Map) return ((Map<?, ?>)child).get(path.substring(dot + 1));
		return null;
	}

	public String toPrettyString() {
		try {
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(this);
		} catch (JsonProcessingException e) {
			throw new RuntimeException("Cannot serialize Lson", e);
		}
	}

	@Override
	public String toString() {
		try {
			return mapper.writeValueAsString(this);
		} catch (JsonProcessingException e) {
			throw new RuntimeException("Cannot serialize Lson", e);
		}
	}
}
