// Part of Rendercache
package com.machinezoo.rendercache.encoding;

import java.io.*;
import java.math.*;
import java.time.*;
import java.time.format.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;
import java.util.function.*;
import java.util.regex.*;
import org.slf4j.*;
import com.fasterxml.jackson.core.*;
import com.fasterxml.jackson.databind.*;
import com.google.common.cache.*;
import com.machinezoo.noexception.*;
import com.machinezoo.rendercache.theme.*;
import com.machinezoo.stagean.*;
import it.unimi.dsi.fastutil.objects.*;

/*
 * Canonical encoding is JSON with a few conventions:
 * - plain objects (maps with string keys) are written with sorted keys,
 * - special leaves and non-plain containers are written as objects with "$type" tag,
 * - containers on the current descent path are written as {"$type":"Circular","ref":id},
 * - keys of plain objects that start with '$' get one more '$', so that user data never looks like a tag.
 *
 * Container IDs are not written. Both encoder and decoder number containers in pre-order,
 * so the decoder can resolve circular references by counting containers it has already restored.
 * Everything that is written in place of a container (sentinels, circular markers) must not consume an ID.
 *
 * Property graphs can be arbitrarily deep. Encoder streams JSON tokens into generator while walking the graph
 * with explicit stack of steps, so depth is limited by heap, not by thread stack.
 * Every container is snapshotted before its first token is written. Snapshot is the only place where
 * broken or concurrently modified collections throw, so failures never leave half-written containers behind.
 *
 * Functions are identified by reference. IDs come from a weak identity map owned by the encoder,
 * so that the same function always receives the same ID and distinct functions never share one.
 * Guava's weak-keyed cache compares keys by reference, which is exactly what we need here.
 */
/**
 * Deterministic, cycle-safe encoder of property graphs into {@link Signature}s.
 */
@DraftDocs("document supported value types on the website")
public class CanonicalEncoder {
	private static final Logger logger = LoggerFactory.getLogger(CanonicalEncoder.class);
	static final String UNSERIALIZABLE = "<unserializable>";
	/**
	 * Signature of a value that could not be encoded at all.
	 */
	public static final Signature UNSERIALIZABLE_SIGNATURE = new Signature("\"" + UNSERIALIZABLE + "\"");
	private static final ObjectMapper mapper = new ObjectMapper();
	private final AtomicInteger functionCounter = new AtomicInteger();
	private final LoadingCache<Object, Integer> functionIds = CacheBuilder.newBuilder()
		.weakKeys()
		.build(CacheLoader.from(function -> functionCounter.getAndIncrement()));
	public Signature encode(Object value) {
		try {
			return new Signature(Exceptions.sneak().get(() -> {
				StringWriter writer = new StringWriter();
				try (JsonGenerator json = mapper.getFactory().createGenerator(writer)) {
					new Encoding(json).run(value);
				}
				return writer.toString();
			}));
		} catch (RuntimeException ex) {
			logger.debug("Cannot encode {} instance.", value.getClass().getName(), ex);
			return UNSERIALIZABLE_SIGNATURE;
		}
	}
	@FunctionalInterface
	private interface Step {
		void run() throws IOException;
	}
	/*
	 * State of one encode() call.
	 * Containers are identified by reference, not by equals(), which could recurse forever on cyclic collections.
	 * Only containers on the current path are recorded, so shared subgraphs in unrelated branches are encoded in full.
	 */
	private class Encoding {
		final JsonGenerator json;
		final Deque<Step> steps = new ArrayDeque<>();
		final Reference2IntOpenHashMap<Object> path = new Reference2IntOpenHashMap<>();
		int next;
		Encoding(JsonGenerator json) {
			this.json = json;
			path.defaultReturnValue(-1);
		}
		void run(Object root) throws IOException {
			steps.push(() -> value(root));
			while (!steps.isEmpty())
				steps.pop().run();
		}
		void value(Object value) throws IOException {
			if (value instanceof Map || value instanceof Collection || value instanceof Object[])
				container(value);
			else
				leaf(value);
		}
		void leaf(Object value) throws IOException {
			if (value == null)
				json.writeNull();
			else if (value instanceof String)
				json.writeString((String)value);
			else if (value instanceof Boolean)
				json.writeBoolean((Boolean)value);
			else if (value instanceof Character)
				json.writeString(value.toString());
			else if (value instanceof BigInteger)
				tagged("BigInt", "value", value.toString());
			else if (value instanceof Number)
				number((Number)value);
			else if (isFunction(value)) {
				json.writeStartObject();
				json.writeStringField("$type", "Function");
				json.writeStringField("name", functionName(value));
				json.writeNumberField("id", functionIds.getUnchecked(value));
				json.writeEndObject();
			} else if (value instanceof Symbol)
				tagged("Symbol", "key", ((Symbol)value).description());
			else if (value instanceof Enum) {
				Enum<?> constant = (Enum<?>)value;
				tagged("Symbol", "key", constant.getDeclaringClass().getSimpleName() + "." + constant.name());
			} else if (value instanceof Date)
				tagged("Date", "value", Instant.ofEpochMilli(((Date)value).getTime()).toString());
			else if (value instanceof Instant)
				tagged("Date", "value", value.toString());
			else if (value instanceof Pattern) {
				Pattern pattern = (Pattern)value;
				json.writeStartObject();
				json.writeStringField("$type", "RegExp");
				json.writeStringField("source", pattern.pattern());
				json.writeNumberField("flags", pattern.flags());
				json.writeEndObject();
			} else {
				String text;
				try {
					text = String.valueOf(value);
				} catch (RuntimeException ex) {
					logger.debug("Cannot stringify {} instance.", value.getClass().getName(), ex);
					text = UNSERIALIZABLE;
				}
				json.writeString(text);
			}
		}
		void number(Number number) throws IOException {
			if (number instanceof Integer || number instanceof Long || number instanceof Short || number instanceof Byte)
				json.writeNumber(number.longValue());
			else if (number instanceof BigDecimal) {
				BigDecimal decimal = (BigDecimal)number;
				json.writeNumber(decimal.signum() == 0 ? BigDecimal.ZERO : decimal.stripTrailingZeros());
			} else {
				double real = number.doubleValue();
				if (Double.isNaN(real) || Double.isInfinite(real))
					json.writeString(Double.toString(real));
				else
					json.writeNumber(real);
			}
		}
		void tagged(String type, String field, String value) throws IOException {
			json.writeStartObject();
			json.writeStringField("$type", type);
			json.writeStringField(field, value);
			json.writeEndObject();
		}
		void container(Object value) throws IOException {
			int existing = path.getInt(value);
			if (existing >= 0) {
				json.writeStartObject();
				json.writeStringField("$type", "Circular");
				json.writeNumberField("ref", existing);
				json.writeEndObject();
				return;
			}
			List<Object> keys = null;
			List<Object> values;
			boolean plain = false;
			try {
				if (value instanceof Map) {
					Map<?, ?> map = (Map<?, ?>)value;
					keys = new ArrayList<>();
					values = new ArrayList<>();
					plain = plain(map);
					if (plain) {
						List<String> sorted = new ArrayList<>();
						for (Object key : map.keySet())
							sorted.add((String)key);
						Collections.sort(sorted);
						for (String key : sorted) {
							keys.add(key);
							values.add(map.get(key));
						}
					} else {
						for (Map.Entry<?, ?> entry : map.entrySet()) {
							keys.add(entry.getKey());
							values.add(entry.getValue());
						}
					}
				} else if (value instanceof Object[])
					values = new ArrayList<>(Arrays.asList((Object[])value));
				else
					values = new ArrayList<>((Collection<?>)value);
			} catch (RuntimeException ex) {
				/*
				 * Typically concurrent modification or a broken collection implementation.
				 * The sentinel is not a container, so it doesn't consume an ID.
				 */
				logger.debug("Cannot encode {} instance.", value.getClass().getName(), ex);
				json.writeString(UNSERIALIZABLE);
				return;
			}
			path.put(value, next++);
			if (value instanceof Map && plain) {
				json.writeStartObject();
				steps.push(() -> {
					json.writeEndObject();
					path.removeInt(value);
				});
				for (int i = values.size() - 1; i >= 0; --i) {
					String key = (String)keys.get(i);
					Object child = values.get(i);
					steps.push(() -> {
						json.writeFieldName(key.startsWith("$") ? "$" + key : key);
						value(child);
					});
				}
			} else if (value instanceof Map) {
				json.writeStartObject();
				json.writeStringField("$type", "Map");
				json.writeArrayFieldStart("entries");
				steps.push(() -> {
					json.writeEndArray();
					json.writeEndObject();
					path.removeInt(value);
				});
				for (int i = values.size() - 1; i >= 0; --i) {
					Object key = keys.get(i);
					Object child = values.get(i);
					steps.push(() -> {
						json.writeStartArray();
						steps.push(json::writeEndArray);
						steps.push(() -> value(child));
						steps.push(() -> value(key));
					});
				}
			} else {
				boolean set = value instanceof Set;
				if (set) {
					json.writeStartObject();
					json.writeStringField("$type", "Set");
					json.writeArrayFieldStart("values");
				} else
					json.writeStartArray();
				steps.push(() -> {
					json.writeEndArray();
					if (set)
						json.writeEndObject();
					path.removeInt(value);
				});
				for (int i = values.size() - 1; i >= 0; --i) {
					Object child = values.get(i);
					steps.push(() -> value(child));
				}
			}
		}
	}
	static boolean isFunction(Object value) {
		return value instanceof ThemeFunction
			|| value instanceof Runnable
			|| value instanceof Callable
			|| value instanceof Function
			|| value instanceof BiFunction
			|| value instanceof Supplier
			|| value instanceof Consumer
			|| value instanceof BiConsumer
			|| value instanceof Predicate;
	}
	/*
	 * Lambdas and anonymous classes have no meaningful name. Their generated class names are not stable anyway.
	 */
	private static String functionName(Object function) {
		Class<?> type = function.getClass();
		if (type.isSynthetic() || type.getName().contains("$$Lambda"))
			return "";
		return type.getSimpleName();
	}
	static boolean plain(Map<?, ?> map) {
		for (Object key : map.keySet())
			if (!(key instanceof String))
				return false;
		return true;
	}
	/*
	 * Decoding is lenient. Unknown or malformed tags are restored as plain objects
	 * and text that isn't JSON at all is returned as is. Parser limits nesting depth,
	 * so signatures of very deep graphs are returned as text too.
	 */
	public Object decode(Signature signature) {
		Objects.requireNonNull(signature);
		JsonNode tree;
		try {
			tree = mapper.readTree(signature.text());
		} catch (JsonProcessingException ex) {
			logger.debug("Signature is not canonical JSON, returning it verbatim.", ex);
			return signature.text();
		}
		return restore(tree, new ArrayList<>());
	}
	private Object restore(JsonNode node, List<Object> containers) {
		if (node == null || node.isNull() || node.isMissingNode())
			return null;
		if (node.isTextual())
			return node.textValue();
		if (node.isBoolean())
			return node.booleanValue();
		if (node.isNumber())
			return node.numberValue();
		if (node.isArray()) {
			List<Object> list = new ArrayList<>();
			containers.add(list);
			for (JsonNode item : node)
				list.add(restore(item, containers));
			return list;
		}
		JsonNode type = node.get("$type");
		if (type != null && type.isTextual()) {
			Object special = special(type.textValue(), node, containers);
			if (special != null)
				return special;
		}
		Map<String, Object> map = new LinkedHashMap<>();
		containers.add(map);
		Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
		while (fields.hasNext()) {
			Map.Entry<String, JsonNode> field = fields.next();
			String key = field.getKey();
			map.put(key.startsWith("$$") ? key.substring(1) : key, restore(field.getValue(), containers));
		}
		return map;
	}
	private Object special(String type, JsonNode node, List<Object> containers) {
		switch (type) {
		case "Function":
			return new FunctionPlaceholder(node.path("name").asText(""), node.path("id").asInt(-1));
		case "Symbol":
			return new Symbol(node.path("key").asText(""));
		case "BigInt":
			try {
				return new BigInteger(node.path("value").asText());
			} catch (NumberFormatException ex) {
				return null;
			}
		case "Date":
			try {
				return Instant.parse(node.path("value").asText());
			} catch (DateTimeParseException ex) {
				return null;
			}
		case "RegExp":
			try {
				return Pattern.compile(node.path("source").asText(""), node.path("flags").asInt(0));
			} catch (IllegalArgumentException ex) {
				return null;
			}
		case "Map": {
			JsonNode entries = node.get("entries");
			if (entries == null || !entries.isArray())
				return null;
			Map<Object, Object> map = new LinkedHashMap<>();
			containers.add(map);
			for (JsonNode entry : entries)
				map.put(restore(entry.get(0), containers), restore(entry.get(1), containers));
			return map;
		}
		case "Set": {
			JsonNode values = node.get("values");
			if (values == null || !values.isArray())
				return null;
			Set<Object> set = new LinkedHashSet<>();
			containers.add(set);
			for (JsonNode item : values)
				set.add(restore(item, containers));
			return set;
		}
		case "Circular": {
			int ref = node.path("ref").asInt(-1);
			if (ref < 0 || ref >= containers.size())
				return null;
			return containers.get(ref);
		}
		default:
			return null;
		}
	}
	@Override
	public String toString() {
		return "CanonicalEncoder: " + functionIds.size() + " functions";
	}
}
