// Part of Rendercache
package com.machinezoo.rendercache.encoding;

import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import java.math.*;
import java.time.*;
import java.util.*;
import java.util.regex.*;
import org.junit.jupiter.api.*;

public class CanonicalEncoderTest {
	CanonicalEncoder encoder = new CanonicalEncoder();
	@Test
	public void sortedKeys() {
		Map<String, Object> forward = new LinkedHashMap<>();
		forward.put("a", 1);
		forward.put("b", Map.of("y", true, "x", "text"));
		Map<String, Object> backward = new LinkedHashMap<>();
		backward.put("b", Map.of("x", "text", "y", true));
		backward.put("a", 1);
		assertEquals(encoder.encode(forward), encoder.encode(backward));
		assertEquals("{\"a\":1,\"b\":{\"x\":\"text\",\"y\":true}}", encoder.encode(forward).text());
		// Arrays keep their order.
		assertNotEquals(encoder.encode(List.of(1, 2)), encoder.encode(List.of(2, 1)));
		assertEquals(encoder.encode(List.of(1, 2)), encoder.encode(new Object[] { 1, 2 }));
	}
	@Test
	public void selfReference() {
		Map<String, Object> a = new HashMap<>();
		a.put("self", a);
		Signature signature = encoder.encode(a);
		assertEquals("{\"self\":{\"$type\":\"Circular\",\"ref\":0}}", signature.text());
		@SuppressWarnings("unchecked") Map<String, Object> decoded = (Map<String, Object>)encoder.decode(signature);
		assertSame(decoded, decoded.get("self"));
	}
	@Test
	public void nestedCycle() {
		Map<String, Object> parent = new HashMap<>();
		List<Object> children = new ArrayList<>();
		Map<String, Object> child = new HashMap<>();
		parent.put("children", children);
		children.add(child);
		child.put("parent", parent);
		Signature signature = encoder.encode(parent);
		assertEquals("{\"children\":[{\"parent\":{\"$type\":\"Circular\",\"ref\":0}}]}", signature.text());
		@SuppressWarnings("unchecked") Map<String, Object> decoded = (Map<String, Object>)encoder.decode(signature);
		List<?> restored = (List<?>)decoded.get("children");
		assertSame(decoded, ((Map<?, ?>)restored.get(0)).get("parent"));
	}
	@Test
	public void sharedSubgraph() {
		Map<String, Object> shared = Map.of("x", 1);
		Map<String, Object> graph = new LinkedHashMap<>();
		graph.put("left", shared);
		graph.put("right", shared);
		// Shared subgraph is not a cycle. It is encoded in full at every occurrence.
		String text = encoder.encode(graph).text();
		assertEquals("{\"left\":{\"x\":1},\"right\":{\"x\":1}}", text);
	}
	@Test
	public void functions() {
		Runnable first = () -> {
		};
		Runnable second = () -> {
		};
		assertEquals(encoder.encode(Map.of("f", first)), encoder.encode(Map.of("f", first)));
		assertNotEquals(encoder.encode(Map.of("f", first)), encoder.encode(Map.of("f", second)));
		Object decoded = ((Map<?, ?>)encoder.decode(encoder.encode(Map.of("f", first)))).get("f");
		FunctionPlaceholder placeholder = assertInstanceOf(FunctionPlaceholder.class, decoded);
		IllegalStateException ex = assertThrows(IllegalStateException.class, placeholder::run);
		assertThat(ex.getMessage(), containsString("anonymous"));
	}
	@Test
	public void specialLeaves() {
		Symbol symbol = new Symbol("token");
		assertEquals("{\"$type\":\"Symbol\",\"key\":\"token\"}", encoder.encode(symbol).text());
		assertEquals("{\"$type\":\"Symbol\",\"key\":\"State.NEW\"}", encoder.encode(Thread.State.NEW).text());
		assertEquals("{\"$type\":\"BigInt\",\"value\":\"123456789012345678901234567890\"}", encoder.encode(new BigInteger("123456789012345678901234567890")).text());
		Instant instant = Instant.parse("2024-01-02T03:04:05Z");
		assertEquals("{\"$type\":\"Date\",\"value\":\"2024-01-02T03:04:05Z\"}", encoder.encode(instant).text());
		assertEquals(encoder.encode(instant), encoder.encode(Date.from(instant)));
		Map<String, Object> graph = new LinkedHashMap<>();
		graph.put("symbol", symbol);
		graph.put("big", BigInteger.TEN);
		graph.put("date", instant);
		graph.put("regex", Pattern.compile("a+b", Pattern.CASE_INSENSITIVE));
		Map<?, ?> decoded = (Map<?, ?>)encoder.decode(encoder.encode(graph));
		assertEquals("token", ((Symbol)decoded.get("symbol")).description());
		assertEquals(BigInteger.TEN, decoded.get("big"));
		assertEquals(instant, decoded.get("date"));
		Pattern regex = (Pattern)decoded.get("regex");
		assertEquals("a+b", regex.pattern());
		assertEquals(Pattern.CASE_INSENSITIVE, regex.flags());
	}
	@Test
	public void mapsAndSets() {
		Map<Object, Object> map = new LinkedHashMap<>();
		map.put(1, "one");
		map.put("two", 2);
		assertEquals("{\"$type\":\"Map\",\"entries\":[[1,\"one\"],[\"two\",2]]}", encoder.encode(map).text());
		Set<String> set = new LinkedHashSet<>(List.of("x", "y"));
		assertEquals("{\"$type\":\"Set\",\"values\":[\"x\",\"y\"]}", encoder.encode(set).text());
		Map<?, ?> decodedMap = (Map<?, ?>)encoder.decode(encoder.encode(map));
		assertEquals("one", decodedMap.get(1));
		assertEquals(2, decodedMap.get("two"));
		assertEquals(set, encoder.decode(encoder.encode(set)));
	}
	@Test
	public void numbers() {
		assertEquals("[1,2.5,\"NaN\",\"Infinity\"]", encoder.encode(List.of(1L, 2.5, Double.NaN, Double.POSITIVE_INFINITY)).text());
		assertEquals(encoder.encode(1), encoder.encode(1L));
	}
	@Test
	public void unserializable() {
		Object broken = new Object() {
			@Override
			public String toString() {
				throw new UnsupportedOperationException();
			}
		};
		assertEquals("{\"x\":\"" + CanonicalEncoder.UNSERIALIZABLE + "\"}", encoder.encode(Map.of("x", broken)).text());
		List<Object> failing = new AbstractList<>() {
			@Override
			public Object get(int index) {
				throw new IllegalStateException();
			}
			@Override
			public int size() {
				return 1;
			}
		};
		Map<String, Object> self = new HashMap<>();
		self.put("self", self);
		List<Object> graph = List.of(failing, self);
		// Failed container doesn't consume an ID, so the circular reference in the next sibling points to the right container.
		assertEquals("[\"<unserializable>\",{\"self\":{\"$type\":\"Circular\",\"ref\":1}}]", encoder.encode(graph).text());
		// Unencodable objects fall back to toString().
		assertEquals("\"custom\"", encoder.encode(new Object() {
			@Override
			public String toString() {
				return "custom";
			}
		}).text());
	}
	@Test
	public void dollarKeys() {
		Map<String, Object> tagLike = new LinkedHashMap<>();
		tagLike.put("$type", "Symbol");
		tagLike.put("$$x", 1);
		Map<String, Object> self = new HashMap<>();
		self.put("self", self);
		List<Object> graph = List.of(tagLike, self);
		Signature signature = encoder.encode(graph);
		assertEquals("[{\"$$$x\":1,\"$$type\":\"Symbol\"},{\"self\":{\"$type\":\"Circular\",\"ref\":2}}]", signature.text());
		// User data that looks like a tag is restored as data and circular references still point to the right container.
		List<?> decoded = (List<?>)encoder.decode(signature);
		assertEquals(tagLike, decoded.get(0));
		Map<?, ?> restored = (Map<?, ?>)decoded.get(1);
		assertSame(restored, restored.get("self"));
	}
	@Test
	public void deep() {
		Map<String, Object> root = new HashMap<>();
		Map<String, Object> current = root;
		for (int i = 0; i < 100_000; ++i) {
			Map<String, Object> child = new HashMap<>();
			current.put("child", List.of(i, child));
			current = child;
		}
		current.put("root", root);
		Signature signature = encoder.encode(root);
		assertThat(signature.text(), startsWith("{\"child\":[0,{\"child\":[1,"));
		assertThat(signature.text(), endsWith("{\"root\":{\"$type\":\"Circular\",\"ref\":0}}" + "]}".repeat(100_000)));
		assertEquals(signature, encoder.encode(root));
		// Parser limits nesting, so decoding falls back to returning the text.
		assertEquals(signature.text(), encoder.decode(signature));
	}
	@Test
	public void lenientDecoding() {
		assertEquals("not json {", encoder.decode(new Signature("not json {")));
		Map<?, ?> unknown = (Map<?, ?>)encoder.decode(new Signature("{\"$type\":\"Weird\",\"x\":1}"));
		assertEquals("Weird", unknown.get("$type"));
		assertEquals(1, unknown.get("x"));
		// Malformed tags are restored as plain objects too.
		Map<?, ?> malformed = (Map<?, ?>)encoder.decode(new Signature("{\"$type\":\"BigInt\",\"value\":\"abc\"}"));
		assertEquals("abc", malformed.get("value"));
	}
	@Test
	public void digest() {
		Signature signature = encoder.encode(Map.of("a", 1));
		assertEquals(signature.digest(), encoder.encode(Map.of("a", 1)).digest());
		assertNotEquals(signature.digest(), encoder.encode(Map.of("a", 2)).digest());
		// SHA-256 in BASE64 without padding.
		assertEquals(43, signature.digest().length());
	}
}
