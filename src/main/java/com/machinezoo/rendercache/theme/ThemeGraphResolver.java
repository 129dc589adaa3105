// Part of Rendercache
package com.machinezoo.rendercache.theme;

import java.util.*;
import java.util.regex.*;
import org.slf4j.*;
import com.google.common.base.Splitter;
import com.machinezoo.rendercache.*;
import com.machinezoo.rendercache.encoding.*;
import io.micrometer.core.instrument.*;
import it.unimi.dsi.fastutil.objects.*;

/*
 * Host frameworks skip rendering of subtrees whose props are reference-equal to the previous render.
 * Resolution must therefore return the very same reference for every subgraph that contains no theme placeholders.
 * New containers are allocated only along paths leading to changed leaves.
 *
 * Property graphs can be arbitrarily deep (generated layouts, long chains of nested styles).
 * Traversal uses explicit stack of frames instead of recursion, so depth is limited by heap, not by thread stack.
 * Every frame is visited twice. The first visit queues children. The second visit assembles the container from resolved children.
 *
 * Cycles are detected with a set of containers on the current descent path. Containers leave the set when completed,
 * so the same container can appear in unrelated branches. Resolved containers are memoized by reference,
 * which makes shared subgraphs resolve to one shared result and keeps the whole resolution linear.
 *
 * Invalid theme paths are handled leniently in all code paths: the placeholder is left in the string verbatim.
 */
/**
 * Rewrites {@code theme.a.b} placeholders in property graphs using {@link Theme} dictionary.
 * Unchanged subgraphs keep their identity.
 */
public class ThemeGraphResolver {
	private static final Logger logger = LoggerFactory.getLogger(ThemeGraphResolver.class);
	private static final Counter hits = Metrics.counter("rendercache.resolution.hits");
	private static final Counter misses = Metrics.counter("rendercache.resolution.misses");
	static final String PREFIX = "theme.";
	private static final Pattern PLACEHOLDER = Pattern.compile("theme\\.([a-zA-Z0-9_.-]+)");
	private static final Splitter PATH = Splitter.on('.');
	/*
	 * Stored in resolution cache when resolution doesn't change the graph.
	 * Equal signature implies that any other graph with the same content resolves to itself too,
	 * so we can return the caller's graph instead of the graph that was resolved first.
	 */
	private static final Object UNCHANGED = new Object();
	/*
	 * Changed results contain unchanged subgraphs of the graph they were resolved from.
	 * Handing them to a caller with merely equal graph would break reference identity of that caller's subgraphs,
	 * so they are reused only when the very same graph instance is resolved again.
	 */
	private record Resolved(Object graph, Object result) {
	}
	private final CanonicalEncoder encoder;
	private final ResolutionCache<String, Object> resolutions;
	private final ResolutionCache<String, Object> paths;
	private final boolean caching;
	public ThemeGraphResolver(CanonicalEncoder encoder, ResolutionCache<String, Object> resolutions, ResolutionCache<String, Object> paths, boolean caching) {
		Objects.requireNonNull(encoder);
		Objects.requireNonNull(resolutions);
		Objects.requireNonNull(paths);
		this.encoder = encoder;
		this.resolutions = resolutions;
		this.paths = paths;
		this.caching = caching;
	}
	/*
	 * Resolution caching pays off only where the same graphs are resolved repeatedly, typically in server-side rendering.
	 * It is therefore off by default.
	 */
	public ThemeGraphResolver() {
		this(new CanonicalEncoder(), new ResolutionCache<>(500, 50), new ResolutionCache<>(500, 50), false);
	}
	public Map<String, Object> resolve(Map<String, Object> props, Theme theme) {
		return resolve(props, theme, false);
	}
	/*
	 * Rekeyed maps still have string keys, because placeholders in string keys resolve to strings.
	 */
	@SuppressWarnings("unchecked")
	public Map<String, Object> resolve(Map<String, Object> props, Theme theme, boolean processFunctions) {
		return (Map<String, Object>)resolve((Object)props, theme, processFunctions);
	}
	public Object resolve(Object graph, Theme theme) {
		return resolve(graph, theme, false);
	}
	/**
	 * Resolves placeholders in the graph. Changed containers are returned as unmodifiable maps and lists
	 * regardless of the type of the input container.
	 */
	public Object resolve(Object graph, Theme theme, boolean processFunctions) {
		if (graph == null || theme == null || theme.empty())
			return graph;
		if (graph instanceof Map) {
			if (((Map<?, ?>)graph).isEmpty())
				return graph;
		} else if (graph instanceof List) {
			if (((List<?>)graph).isEmpty())
				return graph;
		} else
			return graph;
		Resolution resolution = new Resolution(theme, processFunctions);
		String key = null;
		if (caching) {
			key = resolution.key(graph);
			Object cached = resolutions.get(key);
			if (cached == UNCHANGED) {
				hits.increment();
				return graph;
			}
			if (cached != null && ((Resolved)cached).graph() == graph) {
				hits.increment();
				return ((Resolved)cached).result();
			}
			misses.increment();
		}
		Object result = resolution.run(graph);
		if (key != null)
			resolutions.set(key, result == graph ? UNCHANGED : new Resolved(graph, result));
		return result;
	}
	public void clear() {
		resolutions.clear();
		paths.clear();
	}
	private static class Frame {
		final Object value;
		boolean queued;
		Frame(Object value) {
			this.value = value;
		}
	}
	private static boolean container(Object value) {
		return value instanceof Map || value instanceof List;
	}
	/*
	 * State of one resolve() call.
	 */
	private class Resolution {
		final Theme theme;
		final boolean processFunctions;
		final Reference2ObjectOpenHashMap<Object, Object> resolved = new Reference2ObjectOpenHashMap<>();
		final ReferenceOpenHashSet<Object> path = new ReferenceOpenHashSet<>();
		String dictionary;
		Resolution(Theme theme, boolean processFunctions) {
			this.theme = theme;
			this.processFunctions = processFunctions;
		}
		/*
		 * Signature of the dictionary is computed at most once per call, because it may be needed for every placeholder.
		 */
		String dictionary() {
			if (dictionary == null)
				dictionary = encoder.encode(theme.system()).digest();
			return dictionary;
		}
		/*
		 * Mode must be part of the key. Light and dark themes often share dictionary objects.
		 * Function processing changes the result, so it is part of the key too.
		 */
		String key(Object graph) {
			return encoder.encode(graph).digest() + "_" + theme.mode() + "_" + dictionary() + (processFunctions ? "_f" : "");
		}
		Object run(Object root) {
			Deque<Frame> stack = new ArrayDeque<>();
			stack.push(new Frame(root));
			while (!stack.isEmpty()) {
				Frame frame = stack.peek();
				Object current = frame.value;
				if (resolved.containsKey(current)) {
					stack.pop();
					continue;
				}
				if (!frame.queued) {
					frame.queued = true;
					path.add(current);
					List<Object> children = new ArrayList<>(current instanceof Map ? ((Map<?, ?>)current).values() : (List<?>)current);
					for (int i = children.size() - 1; i >= 0; --i) {
						Object child = children.get(i);
						if (container(child) && !path.contains(child))
							stack.push(new Frame(child));
					}
				} else {
					stack.pop();
					path.remove(current);
					resolved.put(current, current instanceof Map ? complete((Map<?, ?>)current) : complete((List<?>)current));
				}
			}
			Object result = resolved.get(root);
			return result != null ? result : root;
		}
		Object child(Object value) {
			if (container(value)) {
				Object result = resolved.get(value);
				return result != null ? result : value;
			}
			return leaf(value);
		}
		Object complete(Map<?, ?> map) {
			Map<Object, Object> copy = null;
			int index = 0;
			for (Map.Entry<?, ?> entry : map.entrySet()) {
				Object key = entry.getKey();
				Object value = entry.getValue();
				Object rekeyed = key instanceof String && ((String)key).contains(PREFIX) ? string((String)key) : key;
				Object replaced = child(value);
				if (copy == null && (rekeyed != key || replaced != value)) {
					copy = new LinkedHashMap<>();
					int remaining = index;
					for (Map.Entry<?, ?> unchanged : map.entrySet()) {
						if (remaining-- == 0)
							break;
						copy.put(unchanged.getKey(), unchanged.getValue());
					}
				}
				if (copy != null)
					copy.put(rekeyed, replaced);
				++index;
			}
			return copy != null ? Collections.unmodifiableMap(copy) : map;
		}
		Object complete(List<?> list) {
			List<Object> copy = null;
			for (int i = 0; i < list.size(); ++i) {
				Object item = list.get(i);
				Object replaced = child(item);
				if (replaced != item) {
					if (copy == null)
						copy = new ArrayList<>(list);
					copy.set(i, replaced);
				}
			}
			return copy != null ? Collections.unmodifiableList(copy) : list;
		}
		Object leaf(Object value) {
			if (processFunctions && value instanceof ThemeFunction) {
				Object result;
				try {
					result = ((ThemeFunction)value).apply(theme);
				} catch (RuntimeException ex) {
					logger.warn("Theme function {} failed. Leaving it unresolved.", value, ex);
					return value;
				}
				return placeholders(result);
			}
			return placeholders(value);
		}
		Object placeholders(Object value) {
			if (value instanceof String && ((String)value).contains(PREFIX))
				return string((String)value);
			return value;
		}
		/*
		 * Returns the original string instance when no placeholder was resolved.
		 */
		String string(String text) {
			Matcher matcher = PLACEHOLDER.matcher(text);
			StringBuilder builder = new StringBuilder();
			boolean changed = false;
			while (matcher.find()) {
				String replacement = replacement(matcher.group(1));
				if (replacement != null)
					changed = true;
				matcher.appendReplacement(builder, Matcher.quoteReplacement(replacement != null ? replacement : matcher.group()));
			}
			if (!changed)
				return text;
			matcher.appendTail(builder);
			return builder.toString();
		}
		String replacement(String placeholder) {
			Object value = lookup(placeholder);
			if (value == null)
				return null;
			if (value instanceof Map) {
				Object fallback = ((Map<?, ?>)value).get("default");
				if (fallback != null && !container(fallback))
					return String.valueOf(fallback);
				logger.debug("Theme path {} leads to a dictionary without scalar default. Leaving it unresolved.", placeholder);
				return null;
			}
			if (value instanceof Collection || value instanceof Object[]) {
				logger.debug("Theme path {} leads to a collection. Leaving it unresolved.", placeholder);
				return null;
			}
			return String.valueOf(value);
		}
		Object lookup(String placeholder) {
			String key = dictionary() + "_" + placeholder;
			Object cached = paths.get(key);
			if (cached != null)
				return cached;
			Object current = theme.system();
			for (String part : PATH.split(placeholder)) {
				if (!(current instanceof Map))
					return null;
				current = ((Map<?, ?>)current).get(part);
				if (current == null)
					return null;
			}
			paths.set(key, current);
			return current;
		}
	}
	@Override
	public String toString() {
		return getClass().getSimpleName() + ": " + resolutions + ", paths " + paths;
	}
}
