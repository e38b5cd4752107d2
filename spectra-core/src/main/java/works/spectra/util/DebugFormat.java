package works.spectra.util;

import java.lang.reflect.Array;
import java.nio.file.Path;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Renders values the way they should appear in a failure diagnostic.
 * <p>
 * This is a debug rendering, not {@link Object#toString}: strings and characters are quoted
 * and escaped so that whitespace and empty values are visible,
 * and arrays, iterables, maps and optionals are rendered structurally,
 * recursing into their elements.
 * Anything else falls back to {@link String#valueOf(Object)}.
 * <p>
 * A {@link Path} is an {@code Iterable} of its own name elements, each of which is
 * again a {@code Path}, so it is rendered with {@code String.valueOf} like a scalar.
 * More generally, an {@code Iterable} element of the same class as its container
 * is not recursed into.
 * <p>
 * A container that contains itself is rendered as {@code [...]} at the point of recursion.
 */
public final class DebugFormat {
	private DebugFormat() {}

	public static String render(@Nullable Object value) {
		StringBuilder sb = new StringBuilder();
		new Renderer(sb).append(value);
		return sb.toString();
	}

	private static final class Renderer {
		final StringBuilder out;
		final Set<Object> inProgress = Collections.newSetFromMap(new IdentityHashMap<>());

		Renderer(StringBuilder out) {
			this.out = out;
		}

		void append(@Nullable Object value) {
			if (value == null) {
				out.append("null");
			} else if (value instanceof CharSequence s) {
				appendQuoted(s, '"');
			} else if (value instanceof Character c) {
				appendQuoted(String.valueOf(c), '\'');
			} else if (value instanceof Optional<?> o) {
				if (o.isPresent()) {
					out.append("Some(");
					append(o.get());
					out.append(')');
				} else {
					out.append("None");
				}
			} else if (value.getClass().isArray()) {
				appendNested(value, () -> {
					out.append('[');
					int length = Array.getLength(value);
					for (int i = 0; i < length; i++) {
						if (i > 0) {
							out.append(", ");
						}
						append(Array.get(value, i));
					}
					out.append(']');
				});
			} else if (value instanceof Path) {
				out.append(value);
			} else if (value instanceof Iterable<?> iterable) {
				appendNested(value, () -> {
					out.append('[');
					Iterator<?> iter = iterable.iterator();
					while (iter.hasNext()) {
						Object element = iter.next();
						if (element != null && element.getClass() == value.getClass()) {
							out.append(element);
						} else {
							append(element);
						}
						if (iter.hasNext()) {
							out.append(", ");
						}
					}
					out.append(']');
				});
			} else if (value instanceof Map<?, ?> map) {
				appendNested(value, () -> {
					out.append('{');
					Iterator<? extends Map.Entry<?, ?>> iter = map.entrySet().iterator();
					while (iter.hasNext()) {
						Map.Entry<?, ?> entry = iter.next();
						append(entry.getKey());
						out.append(": ");
						append(entry.getValue());
						if (iter.hasNext()) {
							out.append(", ");
						}
					}
					out.append('}');
				});
			} else {
				out.append(value);
			}
		}

		private void appendNested(Object container, Runnable body) {
			if (!inProgress.add(container)) {
				out.append("[...]");
				return;
			}
			try {
				body.run();
			} finally {
				inProgress.remove(container);
			}
		}

		private void appendQuoted(CharSequence s, char quote) {
			out.append(quote);
			for (int i = 0; i < s.length(); i++) {
				char c = s.charAt(i);
				switch (c) {
					case '\n' -> out.append("\\n");
					case '\r' -> out.append("\\r");
					case '\t' -> out.append("\\t");
					case '\\' -> out.append("\\\\");
					default -> {
						if (c == quote) {
							out.append('\\').append(c);
						} else if (Character.isHighSurrogate(c) && i + 1 < s.length() && Character.isLowSurrogate(s.charAt(i + 1))) {
							out.append(c).append(s.charAt(++i));
						} else if (needsEscape(c)) {
							out.append(String.format("\\u%04x", (int) c));
						} else {
							out.append(c);
						}
					}
				}
			}
			out.append(quote);
		}

		/**
		 * Paired surrogates are handled by the caller; any surrogate that reaches here is unpaired.
		 */
		private static boolean needsEscape(char c) {
			int type = Character.getType(c);
			return Character.isISOControl(c)
				|| Character.isSurrogate(c)
				|| type == Character.LINE_SEPARATOR
				|| type == Character.PARAGRAPH_SEPARATOR;
		}
	}
}
