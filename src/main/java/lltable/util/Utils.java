package lltable.util;

import java.util.Collection;

/**
 * Class with utility methods...
 */
public class Utils {

	private static final char CONTROL_LIMIT = ' ';
	private static final char PRINTABLE_LIMIT = '~';

	/**
	 * Return an escaped and quoted version of the passed string.
	 *
	 * @param source passed string
	 * @return escaped version
	 */
	public static String toPrintableRepresentation(String source) {
		StringBuilder builder = new StringBuilder("\"");
		for (char ch : source.toCharArray()){
			switch (ch) {
				case '\0': builder.append("\\0"); break;
				case '\t': builder.append("\\t"); break;
				case '\n': builder.append("\\n"); break;
				case '\r': builder.append("\\r"); break;
				case '"': builder.append("\\\""); break;
				case '\\': builder.append("\\\\"); break;
				default:
					if (CONTROL_LIMIT <= ch && ch <= PRINTABLE_LIMIT){
						builder.append(ch);
					} else {
						builder.append(String.format("\\u%04x", (int) ch));
					}
			}
		}
		return builder.append('"').toString();
	}

	/**
	 * Joins the string representations of several objects.
	 *
	 * @param objs passed objects
	 * @param separator separator between those representations
	 * @param <T> type of the passed objects
	 * @return joined string
	 */
	public static <T> String join(Collection<T> objs, String separator){
		StringBuilder builder = new StringBuilder();
		boolean first = true;
		for (T obj : objs){
			if (!first){
				builder.append(separator);
			}
			first = false;
			builder.append(obj);
		}
		return builder.toString();
	}
}
