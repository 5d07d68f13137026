package org.springaicommunity.github.mcp;

import java.util.List;

/**
 * Bounding rules applied to every tool result so that no field grows without limit.
 *
 * <p>
 * Lists are capped and report how many items were dropped; free text is cut at a
 * character budget and flagged. Callers use the reported counts to narrow follow-up
 * requests.
 */
public final class ResponseShaping {

	/**
	 * Appended to text that was cut at its character budget.
	 */
	public static final String TRUNCATION_MARKER = "\n...TRUNCATED...";

	private ResponseShaping() {
	}

	/**
	 * Clamp {@code value} into {@code [low, high]}. Requires {@code low <= high}.
	 */
	public static int clamp(int value, int low, int high) {
		return Math.max(low, Math.min(high, value));
	}

	/**
	 * Cut {@code text} to at most {@code maxChars} code points.
	 * @param text decoded text
	 * @param maxChars character budget; negative budgets are treated as zero
	 * @return the text unchanged, or its prefix followed by {@link #TRUNCATION_MARKER}
	 */
	public static TruncatedText truncateText(String text, int maxChars) {
		int budget = Math.max(0, maxChars);
		if (text.codePointCount(0, text.length()) <= budget) {
			return new TruncatedText(text, false);
		}
		int end = text.offsetByCodePoints(0, budget);
		return new TruncatedText(text.substring(0, end) + TRUNCATION_MARKER, true);
	}

	/**
	 * Keep the first {@code maxCount} items in their original order.
	 * @param items source list
	 * @param maxCount maximum number of items to keep; negative counts keep nothing
	 * @return the retained items and how many were dropped
	 */
	public static <T> CappedList<T> capList(List<T> items, int maxCount) {
		int kept = Math.min(items.size(), Math.max(0, maxCount));
		return new CappedList<>(List.copyOf(items.subList(0, kept)), items.size() - kept);
	}

	/**
	 * Text after applying a character budget.
	 *
	 * @param text the possibly shortened text
	 * @param truncated whether anything was removed
	 */
	public record TruncatedText(String text, boolean truncated) {

	}

	/**
	 * List after applying a count cap.
	 *
	 * @param items the retained items, in input order
	 * @param dropped number of items removed, never negative
	 */
	public record CappedList<T>(List<T> items, int dropped) {

		public boolean truncated() {
			return dropped > 0;
		}

	}

}
