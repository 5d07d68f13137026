package org.springaicommunity.github.mcp;

import org.jspecify.annotations.Nullable;

/**
 * Allowed range and requested value for one caller-supplied bound (a page size, a list cap
 * or a character budget).
 *
 * @param minLimit smallest accepted value
 * @param maxLimit largest accepted value, not less than {@code minLimit}
 * @param requestedLimit the value the caller asked for
 */
public record ShapingLimits(int minLimit, int maxLimit, int requestedLimit) {

	public ShapingLimits {
		if (minLimit > maxLimit) {
			throw new IllegalArgumentException("minLimit " + minLimit + " exceeds maxLimit " + maxLimit);
		}
	}

	/**
	 * @param requested value from the caller, or {@code null} to use {@code defaultLimit}
	 */
	public static ShapingLimits of(int minLimit, int maxLimit, int defaultLimit, @Nullable Integer requested) {
		return new ShapingLimits(minLimit, maxLimit, requested != null ? requested : defaultLimit);
	}

	/**
	 * The requested value clamped into range.
	 */
	public int effective() {
		return ResponseShaping.clamp(requestedLimit, minLimit, maxLimit);
	}

}
