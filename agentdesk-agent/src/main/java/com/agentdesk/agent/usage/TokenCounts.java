package com.agentdesk.agent.usage;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Four non-negative token counters: input, output, cache creation and cache read.
 * <p>
 * Instances are mutable so that running totals can accumulate in place; use
 * {@link #add(TokenCounts, TokenCounts)} for a side-effect-free sum and
 * {@link #copy()} before handing a running total to observers.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class TokenCounts {

    private long input;
    private long output;
    private long cacheCreation;
    private long cacheRead;

    public TokenCounts() {
    }

    public TokenCounts(long input, long output, long cacheCreation, long cacheRead) {
        this.input = requireNonNegative(input, "input");
        this.output = requireNonNegative(output, "output");
        this.cacheCreation = requireNonNegative(cacheCreation, "cacheCreation");
        this.cacheRead = requireNonNegative(cacheRead, "cacheRead");
    }

    public static TokenCounts zero() {
        return new TokenCounts();
    }

    public static TokenCounts ofOutput(long output) {
        return new TokenCounts(0, output, 0, 0);
    }

    /**
     * Pointwise sum. Neither argument is modified; null counts as zero.
     */
    public static TokenCounts add(TokenCounts a, TokenCounts b) {
        TokenCounts sum = a != null ? a.copy() : zero();
        return sum.accumulate(b);
    }

    /**
     * Add {@code other} into this instance.
     *
     * @return this, for chaining
     */
    public TokenCounts accumulate(TokenCounts other) {
        if (other == null) {
            return this;
        }
        input = Math.addExact(input, other.input);
        output = Math.addExact(output, other.output);
        cacheCreation = Math.addExact(cacheCreation, other.cacheCreation);
        cacheRead = Math.addExact(cacheRead, other.cacheRead);
        return this;
    }

    public void reset() {
        input = 0;
        output = 0;
        cacheCreation = 0;
        cacheRead = 0;
    }

    public TokenCounts copy() {
        return new TokenCounts(input, output, cacheCreation, cacheRead);
    }

    public boolean isEmpty() {
        return input == 0 && output == 0 && cacheCreation == 0 && cacheRead == 0;
    }

    /** Prompt-side total: input plus both cache counters. */
    public long promptTokens() {
        return input + cacheCreation + cacheRead;
    }

    private static long requireNonNegative(long value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must be non-negative: " + value);
        }
        return value;
    }
}
