package com.tyron.ledgercst.core.fields;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Slice over a sequence with optional start, stop and step. Negative bounds count from
 * the end; a negative step walks backwards.
 */
public record Slice(@Nullable Integer start, @Nullable Integer stop, @Nullable Integer step) {

    public Slice {
        if (step != null && step == 0) {
            throw new IllegalArgumentException("slice step cannot be zero");
        }
    }

    public static @NotNull Slice of(@Nullable Integer start, @Nullable Integer stop) {
        return new Slice(start, stop, null);
    }

    public static @NotNull Slice all() {
        return new Slice(null, null, null);
    }

    /**
     * Bounds clamped to a sequence of {@code length}.
     */
    public record Bounds(int start, int stop, int step) {
    }

    public @NotNull Bounds resolve(int length) {
        int s = step == null ? 1 : step;
        int lower = s > 0 ? 0 : -1;
        int upper = s > 0 ? length : length - 1;
        int from = start == null ? (s > 0 ? lower : upper) : clamp(start, length, lower, upper);
        int to = stop == null ? (s > 0 ? upper : lower) : clamp(stop, length, lower, upper);
        return new Bounds(from, to, s);
    }

    /**
     * Indices selected by this slice in a sequence of {@code length}, in slice order.
     */
    public @NotNull List<Integer> indices(int length) {
        Bounds b = resolve(length);
        List<Integer> result = new ArrayList<>();
        if (b.step() > 0) {
            for (int i = b.start(); i < b.stop(); i += b.step()) {
                result.add(i);
            }
        } else {
            for (int i = b.start(); i > b.stop(); i += b.step()) {
                result.add(i);
            }
        }
        return result;
    }

    private static int clamp(int bound, int length, int lower, int upper) {
        if (bound < 0) {
            return Math.max(bound + length, lower);
        }
        return Math.min(bound, upper);
    }
}
