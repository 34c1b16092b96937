package com.tyron.ledgercst.core.fields;

import java.util.List;

/**
 * Index arithmetic for sequences that accept negative indices.
 */
final class Indexes {

    private Indexes() {
    }

    /**
     * Resolves a possibly negative index against {@code size}.
     *
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    static int element(int index, int size) {
        int resolved = index < 0 ? index + size : index;
        if (resolved < 0 || resolved >= size) {
            throw new IndexOutOfBoundsException("index " + index + " is out of range for size=" + size);
        }
        return resolved;
    }

    /**
     * Resolves an insertion point, clamping it into {@code [0, size]}.
     */
    static int insertion(int index, int size) {
        int resolved = index < 0 ? index + size : index;
        return Math.max(0, Math.min(resolved, size));
    }

    static int identityIndexOf(List<?> list, Object element) {
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i) == element) {
                return i;
            }
        }
        return -1;
    }
}
