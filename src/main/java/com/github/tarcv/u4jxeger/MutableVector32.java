// New code and changes are © 2024 TarCV
// © 2016 and later: Unicode, Inc. and others.
// License & terms of use: http://www.unicode.org/copyright.html
package com.github.tarcv.u4jxeger;

import java.util.Arrays;

// Growable array of ints without boxing. Backs the columns of SyntaxTree while it is
// being built and the code point buffer of a single generation call.
final class MutableVector32 {
    public MutableVector32() {
        this(-1);
    }

    public MutableVector32(final int initialCapacity) {
        int fixedCapacity = initialCapacity;
        if (fixedCapacity < 1) {
            fixedCapacity = 32;
        }
        buffer = new int[fixedCapacity];
    }
    public int size() { return length; }
    public void addElement(final int e) {
        ensureAppendCapacity();
        buffer[length++] = e;
    }
    public void addElements(final int[] elements, final int from, final int count) {
        ensureCapacity(length + count);
        System.arraycopy(elements, from, buffer, length, count);
        length += count;
    }

    private void ensureAppendCapacity() {
        ensureCapacity(length + 1);
    }

    void ensureCapacity(final int minimumCapacity) {
        if (minimumCapacity < 0) {
            throw new IllegalArgumentException();
        }
        if (buffer.length < minimumCapacity) {
            expandCapacity(minimumCapacity);
        }
    }

    void expandCapacity(final int minimumCapacity) {
        if (buffer.length >= minimumCapacity) {
            return;
        }
        int newCap = buffer.length <= 0xffff ? 4 * buffer.length : 2 * buffer.length;
        if (newCap < minimumCapacity) {
            newCap = minimumCapacity;
        }
        buffer = Arrays.copyOf(buffer, newCap);
    }

    private int[] buffer;
    private int length = 0;

    /**
     * Truncate to newSize elements.  A larger newSize leaves the vector unchanged.
     */
    void truncate(final int newSize) {
        if (newSize >= 0 && newSize < length) {
            length = newSize;
        }
    }

    /**
     * Snapshot of the held elements.  Later changes to the vector are not reflected.
     */
    int[] toArray() {
        return Arrays.copyOf(buffer, length);
    }

    /**
     * The held elements, taken as Unicode code points.
     */
    String toCodePointString() {
        return new String(buffer, 0, length);
    }
}
