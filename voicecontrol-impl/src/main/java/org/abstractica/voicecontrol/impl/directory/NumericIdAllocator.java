package org.abstractica.voicecontrol.impl.directory;

import org.abstractica.voicecontrol.DirectoryFullException;

import java.util.function.IntPredicate;

/**
 * Hands out numeric IDs by scanning forward from a cursor.
 *
 * <p>IDs run from {@code min} to {@code max} and wrap back to {@code min};
 * values below {@code min} are never produced. Not thread-safe: callers
 * serialize access.</p>
 */
final class NumericIdAllocator
{
    private final int min;
    private final int max;
    private int next;

    NumericIdAllocator(int min, int max)
    {
        if (min < 1 || max < min)
        {
            throw new IllegalArgumentException("Invalid ID range: " + min + "-" + max);
        }
        this.min = min;
        this.max = max;
        this.next = min;
    }

    /**
     * Allocates the first ID at or after the cursor that is not in use.
     *
     * @param inUse tells whether an ID is taken
     * @return the allocated ID
     * @throws DirectoryFullException if a whole cycle finds no free ID
     */
    int allocate(IntPredicate inUse)
    {
        int start = next;
        while (inUse.test(next))
        {
            advance();
            if (next == start)
            {
                throw new DirectoryFullException(capacity());
            }
        }

        int allocated = next;
        advance();
        return allocated;
    }

    /**
     * Returns the ID the next scan starts from.
     */
    int peekNext()
    {
        return next;
    }

    /**
     * Moves the cursor.
     *
     * @param id the ID the next scan starts from
     */
    void reposition(int id)
    {
        if (id < min || id > max)
        {
            throw new IllegalArgumentException("ID out of range " + min + "-" + max + ": " + id);
        }
        this.next = id;
    }

    int capacity()
    {
        return max - min + 1;
    }

    private void advance()
    {
        next = next == max ? min : next + 1;
    }
}
