package org.abstractica.voicecontrol;

/**
 * Thrown when every numeric ID is held by a live session.
 *
 * <p>The caller must refuse the new connection. The directory never retries.</p>
 */
public class DirectoryFullException extends RuntimeException
{
    private final int capacity;

    /**
     * Creates a new exception.
     *
     * @param capacity the number of IDs the directory can hand out
     */
    public DirectoryFullException(int capacity)
    {
        super("No available numeric IDs (capacity " + capacity + ")");
        this.capacity = capacity;
    }

    /**
     * Returns the number of IDs the directory can hand out.
     */
    public int getCapacity()
    {
        return capacity;
    }
}
