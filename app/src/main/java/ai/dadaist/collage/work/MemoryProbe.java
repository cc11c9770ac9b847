package ai.dadaist.collage.work;

/**
 * Reports memory available for large buffers.
 */
public interface MemoryProbe {

    /**
     * Physical memory currently free on the host, in bytes.
     */
    long availableSystemBytes();

    /**
     * Heap the JVM could still allocate, in bytes.
     */
    long availableHeapBytes();
}
