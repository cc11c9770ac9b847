package ai.dadaist.collage.work;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

/**
 * Reads free memory from the platform MXBean and the JVM runtime.
 */
public class SystemMemoryProbe implements MemoryProbe {

    @Override
    public long availableSystemBytes() {
        OperatingSystemMXBean bean = ManagementFactory.getOperatingSystemMXBean();
        if (bean instanceof com.sun.management.OperatingSystemMXBean platformBean) {
            return platformBean.getFreeMemorySize();
        }
        return availableHeapBytes();
    }

    @Override
    public long availableHeapBytes() {
        Runtime runtime = Runtime.getRuntime();
        long used = runtime.totalMemory() - runtime.freeMemory();
        return runtime.maxMemory() - used;
    }
}
