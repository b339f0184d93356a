package com.mcpdesktop.telemetry.memory;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;

/** Source of the heap utilization ratio (used / limit, 0..1) sampled by the {@link MemoryGuardian}. */
@FunctionalInterface
public interface HeapUsageProbe {

	double heapUsageRatio();

	/** Reads the platform {@link MemoryMXBean}; uses committed heap as the limit when no max is configured. */
	static HeapUsageProbe jvm() {
		final MemoryMXBean bean = ManagementFactory.getMemoryMXBean();
		return () -> {
			MemoryUsage heap = bean.getHeapMemoryUsage();
			long limit = heap.getMax() > 0 ? heap.getMax() : heap.getCommitted();
			return limit <= 0 ? 0.0 : (double) heap.getUsed() / limit;
		};
	}
}
