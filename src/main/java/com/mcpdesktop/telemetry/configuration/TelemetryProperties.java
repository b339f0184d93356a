package com.mcpdesktop.telemetry.configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import com.mcpdesktop.telemetry.gating.DedupFilter;
import com.mcpdesktop.telemetry.gating.NoiseFilter;
import com.mcpdesktop.telemetry.gating.RuntimeMode;
import com.mcpdesktop.telemetry.memory.MemoryGuardian;
import com.mcpdesktop.telemetry.store.CircularLogStore;

/**
 * {@code telemetry.*} settings. Read once at startup; out-of-range values fail context startup.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "telemetry")
public class TelemetryProperties {

	/** Master switch for the auto-configuration. */
	private boolean enabled = true;

	private RuntimeMode runtimeMode = RuntimeMode.DEVELOPMENT;

	private Duration sweepInterval = Duration.ofSeconds(5);

	private final Buffer buffer = new Buffer();
	private final Throttle throttle = new Throttle();
	private final Dedup dedup = new Dedup();
	private final Memory memory = new Memory();
	private final Persistence persistence = new Persistence();

	@Getter
	@Setter
	public static class Buffer {
		private int capacity = CircularLogStore.DEFAULT_CAPACITY;
	}

	@Getter
	@Setter
	public static class Throttle {
		private Duration window = Duration.ofSeconds(1);
		private int threshold = 10;
	}

	@Getter
	@Setter
	public static class Dedup {
		private Duration defaultWindow = DedupFilter.Settings.DEFAULT_WINDOW;
		private Duration errorWindow = DedupFilter.Settings.DEFAULT_ERROR_WINDOW;
		private Map<String, Duration> categoryWindows =
			new LinkedHashMap<>(DedupFilter.Settings.defaultCategoryWindows());
		private int maxEntries = DedupFilter.Settings.DEFAULT_MAX_ENTRIES;
		private double sweepProbability = DedupFilter.Settings.DEFAULT_SWEEP_PROBABILITY;
		private List<String> contextFields = new ArrayList<>(DedupFilter.Settings.DEFAULT_CONTEXT_FIELDS);
	}

	@Getter
	@Setter
	public static class Memory {
		private double emergencyThreshold = 0.95;
		private double recoveryThreshold = 0.80;
		private Duration sampleInterval = Duration.ofSeconds(5);
		private double warningThreshold = 0.85;
		private Duration warningInterval = Duration.ofSeconds(30);
		private boolean requestGcOnWarning = true;
	}

	@Getter
	@Setter
	public static class Persistence {
		/** Persist records carrying a user id through the {@code UserLogRepository}. */
		private boolean enabled = true;
	}

	// === Conversions ===

	DedupFilter.Settings dedupSettings() {
		return new DedupFilter.Settings(
			dedup.defaultWindow,
			dedup.errorWindow,
			dedup.categoryWindows,
			dedup.maxEntries,
			dedup.sweepProbability,
			dedup.contextFields);
	}

	MemoryGuardian.Settings memorySettings() {
		return new MemoryGuardian.Settings(
			memory.emergencyThreshold,
			memory.recoveryThreshold,
			memory.sampleInterval,
			memory.warningThreshold,
			memory.warningInterval,
			memory.requestGcOnWarning);
	}

	NoiseFilter.Settings noiseSettings() {
		return NoiseFilter.Settings.defaults(runtimeMode);
	}
}
