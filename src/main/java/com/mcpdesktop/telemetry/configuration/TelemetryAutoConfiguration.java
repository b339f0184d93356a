package com.mcpdesktop.telemetry.configuration;

import static org.springframework.core.Ordered.HIGHEST_PRECEDENCE;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfigureOrder;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mcpdesktop.telemetry.aspect.MonitoredOperationAspect;
import com.mcpdesktop.telemetry.aspect.OperationLogger;
import com.mcpdesktop.telemetry.dispatch.EventBus;
import com.mcpdesktop.telemetry.errors.ErrorFactory;
import com.mcpdesktop.telemetry.gating.DedupFilter;
import com.mcpdesktop.telemetry.gating.NoiseFilter;
import com.mcpdesktop.telemetry.gating.ThrottleGuard;
import com.mcpdesktop.telemetry.memory.HeapUsageProbe;
import com.mcpdesktop.telemetry.memory.MemoryGuardian;
import com.mcpdesktop.telemetry.processor.TelemetryPipeline;
import com.mcpdesktop.telemetry.processor.TelemetrySink;
import com.mcpdesktop.telemetry.processor.TraceCorrelation;
import com.mcpdesktop.telemetry.receivers.InMemoryUserLogRepository;
import com.mcpdesktop.telemetry.receivers.LogTransport;
import com.mcpdesktop.telemetry.receivers.Slf4jLogTransport;
import com.mcpdesktop.telemetry.receivers.UserLogRepository;

/**
 * Wires the bus, the gates and the pipeline. The pipeline bean is created after everything it depends on and only
 * then registers itself with the bus ({@code initMethod = "start"}), so no component needs a reference to the sink
 * while it is being built. Every bean backs off when the host defines its own.
 */
@Configuration
@AutoConfigureOrder(value = HIGHEST_PRECEDENCE)
@ConditionalOnProperty(prefix = "telemetry", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(TelemetryProperties.class)
public class TelemetryAutoConfiguration {

	@Bean
	@ConditionalOnMissingBean
	public EventBus eventBus() {
		return new EventBus();
	}

	@Bean
	@ConditionalOnMissingBean
	public ErrorFactory errorFactory(EventBus eventBus) {
		return new ErrorFactory(eventBus);
	}

	@Bean
	@ConditionalOnMissingBean
	public ThrottleGuard throttleGuard(TelemetryProperties props) {
		return new ThrottleGuard(
			props.getThrottle().getWindow(), props.getThrottle().getThreshold(), Clock.systemUTC());
	}

	@Bean
	@ConditionalOnMissingBean
	public DedupFilter dedupFilter(TelemetryProperties props) {
		return new DedupFilter(
			props.dedupSettings(), Clock.systemUTC(), () -> ThreadLocalRandom.current().nextDouble());
	}

	@Bean
	@ConditionalOnMissingBean
	public NoiseFilter noiseFilter(TelemetryProperties props) {
		return new NoiseFilter(props.noiseSettings());
	}

	@Bean
	@ConditionalOnMissingBean
	public HeapUsageProbe heapUsageProbe() {
		return HeapUsageProbe.jvm();
	}

	@Bean
	@ConditionalOnMissingBean
	public MemoryGuardian memoryGuardian(TelemetryProperties props, HeapUsageProbe heapUsageProbe) {
		return new MemoryGuardian(props.memorySettings(), heapUsageProbe, Clock.systemUTC(), System::gc);
	}

	@Bean
	@ConditionalOnMissingBean
	public LogTransport telemetryLogTransport(ObjectProvider<ObjectMapper> objectMapper) {
		return new Slf4jLogTransport(objectMapper.getIfAvailable());
	}

	@Bean
	@ConditionalOnMissingBean
	@ConditionalOnProperty(prefix = "telemetry.persistence", name = "enabled", matchIfMissing = true)
	public UserLogRepository userLogRepository() {
		return new InMemoryUserLogRepository();
	}

	@Bean
	@ConditionalOnMissingBean
	public TraceCorrelation traceCorrelation() {
		return new TraceCorrelation();
	}

	@Bean(initMethod = "start", destroyMethod = "close")
	@ConditionalOnMissingBean(TelemetrySink.class)
	public TelemetryPipeline telemetryPipeline(
		TelemetryProperties props,
		EventBus eventBus,
		ThrottleGuard throttleGuard,
		DedupFilter dedupFilter,
		NoiseFilter noiseFilter,
		MemoryGuardian memoryGuardian,
		LogTransport telemetryLogTransport,
		ObjectProvider<UserLogRepository> userLogRepository,
		TraceCorrelation traceCorrelation) {

		return TelemetryPipeline.builder(eventBus)
			.throttle(throttleGuard)
			.dedup(dedupFilter)
			.noise(noiseFilter)
			.guardian(memoryGuardian)
			.bufferCapacity(props.getBuffer().getCapacity())
			.transport(telemetryLogTransport)
			.userLogs(props.getPersistence().isEnabled() ? userLogRepository.getIfAvailable() : null)
			.traces(traceCorrelation)
			.sweepInterval(props.getSweepInterval())
			.build();
	}

	@Bean
	@ConditionalOnMissingBean
	public OperationLogger operationLogger(TelemetrySink telemetrySink) {
		return new OperationLogger(telemetrySink);
	}

	@Bean
	@ConditionalOnMissingBean
	@ConditionalOnClass(name = "org.aspectj.lang.annotation.Aspect")
	public MonitoredOperationAspect monitoredOperationAspect(OperationLogger operationLogger) {
		return new MonitoredOperationAspect(operationLogger);
	}
}
