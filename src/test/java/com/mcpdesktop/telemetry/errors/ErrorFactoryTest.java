package com.mcpdesktop.telemetry.errors;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.mcpdesktop.telemetry.dispatch.EventBus;
import com.mcpdesktop.telemetry.dispatch.SubscribeOptions;
import com.mcpdesktop.telemetry.model.EventTypes;
import com.mcpdesktop.telemetry.model.LogLevel;
import com.mcpdesktop.telemetry.model.TelemetryRecord;
import com.mcpdesktop.telemetry.support.MutableClock;

class ErrorFactoryTest {

	private EventBus bus;
	private ErrorFactory factory;
	private final List<Object> created = new CopyOnWriteArrayList<>();
	private final List<Object> logged = new CopyOnWriteArrayList<>();
	private final List<Object> liveErrors = new CopyOnWriteArrayList<>();

	@BeforeEach
	void setUp() {
		bus = new EventBus();
		factory = new ErrorFactory(bus, new MutableClock());
		bus.subscribe(EventTypes.ERROR_CREATED, created::add);
		bus.subscribe(EventTypes.LOG_INGEST, logged::add);
		bus.subscribe(EventTypes.LOG_ERROR, liveErrors::add);
	}

	@Test
	@DisplayName("created error carries defaults, strips secrets and is offered for ingestion")
	void create_and_publish() {
		TelemetryError error = factory.createError(
			ErrorCategory.AUTH,
			"Token refresh failed",
			Severity.CRITICAL,
			Map.of("password", "hunter2", "refreshToken", "r-1", "attempt", 3));

		assertThat(error.id()).isNotBlank();
		assertThat(error.category()).isEqualTo("auth");
		assertThat(error.context()).containsOnlyKeys("attempt");
		assertThat(error.recursionLimited()).isFalse();

		assertThat(created).containsExactly(error);
		assertThat(logged).singleElement().isInstanceOfSatisfying(TelemetryRecord.class, r -> {
			assertThat(r.id()).isEqualTo(error.id());
			assertThat(r.level()).isEqualTo(LogLevel.ERROR);
			assertThat(r.severity()).isEqualTo("critical");
			assertThat(r.source()).isEqualTo(ErrorFactory.SOURCE);
			assertThat(r.builtByPipeline()).isFalse();
		});
		// live log events are left to the pipeline
		assertThat(liveErrors).isEmpty();
	}

	@Test
	@DisplayName("warning severity becomes a warn-level record")
	void severity_maps_to_level() {
		TelemetryError error = factory.createError(ErrorCategory.MODULE, "slow start", Severity.WARNING);

		assertThat(error.toRecord(ErrorFactory.SOURCE).level()).isEqualTo(LogLevel.WARN);
	}

	@Test
	@DisplayName("errors for a user are only delivered to that user's scoped listeners")
	void scoped_publication() {
		List<Object> alice = new CopyOnWriteArrayList<>();
		List<Object> bob = new CopyOnWriteArrayList<>();
		bus.subscribe(EventTypes.ERROR_CREATED, alice::add, SubscribeOptions.scoped("alice", null));
		bus.subscribe(EventTypes.ERROR_CREATED, bob::add, SubscribeOptions.scoped("bob", null));

		factory.createError("graph", "sync failed", Severity.ERROR, Map.of(), null, "alice", "laptop");

		assertThat(alice).hasSize(1);
		assertThat(bob).isEmpty();
	}

	@Test
	@DisplayName("listeners that keep creating errors are cut off at the recursion limit")
	void recursion_limit() {
		List<TelemetryError> results = new CopyOnWriteArrayList<>();
		bus.subscribe(EventTypes.ERROR_CREATED, payload ->
			results.add(factory.createError(ErrorCategory.SYSTEM, "nested", Severity.ERROR)));

		TelemetryError outer = factory.createError(ErrorCategory.DATABASE, "outer", Severity.ERROR);

		assertThat(outer.recursionLimited()).isFalse();
		assertThat(results).anySatisfy(e -> {
			assertThat(e.recursionLimited()).isTrue();
			assertThat(e.message()).isEqualTo("Error recursion limit reached");
			assertThat(e.context()).containsEntry("originalMessage", "nested");
		});
		// outer plus two nested levels were published; the third nested call was refused
		assertThat(created).hasSize(ErrorFactory.MAX_DEPTH);

		// depth is released afterwards
		assertThat(factory.createError(ErrorCategory.SYSTEM, "later", Severity.INFO).recursionLimited()).isFalse();
	}

	@Test
	@DisplayName("API view keeps only client-facing fields")
	void api_error() {
		TelemetryError error = factory.createError(
			"api", "Bad request", Severity.WARNING, Map.of("field", "start"), "trace-1", "alice", "phone");

		ApiError api = factory.toApiError(error);

		assertThat(api.id()).isEqualTo(error.id());
		assertThat(api.category()).isEqualTo("api");
		assertThat(api.severity()).isEqualTo(Severity.WARNING);
		assertThat(api.context()).containsEntry("field", "start");
	}
}
