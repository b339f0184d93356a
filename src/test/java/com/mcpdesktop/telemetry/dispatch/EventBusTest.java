package com.mcpdesktop.telemetry.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class EventBusTest {

	private EventBus bus;
	private List<HandlerFailure> failures;

	@BeforeEach
	void setUp() {
		bus = new EventBus();
		failures = new CopyOnWriteArrayList<>();
		bus.setFailureReporter(failures::add);
	}

	@Test
	@DisplayName("subscription ids start at 1, increase and are never reused")
	void ids_are_unique_and_monotonic() {
		long a = bus.subscribe("calendar:sync", p -> {});
		long b = bus.subscribe("calendar:sync", p -> {});
		assertThat(bus.unsubscribe(b)).isTrue();
		long c = bus.subscribe("calendar:sync", p -> {});

		assertThat(a).isEqualTo(1L);
		assertThat(b).isEqualTo(2L);
		assertThat(c).isEqualTo(3L);
	}

	@Test
	@DisplayName("unsubscribe of an unknown id returns false and does not throw")
	void unsubscribe_unknown_id() {
		assertThat(bus.unsubscribe(42L)).isFalse();

		long id = bus.subscribe("x", p -> {});
		assertThat(bus.unsubscribe(id)).isTrue();
		assertThat(bus.unsubscribe(id)).isFalse();
	}

	@Test
	@DisplayName("blank event names and null handlers are rejected before any state changes")
	void validation_errors() {
		assertThatThrownBy(() -> bus.subscribe("", p -> {})).isInstanceOf(ValidationException.class);
		assertThatThrownBy(() -> bus.subscribe("  ", p -> {})).isInstanceOf(ValidationException.class);
		assertThatThrownBy(() -> bus.subscribe("x", null)).isInstanceOf(ValidationException.class);
		assertThatThrownBy(() -> bus.emit(null, "payload")).isInstanceOf(ValidationException.class);

		assertThat(bus.listenerCount()).isZero();
		// the failed attempts did not consume ids
		assertThat(bus.subscribe("x", p -> {})).isEqualTo(1L);
	}

	@Test
	@DisplayName("listeners run in subscription order")
	void delivery_order() {
		List<String> seen = new ArrayList<>();
		bus.subscribe("e", p -> seen.add("first:" + p));
		bus.subscribe("e", p -> seen.add("second:" + p));
		bus.subscribe("other", p -> seen.add("other:" + p));

		bus.emit("e", "v");

		assertThat(seen).containsExactly("first:v", "second:v");
	}

	@Test
	@DisplayName("emit without listeners is a no-op")
	void emit_without_listeners() {
		bus.emit("nobody:listens", "payload");

		assertThat(bus.statistics().emits()).isEqualTo(1);
		assertThat(bus.statistics().delivered()).isZero();
	}

	@Test
	@DisplayName("once-subscriptions are delivered exactly one payload and then removed")
	void once_semantics() {
		AtomicInteger calls = new AtomicInteger();
		bus.subscribe("e", p -> calls.incrementAndGet(), SubscribeOptions.onceOnly());

		bus.emit("e", 1);
		bus.emit("e", 2);

		assertThat(calls).hasValue(1);
		assertThat(bus.listenerCount("e")).isZero();
	}

	@Test
	@DisplayName("a once-subscription is removed even when its handler fails")
	void once_removed_after_failure() {
		AtomicInteger calls = new AtomicInteger();
		bus.subscribe("e", p -> {
			calls.incrementAndGet();
			throw new IllegalStateException("boom");
		}, SubscribeOptions.onceOnly());

		bus.emit("e", 1);
		bus.emit("e", 2);

		assertThat(calls).hasValue(1);
		assertThat(failures).hasSize(1);
	}

	@Test
	@DisplayName("concurrent emits deliver a once-subscription at most once")
	void once_under_concurrency() throws Exception {
		AtomicInteger calls = new AtomicInteger();
		bus.subscribe("e", p -> calls.incrementAndGet(), SubscribeOptions.onceOnly());

		ExecutorService pool = Executors.newFixedThreadPool(8);
		CountDownLatch go = new CountDownLatch(1);
		try {
			for (int i = 0; i < 8; i++) {
				pool.submit(() -> {
					go.await();
					bus.emit("e", "x");
					return null;
				});
			}
			go.countDown();
		} finally {
			pool.shutdown();
			assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
		}

		assertThat(calls).hasValue(1);
	}

	@Test
	@DisplayName("scoped listeners only receive emits for their own user")
	void scope_isolation() {
		List<Object> u1 = new ArrayList<>();
		List<Object> u2 = new ArrayList<>();
		List<Object> everyone = new ArrayList<>();
		bus.subscribe("log:error", u1::add, SubscribeOptions.scoped("u1", null));
		bus.subscribe("log:error", u2::add, SubscribeOptions.scoped("u2", null));
		bus.subscribe("log:error", everyone::add);

		bus.emit("log:error", "for-u1", EmitOptions.forUser("u1"));
		bus.emit("log:error", "broadcast");

		assertThat(u1).containsExactly("for-u1", "broadcast");
		assertThat(u2).containsExactly("broadcast");
		assertThat(everyone).containsExactly("for-u1", "broadcast");
		assertThat(bus.statistics().scopeFiltered()).isEqualTo(1);
	}

	@Test
	@DisplayName("device scope is applied independently of user scope")
	void device_scope() {
		List<Object> laptop = new ArrayList<>();
		bus.subscribe("e", laptop::add, SubscribeOptions.scoped("u1", "laptop"));

		bus.emit("e", "phone", new EmitOptions("u1", "phone"));
		bus.emit("e", "laptop", new EmitOptions("u1", "laptop"));
		bus.emit("e", "any-device", EmitOptions.forUser("u1"));

		assertThat(laptop).containsExactly("laptop", "any-device");
	}

	@Test
	@DisplayName("a filter returning false skips the listener without counting a failure")
	void filter_skips() {
		List<Object> seen = new ArrayList<>();
		bus.subscribe("e", seen::add, SubscribeOptions.filtered(p -> p instanceof Integer i && i > 10));

		bus.emit("e", 5);
		bus.emit("e", 50);

		assertThat(seen).containsExactly(50);
		assertThat(failures).isEmpty();
		assertThat(bus.statistics().filtered()).isEqualTo(1);
	}

	@Test
	@DisplayName("a throwing listener is isolated and reported once; the others still run")
	void handler_failure_isolated() {
		List<Object> after = new ArrayList<>();
		long failingId = bus.subscribe("calendar:sync", p -> {
			throw new IllegalStateException("calendar offline");
		});
		bus.subscribe("calendar:sync", after::add);

		bus.emit("calendar:sync", "payload");

		assertThat(after).containsExactly("payload");
		assertThat(failures).singleElement().satisfies(f -> {
			assertThat(f.eventName()).isEqualTo("calendar:sync");
			assertThat(f.subscriptionId()).isEqualTo(failingId);
			assertThat(f.errorMessage()).isEqualTo("calendar offline");
		});
		assertThat(bus.statistics().failed()).isEqualTo(1);
	}

	@Test
	@DisplayName("without a failure reporter, handler failures are only logged")
	void failure_without_reporter() {
		bus.setFailureReporter(null);
		List<Object> after = new ArrayList<>();
		bus.subscribe("e", p -> {
			throw new Exception("checked");
		});
		bus.subscribe("e", after::add);

		bus.emit("e", "payload");

		assertThat(after).containsExactly("payload");
	}

	@Test
	@DisplayName("unsubscribing during dispatch only affects later emits")
	void unsubscribe_during_dispatch() {
		List<String> seen = new ArrayList<>();
		long[] second = new long[1];
		bus.subscribe("e", p -> {
			seen.add("first");
			bus.unsubscribe(second[0]);
		});
		second[0] = bus.subscribe("e", p -> seen.add("second"));

		bus.emit("e", 1);
		bus.emit("e", 2);

		assertThat(seen).containsExactly("first", "second", "first");
	}

	@Test
	@DisplayName("clear removes every subscription")
	void clear_removes_all() {
		bus.subscribe("a", p -> {});
		bus.subscribe("b", p -> {});

		bus.clear();

		assertThat(bus.listenerCount()).isZero();
		assertThat(bus.listenerCount("a")).isZero();
	}
}
