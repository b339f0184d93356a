package com.mcpdesktop.telemetry.utils;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.UUID;

/**
 * Time-ordered record ids (UUIDv7): 48-bit epoch millis, version nibble, 74 random bits. Records sorted by id come
 * out in creation order to millisecond resolution.
 */
public final class TelemetryIds {

	private static final SecureRandom RNG = new SecureRandom();

	private TelemetryIds() {}

	public static String newId() {
		return newId(Clock.systemUTC());
	}

	public static String newId(Clock clock) {
		long millis = clock.millis();
		long msb = ((millis & 0xFFFFFFFFFFFFL) << 16) | 0x7000L | (RNG.nextInt() & 0x0FFFL);
		long lsb = (RNG.nextLong() & 0x3FFFFFFFFFFFFFFFL) | 0x8000000000000000L;
		return new UUID(msb, lsb).toString();
	}
}
