package com.mcpdesktop.telemetry.aspect;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.RequiredArgsConstructor;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;

import com.mcpdesktop.telemetry.annotations.Monitored;

/**
 * Spring AOP aspect that wraps {@link Monitored} operations with entry, completion and failure telemetry.
 *
 * <p>Failures are recorded and rethrown unchanged; the aspect never alters the outcome of the call.
 *
 * <ul>
 *   <li>method-level {@code @Monitored}: {@code execution(* *(..)) && @annotation(monitored)}
 *   <li>type-level {@code @Monitored}: every public method of the type not annotated itself
 * </ul>
 */
@Aspect
@RequiredArgsConstructor
public class MonitoredOperationAspect {

	private final OperationLogger operationLogger;

	@Around(value = "execution(* *(..)) && @annotation(monitored)", argNames = "joinPoint,monitored")
	public Object interceptMethod(ProceedingJoinPoint joinPoint, Monitored monitored) throws Throwable { // NOSONAR
		return proceed(joinPoint);
	}

	@Around(
		value = "execution(public * *(..)) && @within(monitored)"
			+ " && !@annotation(com.mcpdesktop.telemetry.annotations.Monitored)",
		argNames = "joinPoint,monitored")
	public Object interceptType(ProceedingJoinPoint joinPoint, Monitored monitored) throws Throwable { // NOSONAR
		return proceed(joinPoint);
	}

	private Object proceed(ProceedingJoinPoint joinPoint) throws Throwable {
		final OperationOptions op = OperationOptionsFactory.fromJoinPoint(joinPoint);
		final Object[] args = joinPoint.getArgs();
		final String requestId = requestId(op, args);

		operationLogger.logMethodEntry(op, params(joinPoint, args), requestId);
		final long start = System.nanoTime();
		try {
			Object result = joinPoint.proceed();
			operationLogger.logMethodExit(op, result, elapsedMs(start), requestId);
			return result;
		} catch (Throwable t) {
			operationLogger.logMethodError(op, t, elapsedMs(start), requestId);
			throw t;
		}
	}

	private static Map<String, Object> params(ProceedingJoinPoint joinPoint, Object[] args) {
		String[] names = ((MethodSignature) joinPoint.getSignature()).getParameterNames();
		Map<String, Object> params = new LinkedHashMap<>();
		for (int i = 0; i < args.length; i++) {
			String name = (names != null && i < names.length) ? names[i] : "arg" + i;
			params.put(name, args[i]);
		}
		return params;
	}

	private static String requestId(OperationOptions op, Object[] args) {
		int idx = op.requestIdIndex();
		if (idx < 0 || idx >= args.length || args[idx] == null) return null;
		return String.valueOf(args[idx]);
	}

	private static double elapsedMs(long startNanos) {
		return (System.nanoTime() - startNanos) / 1_000_000.0;
	}
}
