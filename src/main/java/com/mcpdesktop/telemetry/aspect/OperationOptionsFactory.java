package com.mcpdesktop.telemetry.aspect;

import java.lang.annotation.Annotation;
import java.lang.reflect.Method;

import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.aop.support.AopUtils;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.util.ClassUtils;

import com.mcpdesktop.telemetry.annotations.Monitored;
import com.mcpdesktop.telemetry.annotations.RequestId;

/** Builds {@link OperationOptions} from the {@code @Monitored} annotation nearest to the invoked method. */
public final class OperationOptionsFactory {

	private OperationOptionsFactory() {}

	public static OperationOptions fromJoinPoint(ProceedingJoinPoint pjp) {
		MethodSignature sig = (MethodSignature) pjp.getSignature();
		Method method = sig.getMethod();
		Class<?> targetClass = (pjp.getTarget() != null)
			? ClassUtils.getUserClass(pjp.getTarget())
			: method.getDeclaringClass();
		return fromMethod(AopUtils.getMostSpecificMethod(method, targetClass), targetClass);
	}

	/** Precedence: {@code @Monitored} on the method, then on the class. */
	public static OperationOptions fromMethod(Method method, Class<?> targetClass) {
		Monitored monitored = AnnotatedElementUtils.findMergedAnnotation(method, Monitored.class);
		if (monitored == null) {
			monitored = AnnotatedElementUtils.findMergedAnnotation(targetClass, Monitored.class);
		}
		if (monitored == null) {
			throw new IllegalArgumentException("Neither method nor type carries @Monitored: " + method);
		}
		String name = monitored.value().isBlank() ? targetClass.getSimpleName() : monitored.value();
		return new OperationOptions(
			monitored.component(), name, method.getName(), monitored.logParams(), requestIdIndex(method));
	}

	/* ------------------ helpers ------------------ */

	private static int requestIdIndex(Method method) {
		Annotation[][] byParam = method.getParameterAnnotations();
		for (int i = 0; i < byParam.length; i++) {
			for (Annotation a : byParam[i]) {
				if (a.annotationType() == RequestId.class) return i;
			}
		}
		return -1;
	}
}
