package com.mcpdesktop.telemetry.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.util.Locale;

/**
 * Logs entry, completion and failure of a module or service operation through the telemetry sink.
 *
 * <p>On a type, every public method is monitored; on a method, only that method (and its settings win over the
 * type's).
 *
 * <pre>
 *   &#64;Monitored(value = "calendar", component = Monitored.Component.MODULE)
 *   public class CalendarModule {
 *     public List&lt;Event&gt; findEvents(&#64;RequestId String requestId, Query query) { ... }
 *   }
 * </pre>
 */
@Documented
@Target({ElementType.TYPE, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
public @interface Monitored {

	/** Module or service name; defaults to the simple class name of the target. */
	String value() default "";

	Component component() default Component.MODULE;

	/** When false, arguments are not included in the entry record. */
	boolean logParams() default true;

	enum Component {
		MODULE("Module"),
		SERVICE("Service");

		private final String label;

		Component(String label) {
			this.label = label;
		}

		public String label() {
			return label;
		}

		/** Telemetry category used for this component's records. */
		public String category() {
			return label.toLowerCase(Locale.ROOT);
		}
	}
}
