package com.example.presence.shared.aspect;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Times calls into an external collaborator and counts their outcomes under
 * {@code presence.<value>.latency} and {@code presence.<value>.calls}.
 */
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
public @interface Monitored {

    /** Metric group, e.g. "collaborator". */
    String value();

    /** Calls slower than this are logged at WARN; they run on the session scheduler and delay the next inbound frame. */
    long slowCallMillis() default 500;
}
