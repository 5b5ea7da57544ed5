package com.p14n.eventstream.telemetry;

import java.util.function.Supplier;

import com.p14n.eventstream.data.Events;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

public class OpenTelemetryFunctions {

        public static <T> T processWithTelemetry(Tracer tracer, Events events, String spanName,
                                                 Supplier<T> action) {

                SpanBuilder sb = tracer.spanBuilder(spanName)
                        .setAttribute("index", events.index())
                        .setAttribute("event.count", (long) events.events().size());
                Span span = sb.startSpan();
                try (Scope scope = span.makeCurrent()) {
                        return action.get();
                } catch (Exception e) {
                        span.recordException(e);
                        throw e;
                } finally {
                        span.end();
                }
        }
}
