package com.p14n.eventbus.telemetry;

import java.util.function.Supplier;

import com.p14n.eventbus.data.Traceable;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

public class OpenTelemetryFunctions {

        private OpenTelemetryFunctions() {
        }

        public static <T> T processWithTelemetry(Tracer tracer, String spanName,
                                                 Supplier<T> action) {

                Span span = tracer.spanBuilder(spanName).startSpan();
                try (Scope scope = span.makeCurrent()) {
                        return action.get();
                } catch (Exception e) {
                        span.recordException(e);
                        throw e;
                } finally {
                        span.end();
                }
        }

        public static <T> T processWithTelemetry(Tracer tracer, Traceable event, String spanName,
                        Supplier<T> action) {

                Span span = tracer.spanBuilder(spanName)
                        .setAttribute("event.name", event.eventName())
                        .setAttribute("event.id", event.id())
                        .setAttribute("event.key", event.key())
                        .startSpan();
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
