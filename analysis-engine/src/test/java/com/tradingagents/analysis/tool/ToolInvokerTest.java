package com.tradingagents.analysis.tool;

import com.tradingagents.analysis.support.StubCapabilities;
import com.tradingagents.common.llm.ToolCall;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ToolInvokerTest {

    private static ToolInvoker invokerWith(ToolCapability... capabilities) {
        return new ToolInvoker(new CapabilityRegistry(List.of(capabilities)), Duration.ofSeconds(1));
    }

    @Nested
    @DisplayName("invoke()")
    class Invoke {

        @Test
        @DisplayName("unknown capability → UNKNOWN_CAPABILITY, no exception")
        void unknownCapability() {
            ToolInvoker invoker = invokerWith(StubCapabilities.answering("get_a", "a"));

            StepVerifier.create(invoker.invoke(new ToolCall("c1", "get_nothing", Map.of())))
                .assertNext(r -> {
                    assertFalse(r.succeeded());
                    assertEquals(FailureKind.UNKNOWN_CAPABILITY, r.failure());
                    assertEquals("c1", r.callId());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("successful handler → text passed through")
        void success() {
            ToolInvoker invoker = invokerWith(StubCapabilities.answering("get_a", "hello"));

            StepVerifier.create(invoker.invoke(new ToolCall("c1", "get_a", Map.of())))
                .assertNext(r -> {
                    assertTrue(r.succeeded());
                    assertEquals("hello", r.text());
                    assertEquals("hello", r.modelFacingText());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("missing required argument → PERMANENT without calling the handler")
        void missingRequiredArgument() {
            AtomicReference<ToolArguments> seen = new AtomicReference<>();
            ToolInvoker invoker = invokerWith(StubCapabilities.requiringSymbol("get_price",
                args -> { seen.set(args); return Mono.just("x"); }));

            StepVerifier.create(invoker.invoke(new ToolCall("c1", "get_price", Map.of())))
                .assertNext(r -> assertEquals(FailureKind.PERMANENT, r.failure()))
                .verifyComplete();
            assertNull(seen.get());
        }

        @Test
        @DisplayName("symbol is upper-cased and days parsed from a string")
        void argumentsNormalized() {
            AtomicReference<ToolArguments> seen = new AtomicReference<>();
            ToolInvoker invoker = invokerWith(StubCapabilities.requiringSymbol("get_price",
                args -> { seen.set(args); return Mono.just("x"); }));

            StepVerifier.create(invoker.invoke(new ToolCall("c1", "get_price", Map.of("symbol", " btc", "days", "7"))))
                .expectNextCount(1)
                .verifyComplete();
            assertEquals("BTC", seen.get().symbol());
            assertEquals(7, seen.get().lookbackDays());
        }

        @Test
        @DisplayName("handler slower than the timeout → TRANSIENT")
        void timeoutIsTransient() {
            ToolCapability slow = new ToolCapability("get_slow", "slow", List.of(),
                args -> Mono.just("late").delayElement(Duration.ofSeconds(5)));
            ToolInvoker invoker = new ToolInvoker(new CapabilityRegistry(List.of(slow)), Duration.ofMillis(50));

            StepVerifier.create(invoker.invoke(new ToolCall("c1", "get_slow", Map.of())))
                .assertNext(r -> assertEquals(FailureKind.TRANSIENT, r.failure()))
                .verifyComplete();
        }

        @Test
        @DisplayName("empty handler result → PERMANENT")
        void emptyIsPermanent() {
            ToolCapability empty = new ToolCapability("get_empty", "empty", List.of(), args -> Mono.empty());
            ToolInvoker invoker = invokerWith(empty);

            StepVerifier.create(invoker.invoke(new ToolCall("c1", "get_empty", Map.of())))
                .assertNext(r -> assertEquals(FailureKind.PERMANENT, r.failure()))
                .verifyComplete();
        }

        @Test
        @DisplayName("failed result tells the model the data is unavailable")
        void failedModelFacingText() {
            ToolInvoker invoker = invokerWith(StubCapabilities.failing("get_a", FailureKind.PERMANENT));

            StepVerifier.create(invoker.invoke(new ToolCall("c1", "get_a", Map.of())))
                .assertNext(r -> {
                    assertTrue(r.modelFacingText().contains("unavailable"));
                    assertEquals("get_a unavailable (PERMANENT)", r.degradedMarker());
                })
                .verifyComplete();
        }
    }

    @Nested
    @DisplayName("classify()")
    class Classify {

        @Test
        void toolFailureKeepsItsKind() {
            assertEquals(FailureKind.PERMANENT,
                ToolInvoker.classify(new ToolFailureException(FailureKind.PERMANENT, "no key")));
        }

        @Test
        void timeoutIsTransient() {
            assertEquals(FailureKind.TRANSIENT, ToolInvoker.classify(new TimeoutException()));
        }

        @Test
        @DisplayName("5xx and 429 are transient, other 4xx permanent")
        void httpStatuses() {
            assertEquals(FailureKind.TRANSIENT, ToolInvoker.classify(http(HttpStatus.SERVICE_UNAVAILABLE)));
            assertEquals(FailureKind.TRANSIENT, ToolInvoker.classify(http(HttpStatus.TOO_MANY_REQUESTS)));
            assertEquals(FailureKind.PERMANENT, ToolInvoker.classify(http(HttpStatus.NOT_FOUND)));
        }

        @Test
        void illegalArgumentIsPermanent() {
            assertEquals(FailureKind.PERMANENT, ToolInvoker.classify(new IllegalArgumentException("bad")));
        }

        private WebClientResponseException http(HttpStatus status) {
            return WebClientResponseException.create(status.value(), status.getReasonPhrase(),
                HttpHeaders.EMPTY, new byte[0], null);
        }
    }
}
