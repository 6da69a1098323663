package com.pgoutbox.application.error;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ErrorDirectiveTest {

    @Test
    void retryBackoffGrowsLinearly() {
        ErrorDirective.Retry retry = new ErrorDirective.Retry(3, Duration.ofMillis(200), ErrorDirective.abort());

        assertEquals(Duration.ofMillis(200), retry.delayBefore(1));
        assertEquals(Duration.ofMillis(600), retry.delayBefore(3));
    }

    @Test
    void retryRejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class,
            () -> ErrorDirective.retry(0, Duration.ZERO, ErrorDirective.skip()));
        assertThrows(IllegalArgumentException.class,
            () -> ErrorDirective.retry(1, Duration.ofMillis(-1), ErrorDirective.skip()));
        assertThrows(IllegalArgumentException.class,
            () -> ErrorDirective.retry(1, Duration.ZERO, ErrorDirective.retry(1, Duration.ZERO, ErrorDirective.skip())));
    }

    @Test
    void factoriesReturnSingletons() {
        assertSame(ErrorDirective.Continue.INSTANCE, ErrorDirective.skip());
        assertSame(ErrorDirective.Abort.INSTANCE, ErrorDirective.abort());
    }
}
