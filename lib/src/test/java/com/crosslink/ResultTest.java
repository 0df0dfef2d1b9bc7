package com.crosslink;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ResultTest {

    @Test
    void testSuccessOperations() {
        Result<Integer> result = Result.success(21);

        assertTrue(result.isSuccess());
        assertEquals(21, result.getOrThrow());
        assertEquals(42, result.map(v -> v * 2).getOrThrow());
        assertEquals(21, result.getOrElse(0));
        assertTrue(result.error().isEmpty());
    }

    @Test
    void testFailureOperations() {
        AlreadyClaimedException error = new AlreadyClaimedException("taken", "id");
        Result<Integer> result = Result.failure(error);

        assertFalse(result.isSuccess());
        assertSame(error, assertThrows(AlreadyClaimedException.class, result::getOrThrow));
        assertEquals(-1, result.getOrElse(-1));
        assertEquals(-1, result.getOrElse(e -> -1));
        assertFalse(result.map(v -> v * 2).isSuccess());
        assertSame(error, result.error().orElseThrow());
    }

    @Test
    void testCheckedFailureIsWrapped() {
        Result<String> result = Result.failure(new IOException("disk"));

        CommsException thrown = assertThrows(CommsException.class, result::getOrThrow);
        assertInstanceOf(IOException.class, thrown.getCause());
    }

    @Test
    void testAttemptCapturesException() {
        Result<String> ok = Result.attempt(() -> "value");
        Result<String> failed = Result.attempt(() -> {
            throw new IllegalStateException("boom");
        });

        assertEquals("value", ok.getOrThrow());
        assertInstanceOf(IllegalStateException.class, failed.error().orElseThrow());
    }

    @Test
    void testFlatMapAndRecover() {
        Result<Integer> chained = Result.success(2).flatMap(v -> Result.success(v + 1));
        Result<Integer> recovered = Result.<Integer>failure(new RuntimeException("x")).recover(e -> 0);

        assertEquals(3, chained.getOrThrow());
        assertEquals(0, recovered.getOrThrow());
    }

    @Test
    void testCallbacks() {
        AtomicReference<Object> seen = new AtomicReference<>();

        Result.success("yes").ifSuccess(seen::set);
        assertEquals("yes", seen.get());

        RuntimeException error = new RuntimeException("no");
        Result.failure(error).ifFailure(seen::set);
        assertSame(error, seen.get());
    }
}
