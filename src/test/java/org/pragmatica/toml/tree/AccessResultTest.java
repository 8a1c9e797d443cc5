package org.pragmatica.toml.tree;

import org.junit.jupiter.api.Test;
import org.pragmatica.toml.error.AccessorError;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class AccessResultTest {

    private final AccessResult<Long> found = AccessResult.found(42L);
    private final AccessResult<Long> missing = AccessResult.failed(new AccessorError.InvalidKey("port"));

    @Test
    void found_unwrapsValue() {
        assertTrue(found.isSuccess());
        assertFalse(found.isFailure());
        assertEquals(42L, found.unwrap());
        assertTrue(found.error().isEmpty());
    }

    @Test
    void failed_unwrapThrowsWithAccessorMessage() {
        assertTrue(missing.isFailure());
        assertThatThrownBy(missing::unwrap)
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("No value for key 'port'");
    }

    @Test
    void map_appliesOnlyOnSuccess() {
        assertEquals("42", found.map(value -> Long.toString(value)).unwrap());
        assertEquals(missing.error(), missing.map(value -> Long.toString(value)).error());
    }

    @Test
    void flatMap_chainsLookups() {
        AccessResult<String> chained = found.flatMap(value -> AccessResult.failed(new AccessorError.InvalidKey("x")));

        assertTrue(chained.isFailure());
        assertEquals("x", chained.error().orElseThrow().key());
    }

    @Test
    void or_returnsFallbackOnFailure() {
        assertEquals(42L, found.or(7L));
        assertEquals(7L, missing.or(7L));
    }

    @Test
    void toOptional_dropsError() {
        assertEquals(42L, found.toOptional().orElseThrow());
        assertTrue(missing.toOptional().isEmpty());
    }

    @Test
    void fold_selectsBranch() {
        assertEquals("ok:42", found.fold(AccessorError::message, value -> "ok:" + value));
        assertEquals("No value for key 'port'", missing.fold(AccessorError::message, value -> "ok:" + value));
    }
}
