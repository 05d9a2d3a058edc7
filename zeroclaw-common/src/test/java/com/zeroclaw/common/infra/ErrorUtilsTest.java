package com.zeroclaw.common.infra;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class ErrorUtilsTest {

    @Test
    void formatErrorMessage_fallsBackToClassName() {
        assertEquals("boom", ErrorUtils.formatErrorMessage(new IllegalStateException("boom")));
        assertEquals("IllegalStateException", ErrorUtils.formatErrorMessage(new IllegalStateException()));
        assertEquals("Error", ErrorUtils.formatErrorMessage(null));
    }

    @Test
    void formatErrorChain_walksCauses() {
        Exception err = new RuntimeException("outer", new IOException("disk full"));
        assertEquals("outer -> disk full", ErrorUtils.formatErrorChain(err));
    }
}
