package com.kafcat.app;

import com.kafcat.core.error.BrokerRoundTripException;
import com.kafcat.core.error.ConfigurationException;
import com.kafcat.core.error.ConnectionException;
import com.kafcat.core.error.KafcatException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class KafcatAppTest {

    @Test
    void testSetupFailuresExitWithOne() {
        assertEquals(1, KafcatApp.exitCodeFor(new ConfigurationException("Topic is required")));
        assertEquals(1, KafcatApp.exitCodeFor(new ConnectionException("Consumer creation failed", new RuntimeException())));
    }

    @Test
    void testRuntimeFailuresExitWithTwo() {
        assertEquals(2, KafcatApp.exitCodeFor(new BrokerRoundTripException("poll timed out", new RuntimeException())));
        assertEquals(2, KafcatApp.exitCodeFor(new KafcatException("closed")));
        assertEquals(2, KafcatApp.exitCodeFor(new IllegalArgumentException("Cannot parse JSON")));
    }
}
