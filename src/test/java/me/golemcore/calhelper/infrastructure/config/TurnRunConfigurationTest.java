package me.golemcore.calhelper.infrastructure.config;

import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TurnRunConfigurationTest {

    @Test
    void shouldRunTurnsOnNamedDaemonThreads() throws Exception {
        TurnRunConfiguration configuration = new TurnRunConfiguration();
        ExecutorService executor = configuration.turnRunExecutor();

        Thread worker = executor.submit(Thread::currentThread).get(5, TimeUnit.SECONDS);

        assertEquals("turn-run", worker.getName());
        assertTrue(worker.isDaemon());
        assertSame(executor, configuration.turnRunExecutor());

        configuration.shutdown();
        assertTrue(executor.isShutdown());
    }
}
