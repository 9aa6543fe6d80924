package io.ledgerpoller.util;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DaemonThreadFactoryTest {

    @Test
    void createsNamedDaemonThreads() {
        DaemonThreadFactory factory = new DaemonThreadFactory("ledger-poller-query-");

        Thread thread = factory.newThread(() -> {
        });

        assertTrue(thread.isDaemon());
        assertEquals("ledger-poller-query-1", thread.getName());
    }

    @Test
    void sequentialNaming() {
        DaemonThreadFactory factory = new DaemonThreadFactory("test-");

        Thread t1 = factory.newThread(() -> {
        });
        Thread t2 = factory.newThread(() -> {
        });

        assertEquals("test-1", t1.getName());
        assertEquals("test-2", t2.getName());
    }

    @Test
    void uncaughtFailureIsLogged() throws Exception {
        Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());
        List<LogRecord> records = new ArrayList<>();
        Handler handler = new Handler() {
            @Override
            public void publish(LogRecord record) {
                synchronized (records) {
                    records.add(record);
                }
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        logger.addHandler(handler);
        try {
            IllegalStateException boom = new IllegalStateException("boom");
            Thread thread = new DaemonThreadFactory("failing-").newThread(() -> {
                throw boom;
            });
            thread.start();
            thread.join(5_000);

            synchronized (records) {
                assertEquals(1, records.size());
                assertEquals(Level.SEVERE, records.get(0).getLevel());
                assertSame(boom, records.get(0).getThrown());
                assertTrue(records.get(0).getMessage().contains("failing-1"));
            }
        } finally {
            logger.removeHandler(handler);
        }
    }

    @Test
    void nullPrefixThrows() {
        assertThrows(NullPointerException.class, () ->
                new DaemonThreadFactory(null));
    }
}
