package net.spookly.hyping.server;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import net.spookly.hyping.client.QueryClient;
import net.spookly.hyping.client.QueryResult;
import net.spookly.hyping.protocol.QueryCodec;
import net.spookly.hyping.protocol.QueryTransportException;
import net.spookly.hyping.status.BattleMode;
import net.spookly.hyping.status.LiveStatusSource;
import net.spookly.hyping.status.StatusRecord;
import org.junit.jupiter.api.Test;

class QueryServerIntegrationTest {
    private static final InetSocketAddress LOOPBACK = new InetSocketAddress("127.0.0.1", 0);
    private static final StatusRecord STATUS =
            new StatusRecord(new byte[StatusRecord.BUILD_ID_LENGTH], 5, 100, BattleMode.globalPve());

    @Test
    void clientReceivesPublishedStatus() throws Exception {
        QueryMetrics metrics = new QueryMetrics();
        try (QueryServer server = new QueryServer(LOOPBACK, new LiveStatusSource(STATUS));
             QueryClient client = new QueryClient(server.start(metrics))) {
            QueryResult result = client.status(Duration.ofSeconds(1));

            assertEquals(STATUS, result.status());
            assertTrue(result.roundTrip().compareTo(Duration.ZERO) > 0);
            assertTrue(result.roundTrip().compareTo(Duration.ofSeconds(1)) < 0);
            assertTrue(awaitCondition(() -> metrics.snapshot().sentResponses() == 1L, 2_000));
        }
    }

    @Test
    void laterQueriesSeePublishedUpdates() throws Exception {
        LiveStatusSource source = new LiveStatusSource(STATUS);
        try (QueryServer server = new QueryServer(LOOPBACK, source);
             QueryClient client = new QueryClient(server.start(new QueryMetrics()))) {
            assertEquals(STATUS, client.status(Duration.ofSeconds(1)).status());

            StatusRecord updated = StatusRecord.of("rel-2", 42, 100, BattleMode.perPlayer(true));
            source.publish(updated);

            assertEquals(updated, client.status(Duration.ofSeconds(1)).status());
        }
    }

    @Test
    void concurrentClientsAreAllAnswered() throws Exception {
        int clients = 8;
        int queriesPerClient = 25;
        QueryMetrics metrics = new QueryMetrics();
        ExecutorService executor = Executors.newFixedThreadPool(clients);
        try (QueryServer server = new QueryServer(LOOPBACK, new LiveStatusSource(STATUS))) {
            InetSocketAddress address = server.start(metrics);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Integer>> results = new ArrayList<>();
            for (int i = 0; i < clients; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    int matched = 0;
                    try (QueryClient client = new QueryClient(address)) {
                        for (int j = 0; j < queriesPerClient; j++) {
                            if (STATUS.equals(client.status(Duration.ofSeconds(2)).status())) {
                                matched++;
                            }
                        }
                    }
                    return matched;
                }));
            }
            start.countDown();
            int matched = 0;
            for (Future<Integer> result : results) {
                matched += result.get(30, TimeUnit.SECONDS);
            }

            long expected = (long) clients * queriesPerClient;
            assertEquals(expected, matched);
            assertTrue(awaitCondition(() -> metrics.snapshot().sentResponses() == expected, 2_000));
            QueryMetricsSnapshot snapshot = metrics.snapshot();
            assertEquals(expected, snapshot.requests());
            assertEquals(0L, snapshot.errors());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void malformedDatagramsDoNotDisturbValidOnes() throws Exception {
        int valid = 5;
        byte[][] malformed = {
                {0x02},
                {0x00, 0x01, 0x02},
                new byte[QueryCodec.MAX_REQUEST_SIZE + 10]
        };
        QueryMetrics metrics = new QueryMetrics();
        try (QueryServer server = new QueryServer(LOOPBACK, new LiveStatusSource(STATUS));
             DatagramSocket socket = new DatagramSocket(new InetSocketAddress("127.0.0.1", 0))) {
            InetSocketAddress address = server.start(metrics);
            socket.setSoTimeout(2_000);
            for (int i = 0; i < valid; i++) {
                send(socket, malformed[i % malformed.length], address);
                send(socket, QueryCodec.encodeRequest(), address);
            }

            byte[] expected = QueryCodec.encodeResponse(STATUS);
            for (int i = 0; i < valid; i++) {
                assertArrayEquals(expected, receive(socket));
            }
            socket.setSoTimeout(300);
            assertNull(receive(socket));

            assertTrue(awaitCondition(() -> metrics.snapshot().invalidPackets() == valid, 2_000));
            QueryMetricsSnapshot snapshot = metrics.snapshot();
            assertEquals(valid, snapshot.requests());
            assertEquals(2L * valid, snapshot.receivedPackets());
            assertTrue(server.isRunning());
        }
    }

    @Test
    void runReturnsAfterStop() throws Exception {
        QueryServer server = new QueryServer(LOOPBACK, new LiveStatusSource(STATUS));
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread runner = new Thread(() -> {
            try {
                server.run(new QueryMetrics());
            } catch (Throwable t) {
                failure.set(t);
            }
        }, "query-server-runner");
        runner.start();

        assertTrue(awaitCondition(server::isRunning, 5_000));
        server.stop();
        runner.join(5_000);

        assertFalse(runner.isAlive());
        assertNull(failure.get());
        assertFalse(server.isRunning());
    }

    @Test
    void runReturnsWhenInterrupted() throws Exception {
        QueryServer server = new QueryServer(LOOPBACK, new LiveStatusSource(STATUS));
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread runner = new Thread(() -> {
            try {
                server.run(new QueryMetrics());
            } catch (Throwable t) {
                failure.set(t);
            }
        }, "query-server-runner");
        runner.start();

        assertTrue(awaitCondition(server::isRunning, 5_000));
        runner.interrupt();
        runner.join(5_000);

        assertFalse(runner.isAlive());
        assertNull(failure.get());
        assertFalse(server.isRunning());
    }

    @Test
    void runFailsWhenListenerClosesOnItsOwn() throws Exception {
        QueryServer server = new QueryServer(LOOPBACK, new LiveStatusSource(STATUS));
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread runner = new Thread(() -> {
            try {
                server.run(new QueryMetrics());
            } catch (Throwable t) {
                failure.set(t);
            }
        }, "query-server-runner");
        runner.start();

        assertTrue(awaitCondition(server::isRunning, 5_000));
        server.channel().close().syncUninterruptibly();
        runner.join(5_000);

        assertFalse(runner.isAlive());
        assertTrue(failure.get() instanceof QueryTransportException);
        assertFalse(server.isRunning());
    }

    @Test
    void runReturnsWhenStoppedBeforeStart() {
        QueryServer server = new QueryServer(LOOPBACK, new LiveStatusSource(STATUS));
        server.stop();

        assertDoesNotThrow(() -> server.run(new QueryMetrics()));
        assertNull(server.localAddress());
        assertThrows(IllegalStateException.class, () -> server.start(new QueryMetrics()));
    }

    @Test
    void bindConflictIsReportedAsTransportFailure() throws Exception {
        try (DatagramSocket occupied = new DatagramSocket(new InetSocketAddress("127.0.0.1", 0))) {
            InetSocketAddress taken = new InetSocketAddress("127.0.0.1", occupied.getLocalPort());
            try (QueryServer server = new QueryServer(taken, new LiveStatusSource(STATUS))) {
                assertThrows(QueryTransportException.class, () -> server.start(new QueryMetrics()));
                assertFalse(server.isRunning());
            }
        }
    }

    private static void send(DatagramSocket socket, byte[] payload, InetSocketAddress target) throws Exception {
        socket.send(new java.net.DatagramPacket(payload, payload.length, target));
    }

    private static byte[] receive(DatagramSocket socket) throws Exception {
        byte[] buffer = new byte[256];
        java.net.DatagramPacket packet = new java.net.DatagramPacket(buffer, buffer.length);
        try {
            socket.receive(packet);
        } catch (SocketTimeoutException e) {
            return null;
        }
        return Arrays.copyOf(packet.getData(), packet.getLength());
    }

    private static boolean awaitCondition(BooleanSupplier condition, long timeoutMillis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(10);
        }
        return condition.getAsBoolean();
    }
}
