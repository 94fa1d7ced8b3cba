package org.abstractica.chat.server;

import org.abstractica.chat.protocol.Message;
import org.abstractica.chat.session.ChatStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.EOFException;
import java.io.IOException;
import java.net.Socket;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class OutboxTest
{
    private ExecutorService drains;
    private Socket client;
    private Socket server;
    private ChatStream peer;

    @BeforeEach
    void setUp() throws IOException
    {
        drains = Executors.newCachedThreadPool();
        Socket[] pair = TestConnections.loopbackPair();
        client = pair[0];
        server = pair[1];
        peer = new ChatStream(client);
    }

    @AfterEach
    void tearDown() throws IOException
    {
        drains.shutdownNow();
        client.close();
        server.close();
    }

    @Test
    void offer_started_writesInOrder() throws Exception
    {
        Outbox outbox = newOutbox(16);
        outbox.start(drains);

        for (int i = 0; i < 50; i++)
        {
            assertTrue(outbox.offer(new Message.NickedUserMsg("alice", "m" + i)));
        }

        for (int i = 0; i < 50; i++)
        {
            assertEquals(new Message.NickedUserMsg("alice", "m" + i), peer.receive());
        }
    }

    @Test
    void offer_notStarted_queuesUpToCapacity() throws IOException
    {
        Outbox outbox = newOutbox(3);

        assertTrue(outbox.offer(new Message.NickedConnect("a")));
        assertTrue(outbox.offer(new Message.NickedConnect("b")));
        assertTrue(outbox.offer(new Message.NickedConnect("c")));

        assertEquals(3, outbox.pending());
        assertFalse(outbox.isClosed());
    }

    @Test
    void offer_overCapacity_disconnectsUser() throws IOException
    {
        Outbox outbox = newOutbox(2);
        outbox.offer(new Message.NickedConnect("a"));
        outbox.offer(new Message.NickedConnect("b"));

        assertFalse(outbox.offer(new Message.NickedConnect("c")));

        assertTrue(outbox.isClosed());
        assertEquals(0, outbox.pending());
        assertThrows(EOFException.class, peer::receive);
    }

    @Test
    void close_refusesFurtherMessages() throws IOException
    {
        Outbox outbox = newOutbox(4);
        outbox.start(drains);

        outbox.close();

        assertFalse(outbox.offer(new Message.NickedConnect("late")));
        assertThrows(EOFException.class, peer::receive);
    }

    @Test
    void writeFailure_closesOutbox() throws Exception
    {
        Outbox outbox = newOutbox(4);
        outbox.start(drains);
        server.close();

        outbox.offer(new Message.NickedConnect("a"));

        TestConnections.awaitCondition(outbox::isClosed, "outbox to close after a failed write");
    }

    @Test
    void constructor_nonPositiveCapacity_throws() throws IOException
    {
        ChatStream stream = new ChatStream(server);
        assertThrows(IllegalArgumentException.class,
                () -> new Outbox("alice", stream.split().writer(), 0));
    }

    private Outbox newOutbox(int capacity) throws IOException
    {
        return new Outbox("alice", new ChatStream(server).split().writer(), capacity);
    }
}
