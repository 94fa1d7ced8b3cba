package org.abstractica.chat.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Nicknames of connected users mapped to their {@link Outbox}.
 *
 * <p>A nickname is first reserved by the admission check and becomes an entry
 * once its connection is active. Reservations count towards capacity, so two
 * connections can never both be admitted under the same nickname.</p>
 *
 * <p>All access happens under one lock, held only for map operations. Nothing
 * blocks on the network while holding it apart from {@link #closeAll()}, which
 * only closes sockets.</p>
 */
public class UserRegistry
{
    private static final Logger LOG = LoggerFactory.getLogger(UserRegistry.class);

    /**
     * Outcome of an admission check.
     */
    public enum Admission
    {
        ACCEPTED(null),
        TOO_MANY_USERS("too many users"),
        NICK_TAKEN("nick taken"),
        SHUT_DOWN(null);

        private final String reason;

        Admission(String reason)
        {
            this.reason = reason;
        }

        /**
         * Returns the reason sent to a rejected client.
         *
         * @return the rejection reason, or null if nothing is sent
         */
        public String getReason()
        {
            return reason;
        }
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Outbox> users = new HashMap<>();
    private final Set<String> reserved = new HashSet<>();
    private final int maxUsers;
    private boolean closed;

    /**
     * Creates an empty registry.
     *
     * @param maxUsers maximum number of entries and reservations together
     */
    public UserRegistry(int maxUsers)
    {
        if (maxUsers <= 0)
        {
            throw new IllegalArgumentException("maxUsers must be positive: " + maxUsers);
        }
        this.maxUsers = maxUsers;
    }

    /**
     * Checks capacity and nickname uniqueness in one step and reserves the
     * nickname if both pass.
     *
     * @param nick the requested nickname
     * @return {@link Admission#ACCEPTED} if the nickname is now reserved
     */
    public Admission tryReserve(String nick)
    {
        Objects.requireNonNull(nick, "nick");
        lock.lock();
        try
        {
            if (closed)
            {
                return Admission.SHUT_DOWN;
            }
            if (users.size() + reserved.size() >= maxUsers)
            {
                return Admission.TOO_MANY_USERS;
            }
            if (users.containsKey(nick) || reserved.contains(nick))
            {
                return Admission.NICK_TAKEN;
            }
            reserved.add(nick);
            return Admission.ACCEPTED;
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * Turns a reservation into an entry.
     *
     * <p>The reservation is consumed either way. After {@link #closeAll()} the
     * outbox is not registered and the caller must close it.</p>
     *
     * @param nick   a nickname reserved by {@link #tryReserve(String)}
     * @param outbox the user's outbound queue
     * @return true if registered, false if the registry has been closed
     */
    public boolean register(String nick, Outbox outbox)
    {
        Objects.requireNonNull(nick, "nick");
        Objects.requireNonNull(outbox, "outbox");
        lock.lock();
        try
        {
            if (!reserved.remove(nick))
            {
                throw new IllegalStateException("Nickname not reserved: " + nick);
            }
            if (closed)
            {
                return false;
            }
            users.put(nick, outbox);
            return true;
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * Drops a reservation whose connection never became active.
     *
     * @param nick the reserved nickname
     */
    public void release(String nick)
    {
        lock.lock();
        try
        {
            reserved.remove(nick);
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * Removes a user's entry.
     *
     * @param nick the nickname
     * @return true if the nickname was registered
     */
    public boolean remove(String nick)
    {
        lock.lock();
        try
        {
            return users.remove(nick) != null;
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * Returns a copy of the current entries for delivery outside the lock.
     *
     * @return nickname to outbox, in no particular order
     */
    public Map<String, Outbox> snapshot()
    {
        lock.lock();
        try
        {
            return new LinkedHashMap<>(users);
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * Closes the transport of every registered user and refuses further
     * admissions.
     *
     * <p>Each closed connection's read loop then fails and tears itself down,
     * removing its own entry.</p>
     */
    public void closeAll()
    {
        int count;
        lock.lock();
        try
        {
            closed = true;
            for (Outbox outbox : users.values())
            {
                outbox.close();
            }
            count = users.size();
        }
        finally
        {
            lock.unlock();
        }
        LOG.info("Closed {} user connection(s)", count);
    }

    /**
     * Returns the registered nicknames, sorted.
     *
     * @return an unmodifiable snapshot
     */
    public Set<String> nicknames()
    {
        lock.lock();
        try
        {
            return Collections.unmodifiableSet(new TreeSet<>(users.keySet()));
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * Returns the number of registered users, reservations excluded.
     *
     * @return the user count
     */
    public int size()
    {
        lock.lock();
        try
        {
            return users.size();
        }
        finally
        {
            lock.unlock();
        }
    }
}
