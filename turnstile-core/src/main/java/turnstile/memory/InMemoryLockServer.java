package turnstile.memory;

import turnstile.StoreException;
import turnstile.lock.LockId;
import turnstile.spi.LockDatabase;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Advisory-lock server living inside one JVM.
 *
 * <p>Stands in for the database's lock table when all coordinators run in the same process
 * (single-node deployments on databases without advisory locks, and tests). Each
 * {@link #openSession()} behaves like a separate database session: locks are reentrant
 * within a session, exclusive across sessions, and released when the session closes.
 *
 * <p>This class is thread-safe.
 */
public final class InMemoryLockServer {

    private final Map<LockId, Hold> holds = new HashMap<>();

    /**
     * Opens a new session. Give each {@link turnstile.lock.LockCoordinator} its own.
     */
    public LockDatabase openSession() {
        return new Session();
    }

    /**
     * Whether any session holds {@code id}.
     */
    public synchronized boolean isLocked(LockId id) {
        return holds.containsKey(id);
    }

    private synchronized boolean tryAcquire(Session session, LockId id) {
        Hold hold = holds.get(id);
        if (hold == null) {
            holds.put(id, new Hold(session));
            return true;
        }
        if (hold.owner == session) {
            hold.count++;
            return true;
        }
        return false;
    }

    private synchronized boolean release(Session session, LockId id) {
        Hold hold = holds.get(id);
        if (hold == null || hold.owner != session) {
            return false;
        }
        if (--hold.count == 0) {
            holds.remove(id);
        }
        return true;
    }

    private synchronized void releaseAll(Session session) {
        Iterator<Hold> it = holds.values().iterator();
        while (it.hasNext()) {
            if (it.next().owner == session) {
                it.remove();
            }
        }
    }

    private static final class Hold {
        private final Session owner;
        private int count = 1;

        private Hold(Session owner) {
            this.owner = owner;
        }
    }

    private final class Session implements LockDatabase {
        private volatile boolean closed;

        @Override
        public boolean tryAcquire(LockId id) {
            ensureOpen();
            return InMemoryLockServer.this.tryAcquire(this, id);
        }

        @Override
        public boolean release(LockId id) {
            ensureOpen();
            return InMemoryLockServer.this.release(this, id);
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                releaseAll(this);
            }
        }

        private void ensureOpen() {
            if (closed) {
                throw new StoreException("Lock session is closed");
            }
        }
    }
}
