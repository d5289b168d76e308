package turnstile.lock;

import turnstile.StoreException;
import turnstile.spi.LeaseStore;

import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link LeaseStore} with the same time-gate semantics as the JDBC one.
 */
final class StubLeaseStore implements LeaseStore {
    final Map<String, Instant> claims = new ConcurrentHashMap<>();
    final AtomicInteger renewals = new AtomicInteger();
    volatile boolean failing;
    volatile Runnable afterSign = () -> {};

    static Connection stubConnection() {
        return (Connection) Proxy.newProxyInstance(
            Connection.class.getClassLoader(),
            new Class<?>[]{Connection.class},
            (proxy, method, args) -> null);
    }

    @Override
    public void ensureExists(Connection conn, String name) {
        checkFailing();
        claims.putIfAbsent(name, Instant.EPOCH);
    }

    @Override
    public synchronized boolean attemptSign(Connection conn, String name, Instant now, Duration interval) {
        checkFailing();
        Instant last = claims.get(name);
        if (last == null || last.isAfter(now.minus(interval))) {
            return false;
        }
        claims.put(name, now);
        afterSign.run();
        return true;
    }

    @Override
    public boolean renew(Connection conn, String name, Instant now) {
        checkFailing();
        if (claims.replace(name, now) == null) {
            return false;
        }
        renewals.incrementAndGet();
        return true;
    }

    private void checkFailing() {
        if (failing) {
            throw new StoreException("lease table unavailable");
        }
    }
}
