package turnstile.lock;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LockRegistryTest {

    @Test
    void registersOnce() {
        LockRegistry registry = new LockRegistry();
        LockId id = LockId.task("a");

        assertTrue(registry.tryRegister(id));
        assertFalse(registry.tryRegister(id));
        assertTrue(registry.isRegistered(id));
        assertEquals(1, registry.size());
    }

    @Test
    void unregisterFreesTheId() {
        LockRegistry registry = new LockRegistry();
        LockId id = LockId.task("a");
        registry.tryRegister(id);

        registry.unregister(id);

        assertFalse(registry.isRegistered(id));
        assertTrue(registry.tryRegister(id));
    }

    @Test
    void unregisterUnknownIsNoop() {
        LockRegistry registry = new LockRegistry();
        registry.unregister(LockId.task("never"));
        assertEquals(0, registry.size());
    }
}
