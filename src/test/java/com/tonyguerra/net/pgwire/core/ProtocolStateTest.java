package com.tonyguerra.net.pgwire.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.tonyguerra.net.pgwire.enums.Phase;

final class ProtocolStateTest {

    @Test
    void namesFollowTheStateKind() {
        assertEquals("Ready", ProtocolState.READY.name());
        assertEquals("CopyIn", new ProtocolState.CopyIn(new CopyFormat(false, new boolean[0])).name());
        assertEquals("Broken", new ProtocolState.Broken("eof").name());
    }

    @Test
    void onlyCopyStatesCarryAFormat() {
        final var format = new CopyFormat(true, new boolean[] { true });

        assertSame(format, new ProtocolState.CopyOut(format).copyFormat());
        assertNull(ProtocolState.READY.copyFormat());
        assertNull(new ProtocolState.Executing("SELECT 1").copyFormat());
    }

    @Test
    void copyStatesRequireAFormat() {
        assertThrows(NullPointerException.class, () -> new ProtocolState.CopyIn(null));
        assertThrows(NullPointerException.class, () -> new ProtocolState.CopyOut(null));
    }

    @Test
    void phasesMatch() {
        assertEquals(Phase.CLOSED, ProtocolState.CLOSED.phase());
        assertEquals(Phase.CONNECTING, ProtocolState.CONNECTING.phase());
        assertEquals(Phase.EXECUTING, new ProtocolState.Executing("x").phase());
        assertEquals(Phase.BROKEN, new ProtocolState.Broken("x").phase());
    }
}
