package com.nodegraph.codegen.registry;

import org.junit.Test;

import static org.junit.Assert.*;

public class PortKindsTest {

    @Test
    public void testReservedKinds() {
        assertTrue(PortKinds.isExec("exec"));
        assertFalse(PortKinds.isExec("data"));
        assertFalse(PortKinds.isExec(null));
        assertTrue(PortKinds.isWildcard("data"));
        assertFalse(PortKinds.isWildcard("float"));
    }
}
