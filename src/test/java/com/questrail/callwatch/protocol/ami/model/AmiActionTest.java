package com.questrail.callwatch.protocol.ami.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class AmiActionTest
{
    @Test
    void actionIdIsInsertedAfterActionAndReplacesExisting()
    {
        AmiAction action = AmiAction.named("Ping").field("ActionID", "old").build();

        AmiAction tagged = action.withActionId("callwatch-1");

        assertEquals("Action", tagged.fields().get(0).name());
        assertEquals("ActionID", tagged.fields().get(1).name());
        assertEquals("callwatch-1", tagged.get("actionid").orElseThrow());
        assertEquals(2, tagged.fields().size());
        assertEquals("old", action.get("ActionID").orElseThrow());
    }

    @Test
    void toStringMasksSecret()
    {
        AmiAction login = AmiAction.named("Login").field("Username", "admin").field("Secret", "hunter2").build();

        assertFalse(login.toString().contains("hunter2"));
        assertTrue(login.toString().contains("admin"));
    }

    @Test
    void blankActionNameIsRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> AmiAction.named(" "));
    }
}
