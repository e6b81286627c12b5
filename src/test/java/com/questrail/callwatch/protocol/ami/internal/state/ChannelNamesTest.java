package com.questrail.callwatch.protocol.ami.internal.state;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ChannelNamesTest {

    @Test
    void extractsPeerFromTechnologyChannels() {
        assertEquals(Optional.of("101"), ChannelNames.peer("PJSIP/101-0000001a"));
        assertEquals(Optional.of("alice"), ChannelNames.peer("SIP/alice@pbx-00000003"));
        assertEquals(Optional.of("1"), ChannelNames.peer("DAHDI/1-1"));
        assertEquals(Optional.of("trunk-a"), ChannelNames.peer("PJSIP/trunk-a-00000009"));
    }

    @Test
    void localAndMalformedChannelsHaveNoPeer() {
        assertTrue(ChannelNames.peer("Local/101@from-internal-00000001;1").isEmpty());
        assertTrue(ChannelNames.peer("local/101@from-internal-00000001;2").isEmpty());
        assertTrue(ChannelNames.peer("NoSlash").isEmpty());
        assertTrue(ChannelNames.peer("PJSIP/").isEmpty());
        assertTrue(ChannelNames.peer(null).isEmpty());
    }
}
