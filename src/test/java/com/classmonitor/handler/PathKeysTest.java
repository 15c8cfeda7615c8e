package com.classmonitor.handler;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PathKeysTest {

    @Test
    void readsTrailingSegment() {
        assertEquals("room-7", PathKeys.lastSegment(URI.create("ws://host/api/websocket/ws/stream/room-7?token=abc")));
        assertEquals("teacher-5", PathKeys.lastSegment(URI.create("ws://host/api/websocket/ws/alerts/teacher-5/")));
        assertEquals("", PathKeys.lastSegment(URI.create("ws://host/")));
    }
}
