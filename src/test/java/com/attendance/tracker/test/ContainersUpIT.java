package com.attendance.tracker.test;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertTrue;

class ContainersUpIT extends BaseContainers {
    @Test
    void containersAreRunning() {
        assertTrue(BaseContainers.MONGO.isRunning(), "Mongo must run");
    }
}
