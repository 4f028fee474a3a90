package com.questrail.booking.config;

import com.questrail.booking.client.InvocationPolicy;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ServerConfigTest {

    @Test
    void defaultsMatchTheClientRetryBudget() {
        ServerConfig config = ServerConfig.defaults();

        assertEquals(Duration.ofMillis(22_000), config.replyRetention());
        assertEquals(10_000, config.replyCacheCapacity());
        assertEquals(4, config.workerThreads());
        assertTrue(config.replyCacheEnabled());
        assertTrue(config.lossProfile().isLossless());
        assertEquals(new InetSocketAddress("127.0.0.1", ServerConfig.DEFAULT_PORT), config.bindAddress());
    }

    @Test
    void invocationPolicyDefaults() {
        InvocationPolicy policy = InvocationPolicy.defaults();
        assertEquals(Duration.ofMillis(500), policy.timeout());
        assertEquals(10, policy.maxRetries());
        assertEquals(Duration.ofMillis(5500), policy.worstCaseDuration());
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.builder().withFacilities("A", "A").build());
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.builder().withWorkerThreads(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.builder().withReplyRetention(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.builder().withReplyCacheCapacity(0).build());
        assertThrows(NullPointerException.class,
                () -> ServerConfig.builder().withLossProfile(null).build());
        assertThrows(IllegalArgumentException.class, () -> new InvocationPolicy(Duration.ZERO, 1));
        assertThrows(IllegalArgumentException.class, () -> new InvocationPolicy(Duration.ofMillis(1), -1));
    }

    @Test
    void facilityListIsCopied() {
        List<String> names = new ArrayList<>(List.of("Room101"));
        ServerConfig config = ServerConfig.builder().withFacilities(names).build();
        names.add("Lab");
        assertEquals(List.of("Room101"), config.facilities());
    }

    @Test
    void clientConfigDefaultsToEphemeralPortAndDefaultServer() {
        ClientConfig config = ClientConfig.builder().build();
        assertEquals(0, config.bindAddress().getPort());
        assertEquals(ServerConfig.DEFAULT_PORT, config.serverAddress().getPort());
        assertNotEquals(config.clientId(), ClientConfig.builder().build().clientId());
    }
}
