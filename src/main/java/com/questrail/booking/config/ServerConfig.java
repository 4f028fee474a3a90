package com.questrail.booking.config;

import com.questrail.booking.client.InvocationPolicy;
import com.questrail.booking.transport.lossy.LossProfile;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Configuration of a booking server runtime.
 *
 * <p>The default reply retention is four times the longest a client using
 * {@link InvocationPolicy#defaults()} keeps retransmitting one request.</p>
 */
public record ServerConfig(
    InetSocketAddress bindAddress,
    List<String> facilities,
    LossProfile lossProfile,
    boolean replyCacheEnabled,
    Duration replyRetention,
    int replyCacheCapacity,
    int workerThreads,
    Duration purgeInterval
) {
    public static final int DEFAULT_PORT = 34524;

    public ServerConfig {
        Objects.requireNonNull(bindAddress, "bindAddress");
        Objects.requireNonNull(facilities, "facilities");
        Objects.requireNonNull(lossProfile, "lossProfile");
        Objects.requireNonNull(replyRetention, "replyRetention");
        Objects.requireNonNull(purgeInterval, "purgeInterval");

        facilities = List.copyOf(facilities);
        if (new LinkedHashSet<>(facilities).size() != facilities.size()) {
            throw new IllegalArgumentException("facility names must be unique: " + facilities);
        }
        if (replyRetention.isZero() || replyRetention.isNegative()) {
            throw new IllegalArgumentException("replyRetention must be > 0");
        }
        if (replyCacheCapacity < 1) {
            throw new IllegalArgumentException("replyCacheCapacity must be >= 1");
        }
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be >= 1");
        }
        if (purgeInterval.isZero() || purgeInterval.isNegative()) {
            throw new IllegalArgumentException("purgeInterval must be > 0");
        }
    }

    public static Duration defaultReplyRetention() {
        return InvocationPolicy.defaults().worstCaseDuration().multipliedBy(4);
    }

    public static ServerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private InetSocketAddress bindAddress = new InetSocketAddress("127.0.0.1", DEFAULT_PORT);
        private List<String> facilities = List.of();
        private LossProfile lossProfile = LossProfile.none();
        private boolean replyCacheEnabled = true;
        private Duration replyRetention = defaultReplyRetention();
        private int replyCacheCapacity = 10_000;
        private int workerThreads = 4;
        private Duration purgeInterval = Duration.ofSeconds(5);

        public Builder withBindAddress(InetSocketAddress bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public Builder withFacilities(List<String> facilities) {
            this.facilities = facilities;
            return this;
        }

        public Builder withFacilities(String... facilities) {
            return withFacilities(List.of(facilities));
        }

        public Builder withLossProfile(LossProfile lossProfile) {
            this.lossProfile = lossProfile;
            return this;
        }

        public Builder withReplyCacheEnabled(boolean enabled) {
            this.replyCacheEnabled = enabled;
            return this;
        }

        public Builder withReplyRetention(Duration retention) {
            this.replyRetention = retention;
            return this;
        }

        public Builder withReplyCacheCapacity(int capacity) {
            this.replyCacheCapacity = capacity;
            return this;
        }

        public Builder withWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder withPurgeInterval(Duration purgeInterval) {
            this.purgeInterval = purgeInterval;
            return this;
        }

        public ServerConfig build() {
            return new ServerConfig(bindAddress, facilities, lossProfile, replyCacheEnabled,
                    replyRetention, replyCacheCapacity, workerThreads, purgeInterval);
        }
    }
}
