package com.questrail.booking.config;

import com.questrail.booking.client.InvocationPolicy;
import com.questrail.booking.model.ClientId;
import com.questrail.booking.transport.lossy.LossProfile;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Configuration of a booking client runtime.
 *
 * <p>The client binds an ephemeral port by default. A fresh random
 * {@link ClientId} is drawn per builder unless one is supplied.</p>
 */
public record ClientConfig(
    InetSocketAddress bindAddress,
    InetSocketAddress serverAddress,
    ClientId clientId,
    LossProfile lossProfile,
    InvocationPolicy invocationPolicy
) {
    public ClientConfig {
        Objects.requireNonNull(bindAddress, "bindAddress");
        Objects.requireNonNull(serverAddress, "serverAddress");
        Objects.requireNonNull(clientId, "clientId");
        Objects.requireNonNull(lossProfile, "lossProfile");
        Objects.requireNonNull(invocationPolicy, "invocationPolicy");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private InetSocketAddress bindAddress = new InetSocketAddress(0);
        private InetSocketAddress serverAddress = new InetSocketAddress("127.0.0.1", ServerConfig.DEFAULT_PORT);
        private ClientId clientId = ClientId.random();
        private LossProfile lossProfile = LossProfile.none();
        private InvocationPolicy invocationPolicy = InvocationPolicy.defaults();

        public Builder withBindAddress(InetSocketAddress bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public Builder withServerAddress(InetSocketAddress serverAddress) {
            this.serverAddress = serverAddress;
            return this;
        }

        public Builder withClientId(ClientId clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder withLossProfile(LossProfile lossProfile) {
            this.lossProfile = lossProfile;
            return this;
        }

        public Builder withInvocationPolicy(InvocationPolicy invocationPolicy) {
            this.invocationPolicy = invocationPolicy;
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(bindAddress, serverAddress, clientId, lossProfile, invocationPolicy);
        }
    }
}
