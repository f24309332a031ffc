package com.questrail.rendezvous.protocol.slice;

import com.questrail.rendezvous.key.KeyPrefix;
import com.questrail.rendezvous.model.DataType;

import java.time.Duration;
import java.util.Objects;

/**
 * Static parameters of one sliced transfer edge. Sender and receiver must be
 * built from equal configurations.
 *
 * @param recvTimeout per-phase receive timeout; {@link Duration#ZERO} waits
 *        indefinitely
 */
public record SliceTransferConfig(
    String sourceEndpoint,
    String destinationEndpoint,
    long sourceIncarnation,
    String channelName,
    long sliceSize,
    DataType dataType,
    Duration recvTimeout
) {
    public SliceTransferConfig {
        Objects.requireNonNull(sourceEndpoint, "sourceEndpoint");
        Objects.requireNonNull(destinationEndpoint, "destinationEndpoint");
        Objects.requireNonNull(channelName, "channelName");
        Objects.requireNonNull(dataType, "dataType");
        Objects.requireNonNull(recvTimeout, "recvTimeout");
        if (sliceSize <= 0 || sliceSize > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("sliceSize must be in [1, " + Integer.MAX_VALUE + "], was " + sliceSize);
        }
        if (recvTimeout.isNegative()) {
            throw new IllegalArgumentException("recvTimeout must not be negative");
        }
    }

    /**
     * @throws com.questrail.rendezvous.key.MalformedKeyException if an endpoint
     *         or the channel name cannot form a key
     */
    public KeyPrefix keyPrefix() {
        return KeyPrefix.of(sourceEndpoint, sourceIncarnation, destinationEndpoint, channelName);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String sourceEndpoint;
        private String destinationEndpoint;
        private long sourceIncarnation;
        private String channelName;
        private long sliceSize = 64L * 1024;
        private DataType dataType;
        private Duration recvTimeout = Duration.ZERO;

        public Builder withSourceEndpoint(String sourceEndpoint) {
            this.sourceEndpoint = sourceEndpoint;
            return this;
        }

        public Builder withDestinationEndpoint(String destinationEndpoint) {
            this.destinationEndpoint = destinationEndpoint;
            return this;
        }

        public Builder withSourceIncarnation(long sourceIncarnation) {
            this.sourceIncarnation = sourceIncarnation;
            return this;
        }

        public Builder withChannelName(String channelName) {
            this.channelName = channelName;
            return this;
        }

        public Builder withSliceSize(long sliceSize) {
            this.sliceSize = sliceSize;
            return this;
        }

        public Builder withDataType(DataType dataType) {
            this.dataType = dataType;
            return this;
        }

        public Builder withRecvTimeout(Duration recvTimeout) {
            this.recvTimeout = recvTimeout;
            return this;
        }

        public SliceTransferConfig build() {
            return new SliceTransferConfig(sourceEndpoint, destinationEndpoint, sourceIncarnation,
                    channelName, sliceSize, dataType, recvTimeout);
        }
    }
}
