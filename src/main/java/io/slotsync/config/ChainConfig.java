package io.slotsync.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.slotsync.Network;
import io.slotsync.config.spec.ChainSpec;
import io.slotsync.core.EpochSize;
import io.slotsync.core.SlotLength;
import io.slotsync.core.StartTime;
import io.slotsync.core.SyncTolerance;
import io.slotsync.core.era.EraParams;
import io.slotsync.core.era.Summary;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Chain parameters read from {@code /chain/<network>.json} on the classpath.
 */
@Slf4j
@Getter
@ToString
public class ChainConfig implements ChainSpec {

    @Setter
    private Network network;

    private final StartTime startTime;

    private final Summary summary;

    private final SyncTolerance syncTolerance;

    private final Duration reportInterval;

    public ChainConfig(Network network, StartTime startTime, Summary summary, SyncTolerance syncTolerance,
                       Duration reportInterval) {
        this.network = network;
        this.startTime = startTime;
        this.summary = summary;
        this.syncTolerance = syncTolerance;
        this.reportInterval = reportInterval;
    }

    @JsonCreator
    public static ChainConfig jsonCreator(
            @JsonProperty("startTime") String startTime,
            @JsonProperty("syncToleranceSeconds") long syncToleranceSeconds,
            @JsonProperty("reportIntervalSeconds") long reportIntervalSeconds,
            @JsonProperty("eras") List<Era> eras) {
        if (startTime == null) {
            throw new ChainConfigException("Missing startTime");
        }
        if (eras == null || eras.isEmpty()) {
            throw new ChainConfigException("At least one era must be configured");
        }
        if (reportIntervalSeconds <= 0) {
            throw new ChainConfigException("reportIntervalSeconds must be positive: " + reportIntervalSeconds);
        }

        StartTime start;
        try {
            start = StartTime.of(Instant.parse(startTime));
        } catch (DateTimeParseException e) {
            throw new ChainConfigException("Invalid startTime: " + startTime, e);
        }

        Summary.Builder builder = Summary.builder();
        for (int i = 0; i < eras.size(); i++) {
            Era era = eras.get(i);
            EraParams params;
            try {
                params = new EraParams(EpochSize.of(era.epochSize), SlotLength.ofMillis(era.slotLengthMillis));
            } catch (IllegalArgumentException e) {
                throw new ChainConfigException("Invalid parameters for era " + i, e);
            }
            if (era.epochs != null) {
                builder.era(params, era.epochs);
            } else if (i == eras.size() - 1) {
                builder.openEra(params);
            } else {
                throw new ChainConfigException("Only the last era may leave out its number of epochs");
            }
        }

        return new ChainConfig(null, start, builder.build(), SyncTolerance.ofSeconds(syncToleranceSeconds),
                Duration.ofSeconds(reportIntervalSeconds));
    }

    /**
     * Loads the chain parameters of a network.
     *
     * @throws ChainConfigException if the file is missing or invalid
     */
    public static ChainConfig load(Network network) {
        String path = "/chain/" + network.label() + ".json";
        try (InputStream in = ChainConfig.class.getResourceAsStream(path)) {
            if (in == null) {
                throw new ChainConfigException("Chain config not found: " + path);
            }
            ChainConfig config = new ObjectMapper().readValue(in, ChainConfig.class);
            config.setNetwork(network);
            log.info("Loaded chain config for {}, start time {}, {} era(s)", network,
                    config.getStartTime().getInstant(), config.getSummary().getEras().size());
            return config;
        } catch (IOException e) {
            throw new ChainConfigException("Failed to load chain config " + path, e);
        }
    }

    public static class Era {
        private final long epochSize;
        private final long slotLengthMillis;
        private final Long epochs;

        @JsonCreator
        public Era(@JsonProperty("epochSize") long epochSize,
                   @JsonProperty("slotLengthMillis") long slotLengthMillis,
                   @JsonProperty("epochs") Long epochs) {
            this.epochSize = epochSize;
            this.slotLengthMillis = slotLengthMillis;
            this.epochs = epochs;
        }
    }
}
