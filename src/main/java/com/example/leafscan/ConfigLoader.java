package com.example.leafscan;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Loads {@link ScanReaderConfig} from a JSON file; absent properties take the defaults.
 */
public class ConfigLoader {
    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public ScanReaderConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);
        ScanReaderConfig defaults = ScanReaderConfig.defaults();

        double maxRange = raw.maxRange != null ? raw.maxRange : defaults.maxRange();
        boolean transform = raw.transform != null ? raw.transform : defaults.transform();
        Optional<Double> sensorHeight = Optional.ofNullable(raw.sensorHeight);
        double zenithOffset = raw.zenithOffset != null ? raw.zenithOffset : defaults.zenithOffset();
        if (sensorHeight.isPresent() && !Double.isFinite(sensorHeight.get())) {
            throw new IllegalArgumentException("sensorHeight must be finite.");
        }
        if (!Double.isFinite(zenithOffset)) {
            throw new IllegalArgumentException("zenithOffset must be finite.");
        }

        return new ScanReaderConfig(maxRange, transform, sensorHeight, zenithOffset);
    }

    private static class RawConfig {
        public Double maxRange;
        public Boolean transform;
        public Double sensorHeight;
        public Double zenithOffset;
    }
}
