package io.clientportal.sdk.scanner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parameters for {@code /iserver/scanner/run}.
 */
public final class ScanRequest {

    public static final String DEFAULT_INSTRUMENT = "STK";
    public static final String DEFAULT_LOCATION = "STK.US.MAJOR";
    public static final String DEFAULT_SCAN_TYPE = "TOP_PERC_GAIN";
    public static final int DEFAULT_SIZE = 50;

    private final String instrument;
    private final String location;
    private final String type;
    private final List<Map<String, Object>> filters;
    private final int size;

    private ScanRequest(Builder builder) {
        this.instrument = builder.instrument;
        this.location = builder.location;
        this.type = builder.type;
        this.filters = Collections.unmodifiableList(new ArrayList<>(builder.filters));
        this.size = builder.size;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getInstrument() {
        return instrument;
    }

    public String getLocation() {
        return location;
    }

    public String getType() {
        return type;
    }

    /**
     * @return scanner filters, each a {@code code}/{@code value} pair. Never null; the gateway requires the array.
     */
    public List<Map<String, Object>> getFilters() {
        return filters;
    }

    public int getSize() {
        return size;
    }

    public static final class Builder {
        private String instrument = DEFAULT_INSTRUMENT;
        private String location = DEFAULT_LOCATION;
        private String type = DEFAULT_SCAN_TYPE;
        private final List<Map<String, Object>> filters = new ArrayList<>();
        private int size = DEFAULT_SIZE;

        public Builder instrument(String instrument) {
            this.instrument = instrument;
            return this;
        }

        public Builder location(String location) {
            this.location = location;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder filter(String code, Object value) {
            Map<String, Object> filter = new LinkedHashMap<>();
            filter.put("code", Objects.requireNonNull(code, "code"));
            filter.put("value", value);
            this.filters.add(Collections.unmodifiableMap(filter));
            return this;
        }

        public Builder filters(List<Map<String, Object>> filters) {
            this.filters.clear();
            if (filters != null) {
                filters.forEach(f -> this.filters.add(Map.copyOf(f)));
            }
            return this;
        }

        public Builder size(int size) {
            this.size = size;
            return this;
        }

        public ScanRequest build() {
            if (instrument == null || instrument.isBlank()) {
                throw new IllegalArgumentException("instrument is required");
            }
            if (location == null || location.isBlank()) {
                throw new IllegalArgumentException("location is required");
            }
            if (type == null || type.isBlank()) {
                throw new IllegalArgumentException("scan type is required");
            }
            if (size <= 0) {
                throw new IllegalArgumentException("size must be positive");
            }
            return new ScanRequest(this);
        }
    }
}
