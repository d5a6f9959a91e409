package com.costtracker.costs.config;

import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "costs")
public record CostsProperties(
        String serviceName,
        Report report,
        Logs logs,
        About about
) {

    @ConstructorBinding
    public CostsProperties {
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must be provided");
        }
        if (report == null) {
            throw new IllegalArgumentException("report configuration must be provided");
        }
        // logs and about may be omitted; handled via accessor methods
    }

    public Logs logs() {
        return logs != null ? logs : new Logs(null, null);
    }

    public About about() {
        return about != null ? about : new About(List.of());
    }

    public record Report(String zone) {
        public Report {
            if (zone == null || zone.isBlank()) {
                throw new IllegalArgumentException("zone must be provided");
            }
            // fail at startup rather than on the first report request
            ZoneId.of(zone);
        }

        public ZoneId zoneId() {
            return ZoneId.of(zone);
        }
    }

    public record Logs(String shipUrl, Duration shipTimeout) {
        public Logs {
            if (shipTimeout != null && (shipTimeout.isNegative() || shipTimeout.isZero())) {
                throw new IllegalArgumentException("shipTimeout must be positive");
            }
        }

        public boolean shippingEnabled() {
            return shipUrl != null && !shipUrl.isBlank();
        }

        public Duration shipTimeoutOrDefault() {
            return shipTimeout != null ? shipTimeout : Duration.ofSeconds(2);
        }
    }

    public record About(List<Member> members) {
        public About {
            members = members == null ? List.of() : List.copyOf(members);
        }

        public record Member(String firstName, String lastName) {
            public Member {
                if (firstName == null || firstName.isBlank()) {
                    throw new IllegalArgumentException("member firstName must be provided");
                }
                if (lastName == null || lastName.isBlank()) {
                    throw new IllegalArgumentException("member lastName must be provided");
                }
            }
        }
    }
}
