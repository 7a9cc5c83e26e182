package com.relay.notification.config;

import com.relay.notification.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FilterPipelinePropertiesTest {

    @Test
    void validate_defaults_pass() {
        assertThatCode(() -> new FilterPipelineProperties().validate()).doesNotThrowAnyException();
    }

    @Test
    void validate_zeroRateLimit_rejected() {
        FilterPipelineProperties properties = new FilterPipelineProperties();
        properties.setMaxNotificationsPerHour(0);

        assertPropertyRejected(properties, "max-notifications-per-hour");
    }

    @Test
    void validate_negativeWeight_rejected() {
        FilterPipelineProperties properties = new FilterPipelineProperties();
        properties.getWeights().setSystemStatus(-0.1);

        assertPropertyRejected(properties, "weights.system-status");
    }

    @Test
    void validate_unknownZone_rejected() {
        FilterPipelineProperties properties = new FilterPipelineProperties();
        properties.setZoneId("Mars/Olympus_Mons");

        assertPropertyRejected(properties, "zone-id");
    }

    @Test
    void validate_unknownStoreType_rejected() {
        FilterPipelineProperties properties = new FilterPipelineProperties();
        properties.getBehaviorStore().setType("redis");

        assertPropertyRejected(properties, "behavior-store.type");
    }

    private static void assertPropertyRejected(FilterPipelineProperties properties, String property) {
        assertThatThrownBy(properties::validate)
                .isInstanceOf(ConfigurationException.class)
                .extracting(e -> ((ConfigurationException) e).getProperty())
                .isEqualTo(property);
    }
}
