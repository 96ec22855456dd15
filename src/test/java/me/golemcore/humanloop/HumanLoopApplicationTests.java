package me.golemcore.humanloop;

import me.golemcore.humanloop.adapter.outbound.humaninput.BrokerHumanInputAdapter;
import me.golemcore.humanloop.domain.service.ResponseBroker;
import me.golemcore.humanloop.port.outbound.HumanInputPort;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;

@SpringBootTest
class HumanLoopApplicationTests {

    @Autowired
    private ResponseBroker broker;

    @Autowired
    private HumanInputPort humanInputPort;

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(HumanLoopApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(HumanLoopApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldWireBrokerTransportByDefault() {
        assertInstanceOf(BrokerHumanInputAdapter.class, humanInputPort);
        assertEquals(0, broker.openCount());
    }
}
