package com.example.dynatrace;

import com.example.dynatrace.service.DynatraceClient;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;

import static org.junit.jupiter.api.Assertions.assertNotNull;

@SpringBootTest
@TestPropertySource(properties = {
    "dynatrace.environment-url=https://test.live.dynatrace.com",
    "dynatrace.api-token=test-token"
})
class DynatraceConfigSyncApplicationTests {

    @Autowired
    private DynatraceClient dynatraceClient;

    @Test
    void contextLoads() {
        assertNotNull(dynatraceClient);
    }
}
