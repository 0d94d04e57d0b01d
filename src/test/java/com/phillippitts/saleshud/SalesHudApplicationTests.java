package com.phillippitts.saleshud;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;

@Tag("integration")
@SpringBootTest
class SalesHudApplicationTests {

    @Test
    void contextLoads() {
    }
}
