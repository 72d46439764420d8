package com.williamcallahan.flarenormalizer;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class FlareNormalizerApplicationTests {

    @Test
    void contextLoads() {
    }

}
