package com.phillippitts.arithmetic;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class ArithmeticApplicationTests {

    @Test
    void contextLoads() {
    }

}
